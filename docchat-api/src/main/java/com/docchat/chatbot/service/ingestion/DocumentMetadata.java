package com.docchat.chatbot.service.ingestion;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DocumentMetadata(
        String contentType,
        OffsetDateTime createdAt,
        Map<String, Object> attributes
) {

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, null, Map.of());
    }

    public DocumentMetadata withContentType(String value) {
        return new DocumentMetadata(normalise(value), createdAt, attributes);
    }

    public DocumentMetadata withCreatedAt(OffsetDateTime value) {
        return new DocumentMetadata(contentType, value, attributes);
    }

    public DocumentMetadata withAttributes(Map<String, ?> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(attributes());
        extra.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return new DocumentMetadata(contentType, createdAt, Collections.unmodifiableMap(merged));
    }

    @Override
    public Map<String, Object> attributes() {
        return attributes == null ? Map.of() : attributes;
    }

    public DocumentMetadata merge(DocumentMetadata overrides) {
        if (overrides == null) {
            return this;
        }
        DocumentMetadata merged = new DocumentMetadata(
                pick(overrides.contentType, contentType),
                overrides.createdAt != null ? overrides.createdAt : createdAt,
                attributes()
        );
        return merged.withAttributes(overrides.attributes());
    }

    /**
     * Flattened view stored next to every chunk in the vector store.
     */
    public Map<String, Object> asIndexPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(attributes());
        if (contentType != null) {
            payload.put("content_type", contentType);
        }
        if (createdAt != null) {
            payload.put("timestamp", createdAt.toString());
        }
        return Collections.unmodifiableMap(payload);
    }

    private String normalise(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String pick(String primary, String fallback) {
        return primary != null && !primary.isBlank() ? primary.trim() : fallback;
    }
}
