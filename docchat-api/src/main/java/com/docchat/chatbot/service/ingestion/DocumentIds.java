package com.docchat.chatbot.service.ingestion;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

public final class DocumentIds {

    private DocumentIds() {
    }

    /**
     * Stable document id for a source label, so re-importing the same file or CMS source replaces its chunks.
     */
    public static String forSource(OriginType originType, String source) {
        String label = source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
        String key = originType.payloadValue() + ":" + label;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String chunkId(String documentId, int index) {
        return documentId + "-" + index;
    }
}
