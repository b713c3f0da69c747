package com.docchat.chatbot.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record CmsImportRequest(@NotBlank String content,
                               String source,
                               Map<String, Object> metadata) {

    public CmsImportRequest {
        source = source == null || source.isBlank() ? "cms" : source;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
