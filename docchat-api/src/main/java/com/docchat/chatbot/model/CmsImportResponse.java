package com.docchat.chatbot.model;

public record CmsImportResponse(String status, String source, int chunks, String message) {
}
