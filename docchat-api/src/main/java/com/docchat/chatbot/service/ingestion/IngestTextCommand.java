package com.docchat.chatbot.service.ingestion;

import java.util.Map;

public record IngestTextCommand(String source,
                                String content,
                                Map<String, Object> metadata) {
}
