package com.docchat.chatbot.service.ingestion;

import java.util.Locale;

public enum OriginType {
    FILE,
    CMS;

    public String payloadValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
