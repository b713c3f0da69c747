package com.docchat.chatbot.service.vectorstore;

public record CollectionInfo(String name, String status, long vectorsCount) {

    public static CollectionInfo notCreated(String name) {
        return new CollectionInfo(name, "not_created", 0);
    }
}
