package com.docchat.chatbot.service.vectorstore;

/**
 * Payload keys written next to every vector.
 */
public final class PointPayload {

    public static final String TEXT = "text";
    public static final String SOURCE = "source";
    public static final String ORIGIN_TYPE = "type";
    public static final String METADATA = "metadata";
    public static final String DOCUMENT_ID = "document_id";
    public static final String CHUNK_ID = "chunk_id";
    public static final String CHUNK_INDEX = "chunk_index";

    private PointPayload() {
    }
}
