package com.docchat.chatbot.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<TextChunk> chunk(SourceDocument document);
}
