package com.docchat.chatbot.service.ingestion;

import java.util.List;

public record IngestionBatchSummary(List<IngestionResult> results,
                                    int documents,
                                    int indexed,
                                    int empty,
                                    int failed,
                                    int chunks) {

    public static IngestionBatchSummary of(List<IngestionResult> results) {
        int indexed = 0;
        int empty = 0;
        int failed = 0;
        int chunks = 0;
        for (IngestionResult result : results) {
            switch (result.status()) {
                case INDEXED -> indexed++;
                case EMPTY -> empty++;
                case FAILED -> failed++;
            }
            chunks += result.chunks();
        }
        return new IngestionBatchSummary(List.copyOf(results), results.size(), indexed, empty, failed, chunks);
    }

    public boolean allFailed() {
        return documents > 0 && failed == documents;
    }
}
