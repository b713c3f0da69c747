package com.docchat.chatbot.model;

import com.docchat.chatbot.service.ingestion.IngestionBatchSummary;
import com.docchat.chatbot.service.ingestion.IngestionResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Outcome of a multipart upload. {@code filename} joins the names of all files; {@code chunks} is the total.
 */
public record UploadResponse(String status,
                             String filename,
                             int chunks,
                             List<FileResult> results,
                             int indexed,
                             int failed) {

    public static UploadResponse from(IngestionBatchSummary summary) {
        String status = summary.failed() == 0 ? "success" : summary.allFailed() ? "failed" : "partial";
        String filenames = summary.results().stream()
                .map(IngestionResult::source)
                .collect(Collectors.joining(", "));
        List<FileResult> results = summary.results().stream().map(FileResult::from).toList();
        return new UploadResponse(status, filenames, summary.chunks(), results, summary.indexed(), summary.failed());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FileResult(String filename, String status, int chunks, String error, String detail) {

        static FileResult from(IngestionResult result) {
            return new FileResult(
                    result.source(),
                    result.status().name().toLowerCase(Locale.ROOT),
                    result.chunks(),
                    result.errorKind() == null ? null : result.errorKind().name(),
                    result.detail());
        }
    }
}
