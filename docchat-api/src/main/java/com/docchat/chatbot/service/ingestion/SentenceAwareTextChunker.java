package com.docchat.chatbot.service.ingestion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into windows of at most {@code chunkSize} characters, each sharing at least {@code overlap}
 * characters with its predecessor. Split points prefer paragraph breaks, then sentence ends, then any
 * whitespace, and only cut inside a word when the window holds no boundary at all. A whitespace run longer
 * than a window is stepped over, so no chunk is blank and no overlap spans such a gap.
 */
@Component
public class SentenceAwareTextChunker implements TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");
    private static final Pattern SENTENCE_END =
            Pattern.compile("[.!?][\"')\\]]*(?=\\s)|[\u3002\uFF01\uFF1F][\u300D\u300F\uFF09\"')\\]]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int chunkSize;
    private final int overlap;

    public SentenceAwareTextChunker(@Value("${docchat.ingest.chunk-size:800}") int chunkSize,
                                    @Value("${docchat.ingest.overlap:100}") int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("docchat.ingest.chunk-size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("docchat.ingest.overlap must be >= 0 and smaller than the chunk size");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<TextChunk> chunk(SourceDocument document) {
        String text = document.text();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int textEnd = trimEnd(text, text.length(), 0);
        int start = skipWhitespace(text, 0);
        int previousEnd = start;
        List<TextChunk> chunks = new ArrayList<>();
        while (textEnd - start > chunkSize) {
            int end = splitPoint(text, start, previousEnd);
            int contentEnd = trimEnd(text, end, start);
            if (contentEnd > previousEnd) {
                chunks.add(toChunk(document, chunks.size(), start, contentEnd));
                previousEnd = contentEnd;
            } else if (skipWhitespace(text, contentEnd) - contentEnd < chunkSize) {
                chunks.add(toChunk(document, chunks.size(), start, end));
                previousEnd = end;
            }
            // a window of nothing but whitespace is skipped, never emitted
            start = nextStart(text, start, end);
            if (isBlank(text, start, Math.min(start + chunkSize, textEnd))) {
                start = skipWhitespace(text, start);
            }
        }
        chunks.add(toChunk(document, chunks.size(), start, textEnd));
        return List.copyOf(chunks);
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    private int splitPoint(String text, int start, int previousEnd) {
        int hardLimit = start + chunkSize;
        // each window must reach past the previous one and leave room for the next overlap
        int minEnd = Math.max(start + overlap + 1, previousEnd + 1);
        int boundary = lastBoundary(PARAGRAPH_BREAK, text, start, hardLimit, minEnd, at -> trimEnd(text, at, start));
        if (boundary < 0) {
            boundary = lastBoundary(SENTENCE_END, text, start, hardLimit, minEnd, null);
        }
        if (boundary < 0) {
            boundary = lastBoundary(WHITESPACE, text, start, hardLimit, minEnd, at -> trimEnd(text, at, start));
        }
        return boundary < 0 ? hardLimit : boundary;
    }

    /**
     * Last candidate end inside {@code [minEnd, hardLimit]}. Without a mapper the match end is the candidate,
     * otherwise the mapper turns the match start into one.
     */
    private int lastBoundary(Pattern pattern,
                             String text,
                             int start,
                             int hardLimit,
                             int minEnd,
                             IntUnaryOperator fromMatchStart) {
        Matcher matcher = pattern.matcher(text);
        matcher.region(start, hardLimit);
        matcher.useTransparentBounds(true);
        int best = -1;
        while (matcher.find()) {
            int candidate = fromMatchStart == null ? matcher.end() : fromMatchStart.applyAsInt(matcher.start());
            if (candidate >= minEnd && candidate <= hardLimit) {
                best = candidate;
            }
        }
        return best;
    }

    private int nextStart(String text, int start, int end) {
        if (overlap == 0) {
            return skipWhitespace(text, end);
        }
        int candidate = end - overlap;
        int position = candidate;
        while (position > start + 1 && Character.isWhitespace(text.charAt(position))) {
            position--;
        }
        while (position > start + 1 && !Character.isWhitespace(text.charAt(position - 1))) {
            position--;
        }
        boolean wordStart = Character.isWhitespace(text.charAt(position - 1))
                && !Character.isWhitespace(text.charAt(position));
        return wordStart ? position : candidate;
    }

    private TextChunk toChunk(SourceDocument document, int index, int start, int end) {
        return new TextChunk(
                DocumentIds.chunkId(document.id(), index),
                document.id(),
                index,
                document.text().substring(start, end),
                start,
                end,
                document.source(),
                document.originType(),
                document.metadata()
        );
    }

    private int skipWhitespace(String text, int from) {
        int position = from;
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
        return position;
    }

    private boolean isBlank(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private int trimEnd(String text, int end, int floor) {
        int position = end;
        while (position > floor && Character.isWhitespace(text.charAt(position - 1))) {
            position--;
        }
        return position;
    }
}
