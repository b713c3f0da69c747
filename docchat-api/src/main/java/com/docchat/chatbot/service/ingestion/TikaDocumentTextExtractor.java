package com.docchat.chatbot.service.ingestion;

import com.docchat.chatbot.error.ExtractionException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.detect.AutoDetectReader;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private static final int MAX_CSV_ROWS = 100;
    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private static final Pattern FORM_FEED = Pattern.compile("\f");
    private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{4,}");
    private static final Pattern BLANK_LINES = Pattern.compile("\n[ \t]*(\n[ \t]*)+");

    @Override
    public ExtractedDocument extract(String filename, InputStream inputStream) {
        if ("csv".equalsIgnoreCase(FilenameUtils.getExtension(filename))) {
            return extractCsv(filename, inputStream);
        }
        try {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            AutoDetectParser parser = new AutoDetectParser();
            parser.parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString())
                    .map(TikaDocumentTextExtractor::clean)
                    .orElse("");
            log.debug("Extracted {} characters from {}", text.length(), filename);
            return new ExtractedDocument(buildMetadata(metadata, filename), text);
        } catch (Exception e) {
            log.error("Failed to extract text from document {}", filename, e);
            throw new ExtractionException("Failed to extract text from " + filename, e);
        }
    }

    /**
     * Renders each row as {@code Row N: column: value, ...} under a {@code CSV Headers} line, so every value
     * is indexed next to its column name. Only the first {@value #MAX_CSV_ROWS} rows are kept.
     */
    private ExtractedDocument extractCsv(String filename, InputStream inputStream) {
        try (AutoDetectReader reader = new AutoDetectReader(inputStream);
             CSVParser parser = CSV_FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new ExtractionException("CSV file " + filename + " has no header row");
            }
            StringBuilder text = new StringBuilder("CSV Headers: ").append(String.join(", ", headers));
            int rows = 0;
            for (CSVRecord record : parser) {
                rows++;
                if (rows > MAX_CSV_ROWS) {
                    continue;
                }
                List<String> cells = new ArrayList<>();
                for (int i = 0; i < Math.min(headers.size(), record.size()); i++) {
                    String value = record.get(i);
                    if (value != null && !value.isBlank()) {
                        cells.add(headers.get(i) + ": " + value.trim());
                    }
                }
                text.append("\n\nRow ").append(rows).append(": ").append(String.join(", ", cells));
            }
            if (rows > MAX_CSV_ROWS) {
                text.append("\n\n... and ").append(rows - MAX_CSV_ROWS).append(" more rows");
            }
            log.debug("Extracted {} CSV rows from {}", rows, filename);
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("file_type", ".csv");
            attributes.put("rows", rows);
            DocumentMetadata metadata = DocumentMetadata.empty()
                    .withContentType("text/csv; charset=" + reader.getCharset().name())
                    .withAttributes(attributes);
            return new ExtractedDocument(metadata, text.toString());
        } catch (ExtractionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to extract rows from CSV {}", filename, e);
            throw new ExtractionException("Failed to extract text from " + filename, e);
        }
    }

    static String clean(String raw) {
        String text = raw.replace("\r\n", "\n");
        text = FORM_FEED.matcher(text).replaceAll("\n");
        text = REPEATED_DOTS.matcher(text).replaceAll("...");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }

    private DocumentMetadata buildMetadata(Metadata metadata, String filename) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        String extension = FilenameUtils.getExtension(filename);
        if (extension != null && !extension.isBlank()) {
            attributes.put("file_type", "." + extension.toLowerCase(Locale.ROOT));
        }
        String title = metadata.get(TikaCoreProperties.TITLE);
        if (title != null && !title.isBlank()) {
            attributes.put("title", title.trim());
        }
        String author = metadata.get(TikaCoreProperties.CREATOR);
        if (author != null && !author.isBlank()) {
            attributes.put("author", author.trim());
        }
        DocumentMetadata enriched = DocumentMetadata.empty()
                .withContentType(metadata.get(Metadata.CONTENT_TYPE))
                .withAttributes(attributes);
        OffsetDateTime created = parseDate(metadata.get(TikaCoreProperties.CREATED));
        return created == null ? enriched : enriched.withCreatedAt(created);
    }

    private OffsetDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ex) {
            log.debug("Unable to parse creation date {}", value, ex);
            return null;
        }
    }
}
