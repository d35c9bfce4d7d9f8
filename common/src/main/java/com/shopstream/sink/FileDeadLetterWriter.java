package com.shopstream.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends dead-lettered documents to a JSON-lines file, one
 * {@code {"documentId", "reason", "failedAt", "document"}} object per line.
 */
@Slf4j
public class FileDeadLetterWriter implements DeadLetterWriter {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private BufferedWriter writer;

    public FileDeadLetterWriter(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized void write(SinkDocument document, String reason) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("documentId", document.getDocumentId());
        line.put("reason", reason);
        line.put("failedAt", clock.millis());
        line.put("document", document);
        try {
            String json = objectMapper.writeValueAsString(line);
            BufferedWriter out = writer();
            out.write(json);
            out.newLine();
            out.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise dead letter " + document.getDocumentId(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append dead letter to " + path, e);
        }
        log.error("Dead-lettered doc={} to {}: {}", document.getDocumentId(), path, reason);
    }

    @Override
    public synchronized void close() {
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.warn("Failed to close dead-letter file {}: {}", path, e.getMessage());
            }
            writer = null;
        }
    }

    private BufferedWriter writer() throws IOException {
        if (writer == null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        return writer;
    }
}
