package com.luanvv.harvester.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputWriters {
    private final Path baseDir;
    private final boolean jsonEnabled;
    private final boolean csvEnabled;
    private final ObjectMapper objectMapper;

    public OutputWriters(Config.Output cfg) throws IOException {
        this.baseDir = Path.of(cfg.getDir());
        Files.createDirectories(baseDir);
        this.jsonEnabled = cfg.isJson();
        this.csvEnabled = cfg.isCsv();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /** Writes the dataset and returns the JSON path (or the CSV path when JSON is disabled). */
    public Path write(String dataset, List<?> records) throws IOException {
        Path json = baseDir.resolve(dataset + ".json");
        Path csv = baseDir.resolve(dataset + ".csv");
        if (jsonEnabled) writeJson(json, records);
        if (csvEnabled) writeCsv(csv, records);
        return jsonEnabled ? json : csv;
    }

    private void writeJson(Path path, List<?> records) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(records);
        replace(path, tmp -> Files.write(tmp, bytes));
        log.info("Wrote {} records to {}", records.size(), path.toAbsolutePath());
    }

    private void writeCsv(Path path, List<?> records) throws IOException {
        ArrayNode rows = objectMapper.valueToTree(records);
        replace(path, tmp -> {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(w)) {
                List<String> headers = new ArrayList<>();
                if (!rows.isEmpty()) {
                    rows.get(0).fieldNames().forEachRemaining(headers::add);
                }
                csv.writeNext(headers.toArray(String[]::new));
                for (JsonNode row : rows) {
                    csv.writeNext(headers.stream().map(h -> toStringSafe(row.get(h))).toArray(String[]::new));
                }
            }
        });
        log.debug("Wrote CSV {}", path);
    }

    private String toStringSafe(JsonNode v) {
        if (v == null || v.isNull()) return "";
        if (v.isValueNode()) return v.asText();
        List<String> parts = new ArrayList<>();
        for (Iterator<JsonNode> it = v.elements(); it.hasNext(); ) {
            parts.add(it.next().asText());
        }
        return String.join("|", parts);
    }

    private void replace(Path target, FileBody body) throws IOException {
        Path tmp = Files.createTempFile(baseDir, target.getFileName().toString(), ".tmp");
        try {
            body.write(tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @FunctionalInterface
    private interface FileBody {
        void write(Path tmp) throws IOException;
    }
}
