package io.shardguard.alert;

import io.shardguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Callback that persists every alert payload as one JSON line. The core keeps no alert
 * history of its own; this is the opt-in record.
 */
public final class AlertJournal implements AlertCallback {
    private final Path journalFile;

    public AlertJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            if (journalFile.getParent() != null) {
                Files.createDirectories(journalFile.getParent());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize alert journal: " + journalFile, e);
        }
    }

    @Override
    public synchronized void onAlert(Alert alert) throws IOException {
        String line = Jsons.toCompactJson(alert.toPayload()) + System.lineSeparator();
        Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    @SuppressWarnings("unchecked")
    public synchronized List<Map<String, Object>> readAll() throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (!Files.exists(journalFile)) {
            return rows;
        }
        for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            rows.add(Jsons.mapper().readValue(line, Map.class));
        }
        return rows;
    }

    public Path journalFile() {
        return journalFile;
    }
}
