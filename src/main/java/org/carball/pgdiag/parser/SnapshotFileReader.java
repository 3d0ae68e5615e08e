package org.carball.pgdiag.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.model.health.HealthSnapshot;
import org.carball.pgdiag.model.plan.PlanFormat;
import org.carball.pgdiag.model.plan.PlanSource;
import org.carball.pgdiag.model.statement.StatementStat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads diagnostics inputs from exported files instead of connecting to the database.
 *
 * <p>Statement exports are either a bare JSON array of pg_stat_statements rows or an object with a
 * {@code statements} array. Health exports are a single object shaped like {@link HealthSnapshot}.
 */
@Slf4j
public class SnapshotFileReader {

    private static final TypeReference<List<StatementStat>> STATEMENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SnapshotFileReader() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<StatementStat> readStatementStats(Path path) throws IOException {
        JsonNode document = readTree(path);
        JsonNode rows = document.isArray() ? document : document.get("statements");
        if (rows == null || !rows.isArray()) {
            throw new IOException("Missing or invalid statements section in export file: " + path);
        }

        List<StatementStat> stats = objectMapper.convertValue(rows, STATEMENT_LIST);
        log.info("Loaded {} statement rows from {}", stats.size(), path);
        return stats;
    }

    public HealthSnapshot readHealthSnapshot(Path path) throws IOException {
        JsonNode document = readTree(path);
        if (!document.isObject()) {
            throw new IOException("Health export must be a JSON object: " + path);
        }

        HealthSnapshot snapshot = objectMapper.treeToValue(document, HealthSnapshot.class);
        log.info("Loaded health snapshot from {}", path);
        return snapshot;
    }

    /**
     * Loads a saved EXPLAIN output. The format is taken from the file extension
     * (.json, .yaml/.yml, .xml), anything else is read as TEXT.
     */
    public PlanSource readPlan(Path path) throws IOException {
        requireExists(path);
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        PlanFormat format;
        if (name.endsWith(".json")) {
            format = PlanFormat.JSON;
        } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            format = PlanFormat.YAML;
        } else if (name.endsWith(".xml")) {
            format = PlanFormat.XML;
        } else {
            format = PlanFormat.TEXT;
        }
        return PlanSource.of(Files.readString(path), format);
    }

    private JsonNode readTree(Path path) throws IOException {
        requireExists(path);
        JsonNode document = objectMapper.readTree(Files.readString(path));
        if (document == null || document.isMissingNode()) {
            throw new IOException("Export file is empty: " + path);
        }
        return document;
    }

    private static void requireExists(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Export file not found: " + path);
        }
    }
}
