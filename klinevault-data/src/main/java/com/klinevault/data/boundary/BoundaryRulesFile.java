package com.klinevault.data.boundary;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.klinevault.core.model.Interval;
import com.klinevault.data.transport.HttpClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Boundary rules learned by earlier runs, stored as JSON keyed by interval code.
 * A process starting on a warm cache reads them here instead of asking the backend again.
 */
public class BoundaryRulesFile {

    private static final Logger log = LoggerFactory.getLogger(BoundaryRulesFile.class);

    private static final TypeReference<Map<String, BoundaryRules>> RULES_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper = HttpClientFactory.getMapper();

    public BoundaryRulesFile(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Rules recorded for the interval, or null. An unreadable file counts as empty.
     */
    public synchronized BoundaryRules load(Interval interval) {
        return readAll().get(interval.getCode());
    }

    public synchronized void save(Interval interval, BoundaryRules rules) throws IOException {
        Map<String, BoundaryRules> all = new TreeMap<>(readAll());
        all.put(interval.getCode(), rules);

        Files.createDirectories(file.getParent());
        Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), all);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Map<String, BoundaryRules> readAll() {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        try {
            Map<String, BoundaryRules> all = mapper.readValue(file.toFile(), RULES_TYPE);
            return all != null ? all : Map.of();
        } catch (IOException e) {
            log.warn("Ignoring unreadable boundary rules in {}: {}", file, e.getMessage());
            return Map.of();
        }
    }
}
