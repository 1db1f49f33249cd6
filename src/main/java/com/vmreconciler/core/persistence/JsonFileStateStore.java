package com.vmreconciler.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each record as {@code <stateDir>/<machineName>.json}.
 * <p>
 * Writes go to a temporary file in the same directory which is then moved
 * over the previous version, so a crash never leaves a truncated record.
 */
@Component
public class JsonFileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileStateStore(ReconcilerProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStateDir()), objectMapper);
    }

    public JsonFileStateStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<StateRecord> load(String machineName) {
        var file = fileFor(machineName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), StateRecord.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read state of machine '%s' from %s".formatted(machineName, file), e);
        }
    }

    @Override
    public void save(StateRecord record) {
        var file = fileFor(record.getMachineName());
        try {
            Files.createDirectories(directory);
            var tmp = Files.createTempFile(directory, record.getMachineName(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), record);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Saved state of machine '{}' to {}", record.getMachineName(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state of machine '%s' to %s"
                    .formatted(record.getMachineName(), file), e);
        }
    }

    @Override
    public void delete(String machineName) {
        var file = fileFor(machineName);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Removed state of machine '{}'", machineName);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + file, e);
        }
    }

    @Override
    public List<String> machineNames() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    private Path fileFor(String machineName) {
        if (machineName == null || !SAFE_NAME.matcher(machineName).matches()) {
            throw ReconcileException.configuration("invalid machine name '%s'".formatted(machineName));
        }
        return directory.resolve(machineName + SUFFIX);
    }
}
