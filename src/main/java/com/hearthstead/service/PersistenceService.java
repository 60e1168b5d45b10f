package com.hearthstead.service;

import com.hearthstead.config.SettlementProperties;
import com.hearthstead.model.SettlementState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes the settlement save file as JSON.
 */
@Service
public class PersistenceService {

    private static final Logger log = LoggerFactory.getLogger(PersistenceService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path dataFile;
    private final Path tempFile;

    @Autowired
    public PersistenceService(SettlementProperties props) {
        this(Paths.get(props.getSaveFile()));
    }

    public PersistenceService(Path dataFile) {
        this.dataFile = dataFile;
        this.tempFile = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Writes to a temp file and moves it over the real one, so a crash mid-write
     * leaves the previous save intact. Failures are logged, not thrown.
     */
    public boolean save(SettlementState state) {
        try {
            mapper.writeValue(tempFile.toFile(), state);
            Files.move(tempFile, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Settlement saved on day {} to {}", state.day, dataFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to save settlement to {}: {}", dataFile, e.getMessage());
            return false;
        }
    }

    /**
     * @return the saved state, or null if there is no save or it could not be read
     */
    public SettlementState load() {
        if (!Files.exists(dataFile)) return null;
        try {
            if (Files.size(dataFile) == 0) return null;
            SettlementState state = mapper.readValue(dataFile.toFile(), SettlementState.class);
            log.info("Loaded settlement at day {} from {}", state.day, dataFile);
            return state;
        } catch (IOException e) {
            Path backup = dataFile.resolveSibling(dataFile.getFileName() + ".bak_" + System.currentTimeMillis());
            log.warn("Corrupted save detected ({}), moving it to {} and starting fresh", e.getMessage(), backup);
            try {
                Files.move(dataFile, backup, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveFailure) {
                log.error("Could not back up corrupted save {}: {}", dataFile, moveFailure.getMessage());
            }
            return null;
        }
    }

    public Path getDataFile() { return dataFile; }
}
