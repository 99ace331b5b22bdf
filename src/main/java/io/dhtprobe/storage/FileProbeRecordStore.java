package io.dhtprobe.storage;

import io.dhtprobe.error.StoreAccessException;
import io.dhtprobe.model.ProbeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe store kept in a single JSON file. Saves go through a sibling temp file
 * and a rename, so readers see either the old or the new snapshot.
 */
public final class FileProbeRecordStore implements ProbeRecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileProbeRecordStore.class);

    private final Path file;

    public FileProbeRecordStore(Path file) {
        this.file = file.toAbsolutePath().normalize();
    }

    @Override
    public Map<String, ProbeRecord> load() {
        if (!Files.exists(file)) {
            LOG.info("No probe store at {}, starting empty", file);
            return new LinkedHashMap<>();
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to read probe store: " + file, e);
        }
        return ProbeRecordCodec.decode(json, file.toString());
    }

    @Override
    public void save(Map<String, ProbeRecord> records) {
        String json = ProbeRecordCodec.encode(records);
        Path parent = file.getParent();
        Path temp = null;
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, file.getFileName() + ".", ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write probe store: " + file, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOG.warn("Failed to remove temp file {}", temp, e);
                }
            }
        }
        LOG.debug("Saved {} probe records to {}", records.size(), file);
    }

    @Override
    public String location() {
        return file.toString();
    }

    public Path file() {
        return file;
    }
}
