package io.dhtprobe.storage;

import io.dhtprobe.config.ProbeConfig;

import java.net.URI;
import java.nio.file.Paths;

public final class ProbeRecordStores {
    private ProbeRecordStores() {
    }

    /**
     * {@code http://} and {@code https://} locations map to an HTTP store,
     * anything else is a local file path.
     */
    public static ProbeRecordStore forLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("store location must not be blank");
        }
        if (ProbeConfig.isRemote(location)) {
            return new HttpProbeRecordStore(URI.create(location.trim()));
        }
        return new FileProbeRecordStore(Paths.get(location.trim()));
    }
}
