package io.dhtprobe.storage;

import io.dhtprobe.error.StoreAccessException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Host-local exclusive lock that keeps two maintenance cycles from saving over
 * each other's snapshot.
 */
public final class CycleLock implements AutoCloseable {
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private CycleLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @return the held lock, or empty when another cycle holds it
     */
    public static Optional<CycleLock> tryAcquire(Path lockFile) {
        FileChannel channel = null;
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                return Optional.empty();
            }
            return Optional.of(new CycleLock(lockFile, channel, lock));
        } catch (OverlappingFileLockException e) {
            closeChannel(channel, e);
            return Optional.empty();
        } catch (IOException e) {
            closeChannel(channel, e);
            throw new StoreAccessException("Failed to open cycle lock: " + lockFile, e);
        }
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
        } catch (IOException e) {
            throw new StoreAccessException("Failed to release cycle lock: " + lockFile, e);
        }
    }

    private static void closeChannel(FileChannel channel, Exception primary) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
