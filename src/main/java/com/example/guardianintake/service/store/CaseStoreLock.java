package com.example.guardianintake.service.store;

import com.example.guardianintake.config.IntakeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Single-writer guard for the case store. The lock is taken without waiting: a store held
 * by another writer fails the current document instead of queueing it.
 */
@Component
public class CaseStoreLock {

    private static final Logger logger = LoggerFactory.getLogger(CaseStoreLock.class);

    @Autowired
    private IntakeProperties intakeProperties;

    public CaseStoreLock() {
    }

    CaseStoreLock(IntakeProperties intakeProperties) {
        this.intakeProperties = intakeProperties;
    }

    public Handle acquire() {
        Path lockFile = Paths.get(intakeProperties.getStore().getLockFile());
        FileChannel channel = null;
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeQuietly(channel);
                throw new StoreUnavailableException("Case store is locked by another writer: " + lockFile);
            }
            logger.debug("🔒 Case store lock acquired: {}", lockFile);
            return new Handle(channel, lock, lockFile);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new StoreUnavailableException("Case store is already locked in this process: " + lockFile, e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new StoreUnavailableException("Could not open case store lock " + lockFile + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Failed to close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Held store lock; closing it releases the store.
     */
    public static final class Handle implements AutoCloseable {
        private final FileChannel channel;
        private final FileLock lock;
        private final Path lockFile;

        private Handle(FileChannel channel, FileLock lock, Path lockFile) {
            this.channel = channel;
            this.lock = lock;
            this.lockFile = lockFile;
        }

        public boolean isValid() {
            return lock.isValid();
        }

        @Override
        public void close() {
            try {
                if (lock.isValid()) {
                    lock.release();
                }
                logger.debug("🔓 Case store lock released: {}", lockFile);
            } catch (IOException e) {
                logger.warn("Failed to release case store lock {}: {}", lockFile, e.getMessage());
            } finally {
                closeQuietly(channel);
            }
        }
    }
}
