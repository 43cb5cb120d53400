package com.example.guardianintake.service.store;

import com.example.guardianintake.config.IntakeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaseStoreLockTest {

    @TempDir
    Path tempDir;

    private CaseStoreLock storeLock;
    private Path lockFile;

    @BeforeEach
    void setUp() {
        lockFile = tempDir.resolve("nested/case-store.lock");
        IntakeProperties properties = new IntakeProperties();
        properties.getStore().setLockFile(lockFile.toString());
        storeLock = new CaseStoreLock(properties);
    }

    @Test
    void createsLockFileAndParentDirectories() {
        try (CaseStoreLock.Handle handle = storeLock.acquire()) {
            assertThat(handle.isValid()).isTrue();
            assertThat(Files.exists(lockFile)).isTrue();
        }
    }

    @Test
    void secondWriterIsRefusedWithoutWaiting() {
        try (CaseStoreLock.Handle ignored = storeLock.acquire()) {
            assertThatThrownBy(() -> storeLock.acquire())
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("locked");
        }
    }

    @Test
    void lockCanBeTakenAgainAfterRelease() {
        CaseStoreLock.Handle first = storeLock.acquire();
        first.close();

        assertThat(first.isValid()).isFalse();
        try (CaseStoreLock.Handle second = storeLock.acquire()) {
            assertThat(second.isValid()).isTrue();
        }
    }

    @Test
    void unwritableLocationIsUnavailable() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        IntakeProperties properties = new IntakeProperties();
        properties.getStore().setLockFile(blocker.resolve("case-store.lock").toString());

        assertThatThrownBy(() -> new CaseStoreLock(properties).acquire())
            .isInstanceOf(StoreUnavailableException.class);
    }
}
