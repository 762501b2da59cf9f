package com.example.backupcore.verification;

import com.example.backupcore.backend.Backend.Digests;
import com.example.backupcore.backend.Backend.StorageBackend;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.CommandRunner.CommandResult;
import com.example.backupcore.backend.postgres.PostgresBackend;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.GlobalSettings;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.example.backupcore.verification.Verification.ComprehensiveOutcome;
import com.example.backupcore.verification.Verification.VerificationConfig;
import com.example.backupcore.verification.Verification.VerificationEngine;
import com.example.backupcore.verification.Verification.VerificationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class VerificationEngineTest {

    @TempDir
    Path tmp;

    private VerificationEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    @Test
    void checksumPassesOnUntouchedFiles() throws IOException {
        engine = engine(new CommandRunner(), true);
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"), write("b.gz", "beta"));

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.CHECKSUM, null);

        assertTrue(result.passed());
        assertEquals(2, result.details().get("verifiedFiles"));
        assertEquals(0, result.details().get("failedFiles"));
    }

    @Test
    void checksumReportsModifiedFile() throws IOException {
        engine = engine(new CommandRunner(), false);
        Path file = write("a.gz", "alfa");
        BackupMetadata metadata = metadataFor(file);
        Files.writeString(file, "adulterado");

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.CHECKSUM, null);

        assertFalse(result.passed());
        assertEquals(List.of("Checksum divergente: a.gz"), result.errors());
    }

    @Test
    void sizeValidationWithOneMissingFileYieldsSingleError() throws IOException {
        engine = engine(new CommandRunner(), true);
        Path kept = write("a.gz", "alfa");
        Path removed = write("b.gz", "beta");
        BackupMetadata metadata = metadataFor(kept, removed);
        Files.delete(removed);

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.SIZE_VALIDATION, null);

        assertFalse(result.passed());
        assertEquals(1, result.errors().size());
        assertEquals(1, result.details().get("missingFiles"));
        assertEquals(1, result.details().get("existingFiles"));
    }

    @Test
    void emptyFileIsOnlyAWarning() throws IOException {
        engine = engine(new CommandRunner(), true);
        BackupMetadata metadata = metadataFor(write("vazio.gz", ""));

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.SIZE_VALIDATION, null);

        assertTrue(result.passed());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void integrityDelegatesToBackendAndRunsCustomScripts() throws IOException {
        CommandRunner runner = mock(CommandRunner.class);
        when(runner.run(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(new CommandResult(1, "", "falhou", Duration.ZERO));
        engine = new VerificationEngine(VerificationConfig.builder()
                .reportDirectory(tmp.resolve("reports"))
                .restoreTestRoot(tmp.resolve("restore-test"))
                .customScripts(StorageType.FILE_SYSTEM, List.of("/opt/check.sh"))
                .build(), runner);
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.verifyBackup(any(BackupMetadata.class), eq(VerificationType.INTEGRITY_CHECK))).thenReturn(true);
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.INTEGRITY_CHECK, backend);

        assertFalse(result.passed());
        assertEquals(true, result.details().get("integrityCheckPassed"));
        assertEquals(List.of("1 script(s) de verificação falharam"), result.errors());
        verify(runner).run(eq(List.of("/opt/check.sh", "bk-1", tmp.toString())), anyMap(),
                eq(Duration.ofSeconds(300)), any(CancellationToken.class));
    }

    @Test
    void integrityWithoutBackendFails() throws IOException {
        engine = engine(new CommandRunner(), true);
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        assertFalse(engine.verifyBackup(metadata, VerificationType.INTEGRITY_CHECK, null).passed());
    }

    @Test
    void restoreTestRemovesDirectoryEvenWhenRestoreThrows() throws IOException {
        engine = engine(new CommandRunner(), true);
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.restoreBackup(any(BackupMetadata.class), any(RestoreOptions.class)))
                .thenThrow(new IOException("disco cheio"));
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.RESTORE_TEST, backend);

        assertFalse(result.passed());
        assertEquals(List.of("Erro no restore de teste: disco cheio"), result.errors());
        assertFalse(Files.exists(tmp.resolve("restore-test").resolve("bk-1")));
    }

    @Test
    void restoreTestPassesOverwriteWithoutNestedVerification() throws IOException {
        engine = engine(new CommandRunner(), true);
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.restoreBackup(any(BackupMetadata.class), any(RestoreOptions.class))).thenAnswer(inv -> {
            RestoreOptions options = inv.getArgument(1);
            assertTrue(options.overwrite());
            assertFalse(options.verify());
            Files.writeString(Path.of(options.targetPath().orElseThrow()).resolve("restaurado.txt"), "ok");
            return true;
        });
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        VerificationResult result = engine.verifyBackup(metadata, VerificationType.RESTORE_TEST, backend);

        assertTrue(result.passed());
        assertEquals(1, result.details().get("restoredFiles"));
        assertFalse(Files.exists(tmp.resolve("restore-test").resolve("bk-1")));
    }

    @Test
    void comprehensiveVerifySavesReportOnlyOnFailure() throws IOException {
        engine = engine(new CommandRunner(), true);
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.verifyBackup(any(BackupMetadata.class), eq(VerificationType.INTEGRITY_CHECK))).thenReturn(true);
        Path file = write("a.gz", "alfa");
        BackupMetadata metadata = metadataFor(file);

        ComprehensiveOutcome ok = engine.comprehensiveVerify(metadata, backend);
        assertTrue(ok.passed());
        assertTrue(ok.reportPath().isEmpty());
        assertEquals(3, ok.report().overallResult.totalChecks);

        Files.delete(file);
        ComprehensiveOutcome failed = engine.comprehensiveVerify(metadata, backend);
        assertFalse(failed.passed());
        assertTrue(failed.reportPath().isPresent());
        assertTrue(Files.exists(failed.reportPath().get()));
        assertEquals(1, failed.report().overallResult.passedChecks);
        assertEquals("bk-1", failed.report().backupId);
    }

    @Test
    void reconfigureAppliesGlobalVerificationSettings() throws IOException {
        CommandRunner runner = mock(CommandRunner.class);
        when(runner.run(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class)))
                .thenReturn(new CommandResult(0, "ok", "", Duration.ZERO));
        engine = engine(runner, true);

        engine.reconfigure(GlobalSettings.builder()
                .maxParallelJobs(4)
                .parallelVerification(false)
                .verificationTimeoutSeconds(45)
                .verificationScripts(StorageType.FILE_SYSTEM, List.of("/opt/fs-check.sh"))
                .restoreTestDatabase("cipher_verificacao")
                .build());

        VerificationConfig config = engine.config();
        assertEquals(4, config.maxParallelJobs());
        assertFalse(config.enableParallelChecks());
        assertEquals(45, config.timeoutSeconds());
        assertEquals(tmp.resolve("reports"), config.reportDirectory());
        assertEquals("cipher_verificacao", config.restoreTestConfig().get(PostgresBackend.TARGET_DATABASE_KEY));

        StorageBackend backend = mock(StorageBackend.class);
        when(backend.verifyBackup(any(BackupMetadata.class), eq(VerificationType.INTEGRITY_CHECK))).thenReturn(true);
        when(backend.restoreBackup(any(BackupMetadata.class), any(RestoreOptions.class))).thenAnswer(inv -> {
            RestoreOptions options = inv.getArgument(1);
            assertTrue(options.restoreTest());
            assertEquals("cipher_verificacao", options.config().get(PostgresBackend.TARGET_DATABASE_KEY));
            Files.writeString(Path.of(options.targetPath().orElseThrow()).resolve("ok.txt"), "ok");
            return true;
        });
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        assertTrue(engine.verifyBackup(metadata, VerificationType.INTEGRITY_CHECK, backend).passed());
        assertTrue(engine.verifyBackup(metadata, VerificationType.RESTORE_TEST, backend).passed());
        verify(runner).run(eq(List.of("/opt/fs-check.sh", "bk-1", tmp.toString())), anyMap(),
                eq(Duration.ofSeconds(45)), any(CancellationToken.class));

        // sem banco configurado, a chave some do restore-test
        engine.reconfigure(GlobalSettings.builder().build());
        assertFalse(engine.config().restoreTestConfig().containsKey(PostgresBackend.TARGET_DATABASE_KEY));
        assertTrue(engine.config().customScripts().isEmpty());
        assertEquals(3, engine.config().maxParallelJobs());
    }

    @Test
    void quickVerifyRunsChecksumAndSize() throws IOException {
        engine = engine(new CommandRunner(), false);
        BackupMetadata metadata = metadataFor(write("a.gz", "alfa"));

        assertTrue(engine.quickVerify(metadata, null));
    }

    private VerificationEngine engine(CommandRunner runner, boolean parallel) {
        return new VerificationEngine(VerificationConfig.builder()
                .enableParallelChecks(parallel)
                .maxParallelJobs(2)
                .reportDirectory(tmp.resolve("reports"))
                .restoreTestRoot(tmp.resolve("restore-test"))
                .build(), runner);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tmp.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private BackupMetadata metadataFor(Path... files) throws IOException {
        Map<String, String> checksums = new LinkedHashMap<>();
        long size = 0;
        for (Path f : files) {
            checksums.put(f.toString(), Digests.sha256Hex(f));
            size += Files.size(f);
        }
        return new BackupMetadata("bk-1", StorageType.FILE_SYSTEM)
                .compression(CompressionType.GZIP)
                .files(List.copyOf(checksums.keySet()))
                .checksums(checksums)
                .size(size)
                .putMetadata("backupRoot", tmp.toString());
    }
}
