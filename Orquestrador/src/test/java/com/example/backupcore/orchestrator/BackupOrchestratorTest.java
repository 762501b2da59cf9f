package com.example.backupcore.orchestrator;

import com.example.backupcore.backend.Backend.BackupArtifacts;
import com.example.backupcore.backend.Backend.Digests;
import com.example.backupcore.backend.Backend.StorageBackend;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.filesystem.FileSystemBackend;
import com.example.backupcore.destination.Destinations.LocalDestinationHandler;
import com.example.backupcore.errors.BackupException;
import com.example.backupcore.model.BackupRecords.BackupJob;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.BackupStatistics;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupRecords.SearchFilters;
import com.example.backupcore.model.BackupSettings.BackupConfig;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupSettings.BackupSchedule;
import com.example.backupcore.model.BackupSettings.GlobalSettings;
import com.example.backupcore.model.BackupSettings.RetentionPolicy;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.BackupStatus;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.example.backupcore.orchestrator.JobEvents.JobEventType;
import com.example.backupcore.store.MetadataStore;
import com.example.backupcore.verification.Verification.VerificationConfig;
import com.example.backupcore.verification.Verification.VerificationEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BackupOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    @TempDir
    Path tmp;

    private Path destination;
    private BackupOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        destination = tmp.resolve("destino");
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) orchestrator.shutdown();
    }

    // =====================
    // ADMISSÃO E FILA
    // =====================

    @Test
    void neverRunsMoreThanMaxParallelAndDrainsQueue() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 2);
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch completed = await(JobEventType.COMPLETED, 3);

        String first = orchestrator.startBackup(StorageType.POSTGRES);
        String second = orchestrator.startBackup(StorageType.POSTGRES);
        String third = orchestrator.startBackup(StorageType.POSTGRES);

        assertFalse(QueueTicket.isTicketId(first));
        assertFalse(QueueTicket.isTicketId(second));
        assertTrue(QueueTicket.isTicketId(third));
        assertEquals(QueueTicket.State.QUEUED, orchestrator.ticket(third).orElseThrow().state());
        assertTrue(orchestrator.getBackupStatus(third).isEmpty());
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));

        backend.release.countDown();
        assertTrue(completed.await(10, TimeUnit.SECONDS));

        assertTrue(backend.maxInFlight.get() <= 2);
        QueueTicket ticket = orchestrator.ticket(third).orElseThrow();
        assertEquals(QueueTicket.State.DISPATCHED, ticket.state());
        BackupJob dispatched = orchestrator.getBackupStatus(third).orElseThrow();
        assertEquals(ticket.jobId().orElseThrow(), dispatched.id());
        assertEquals(BackupStatus.COMPLETED, dispatched.status());
        assertEquals(3, orchestrator.listJobs().size());
    }

    @Test
    void rejectsTypeThatIsNotEnabled() {
        BackupConfig config = config(2, StorageType.POSTGRES).toBuilder()
                .addStorageConfig(StorageBackupConfig.builder(StorageType.FILE_SYSTEM).enabled(false).build())
                .build();
        orchestrator = orchestrator(config, new GatedBackend(StorageType.FILE_SYSTEM, 1));

        BackupException e = assertThrows(BackupException.class, () -> orchestrator.startBackup(StorageType.FILE_SYSTEM));
        assertEquals(BackupException.Code.NOT_ENABLED, e.code());
        e = assertThrows(BackupException.class, () -> orchestrator.startBackup(StorageType.REDIS));
        assertEquals(BackupException.Code.NOT_ENABLED, e.code());
        assertTrue(orchestrator.listJobs().isEmpty());
    }

    @Test
    void rejectsMissingOrUnavailableBackendWithoutCreatingJobs() {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        backend.available = false;
        BackupConfig config = config(2, StorageType.POSTGRES).toBuilder()
                .addStorageConfig(StorageBackupConfig.builder(StorageType.FILE_SYSTEM).build())
                .build();
        orchestrator = orchestrator(config, backend);

        BackupException unavailable = assertThrows(BackupException.class, () -> orchestrator.startBackup(StorageType.POSTGRES));
        assertEquals(BackupException.Code.UNAVAILABLE, unavailable.code());
        assertTrue(unavailable.retryable());
        BackupException noHandler = assertThrows(BackupException.class, () -> orchestrator.startBackup(StorageType.FILE_SYSTEM));
        assertEquals(BackupException.Code.NO_HANDLER, noHandler.code());
        assertTrue(orchestrator.listJobs().isEmpty());
        assertEquals(0, orchestrator.getStatistics().totalBackups());
    }

    @Test
    void fullBackupSkipsTypesThatFailAdmission() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        BackupConfig config = config(2, StorageType.POSTGRES).toBuilder()
                .addStorageConfig(StorageBackupConfig.builder(StorageType.FILE_SYSTEM).build())
                .addStorageConfig(StorageBackupConfig.builder(StorageType.REDIS).enabled(false).build())
                .build();
        orchestrator = orchestrator(config, backend);
        CountDownLatch completed = await(JobEventType.COMPLETED, 1);

        List<String> ids = orchestrator.startFullBackup();

        assertEquals(1, ids.size());
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));
        backend.release.countDown();
        assertTrue(completed.await(10, TimeUnit.SECONDS));
        assertEquals(StorageType.POSTGRES, orchestrator.getBackupStatus(ids.get(0)).orElseThrow().storageType());
    }

    @Test
    void updateConfigValidatesAndDrainsQueueWithNewCeiling() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 2);
        orchestrator = orchestrator(config(1, StorageType.POSTGRES), backend);
        CountDownLatch completed = await(JobEventType.COMPLETED, 2);

        orchestrator.startBackup(StorageType.POSTGRES);
        String queued = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(QueueTicket.isTicketId(queued));

        BackupConfig invalid = config(2, StorageType.POSTGRES).toBuilder().destinations(List.of()).build();
        assertThrows(IllegalStateException.class, () -> orchestrator.updateConfig(invalid));
        assertEquals(1, orchestrator.getConfig().global().maxParallelJobs());
        assertEquals(QueueTicket.State.QUEUED, orchestrator.ticket(queued).orElseThrow().state());

        orchestrator.updateConfig(config(2, StorageType.POSTGRES));

        assertEquals(2, orchestrator.getConfig().global().maxParallelJobs());
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));
        assertEquals(QueueTicket.State.DISPATCHED, orchestrator.ticket(queued).orElseThrow().state());
        backend.release.countDown();
        assertTrue(completed.await(10, TimeUnit.SECONDS));
        assertTrue(backend.maxInFlight.get() <= 2);
    }

    @Test
    void overridesAreMergedIntoTypeConfig() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        orchestrator = orchestrator(config(1, StorageType.POSTGRES), backend);

        String id = orchestrator.startBackup(StorageType.POSTGRES, StorageBackupConfig.builder(StorageType.POSTGRES)
                .compression(CompressionType.NONE)
                .option("database", "vendas")
                .build());

        BackupJob job = orchestrator.getBackupStatus(id).orElseThrow();
        assertEquals(CompressionType.NONE, job.config().compression());
        assertEquals("vendas", job.config().options().get("database"));
        backend.release.countDown();
    }

    // =====================
    // CANCELAMENTO
    // =====================

    @Test
    void cancelledJobIsListedAsCancelled() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch cancelled = await(JobEventType.CANCELLED, 1);

        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));

        assertTrue(orchestrator.cancelBackup(id));
        assertFalse(orchestrator.cancelBackup(id));
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));

        List<BackupJob> cancelledJobs = orchestrator.listJobs(SearchFilters.builder().status(BackupStatus.CANCELLED).build());
        assertEquals(1, cancelledJobs.size());
        assertEquals(id, cancelledJobs.get(0).id());
        assertTrue(orchestrator.searchBackups(SearchFilters.none()).isEmpty());
    }

    @Test
    void cancellingQueuedTicketRemovesItFromQueue() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        orchestrator = orchestrator(config(1, StorageType.POSTGRES), backend);
        CountDownLatch completed = await(JobEventType.COMPLETED, 1);

        orchestrator.startBackup(StorageType.POSTGRES);
        String ticket = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(orchestrator.cancelBackup(ticket));
        assertEquals(QueueTicket.State.CANCELLED, orchestrator.ticket(ticket).orElseThrow().state());

        backend.release.countDown();
        assertTrue(completed.await(5, TimeUnit.SECONDS));
        assertEquals(1, orchestrator.listJobs().size());
        assertEquals(1, backend.created.get());
    }

    // =====================
    // FLUXO COMPLETO
    // =====================

    @Test
    void fileSystemBackupCompletesAndIsSearchableRestorableAndDeletable() throws Exception {
        Path source = Files.createDirectories(tmp.resolve("origem"));
        Files.writeString(source.resolve("a.txt"), "alfa");
        Files.createDirectories(source.resolve("sub"));
        Files.writeString(source.resolve("sub/b.txt"), "beta");

        BackupConfig config = BackupConfig.builder()
                .addStorageConfig(StorageBackupConfig.builder(StorageType.FILE_SYSTEM).build())
                .addDestination(BackupDestination.local(destination.toString()))
                .defaultSchedule(BackupSchedule.builder().enabled(false).build())
                .global(GlobalSettings.builder()
                        .maxParallelJobs(1)
                        .enableVerification(true)
                        .verificationTypes(List.of(VerificationType.CHECKSUM, VerificationType.SIZE_VALIDATION,
                                VerificationType.INTEGRITY_CHECK))
                        .build())
                .build();
        orchestrator = builder(config)
                .backend(new FileSystemBackend(List.of(source), new CommandRunner(), tmp.resolve("restore-test")))
                .build();
        CountDownLatch finished = awaitTerminal();

        String id = orchestrator.startBackup(StorageType.FILE_SYSTEM);
        assertTrue(finished.await(20, TimeUnit.SECONDS));

        BackupJob job = orchestrator.getBackupStatus(id).orElseThrow();
        assertEquals(BackupStatus.COMPLETED, job.status(), () -> String.valueOf(job.error() == null ? null : job.error().message()));
        assertEquals(100, job.progress());

        List<BackupMetadata> found = orchestrator.searchBackups(SearchFilters.builder().storageType(StorageType.FILE_SYSTEM).build());
        assertEquals(1, found.size());
        Path stored = destination.resolve("file-system").resolve(id).toAbsolutePath().normalize();
        assertTrue(found.get(0).files().stream().allMatch(f -> Path.of(f).startsWith(stored)));
        assertTrue(Files.exists(stored.resolve(LocalDestinationHandler.METADATA_FILE)));
        assertTrue(orchestrator.verifyBackup(id));

        Path target = tmp.resolve("restaurado");
        assertTrue(orchestrator.restoreBackup(id, RestoreOptions.builder(id).targetPath(target.toString()).build()));
        assertEquals("alfa", Files.readString(target.resolve("origem/a.txt")));
        assertEquals("beta", Files.readString(target.resolve("origem/sub/b.txt")));

        assertTrue(orchestrator.deleteBackup(id));
        assertFalse(Files.exists(stored));
        assertTrue(orchestrator.searchBackups(SearchFilters.none()).isEmpty());
        BackupException missing = assertThrows(BackupException.class, () -> orchestrator.verifyBackup(id));
        assertEquals(BackupException.Code.NOT_FOUND, missing.code());
    }

    @Test
    void backendFailureMarksJobFailedAndCountsInStatistics() throws Exception {
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.storageType()).thenReturn(StorageType.POSTGRES);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.createBackup(any(StorageBackupConfig.class), anyString(), any(Path.class), any(CancellationToken.class)))
                .thenThrow(BackupException.toolMissing("pg_dump"));
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch failed = await(JobEventType.FAILED, 1);

        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(failed.await(5, TimeUnit.SECONDS));

        BackupJob job = orchestrator.getBackupStatus(id).orElseThrow();
        assertEquals(BackupStatus.FAILED, job.status());
        assertEquals("TOOL_MISSING", job.error().code());
        assertEquals("pg_dump command not found", job.error().message());

        BackupStatistics stats = orchestrator.getStatistics();
        assertEquals(1, stats.totalBackups());
        assertEquals(1, stats.failedBackups());
        assertEquals(0.0, stats.successRate());
        assertTrue(stats.lastBackupTime().isEmpty());
    }

    @Test
    void statisticsSummarizeCompletedJobs() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        backend.release.countDown();
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch completed = await(JobEventType.COMPLETED, 2);

        orchestrator.startBackup(StorageType.POSTGRES);
        orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(completed.await(5, TimeUnit.SECONDS));

        BackupStatistics stats = orchestrator.getStatistics();
        assertEquals(2, stats.successfulBackups());
        assertEquals(100.0, stats.successRate());
        assertEquals(stats.totalSize() / 2, stats.averageSize());
        assertEquals(2, stats.byStorageType().get(StorageType.POSTGRES).count());
        assertEquals(NOW, stats.lastBackupTime().orElseThrow());
    }

    // =====================
    // RETENÇÃO / AGENDA / SHUTDOWN
    // =====================

    @Test
    void cleanupIsIdempotent() throws Exception {
        MetadataStore store = MetadataStore.inMemory();
        for (int i = 0; i < 20; i++) {
            store.save(new BackupMetadata("pg-" + i, StorageType.POSTGRES)
                    .status(BackupStatus.COMPLETED)
                    .startTime(NOW.minus(Duration.ofDays(i)).minus(Duration.ofHours(1))));
        }
        BackupConfig config = config(2, StorageType.POSTGRES).toBuilder()
                .retentionPolicy(RetentionPolicy.builder()
                        .dailyRetentionDays(3)
                        .weeklyRetentionWeeks(0)
                        .monthlyRetentionMonths(0)
                        .maxBackups(100)
                        .build())
                .build();
        orchestrator = builder(config)
                .metadataStore(store)
                .backend(new GatedBackend(StorageType.POSTGRES, 1))
                .build();

        assertEquals(17, orchestrator.cleanupOldBackups());
        assertEquals(0, orchestrator.cleanupOldBackups());
        assertEquals(3, orchestrator.searchBackups(SearchFilters.none()).size());
        assertEquals(3, store.all().size());
    }

    @Test
    void schedulesEachEnabledTypeAndStopsCleanly() {
        BackupConfig config = config(2, StorageType.POSTGRES).toBuilder()
                .defaultSchedule(BackupSchedule.builder().cron("0 2 * * *").timezone("UTC").build())
                .build();
        orchestrator = orchestrator(config, new GatedBackend(StorageType.POSTGRES, 1));

        orchestrator.initialize();

        Map<StorageType, Instant> next = orchestrator.getNextScheduledBackups();
        assertEquals(1, next.size());
        assertTrue(next.containsKey(StorageType.POSTGRES));
        assertTrue(orchestrator.getStatistics().nextScheduledBackup().isPresent());

        orchestrator.stopScheduledBackups();
        assertTrue(orchestrator.getNextScheduledBackups().isEmpty());
    }

    @Test
    void shutdownCancelsRunningJobsAndRejectsNewOnes() throws Exception {
        GatedBackend backend = new GatedBackend(StorageType.POSTGRES, 1);
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(backend.started.await(5, TimeUnit.SECONDS));

        orchestrator.shutdown();
        orchestrator.shutdown();

        assertTrue(orchestrator.isShuttingDown());
        assertEquals(BackupStatus.CANCELLED, orchestrator.getBackupStatus(id).orElseThrow().status());
        assertEquals(1, backend.cleanups.get());
        BackupException e = assertThrows(BackupException.class, () -> orchestrator.startBackup(StorageType.POSTGRES));
        assertEquals(BackupException.Code.SHUTTING_DOWN, e.code());
    }

    @Test
    void verificationEngineFollowsGlobalSettings() {
        VerificationEngine engine = new VerificationEngine(VerificationConfig.builder()
                .maxParallelJobs(9)
                .reportDirectory(tmp.resolve("reports"))
                .restoreTestRoot(tmp.resolve("restore-test"))
                .build(), new CommandRunner());
        BackupConfig first = config(2, StorageType.POSTGRES);
        orchestrator = BackupOrchestrator.builder()
                .config(first)
                .scratchRoot(tmp.resolve("scratch"))
                .verificationEngine(engine)
                .destinationHandler(new LocalDestinationHandler())
                .backend(new GatedBackend(StorageType.POSTGRES, 1))
                .build();

        assertEquals(2, engine.config().maxParallelJobs());
        assertTrue(engine.config().customScripts().isEmpty());

        orchestrator.updateConfig(first.toBuilder()
                .global(first.global().toBuilder()
                        .maxParallelJobs(5)
                        .parallelVerification(false)
                        .verificationTimeoutSeconds(30)
                        .verificationScripts(StorageType.POSTGRES, List.of("/opt/pg-check.sh"))
                        .build())
                .build());

        assertEquals(5, engine.config().maxParallelJobs());
        assertFalse(engine.config().enableParallelChecks());
        assertEquals(30, engine.config().timeoutSeconds());
        assertEquals(List.of("/opt/pg-check.sh"), engine.config().customScripts().get(StorageType.POSTGRES));
        assertEquals(tmp.resolve("reports"), engine.config().reportDirectory());
    }

    // =====================
    // LIMPEZA DO SCRATCH E VERIFICAÇÃO
    // =====================

    @Test
    void scratchDirectoryIsRemovedAfterFailedJob() throws Exception {
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.storageType()).thenReturn(StorageType.POSTGRES);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.createBackup(any(StorageBackupConfig.class), anyString(), any(Path.class), any(CancellationToken.class)))
                .thenAnswer(inv -> {
                    Path dir = Files.createDirectories(inv.<Path>getArgument(2).resolve("postgres"));
                    Files.writeString(dir.resolve("parcial.dump"), "meio dump");
                    throw new IOException("conexão perdida");
                });
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch failed = await(JobEventType.FAILED, 1);

        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(failed.await(5, TimeUnit.SECONDS));

        assertEquals(BackupStatus.FAILED, orchestrator.getBackupStatus(id).orElseThrow().status());
        assertGone(tmp.resolve("scratch").resolve(id));
    }

    @Test
    void scratchDirectoryIsRemovedAfterCancelledJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.storageType()).thenReturn(StorageType.POSTGRES);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.createBackup(any(StorageBackupConfig.class), anyString(), any(Path.class), any(CancellationToken.class)))
                .thenAnswer(inv -> {
                    Path dir = Files.createDirectories(inv.<Path>getArgument(2).resolve("postgres"));
                    Files.writeString(dir.resolve("parcial.dump"), "meio dump");
                    CancellationToken token = inv.getArgument(3);
                    started.countDown();
                    while (true) {
                        token.throwIfCancelled("fake");
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw BackupException.cancelled("fake");
                        }
                    }
                });
        orchestrator = orchestrator(config(2, StorageType.POSTGRES), backend);
        CountDownLatch cancelled = await(JobEventType.CANCELLED, 1);

        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(Files.exists(tmp.resolve("scratch").resolve(id)));
        assertTrue(orchestrator.cancelBackup(id));
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));

        assertEquals(BackupStatus.CANCELLED, orchestrator.getBackupStatus(id).orElseThrow().status());
        assertGone(tmp.resolve("scratch").resolve(id));
    }

    @Test
    void failedVerificationFailsJobAndRemovesDestinationCopies() throws Exception {
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.storageType()).thenReturn(StorageType.POSTGRES);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.createBackup(any(StorageBackupConfig.class), anyString(), any(Path.class), any(CancellationToken.class)))
                .thenAnswer(inv -> {
                    String backupId = inv.getArgument(1);
                    Path root = Files.createDirectories(inv.<Path>getArgument(2).resolve("postgres").resolve(backupId));
                    Path file = Files.writeString(root.resolve("dump.bin"), "payload");
                    // checksum gravado não bate com o conteúdo
                    return new BackupArtifacts(root, List.of(file.toString()), Map.of(file.toString(), "00ff"),
                            Map.of(file.toString(), Files.size(file)), null, List.of("dump.bin"), Map.of());
                });
        BackupConfig config = config(2, StorageType.POSTGRES);
        config = config.toBuilder()
                .global(config.global().toBuilder()
                        .enableVerification(true)
                        .verificationTypes(List.of(VerificationType.CHECKSUM))
                        .build())
                .build();
        orchestrator = orchestrator(config, backend);
        CountDownLatch failed = await(JobEventType.FAILED, 1);

        String id = orchestrator.startBackup(StorageType.POSTGRES);
        assertTrue(failed.await(10, TimeUnit.SECONDS));

        BackupJob job = orchestrator.getBackupStatus(id).orElseThrow();
        assertEquals(BackupStatus.FAILED, job.status());
        assertEquals("VERIFICATION_FAILED", job.error().code());
        assertTrue(job.error().message().contains("Checksum divergente: dump.bin"), job.error().message());
        assertFalse(Files.exists(destination.resolve("postgres").resolve(id)));
        assertTrue(orchestrator.searchBackups(SearchFilters.none()).isEmpty());
        assertGone(tmp.resolve("scratch").resolve(id));
    }

    // =====================
    // HELPERS
    // =====================

    /** O scratch é removido depois do evento terminal; espera até 5s. */
    private static void assertGone(Path path) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (Files.exists(path) && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(Files.exists(path), () -> "ainda existe: " + path);
    }

    private BackupConfig config(int maxParallel, StorageType type) {
        return BackupConfig.builder()
                .addStorageConfig(StorageBackupConfig.builder(type).build())
                .addDestination(BackupDestination.local(destination.toString()))
                .defaultSchedule(BackupSchedule.builder().enabled(false).build())
                .global(GlobalSettings.builder().maxParallelJobs(maxParallel).enableVerification(false).build())
                .build();
    }

    private BackupOrchestrator.Builder builder(BackupConfig config) {
        return BackupOrchestrator.builder()
                .config(config)
                .scratchRoot(tmp.resolve("scratch"))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .verificationEngine(new VerificationEngine(VerificationConfig.builder()
                        .reportDirectory(tmp.resolve("reports"))
                        .restoreTestRoot(tmp.resolve("restore-test"))
                        .build(), new CommandRunner()))
                .destinationHandler(new LocalDestinationHandler());
    }

    private BackupOrchestrator orchestrator(BackupConfig config, StorageBackend backend) {
        return builder(config).backend(backend).build();
    }

    private CountDownLatch await(JobEventType type, int count) {
        CountDownLatch latch = new CountDownLatch(count);
        orchestrator.events().subscribe(event -> {
            if (event.type() == type) latch.countDown();
        });
        return latch;
    }

    private CountDownLatch awaitTerminal() {
        CountDownLatch latch = new CountDownLatch(1);
        orchestrator.events().subscribe(event -> {
            if (event.type() == JobEventType.COMPLETED || event.type() == JobEventType.FAILED) latch.countDown();
        });
        return latch;
    }

    /** Backend que segura o createBackup até {@code release}, respeitando o token. */
    static final class GatedBackend implements StorageBackend {
        final StorageType type;
        final CountDownLatch started;
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger cleanups = new AtomicInteger();
        volatile boolean available = true;

        GatedBackend(StorageType type, int expectedStarts) {
            this.type = type;
            this.started = new CountDownLatch(expectedStarts);
        }

        @Override
        public StorageType storageType() {
            return type;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Map<String, Object> getStorageInfo() {
            return Map.of("type", type.id());
        }

        @Override
        public long getEstimatedSize() {
            return 0;
        }

        @Override
        public BackupArtifacts createBackup(StorageBackupConfig config, String backupId, Path destinationDir,
                                            CancellationToken token) throws IOException {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            started.countDown();
            try {
                while (!release.await(20, TimeUnit.MILLISECONDS)) {
                    token.throwIfCancelled("fake " + backupId);
                }
                token.throwIfCancelled("fake " + backupId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw BackupException.cancelled("fake " + backupId);
            } finally {
                inFlight.decrementAndGet();
            }
            created.incrementAndGet();
            Path root = Files.createDirectories(destinationDir.resolve(type.id()).resolve(backupId));
            Path file = Files.writeString(root.resolve("dump.bin"), "payload-" + backupId);
            List<String> files = new ArrayList<>(List.of(file.toString()));
            return new BackupArtifacts(root, files, Map.of(file.toString(), Digests.sha256Hex(file)),
                    Map.of(file.toString(), Files.size(file)), null, List.of("dump.bin"), Map.of());
        }

        @Override
        public boolean restoreBackup(BackupMetadata metadata, RestoreOptions options, CancellationToken token) {
            return true;
        }

        @Override
        public boolean verifyBackup(BackupMetadata metadata, VerificationType type) {
            return true;
        }

        @Override
        public void cleanup() {
            cleanups.incrementAndGet();
        }
    }
}
