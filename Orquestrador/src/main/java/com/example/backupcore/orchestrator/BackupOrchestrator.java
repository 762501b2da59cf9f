package com.example.backupcore.orchestrator;

import com.example.backupcore.backend.Backend.AbstractStorageBackend;
import com.example.backupcore.backend.Backend.BackupArtifacts;
import com.example.backupcore.backend.Backend.StorageBackend;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.FileTrees;
import com.example.backupcore.config.BackupConfigLoader;
import com.example.backupcore.destination.Destinations.DestinationHandler;
import com.example.backupcore.errors.BackupException;
import com.example.backupcore.metrics.Metrics;
import com.example.backupcore.metrics.Metrics.LoggingMetricsSink;
import com.example.backupcore.metrics.Metrics.MetricsSink;
import com.example.backupcore.model.BackupRecords.BackupJob;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.BackupStatistics;
import com.example.backupcore.model.BackupRecords.ErrorInfo;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupRecords.SearchFilters;
import com.example.backupcore.model.BackupRecords.StorageTypeStats;
import com.example.backupcore.model.BackupSettings.BackupConfig;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupSettings.BackupSchedule;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.BackupStatus;
import com.example.backupcore.model.BackupTypes.DestinationType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.example.backupcore.orchestrator.JobEvents.JobEvent;
import com.example.backupcore.orchestrator.JobEvents.JobEventBus;
import com.example.backupcore.orchestrator.JobEvents.JobEventType;
import com.example.backupcore.schedule.CronScheduler;
import com.example.backupcore.store.MetadataStore;
import com.example.backupcore.verification.Verification.VerificationConfig;
import com.example.backupcore.verification.Verification.VerificationEngine;
import com.example.backupcore.verification.Verification.VerificationResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordena os jobs de backup: admissão com teto de paralelismo, fila FIFO com tickets,
 * execução em estágios, agenda cron, retenção e estatísticas.
 * <p>
 * Os mapas de jobs ativos/finalizados, a fila, os tickets e os handles de agenda só são
 * lidos ou alterados sob {@code lock}. Chamadas a backends, destinos e subprocessos
 * acontecem sempre fora do lock.
 */
public final class BackupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BackupOrchestrator.class);

    static final String CLEANUP_SCHEDULE = "cleanup";
    static final String SCHEDULE_PREFIX = "backup-";
    private static final Duration HOOK_TIMEOUT = Duration.ofMinutes(5);
    private static final int MAX_TICKETS = 1000;
    private static final int MAX_COMPLETED_JOBS = 1000;

    private final Path scratchRoot;
    private final CommandRunner commandRunner;
    private final VerificationEngine verificationEngine;
    private final MetadataStore metadataStore;
    private final MetricsSink metrics;
    private final JobEventBus events;
    private final CronScheduler scheduler;
    private final Clock clock;

    private final Map<StorageType, StorageBackend> backends = new ConcurrentHashMap<>();
    private final Map<DestinationType, DestinationHandler> destinationHandlers = new ConcurrentHashMap<>();

    private final Object lock = new Object();
    private final Map<String, BackupJob> activeJobs = new LinkedHashMap<>();
    private final Map<String, BackupJob> completedJobs = new LinkedHashMap<>();
    private final Deque<PendingRequest> queue = new ArrayDeque<>();
    private final Map<String, QueueTicket> tickets = new LinkedHashMap<>();
    private final Map<String, CancellationToken> tokens = new LinkedHashMap<>();
    private final Map<String, CronScheduler.Handle> schedules = new LinkedHashMap<>();
    private boolean draining;
    private boolean drainRequested;

    private final ExecutorService jobExecutor;
    private volatile BackupConfig config;
    private volatile boolean shuttingDown;

    private BackupOrchestrator(Builder b) {
        this.config = BackupConfigLoader.validate(Objects.requireNonNull(b.config, "config"));
        this.scratchRoot = Objects.requireNonNull(b.scratchRoot, "scratchRoot").toAbsolutePath().normalize();
        this.commandRunner = b.commandRunner != null ? b.commandRunner : new CommandRunner();
        this.verificationEngine = b.verificationEngine != null
                ? b.verificationEngine
                : new VerificationEngine(VerificationConfig.builder().build(), this.commandRunner);
        this.verificationEngine.reconfigure(config.global());
        this.metadataStore = b.metadataStore != null ? b.metadataStore : MetadataStore.inMemory();
        this.metrics = b.metrics != null ? b.metrics : new LoggingMetricsSink();
        this.events = b.events != null ? b.events : new JobEventBus();
        this.scheduler = b.scheduler != null ? b.scheduler : new CronScheduler();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        AtomicInteger seq = new AtomicInteger();
        this.jobExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "backup-job-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        b.backends.forEach(this::registerBackend);
        b.destinationHandlers.forEach(this::registerDestinationHandler);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =====================
    // REGISTRO / CICLO DE VIDA
    // =====================

    public void registerBackend(StorageBackend backend) {
        Objects.requireNonNull(backend, "backend");
        StorageBackend previous = backends.put(backend.storageType(), backend);
        if (previous != null && previous != backend) {
            log.warn("Backend de {} substituído", backend.storageType().id());
        }
        log.info("Backend registrado: {}", backend.storageType().id());
    }

    public void registerDestinationHandler(DestinationHandler handler) {
        Objects.requireNonNull(handler, "handler");
        destinationHandlers.put(handler.type(), handler);
        log.info("Handler de destino registrado: {}", handler.type().id());
    }

    /** Valida a config corrente e inicia a agenda. Não registra backends implicitamente. */
    public void initialize() {
        BackupConfigLoader.validate(config);
        scheduleBackups();
        log.info("Orquestrador de backup inicializado ({} backend(s), maxParallelJobs={})",
                backends.size(), config.global().maxParallelJobs());
    }

    public BackupConfig getConfig() {
        return config;
    }

    /** Valida, troca a config e recria toda a agenda. */
    public void updateConfig(BackupConfig newConfig) {
        BackupConfigLoader.validate(Objects.requireNonNull(newConfig, "newConfig"));
        this.config = newConfig;
        verificationEngine.reconfigure(newConfig.global());
        stopScheduledBackups();
        scheduleBackups();
        processQueue();
        log.info("Configuração de backup atualizada");
    }

    /** Canal de eventos do ciclo de vida dos jobs. */
    public JobEventBus events() {
        return events;
    }

    // =====================
    // ADMISSÃO
    // =====================

    /**
     * Inicia (ou enfileira) um backup do tipo informado.
     *
     * @param overrides sobreposição parcial da config do tipo; pode ser {@code null}
     * @return id do job, ou id de ticket ({@code queue-...}) quando não há slot livre
     * @throws BackupException SHUTTING_DOWN, NOT_ENABLED, NO_HANDLER ou UNAVAILABLE
     */
    public String startBackup(StorageType storageType, StorageBackupConfig overrides) throws BackupException {
        Objects.requireNonNull(storageType, "storageType");
        if (shuttingDown) {
            throw BackupException.shuttingDown();
        }
        BackupConfig current = config;
        StorageBackupConfig typeConfig = enabledConfig(current, storageType)
                .orElseThrow(() -> BackupException.notEnabled(storageType.id()));
        StorageBackend backend = backends.get(storageType);
        if (backend == null) {
            throw BackupException.noHandler(storageType.id());
        }
        if (!backend.isAvailable()) {
            throw BackupException.unavailable(storageType.id());
        }

        BackupJob job = null;
        String ticketId = null;
        synchronized (lock) {
            if (shuttingDown) {
                throw BackupException.shuttingDown();
            }
            if (activeJobs.size() >= current.global().maxParallelJobs() || !queue.isEmpty()) {
                QueueTicket ticket = new QueueTicket(QueueTicket.PREFIX + UUID.randomUUID(), storageType,
                        QueueTicket.State.QUEUED, null, clock.instant());
                queue.addLast(new PendingRequest(ticket.id(), storageType, overrides));
                putTicket(ticket);
                ticketId = ticket.id();
                log.info("Backup de {} enfileirado ({} ativo(s), {} na fila): {}",
                        storageType.id(), activeJobs.size(), queue.size(), ticketId);
            } else {
                job = admit(storageType, typeConfig.mergedWith(overrides), current);
            }
        }
        if (job == null) {
            processQueue();
            return ticketId;
        }
        submit(job);
        return job.id();
    }

    public String startBackup(StorageType storageType) throws BackupException {
        return startBackup(storageType, null);
    }

    /** Dispara todos os tipos habilitados. Falhas individuais são logadas e ignoradas. */
    public List<String> startFullBackup() {
        List<String> ids = new ArrayList<>();
        for (StorageBackupConfig c : config.storageConfigs()) {
            if (!c.enabled()) continue;
            try {
                ids.add(startBackup(c.type(), null));
            } catch (BackupException e) {
                log.error("Falha ao iniciar backup de {}: {}", c.type().id(), e.getMessage());
            }
        }
        log.info("Backup completo disparado: {} job(s)", ids.size());
        return ids;
    }

    /** Executa agora o que a agenda executaria. */
    public List<String> runScheduledBackups() {
        log.info("Executando backups agendados manualmente");
        return startFullBackup();
    }

    private static Optional<StorageBackupConfig> enabledConfig(BackupConfig config, StorageType type) {
        if (!config.enabled()) return Optional.empty();
        return config.storageConfig(type).filter(StorageBackupConfig::enabled);
    }

    /** Chamado sob lock: cria o job e ocupa o slot. */
    private BackupJob admit(StorageType type, StorageBackupConfig jobConfig, BackupConfig current) {
        BackupDestination primary = current.destinations().isEmpty() ? null : current.destinations().get(0);
        BackupJob job = new BackupJob(UUID.randomUUID().toString(), type, jobConfig, primary, clock.instant());
        activeJobs.put(job.id(), job);
        tokens.put(job.id(), new CancellationToken());
        return job;
    }

    private void putTicket(QueueTicket ticket) {
        tickets.put(ticket.id(), ticket);
        if (tickets.size() <= MAX_TICKETS) return;
        Iterator<QueueTicket> it = tickets.values().iterator();
        while (it.hasNext() && tickets.size() > MAX_TICKETS) {
            if (it.next().state() != QueueTicket.State.QUEUED) it.remove();
        }
    }

    private void submit(BackupJob job) {
        try {
            jobExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            log.error("Executor recusou o job {}", job.id());
            finishJob(job, BackupStatus.FAILED, errorInfo(BackupException.shuttingDown()));
        }
    }

    /**
     * Drena a fila enquanto houver slot. Só uma passada roda por vez; chamadas concorrentes
     * marcam {@code drainRequested} e a passada corrente repete.
     */
    private void processQueue() {
        synchronized (lock) {
            if (draining) {
                drainRequested = true;
                return;
            }
            draining = true;
        }
        boolean again = true;
        while (again) {
            List<BackupJob> batch = new ArrayList<>();
            synchronized (lock) {
                drainRequested = false;
                BackupConfig current = config;
                while (!shuttingDown && !queue.isEmpty()
                        && activeJobs.size() < current.global().maxParallelJobs()) {
                    PendingRequest request = queue.pollFirst();
                    QueueTicket ticket = tickets.get(request.ticketId);
                    Optional<StorageBackupConfig> typeConfig = enabledConfig(current, request.storageType);
                    if (typeConfig.isEmpty() || !backends.containsKey(request.storageType)) {
                        log.warn("Pedido {} descartado: {} não está mais habilitado/registrado",
                                request.ticketId, request.storageType.id());
                        if (ticket != null) tickets.put(ticket.id(), ticket.withState(QueueTicket.State.REJECTED));
                        continue;
                    }
                    BackupJob job = admit(request.storageType, typeConfig.get().mergedWith(request.overrides), current);
                    if (ticket != null) tickets.put(ticket.id(), ticket.dispatched(job.id()));
                    log.info("Pedido {} despachado como job {}", request.ticketId, job.id());
                    batch.add(job);
                }
            }
            for (BackupJob job : batch) {
                submit(job);
            }
            synchronized (lock) {
                again = drainRequested;
                if (!again) draining = false;
            }
        }
    }

    // =====================
    // EXECUÇÃO
    // =====================

    private void runJob(BackupJob job) {
        CancellationToken token;
        synchronized (lock) {
            token = tokens.getOrDefault(job.id(), CancellationToken.none());
        }
        StorageBackupConfig jobConfig = job.config();
        StorageBackend backend = backends.get(job.storageType());
        Path scratch = scratchRoot.resolve(job.id());
        List<Uploaded> uploads = new ArrayList<>();

        try {
            if (!update(job, BackupStatus.IN_PROGRESS, 10, "Inicializando backup")) return;
            publish(JobEventType.STARTED, job);
            count(Metrics.JOB_STARTED, job.storageType());
            if (backend == null) {
                throw BackupException.noHandler(job.storageType().id());
            }

            if (!jobConfig.preBackupHooks().isEmpty()) {
                progress(job, 20, "Executando hooks pré-backup");
                runHooks(jobConfig.preBackupHooks(), token);
            }

            progress(job, 30, "Criando backup");
            BackupArtifacts artifacts = backend.createBackup(jobConfig, job.id(), scratch, token);
            token.throwIfCancelled("backup " + job.id());

            synchronized (lock) {
                requireActive(job);
                job.metadata()
                        .files(artifacts.files())
                        .checksums(artifacts.checksums())
                        .size(artifacts.totalSize())
                        .compressedSize(artifacts.compressedSize())
                        .sourceConfig(artifacts.sourceInfo())
                        .putMetadata("originalFiles", artifacts.originalFiles());
            }

            progress(job, 60, "Enviando para destinos");
            upload(job, artifacts, uploads, token);

            BackupConfig current = config;
            if (current.global().enableVerification() && !current.global().verificationTypes().isEmpty()) {
                progress(job, 80, "Verificando backup");
                verify(job, backend, current.global().verificationTypes());
            }

            if (!jobConfig.postBackupHooks().isEmpty()) {
                progress(job, 90, "Executando hooks pós-backup");
                runHooks(jobConfig.postBackupHooks(), token);
            }

            token.throwIfCancelled("backup " + job.id());
            BackupMetadata finalMetadata;
            synchronized (lock) {
                requireActive(job);
                job.metadata().status(BackupStatus.COMPLETED).endTime(clock.instant());
                finalMetadata = job.metadata().copy();
            }
            for (Uploaded u : uploads) {
                u.handler.writeMetadata(u.destination, finalMetadata);
            }
            finishJob(job, BackupStatus.COMPLETED, null);
        } catch (BackupException e) {
            if (e.code() == BackupException.Code.CANCELLED || token.isCancelled()) {
                log.warn("Backup {} cancelado: {}", job.id(), e.getMessage());
                discardUploads(job, uploads);
                finishJob(job, BackupStatus.CANCELLED, null);
            } else {
                fail(job, uploads, e);
            }
        } catch (IOException | RuntimeException e) {
            if (token.isCancelled()) {
                discardUploads(job, uploads);
                finishJob(job, BackupStatus.CANCELLED, null);
            } else {
                fail(job, uploads, e);
            }
        } finally {
            try {
                FileTrees.deleteRecursively(scratch);
            } catch (IOException e) {
                log.warn("Falha ao remover scratch {}: {}", scratch, e.getMessage());
            }
        }
    }

    private void fail(BackupJob job, List<Uploaded> uploads, Exception e) {
        log.error("Backup {} de {} falhou", job.id(), job.storageType().id(), e);
        discardUploads(job, uploads);
        finishJob(job, BackupStatus.FAILED, errorInfo(e));
    }

    private void runHooks(List<String> hooks, CancellationToken token) throws BackupException {
        for (String hook : hooks) {
            log.info("Executando hook: {}", hook);
            commandRunner.runChecked(List.of("/bin/sh", "-c", hook), Map.of(), HOOK_TIMEOUT, token);
        }
    }

    /**
     * Copia os artefatos para cada destino configurado. O primeiro destino com handler vira
     * o primário: os caminhos e checksums dos metadados passam a apontar para ele.
     */
    private void upload(BackupJob job, BackupArtifacts artifacts, List<Uploaded> uploads,
                        CancellationToken token) throws IOException {
        List<Path> files = artifacts.files().stream().map(Path::of).collect(Collectors.toList());
        BackupMetadata snapshot;
        synchronized (lock) {
            snapshot = job.metadata().copy();
        }
        boolean primarySet = false;
        for (BackupDestination destination : config.destinations()) {
            token.throwIfCancelled("upload " + job.id());
            DestinationHandler handler = destinationHandlers.get(destination.type());
            if (handler == null) {
                log.warn("Sem handler para destino {}; ignorando", destination.type().id());
                continue;
            }
            List<String> stored = handler.upload(files, artifacts.root(), destination, snapshot);
            uploads.add(new Uploaded(handler, destination, stored));
            if (!primarySet) {
                Map<String, String> checksums = new LinkedHashMap<>();
                for (int i = 0; i < stored.size(); i++) {
                    String checksum = artifacts.checksums().get(artifacts.files().get(i));
                    if (checksum != null) checksums.put(stored.get(i), checksum);
                }
                synchronized (lock) {
                    requireActive(job);
                    job.metadata()
                            .files(stored)
                            .checksums(checksums)
                            .putMetadata(AbstractStorageBackend.BACKUP_ROOT_KEY, handler.locationOf(destination, snapshot));
                }
                primarySet = true;
            }
        }
        if (uploads.isEmpty()) {
            throw BackupException.notConfigured("nenhum destino com handler registrado para " + job.id());
        }
    }

    private void verify(BackupJob job, StorageBackend backend, List<VerificationType> types) throws BackupException {
        BackupMetadata snapshot;
        synchronized (lock) {
            snapshot = job.metadata().copy();
        }
        List<VerificationResult> results = verificationEngine.verifyBackupComprehensive(snapshot, types, backend);
        List<String> failed = new ArrayList<>();
        for (VerificationResult r : results) {
            if (!r.passed()) failed.add(r.type().id() + ": " + String.join("; ", r.errors()));
        }
        if (!failed.isEmpty()) {
            throw BackupException.verificationFailed(job.id(), String.join(" | ", failed));
        }
    }

    private void discardUploads(BackupJob job, List<Uploaded> uploads) {
        BackupMetadata snapshot;
        synchronized (lock) {
            snapshot = job.metadata().copy();
        }
        for (Uploaded u : uploads) {
            try {
                u.handler.delete(u.stored, u.destination, snapshot);
            } catch (IOException e) {
                log.warn("Falha ao remover cópia parcial de {} em {}: {}", job.id(), u.destination.type().id(), e.getMessage());
            }
        }
    }

    private boolean update(BackupJob job, BackupStatus status, int progress, String operation) {
        synchronized (lock) {
            if (!activeJobs.containsKey(job.id())) return false;
            job.status(status);
            job.progress(progress, operation);
        }
        return true;
    }

    /** Sob lock: um job já finalizado (ex.: cancelado) não pode mais ser alterado. */
    private void requireActive(BackupJob job) throws BackupException {
        if (!activeJobs.containsKey(job.id())) {
            throw BackupException.cancelled("backup " + job.id());
        }
    }

    private void progress(BackupJob job, int value, String operation) throws BackupException {
        BackupJob snapshot;
        synchronized (lock) {
            requireActive(job);
            job.progress(value, operation);
            snapshot = job.snapshot();
        }
        log.debug("Job {}: {}% {}", job.id(), value, operation);
        events.publish(new JobEvent(JobEventType.PROGRESS, snapshot));
    }

    /**
     * Transição terminal, no máximo uma vez por job: move de ativo para histórico, publica,
     * registra métricas e reavalia a fila.
     */
    private void finishJob(BackupJob job, BackupStatus status, ErrorInfo error) {
        BackupJob snapshot;
        synchronized (lock) {
            if (activeJobs.remove(job.id()) == null) return;
            tokens.remove(job.id());
            job.status(status);
            if (error != null) job.error(error);
            if (job.metadata().endTime() == null) job.metadata().endTime(clock.instant());
            job.progress(status == BackupStatus.COMPLETED ? 100 : job.progress(), describe(status));
            completedJobs.put(job.id(), job);
            trimCompleted();
            snapshot = job.snapshot();
        }

        if (status == BackupStatus.COMPLETED) {
            try {
                metadataStore.save(snapshot.metadata());
            } catch (IOException e) {
                log.error("Falha ao persistir metadados do backup {}", job.id(), e);
            }
        }

        switch (status) {
            case COMPLETED:
                log.info("Backup {} de {} concluído ({} bytes)", job.id(), job.storageType().id(), snapshot.metadata().size());
                publish(JobEventType.COMPLETED, snapshot);
                count(Metrics.JOB_COMPLETED, job.storageType());
                histogram(Metrics.BACKUP_SIZE_BYTES, snapshot.metadata().size(), job.storageType());
                break;
            case CANCELLED:
                log.info("Backup {} de {} cancelado", job.id(), job.storageType().id());
                publish(JobEventType.CANCELLED, snapshot);
                count(Metrics.JOB_CANCELLED, job.storageType());
                break;
            default:
                publish(JobEventType.FAILED, snapshot);
                count(Metrics.JOB_FAILED, job.storageType());
                break;
        }
        Instant end = snapshot.metadata().endTime();
        histogram(Metrics.JOB_DURATION_MS, Duration.between(job.startTime(), end).toMillis(), job.storageType());

        processQueue();
    }

    private void trimCompleted() {
        Iterator<BackupJob> it = completedJobs.values().iterator();
        while (completedJobs.size() > MAX_COMPLETED_JOBS && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    private static String describe(BackupStatus status) {
        switch (status) {
            case COMPLETED: return "Backup concluído";
            case CANCELLED: return "Backup cancelado";
            default: return "Backup falhou";
        }
    }

    private void publish(JobEventType type, BackupJob snapshotOrLive) {
        BackupJob snapshot;
        synchronized (lock) {
            snapshot = snapshotOrLive.snapshot();
        }
        events.publish(new JobEvent(type, snapshot));
    }

    private void count(String name, StorageType type) {
        try {
            metrics.increment(name, type);
        } catch (RuntimeException e) {
            log.debug("Sink de métricas falhou em {}: {}", name, e.toString());
        }
    }

    private void histogram(String name, double value, StorageType type) {
        try {
            metrics.histogram(name, value, type);
        } catch (RuntimeException e) {
            log.debug("Sink de métricas falhou em {}: {}", name, e.toString());
        }
    }

    static ErrorInfo errorInfo(Throwable e) {
        StringWriter stack = new StringWriter();
        e.printStackTrace(new PrintWriter(stack));
        String code = e instanceof BackupException ? ((BackupException) e).code().name() : e.getClass().getSimpleName();
        return new ErrorInfo(String.valueOf(e.getMessage()), stack.toString(), code);
    }

    // =====================
    // CONSULTA / CANCELAMENTO
    // =====================

    /**
     * Job pelo id. Aceita id de ticket: resolve para o job quando já despachado.
     */
    public Optional<BackupJob> getBackupStatus(String id) {
        synchronized (lock) {
            String jobId = id;
            if (QueueTicket.isTicketId(id)) {
                QueueTicket ticket = tickets.get(id);
                if (ticket == null || ticket.jobId().isEmpty()) return Optional.empty();
                jobId = ticket.jobId().get();
            }
            BackupJob job = activeJobs.get(jobId);
            if (job == null) job = completedJobs.get(jobId);
            return Optional.ofNullable(job).map(BackupJob::snapshot);
        }
    }

    public Optional<QueueTicket> ticket(String ticketId) {
        synchronized (lock) {
            return Optional.ofNullable(tickets.get(ticketId));
        }
    }

    /** Ativos e históricos que passam no filtro, mais recentes primeiro. */
    public List<BackupJob> listJobs(SearchFilters filters) {
        SearchFilters f = filters != null ? filters : SearchFilters.none();
        List<BackupJob> out = new ArrayList<>();
        synchronized (lock) {
            for (BackupJob job : activeJobs.values()) {
                if (f.matchesJob(job)) out.add(job.snapshot());
            }
            for (BackupJob job : completedJobs.values()) {
                if (f.matchesJob(job)) out.add(job.snapshot());
            }
        }
        out.sort(Comparator.comparing(BackupJob::startTime).reversed());
        return page(out, f);
    }

    public List<BackupJob> listJobs() {
        return listJobs(SearchFilters.none());
    }

    /**
     * Cancela um job ativo (dispara o token) ou remove um ticket da fila.
     *
     * @return false se o id não está ativo nem na fila
     */
    public boolean cancelBackup(String id) {
        BackupJob job;
        CancellationToken token;
        synchronized (lock) {
            String jobId = id;
            if (QueueTicket.isTicketId(id)) {
                QueueTicket ticket = tickets.get(id);
                if (ticket == null) return false;
                if (ticket.state() == QueueTicket.State.QUEUED) {
                    queue.removeIf(r -> r.ticketId.equals(id));
                    tickets.put(id, ticket.withState(QueueTicket.State.CANCELLED));
                    log.info("Pedido {} removido da fila", id);
                    return true;
                }
                if (ticket.jobId().isEmpty()) return false;
                jobId = ticket.jobId().get();
            }
            job = activeJobs.get(jobId);
            if (job == null) return false;
            token = tokens.get(jobId);
        }
        log.info("Cancelando backup {}", job.id());
        if (token != null) token.cancel();
        finishJob(job, BackupStatus.CANCELLED, null);
        return true;
    }

    /**
     * Backups concluídos (store durável + cache em memória), filtrados, ordenados e paginados.
     */
    public List<BackupMetadata> searchBackups(SearchFilters filters) throws IOException {
        SearchFilters f = filters != null ? filters : SearchFilters.none();
        Map<String, BackupMetadata> byId = new LinkedHashMap<>();
        for (BackupMetadata m : metadataStore.all()) byId.put(m.id(), m);
        synchronized (lock) {
            for (BackupJob job : completedJobs.values()) {
                if (job.status() == BackupStatus.COMPLETED) byId.put(job.id(), job.metadata().copy());
            }
        }
        List<BackupMetadata> out = new ArrayList<>();
        for (BackupMetadata m : byId.values()) {
            if (m.status() == BackupStatus.COMPLETED && f.matchesMetadata(m)) out.add(m);
        }
        Comparator<BackupMetadata> order;
        switch (f.sortBy()) {
            case SIZE:
                order = Comparator.comparingLong(BackupMetadata::size);
                break;
            case STORAGE_TYPE:
                order = Comparator.comparing((BackupMetadata m) -> m.storageType().id());
                break;
            default:
                order = Comparator.comparing(BackupMetadata::startTime, Comparator.nullsFirst(Comparator.naturalOrder()));
                break;
        }
        if (f.sortOrder() == SearchFilters.SortOrder.DESC) order = order.reversed();
        out.sort(order);
        return page(out, f);
    }

    private static <T> List<T> page(List<T> items, SearchFilters f) {
        if (f.offset() >= items.size()) return List.of();
        int end = (int) Math.min(items.size(), (long) f.offset() + f.limit());
        return new ArrayList<>(items.subList(f.offset(), end));
    }

    private BackupMetadata findMetadata(String backupId) throws IOException {
        synchronized (lock) {
            BackupJob job = completedJobs.get(backupId);
            if (job != null && job.status() == BackupStatus.COMPLETED) return job.metadata().copy();
        }
        return metadataStore.find(backupId).orElseThrow(() -> BackupException.notFound(backupId));
    }

    private StorageBackend backendFor(BackupMetadata metadata) throws BackupException {
        StorageBackend backend = backends.get(metadata.storageType());
        if (backend == null) throw BackupException.noHandler(metadata.storageType().id());
        return backend;
    }

    // =====================
    // RESTORE / DELETE / VERIFY
    // =====================

    /**
     * Restaura um backup concluído. {@code overwrite=true} é destrutivo (no Postgres derruba
     * o banco alvo antes de recriar).
     */
    public boolean restoreBackup(String backupId, RestoreOptions options) throws IOException {
        BackupMetadata metadata = findMetadata(backupId);
        StorageBackend backend = backendFor(metadata);
        RestoreOptions effective = options != null ? options : RestoreOptions.builder(backupId).build();
        try {
            boolean ok = backend.restoreBackup(metadata, effective, CancellationToken.none());
            count(ok ? Metrics.RESTORE_SUCCESS : Metrics.RESTORE_FAILURE, metadata.storageType());
            return ok;
        } catch (IOException | RuntimeException e) {
            count(Metrics.RESTORE_ERROR, metadata.storageType());
            log.error("Restore do backup {} falhou", backupId, e);
            throw e;
        }
    }

    /** Remove de todos os destinos, do backend e do histórico. */
    public boolean deleteBackup(String backupId) throws IOException {
        BackupMetadata metadata = findMetadata(backupId);
        for (BackupDestination destination : config.destinations()) {
            DestinationHandler handler = destinationHandlers.get(destination.type());
            if (handler == null) {
                log.warn("Sem handler para destino {}; cópia de {} não removida", destination.type().id(), backupId);
                continue;
            }
            handler.delete(metadata.files(), destination, metadata);
        }
        StorageBackend backend = backends.get(metadata.storageType());
        if (backend != null) {
            backend.deleteBackup(metadata);
        }
        metadataStore.delete(backupId);
        synchronized (lock) {
            completedJobs.remove(backupId);
        }
        log.info("Backup {} removido", backupId);
        return true;
    }

    public boolean verifyBackup(String backupId, VerificationType type) throws IOException {
        BackupMetadata metadata = findMetadata(backupId);
        StorageBackend backend = backendFor(metadata);
        return backend.verifyBackup(metadata, type != null ? type : VerificationType.CHECKSUM);
    }

    public boolean verifyBackup(String backupId) throws IOException {
        return verifyBackup(backupId, VerificationType.CHECKSUM);
    }

    // =====================
    // ESTATÍSTICAS
    // =====================

    public BackupStatistics getStatistics() {
        List<BackupJob> all = new ArrayList<>();
        synchronized (lock) {
            for (BackupJob job : activeJobs.values()) all.add(job.snapshot());
            for (BackupJob job : completedJobs.values()) all.add(job.snapshot());
        }
        int successful = 0;
        int failed = 0;
        long totalSize = 0;
        Instant lastBackup = null;
        Map<StorageType, StorageTypeStats> byType = new EnumMap<>(StorageType.class);
        for (BackupJob job : all) {
            if (job.status() == BackupStatus.FAILED) failed++;
            if (job.status() != BackupStatus.COMPLETED) continue;
            successful++;
            long size = job.metadata().size();
            totalSize += size;
            if (lastBackup == null || job.startTime().isAfter(lastBackup)) lastBackup = job.startTime();
            StorageTypeStats prev = byType.get(job.storageType());
            Instant typeLast = prev == null ? job.startTime()
                    : prev.lastBackup().filter(t -> t.isAfter(job.startTime())).orElse(job.startTime());
            byType.put(job.storageType(), new StorageTypeStats(
                    prev == null ? 1 : prev.count() + 1,
                    prev == null ? size : prev.size() + size,
                    typeLast));
        }
        long average = successful == 0 ? 0 : totalSize / successful;
        double successRate = all.isEmpty() ? 0.0 : successful * 100.0 / all.size();
        Instant next = nextScheduledAcrossAll();
        return new BackupStatistics(all.size(), successful, failed, totalSize, average, lastBackup,
                next, successRate, byType);
    }

    private Instant nextScheduledAcrossAll() {
        synchronized (lock) {
            return schedules.values().stream()
                    .map(CronScheduler.Handle::nextFireTime)
                    .flatMap(Optional::stream)
                    .min(Comparator.naturalOrder())
                    .orElse(null);
        }
    }

    // =====================
    // AGENDA
    // =====================

    /**
     * Uma entrada por tipo habilitado ({@code backup-<tipo>}) e a limpeza diária. Tipos com
     * schedule próprio usam o dele.
     */
    public void scheduleBackups() {
        BackupConfig current = config;
        if (!current.enabled() || !current.defaultSchedule().enabled()) {
            log.info("Agenda de backup desabilitada");
            return;
        }
        synchronized (lock) {
            if (shuttingDown) return;
            for (StorageBackupConfig c : current.storageConfigs()) {
                if (!c.enabled()) continue;
                BackupSchedule schedule = c.schedule().orElse(current.defaultSchedule());
                if (!schedule.enabled()) continue;
                StorageType type = c.type();
                String name = SCHEDULE_PREFIX + type.id();
                stopHandle(name);
                schedules.put(name, scheduler.schedule(name, schedule.cron(), schedule.timezone(),
                        () -> runScheduled(type)));
            }
            if (current.retentionPolicy().autoCleanup()) {
                stopHandle(CLEANUP_SCHEDULE);
                schedules.put(CLEANUP_SCHEDULE, scheduler.schedule(CLEANUP_SCHEDULE, current.global().cleanupCron(),
                        current.defaultSchedule().timezone(), this::runScheduledCleanup));
            }
        }
    }

    private void stopHandle(String name) {
        CronScheduler.Handle old = schedules.remove(name);
        if (old != null) old.stop();
    }

    private void runScheduled(StorageType type) {
        try {
            String id = startBackup(type, null);
            log.info("Backup agendado de {} iniciado: {}", type.id(), id);
        } catch (BackupException e) {
            log.error("Backup agendado de {} falhou: {}", type.id(), e.getMessage());
        }
    }

    private void runScheduledCleanup() {
        try {
            int deleted = cleanupOldBackups();
            log.info("Limpeza agendada removeu {} backup(s)", deleted);
        } catch (IOException e) {
            log.error("Limpeza agendada falhou", e);
        }
    }

    public void stopScheduledBackups() {
        synchronized (lock) {
            for (CronScheduler.Handle handle : schedules.values()) {
                handle.stop();
            }
            schedules.clear();
        }
        log.info("Agenda de backup parada");
    }

    /** Próximo disparo por tipo de storage; a limpeza não entra. */
    public Map<StorageType, Instant> getNextScheduledBackups() {
        Map<StorageType, Instant> out = new EnumMap<>(StorageType.class);
        synchronized (lock) {
            for (Map.Entry<String, CronScheduler.Handle> e : schedules.entrySet()) {
                if (CLEANUP_SCHEDULE.equals(e.getKey())) continue;
                StorageType type = StorageType.fromId(e.getKey().substring(SCHEDULE_PREFIX.length()));
                e.getValue().nextFireTime().ifPresent(t -> out.put(type, t));
            }
        }
        return out;
    }

    // =====================
    // RETENÇÃO
    // =====================

    /**
     * Aplica a política de retenção por tipo de storage. Falhas de remoção são logadas e
     * não interrompem a limpeza.
     *
     * @return total removido
     */
    public int cleanupOldBackups() throws IOException {
        List<BackupMetadata> all = searchBackups(SearchFilters.builder().limit(Integer.MAX_VALUE).build());
        Map<StorageType, List<BackupMetadata>> byType = new EnumMap<>(StorageType.class);
        for (BackupMetadata m : all) {
            byType.computeIfAbsent(m.storageType(), k -> new ArrayList<>()).add(m);
        }
        Instant now = clock.instant();
        int deleted = 0;
        for (Map.Entry<StorageType, List<BackupMetadata>> e : byType.entrySet()) {
            RetentionPolicyEvaluator.Decision decision =
                    RetentionPolicyEvaluator.evaluate(e.getValue(), config.retentionPolicy(), now);
            log.info("Retenção {}: mantendo {} (diário={}, semanal={}, mensal={}), removendo {}",
                    e.getKey().id(), decision.keep().size(), decision.dailyCount(), decision.weeklyCount(),
                    decision.monthlyCount(), decision.delete().size());
            for (BackupMetadata m : decision.delete()) {
                try {
                    deleteBackup(m.id());
                    deleted++;
                } catch (IOException | RuntimeException ex) {
                    log.error("Falha ao remover backup antigo {}: {}", m.id(), ex.getMessage());
                }
            }
        }
        log.info("Limpeza concluída: {} backup(s) removido(s)", deleted);
        return deleted;
    }

    // =====================
    // SHUTDOWN
    // =====================

    /** Idempotente: para a agenda, cancela fila e jobs ativos e libera os backends. */
    public void shutdown() {
        List<BackupJob> running;
        synchronized (lock) {
            if (shuttingDown) return;
            shuttingDown = true;
        }
        log.info("Desligando orquestrador de backup");
        stopScheduledBackups();
        synchronized (lock) {
            for (PendingRequest request : queue) {
                QueueTicket ticket = tickets.get(request.ticketId);
                if (ticket != null) tickets.put(ticket.id(), ticket.withState(QueueTicket.State.CANCELLED));
            }
            queue.clear();
            running = new ArrayList<>(activeJobs.values());
        }
        for (BackupJob job : running) {
            cancelBackup(job.id());
        }
        for (StorageBackend backend : backends.values()) {
            try {
                backend.cleanup();
            } catch (RuntimeException e) {
                log.warn("Cleanup do backend {} falhou: {}", backend.storageType().id(), e.getMessage());
            }
        }
        verificationEngine.close();
        jobExecutor.shutdownNow();
        try {
            if (!jobExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Jobs de backup não terminaram dentro do prazo");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        events.close();
        scheduler.close();
        log.info("Orquestrador de backup desligado");
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    // =====================
    // TIPOS INTERNOS
    // =====================

    private static final class PendingRequest {
        final String ticketId;
        final StorageType storageType;
        final StorageBackupConfig overrides;

        PendingRequest(String ticketId, StorageType storageType, StorageBackupConfig overrides) {
            this.ticketId = ticketId;
            this.storageType = storageType;
            this.overrides = overrides;
        }
    }

    private static final class Uploaded {
        final DestinationHandler handler;
        final BackupDestination destination;
        final List<String> stored;

        Uploaded(DestinationHandler handler, BackupDestination destination, List<String> stored) {
            this.handler = handler;
            this.destination = destination;
            this.stored = Collections.unmodifiableList(stored);
        }
    }

    public static final class Builder {
        private BackupConfig config;
        private Path scratchRoot = Path.of("temp", "backups");
        private CommandRunner commandRunner;
        private VerificationEngine verificationEngine;
        private MetadataStore metadataStore;
        private MetricsSink metrics;
        private JobEventBus events;
        private CronScheduler scheduler;
        private Clock clock;
        private final List<StorageBackend> backends = new ArrayList<>();
        private final List<DestinationHandler> destinationHandlers = new ArrayList<>();

        private Builder() {}

        public Builder config(BackupConfig v) { this.config = v; return this; }
        /** Onde cada job gera seus artefatos antes do upload ({@code <scratch>/<jobId>}). */
        public Builder scratchRoot(Path v) { this.scratchRoot = v; return this; }
        public Builder commandRunner(CommandRunner v) { this.commandRunner = v; return this; }
        public Builder verificationEngine(VerificationEngine v) { this.verificationEngine = v; return this; }
        public Builder metadataStore(MetadataStore v) { this.metadataStore = v; return this; }
        public Builder metrics(MetricsSink v) { this.metrics = v; return this; }
        public Builder events(JobEventBus v) { this.events = v; return this; }
        public Builder scheduler(CronScheduler v) { this.scheduler = v; return this; }
        public Builder clock(Clock v) { this.clock = v; return this; }
        public Builder backend(StorageBackend v) { this.backends.add(v); return this; }
        public Builder destinationHandler(DestinationHandler v) { this.destinationHandlers.add(v); return this; }

        public BackupOrchestrator build() { return new BackupOrchestrator(this); }
    }
}
