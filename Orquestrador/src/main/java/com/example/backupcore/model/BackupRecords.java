package com.example.backupcore.model;

import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.BackupKind;
import com.example.backupcore.model.BackupTypes.BackupStatus;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.StorageType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registros de execução: jobs, metadados persistidos, opções de restore, filtros de busca
 * e estatísticas.
 * <p>
 * {@link BackupJob} e {@link BackupMetadata} são mutáveis e pertencem ao orquestrador;
 * quem está fora dele só recebe cópias via {@code snapshot()}/{@code copy()}.
 */
public final class BackupRecords {

    private BackupRecords() {}

    // ==================================================================================
    // ERRO CAPTURADO
    // ==================================================================================

    public static final class ErrorInfo {
        private final String message;
        private final String stack;
        private final String code;

        public ErrorInfo(String message, String stack, String code) {
            this.message = message;
            this.stack = stack;
            this.code = code;
        }

        public String message() { return message; }
        public String stack() { return stack; }
        public String code() { return code; }
    }

    // ==================================================================================
    // METADADOS (registro durável)
    // ==================================================================================

    public static final class BackupMetadata {
        private final String id;
        private final StorageType storageType;
        private BackupKind backupKind;
        private BackupStatus status;
        private Instant startTime;
        private Instant endTime;
        private CompressionType compression;
        private List<String> files = new ArrayList<>();
        private Map<String, String> checksums = new LinkedHashMap<>();
        private long size;
        private Long compressedSize;
        private BackupDestination destination;
        private List<String> tags = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private Map<String, Object> sourceConfig = new LinkedHashMap<>();
        private String version = "1.0.0";
        private ErrorInfo error;

        public BackupMetadata(String id, StorageType storageType) {
            this.id = Objects.requireNonNull(id, "id");
            this.storageType = Objects.requireNonNull(storageType, "storageType");
        }

        public BackupMetadata copy() {
            BackupMetadata c = new BackupMetadata(id, storageType);
            c.backupKind = backupKind;
            c.status = status;
            c.startTime = startTime;
            c.endTime = endTime;
            c.compression = compression;
            c.files = new ArrayList<>(files);
            c.checksums = new LinkedHashMap<>(checksums);
            c.size = size;
            c.compressedSize = compressedSize;
            c.destination = destination;
            c.tags = new ArrayList<>(tags);
            c.metadata = new LinkedHashMap<>(metadata);
            c.sourceConfig = new LinkedHashMap<>(sourceConfig);
            c.version = version;
            c.error = error;
            return c;
        }

        public String id() { return id; }
        public StorageType storageType() { return storageType; }
        public BackupKind backupKind() { return backupKind; }
        public BackupStatus status() { return status; }
        public Instant startTime() { return startTime; }
        public Instant endTime() { return endTime; }
        public CompressionType compression() { return compression; }
        public List<String> files() { return Collections.unmodifiableList(files); }
        public Map<String, String> checksums() { return Collections.unmodifiableMap(checksums); }
        public long size() { return size; }
        public Optional<Long> compressedSize() { return Optional.ofNullable(compressedSize); }
        public BackupDestination destination() { return destination; }
        public List<String> tags() { return Collections.unmodifiableList(tags); }
        public Map<String, Object> metadata() { return Collections.unmodifiableMap(metadata); }
        public Map<String, Object> sourceConfig() { return Collections.unmodifiableMap(sourceConfig); }
        public String version() { return version; }
        public ErrorInfo error() { return error; }

        public BackupMetadata backupKind(BackupKind v) { this.backupKind = v; return this; }
        public BackupMetadata status(BackupStatus v) { this.status = v; return this; }
        public BackupMetadata startTime(Instant v) { this.startTime = v; return this; }
        public BackupMetadata endTime(Instant v) { this.endTime = v; return this; }
        public BackupMetadata compression(CompressionType v) { this.compression = v; return this; }
        public BackupMetadata files(List<String> v) { this.files = new ArrayList<>(v); return this; }
        public BackupMetadata checksums(Map<String, String> v) { this.checksums = new LinkedHashMap<>(v); return this; }
        public BackupMetadata size(long v) { this.size = v; return this; }
        public BackupMetadata compressedSize(Long v) { this.compressedSize = v; return this; }
        public BackupMetadata destination(BackupDestination v) { this.destination = v; return this; }
        public BackupMetadata tags(List<String> v) { this.tags = new ArrayList<>(v); return this; }
        public BackupMetadata metadata(Map<String, Object> v) { this.metadata = new LinkedHashMap<>(v); return this; }
        public BackupMetadata putMetadata(String key, Object value) { this.metadata.put(key, value); return this; }
        public BackupMetadata sourceConfig(Map<String, Object> v) { this.sourceConfig = new LinkedHashMap<>(v); return this; }
        public BackupMetadata version(String v) { this.version = v; return this; }
        public BackupMetadata error(ErrorInfo v) { this.error = v; return this; }
    }

    // ==================================================================================
    // JOB (efêmero)
    // ==================================================================================

    public static final class BackupJob {
        private final String id;
        private final StorageType storageType;
        private final StorageBackupConfig config;
        private final BackupDestination destination;
        private final Instant startTime;
        private final BackupMetadata metadata;
        private BackupStatus status = BackupStatus.PENDING;
        private int progress;
        private String currentOperation = "Na fila de execução";
        private ErrorInfo error;

        public BackupJob(String id, StorageType storageType, StorageBackupConfig config,
                         BackupDestination destination, Instant startTime) {
            this.id = Objects.requireNonNull(id, "id");
            this.storageType = Objects.requireNonNull(storageType, "storageType");
            this.config = Objects.requireNonNull(config, "config");
            this.destination = destination;
            this.startTime = Objects.requireNonNull(startTime, "startTime");
            this.metadata = new BackupMetadata(id, storageType)
                    .backupKind(config.backupKind())
                    .status(BackupStatus.PENDING)
                    .startTime(startTime)
                    .compression(config.compression())
                    .destination(destination)
                    .tags(List.of(storageType.id(), config.backupKind().id()));
        }

        private BackupJob(BackupJob source) {
            this.id = source.id;
            this.storageType = source.storageType;
            this.config = source.config;
            this.destination = source.destination;
            this.startTime = source.startTime;
            this.metadata = source.metadata.copy();
            this.status = source.status;
            this.progress = source.progress;
            this.currentOperation = source.currentOperation;
            this.error = source.error;
        }

        /** Cópia isolada para leitores fora do orquestrador (eventos, API). */
        public BackupJob snapshot() {
            return new BackupJob(this);
        }

        public String id() { return id; }
        public StorageType storageType() { return storageType; }
        public StorageBackupConfig config() { return config; }
        public BackupDestination destination() { return destination; }
        public Instant startTime() { return startTime; }
        public BackupMetadata metadata() { return metadata; }
        public BackupStatus status() { return status; }
        public int progress() { return progress; }
        public String currentOperation() { return currentOperation; }
        public ErrorInfo error() { return error; }

        public void status(BackupStatus v) {
            this.status = v;
            this.metadata.status(v);
        }

        public void progress(int value, String operation) {
            this.progress = Math.max(0, Math.min(100, value));
            this.currentOperation = operation;
        }

        public void error(ErrorInfo v) {
            this.error = v;
            this.metadata.error(v);
        }
    }

    // ==================================================================================
    // RESTORE / BUSCA / ESTATÍSTICAS
    // ==================================================================================

    /**
     * Opções de restore. {@code overwrite=true} é destrutivo: no Postgres derruba e recria o
     * banco (ou limpa objetos existentes) antes de restaurar. Nunca é o padrão.
     */
    public static final class RestoreOptions {
        private final String backupId;
        private final String targetPath;
        private final boolean overwrite;
        private final List<String> files;
        private final boolean verify;
        private final boolean restoreTest;
        private final Map<String, Object> config;

        private RestoreOptions(Builder b) {
            this.backupId = b.backupId;
            this.targetPath = b.targetPath;
            this.overwrite = b.overwrite;
            this.files = b.files == null ? null : List.copyOf(b.files);
            this.verify = b.verify;
            this.restoreTest = b.restoreTest;
            this.config = Collections.unmodifiableMap(new LinkedHashMap<>(b.config));
        }

        public static Builder builder(String backupId) { return new Builder().backupId(backupId); }

        public String backupId() { return backupId; }
        public Optional<String> targetPath() { return Optional.ofNullable(targetPath); }
        public boolean overwrite() { return overwrite; }
        /** Subconjunto de arquivos; vazio = todos os arquivos do backup. */
        public Optional<List<String>> files() { return Optional.ofNullable(files); }
        public boolean verify() { return verify; }
        /**
         * Restore descartável de verificação. Backends com estado fora do disco (bancos)
         * restauram num alvo temporário e nunca na origem configurada.
         */
        public boolean restoreTest() { return restoreTest; }
        public Map<String, Object> config() { return config; }

        public static final class Builder {
            private String backupId;
            private String targetPath;
            private boolean overwrite = false;
            private List<String> files;
            private boolean verify = true;
            private boolean restoreTest = false;
            private Map<String, Object> config = new LinkedHashMap<>();

            public Builder backupId(String v) { this.backupId = v; return this; }
            public Builder targetPath(String v) { this.targetPath = v; return this; }
            public Builder overwrite(boolean v) { this.overwrite = v; return this; }
            public Builder files(List<String> v) { this.files = v; return this; }
            public Builder verify(boolean v) { this.verify = v; return this; }
            public Builder restoreTest(boolean v) { this.restoreTest = v; return this; }
            public Builder config(Map<String, Object> v) { this.config = new LinkedHashMap<>(v); return this; }

            public RestoreOptions build() { return new RestoreOptions(this); }
        }
    }

    public static final class SearchFilters {

        public enum SortBy { START_TIME, SIZE, STORAGE_TYPE }

        public enum SortOrder { ASC, DESC }

        private final StorageType storageType;
        private final BackupStatus status;
        private final Instant from;
        private final Instant to;
        private final Long minSize;
        private final Long maxSize;
        private final List<String> tags;
        private final int limit;
        private final int offset;
        private final SortBy sortBy;
        private final SortOrder sortOrder;

        private SearchFilters(Builder b) {
            this.storageType = b.storageType;
            this.status = b.status;
            this.from = b.from;
            this.to = b.to;
            this.minSize = b.minSize;
            this.maxSize = b.maxSize;
            this.tags = List.copyOf(b.tags);
            this.limit = b.limit;
            this.offset = b.offset;
            this.sortBy = b.sortBy;
            this.sortOrder = b.sortOrder;
        }

        public static Builder builder() { return new Builder(); }

        public static SearchFilters none() { return builder().build(); }

        public Optional<StorageType> storageType() { return Optional.ofNullable(storageType); }
        public Optional<BackupStatus> status() { return Optional.ofNullable(status); }
        public Optional<Instant> from() { return Optional.ofNullable(from); }
        public Optional<Instant> to() { return Optional.ofNullable(to); }
        public Optional<Long> minSize() { return Optional.ofNullable(minSize); }
        public Optional<Long> maxSize() { return Optional.ofNullable(maxSize); }
        public List<String> tags() { return tags; }
        public int limit() { return limit; }
        public int offset() { return offset; }
        public SortBy sortBy() { return sortBy; }
        public SortOrder sortOrder() { return sortOrder; }

        /** Filtro de jobs: tipo, status e intervalo de datas. */
        public boolean matchesJob(BackupJob job) {
            if (storageType != null && job.storageType() != storageType) return false;
            if (status != null && job.status() != status) return false;
            return inRange(job.startTime());
        }

        /** Filtro de metadados: além dos campos do job, tamanho e tags. */
        public boolean matchesMetadata(BackupMetadata metadata) {
            if (storageType != null && metadata.storageType() != storageType) return false;
            if (status != null && metadata.status() != status) return false;
            if (metadata.startTime() != null && !inRange(metadata.startTime())) return false;
            if (minSize != null && metadata.size() < minSize) return false;
            if (maxSize != null && metadata.size() > maxSize) return false;
            return metadata.tags().containsAll(tags);
        }

        private boolean inRange(Instant instant) {
            if (from != null && instant.isBefore(from)) return false;
            return to == null || !instant.isAfter(to);
        }

        public static final class Builder {
            private StorageType storageType;
            private BackupStatus status;
            private Instant from;
            private Instant to;
            private Long minSize;
            private Long maxSize;
            private List<String> tags = new ArrayList<>();
            private int limit = 100;
            private int offset = 0;
            private SortBy sortBy = SortBy.START_TIME;
            private SortOrder sortOrder = SortOrder.DESC;

            public Builder storageType(StorageType v) { this.storageType = v; return this; }
            public Builder status(BackupStatus v) { this.status = v; return this; }
            public Builder dateRange(Instant from, Instant to) { this.from = from; this.to = to; return this; }
            public Builder sizeRange(Long min, Long max) { this.minSize = min; this.maxSize = max; return this; }
            public Builder tags(List<String> v) { this.tags = new ArrayList<>(v); return this; }
            public Builder limit(int v) { this.limit = Math.max(0, v); return this; }
            public Builder offset(int v) { this.offset = Math.max(0, v); return this; }
            public Builder sortBy(SortBy v) { this.sortBy = Objects.requireNonNull(v); return this; }
            public Builder sortOrder(SortOrder v) { this.sortOrder = Objects.requireNonNull(v); return this; }

            public SearchFilters build() { return new SearchFilters(this); }
        }
    }

    public static final class StorageTypeStats {
        private final int count;
        private final long size;
        private final Instant lastBackup;

        public StorageTypeStats(int count, long size, Instant lastBackup) {
            this.count = count;
            this.size = size;
            this.lastBackup = lastBackup;
        }

        public int count() { return count; }
        public long size() { return size; }
        public Optional<Instant> lastBackup() { return Optional.ofNullable(lastBackup); }
    }

    public static final class BackupStatistics {
        private final int totalBackups;
        private final int successfulBackups;
        private final int failedBackups;
        private final long totalSize;
        private final long averageSize;
        private final Instant lastBackupTime;
        private final Instant nextScheduledBackup;
        private final double successRate;
        private final Map<StorageType, StorageTypeStats> byStorageType;

        public BackupStatistics(int totalBackups, int successfulBackups, int failedBackups,
                                long totalSize, long averageSize, Instant lastBackupTime,
                                Instant nextScheduledBackup, double successRate,
                                Map<StorageType, StorageTypeStats> byStorageType) {
            this.totalBackups = totalBackups;
            this.successfulBackups = successfulBackups;
            this.failedBackups = failedBackups;
            this.totalSize = totalSize;
            this.averageSize = averageSize;
            this.lastBackupTime = lastBackupTime;
            this.nextScheduledBackup = nextScheduledBackup;
            this.successRate = successRate;
            this.byStorageType = Map.copyOf(byStorageType);
        }

        public int totalBackups() { return totalBackups; }
        public int successfulBackups() { return successfulBackups; }
        public int failedBackups() { return failedBackups; }
        public long totalSize() { return totalSize; }
        public long averageSize() { return averageSize; }
        public Optional<Instant> lastBackupTime() { return Optional.ofNullable(lastBackupTime); }
        public Optional<Instant> nextScheduledBackup() { return Optional.ofNullable(nextScheduledBackup); }
        /** Percentual 0..100 de jobs concluídos sobre o total. */
        public double successRate() { return successRate; }
        public Map<StorageType, StorageTypeStats> byStorageType() { return byStorageType; }
    }
}
