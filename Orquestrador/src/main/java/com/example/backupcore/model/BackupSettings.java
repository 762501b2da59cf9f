package com.example.backupcore.model;

import com.example.backupcore.model.BackupTypes.BackupKind;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.DestinationType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuração imutável do sistema de backup. Alterações passam por {@code toBuilder()}
 * e pelo updateConfig do orquestrador, nunca por mutação direta.
 */
public final class BackupSettings {

    private BackupSettings() {}

    // ==================================================================================
    // CONFIG GLOBAL
    // ==================================================================================

    public static final class BackupConfig {
        private final boolean enabled;
        private final List<StorageBackupConfig> storageConfigs;
        private final List<BackupDestination> destinations;
        private final BackupSchedule defaultSchedule;
        private final RetentionPolicy retentionPolicy;
        private final GlobalSettings global;

        private BackupConfig(Builder b) {
            this.enabled = b.enabled;
            this.storageConfigs = List.copyOf(b.storageConfigs);
            this.destinations = List.copyOf(b.destinations);
            this.defaultSchedule = Objects.requireNonNull(b.defaultSchedule, "defaultSchedule");
            this.retentionPolicy = Objects.requireNonNull(b.retentionPolicy, "retentionPolicy");
            this.global = Objects.requireNonNull(b.global, "global");
        }

        public static Builder builder() { return new Builder(); }

        public Builder toBuilder() {
            return new Builder()
                    .enabled(enabled)
                    .storageConfigs(storageConfigs)
                    .destinations(destinations)
                    .defaultSchedule(defaultSchedule)
                    .retentionPolicy(retentionPolicy)
                    .global(global);
        }

        public boolean enabled() { return enabled; }
        public List<StorageBackupConfig> storageConfigs() { return storageConfigs; }
        public List<BackupDestination> destinations() { return destinations; }
        public BackupSchedule defaultSchedule() { return defaultSchedule; }
        public RetentionPolicy retentionPolicy() { return retentionPolicy; }
        public GlobalSettings global() { return global; }

        public Optional<StorageBackupConfig> storageConfig(StorageType type) {
            return storageConfigs.stream().filter(c -> c.type() == type).findFirst();
        }

        public static final class Builder {
            private boolean enabled = true;
            private List<StorageBackupConfig> storageConfigs = new ArrayList<>();
            private List<BackupDestination> destinations = new ArrayList<>();
            private BackupSchedule defaultSchedule = BackupSchedule.builder().build();
            private RetentionPolicy retentionPolicy = RetentionPolicy.builder().build();
            private GlobalSettings global = GlobalSettings.builder().build();

            public Builder enabled(boolean v) { this.enabled = v; return this; }
            public Builder storageConfigs(List<StorageBackupConfig> v) { this.storageConfigs = new ArrayList<>(v); return this; }
            public Builder addStorageConfig(StorageBackupConfig v) { this.storageConfigs.add(v); return this; }
            public Builder destinations(List<BackupDestination> v) { this.destinations = new ArrayList<>(v); return this; }
            public Builder addDestination(BackupDestination v) { this.destinations.add(v); return this; }
            public Builder defaultSchedule(BackupSchedule v) { this.defaultSchedule = v; return this; }
            public Builder retentionPolicy(RetentionPolicy v) { this.retentionPolicy = v; return this; }
            public Builder global(GlobalSettings v) { this.global = v; return this; }

            public BackupConfig build() { return new BackupConfig(this); }
        }
    }

    // ==================================================================================
    // CONFIG POR STORAGE
    // ==================================================================================

    public static final class StorageBackupConfig {
        private final StorageType type;
        private final boolean enabled;
        private final BackupKind backupKind;
        private final CompressionType compression;
        private final List<String> preBackupHooks;
        private final List<String> postBackupHooks;
        private final Map<String, Object> options;
        private final BackupSchedule schedule;

        private StorageBackupConfig(Builder b) {
            this.type = Objects.requireNonNull(b.type, "type");
            this.enabled = b.enabled;
            this.backupKind = Objects.requireNonNull(b.backupKind, "backupKind");
            this.compression = Objects.requireNonNull(b.compression, "compression");
            this.preBackupHooks = List.copyOf(b.preBackupHooks);
            this.postBackupHooks = List.copyOf(b.postBackupHooks);
            this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
            this.schedule = b.schedule;
        }

        public static Builder builder(StorageType type) { return new Builder().type(type); }

        public Builder toBuilder() {
            return new Builder()
                    .type(type)
                    .enabled(enabled)
                    .backupKind(backupKind)
                    .compression(compression)
                    .preBackupHooks(preBackupHooks)
                    .postBackupHooks(postBackupHooks)
                    .options(options)
                    .schedule(schedule);
        }

        /**
         * Sobrepõe esta config com overrides do chamador: campos escalares vêm do override,
         * o bag de opções é mesclado chave a chave.
         */
        public StorageBackupConfig mergedWith(StorageBackupConfig override) {
            if (override == null) return this;
            Map<String, Object> merged = new LinkedHashMap<>(options);
            merged.putAll(override.options());
            return override.toBuilder().type(type).options(merged).build();
        }

        public StorageType type() { return type; }
        public boolean enabled() { return enabled; }
        public BackupKind backupKind() { return backupKind; }
        public CompressionType compression() { return compression; }
        public List<String> preBackupHooks() { return preBackupHooks; }
        public List<String> postBackupHooks() { return postBackupHooks; }
        public Map<String, Object> options() { return options; }
        /** Agenda própria; vazio = usa a agenda padrão. */
        public Optional<BackupSchedule> schedule() { return Optional.ofNullable(schedule); }

        public static final class Builder {
            private StorageType type;
            private boolean enabled = true;
            private BackupKind backupKind = BackupKind.FULL;
            private CompressionType compression = CompressionType.GZIP;
            private List<String> preBackupHooks = new ArrayList<>();
            private List<String> postBackupHooks = new ArrayList<>();
            private Map<String, Object> options = new LinkedHashMap<>();
            private BackupSchedule schedule;

            public Builder type(StorageType v) { this.type = v; return this; }
            public Builder enabled(boolean v) { this.enabled = v; return this; }
            public Builder backupKind(BackupKind v) { this.backupKind = v; return this; }
            public Builder compression(CompressionType v) { this.compression = v; return this; }
            public Builder preBackupHooks(List<String> v) { this.preBackupHooks = new ArrayList<>(v); return this; }
            public Builder postBackupHooks(List<String> v) { this.postBackupHooks = new ArrayList<>(v); return this; }
            public Builder options(Map<String, Object> v) { this.options = new LinkedHashMap<>(v); return this; }
            public Builder option(String key, Object value) { this.options.put(key, value); return this; }
            public Builder schedule(BackupSchedule v) { this.schedule = v; return this; }

            public StorageBackupConfig build() { return new StorageBackupConfig(this); }
        }
    }

    // ==================================================================================
    // DESTINO
    // ==================================================================================

    public static final class BackupDestination {
        private final DestinationType type;
        private final String path;
        private final Map<String, String> credentials;
        private final Map<String, Object> options;

        private BackupDestination(Builder b) {
            this.type = Objects.requireNonNull(b.type, "type");
            this.path = Objects.requireNonNull(b.path, "path");
            this.credentials = Map.copyOf(b.credentials);
            this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
        }

        public static Builder builder(DestinationType type, String path) {
            return new Builder().type(type).path(path);
        }

        public static BackupDestination local(String path) {
            return builder(DestinationType.LOCAL, path).build();
        }

        public DestinationType type() { return type; }
        public String path() { return path; }
        /** Segredos do destino. NÃO logar. */
        public Map<String, String> credentials() { return credentials; }
        public Map<String, Object> options() { return options; }

        @Override
        public String toString() {
            return "BackupDestination{type=" + type.id() + ", path=" + path
                    + ", credentials=" + (credentials.isEmpty() ? "unset" : "set") + "}";
        }

        public static final class Builder {
            private DestinationType type;
            private String path;
            private Map<String, String> credentials = new LinkedHashMap<>();
            private Map<String, Object> options = new LinkedHashMap<>();

            public Builder type(DestinationType v) { this.type = v; return this; }
            public Builder path(String v) { this.path = v; return this; }
            public Builder credentials(Map<String, String> v) { this.credentials = new LinkedHashMap<>(v); return this; }
            public Builder options(Map<String, Object> v) { this.options = new LinkedHashMap<>(v); return this; }

            public BackupDestination build() { return new BackupDestination(this); }
        }
    }

    // ==================================================================================
    // RETENÇÃO / AGENDA / GLOBAL
    // ==================================================================================

    public static final class RetentionPolicy {
        private final int dailyRetentionDays;
        private final int weeklyRetentionWeeks;
        private final int monthlyRetentionMonths;
        private final int maxBackups;
        private final boolean autoCleanup;

        private RetentionPolicy(Builder b) {
            this.dailyRetentionDays = b.dailyRetentionDays;
            this.weeklyRetentionWeeks = b.weeklyRetentionWeeks;
            this.monthlyRetentionMonths = b.monthlyRetentionMonths;
            this.maxBackups = b.maxBackups;
            this.autoCleanup = b.autoCleanup;
        }

        public static Builder builder() { return new Builder(); }

        public int dailyRetentionDays() { return dailyRetentionDays; }
        public int weeklyRetentionWeeks() { return weeklyRetentionWeeks; }
        public int monthlyRetentionMonths() { return monthlyRetentionMonths; }
        public int maxBackups() { return maxBackups; }
        public boolean autoCleanup() { return autoCleanup; }

        public static final class Builder {
            private int dailyRetentionDays = 7;
            private int weeklyRetentionWeeks = 4;
            private int monthlyRetentionMonths = 12;
            private int maxBackups = 100;
            private boolean autoCleanup = true;

            public Builder dailyRetentionDays(int v) { this.dailyRetentionDays = v; return this; }
            public Builder weeklyRetentionWeeks(int v) { this.weeklyRetentionWeeks = v; return this; }
            public Builder monthlyRetentionMonths(int v) { this.monthlyRetentionMonths = v; return this; }
            public Builder maxBackups(int v) { this.maxBackups = v; return this; }
            public Builder autoCleanup(boolean v) { this.autoCleanup = v; return this; }

            public RetentionPolicy build() { return new RetentionPolicy(this); }
        }
    }

    public static final class BackupSchedule {
        private final String cron;
        private final String timezone;
        private final boolean enabled;
        private final int timeoutMinutes;
        private final int retries;

        private BackupSchedule(Builder b) {
            this.cron = Objects.requireNonNull(b.cron, "cron");
            this.timezone = Objects.requireNonNull(b.timezone, "timezone");
            this.enabled = b.enabled;
            this.timeoutMinutes = b.timeoutMinutes;
            this.retries = b.retries;
        }

        public static Builder builder() { return new Builder(); }

        public String cron() { return cron; }
        public String timezone() { return timezone; }
        public boolean enabled() { return enabled; }
        public int timeoutMinutes() { return timeoutMinutes; }
        public int retries() { return retries; }

        public static final class Builder {
            private String cron = "0 2 * * *";
            private String timezone = "UTC";
            private boolean enabled = true;
            private int timeoutMinutes = 60;
            private int retries = 3;

            public Builder cron(String v) { this.cron = v; return this; }
            public Builder timezone(String v) { this.timezone = v; return this; }
            public Builder enabled(boolean v) { this.enabled = v; return this; }
            public Builder timeoutMinutes(int v) { this.timeoutMinutes = v; return this; }
            public Builder retries(int v) { this.retries = v; return this; }

            public BackupSchedule build() { return new BackupSchedule(this); }
        }
    }

    public static final class GlobalSettings {
        private final int maxParallelJobs;
        private final boolean enableVerification;
        private final List<VerificationType> verificationTypes;
        private final String cleanupCron;
        private final boolean parallelVerification;
        private final int verificationTimeoutSeconds;
        private final Map<StorageType, List<String>> verificationScripts;
        private final String restoreTestDatabase;

        private GlobalSettings(Builder b) {
            this.maxParallelJobs = b.maxParallelJobs;
            this.enableVerification = b.enableVerification;
            this.verificationTypes = List.copyOf(b.verificationTypes);
            this.cleanupCron = Objects.requireNonNull(b.cleanupCron, "cleanupCron");
            this.parallelVerification = b.parallelVerification;
            this.verificationTimeoutSeconds = b.verificationTimeoutSeconds;
            Map<StorageType, List<String>> scripts = new EnumMap<>(StorageType.class);
            b.verificationScripts.forEach((type, list) -> scripts.put(type, List.copyOf(list)));
            this.verificationScripts = Collections.unmodifiableMap(scripts);
            this.restoreTestDatabase = b.restoreTestDatabase;
        }

        public static Builder builder() { return new Builder(); }

        public Builder toBuilder() {
            return new Builder()
                    .maxParallelJobs(maxParallelJobs)
                    .enableVerification(enableVerification)
                    .verificationTypes(verificationTypes)
                    .cleanupCron(cleanupCron)
                    .parallelVerification(parallelVerification)
                    .verificationTimeoutSeconds(verificationTimeoutSeconds)
                    .verificationScripts(verificationScripts)
                    .restoreTestDatabase(restoreTestDatabase);
        }

        public int maxParallelJobs() { return maxParallelJobs; }
        public boolean enableVerification() { return enableVerification; }
        public List<VerificationType> verificationTypes() { return verificationTypes; }
        public String cleanupCron() { return cleanupCron; }
        /** Estratégias e arquivos verificados em blocos paralelos de {@code maxParallelJobs}. */
        public boolean parallelVerification() { return parallelVerification; }
        /** Limite de cada script de integrity-check. */
        public int verificationTimeoutSeconds() { return verificationTimeoutSeconds; }
        /** Scripts extras do integrity-check, chamados com (backupId, diretório do backup). */
        public Map<StorageType, List<String>> verificationScripts() { return verificationScripts; }
        /** Banco descartável do restore-test; vazio = nome derivado do banco e do backup. */
        public Optional<String> restoreTestDatabase() { return Optional.ofNullable(restoreTestDatabase); }

        public static final class Builder {
            private int maxParallelJobs = 3;
            private boolean enableVerification = true;
            private List<VerificationType> verificationTypes =
                    List.of(VerificationType.CHECKSUM, VerificationType.SIZE_VALIDATION);
            private String cleanupCron = "0 3 * * *";
            private boolean parallelVerification = true;
            private int verificationTimeoutSeconds = 300;
            private Map<StorageType, List<String>> verificationScripts = new EnumMap<>(StorageType.class);
            private String restoreTestDatabase;

            public Builder maxParallelJobs(int v) { this.maxParallelJobs = v; return this; }
            public Builder enableVerification(boolean v) { this.enableVerification = v; return this; }
            public Builder verificationTypes(List<VerificationType> v) { this.verificationTypes = List.copyOf(v); return this; }
            public Builder cleanupCron(String v) { this.cleanupCron = v; return this; }
            public Builder parallelVerification(boolean v) { this.parallelVerification = v; return this; }
            public Builder verificationTimeoutSeconds(int v) { this.verificationTimeoutSeconds = v; return this; }
            public Builder verificationScripts(Map<StorageType, List<String>> v) {
                this.verificationScripts = new EnumMap<>(StorageType.class);
                this.verificationScripts.putAll(v);
                return this;
            }
            public Builder verificationScripts(StorageType type, List<String> scripts) {
                this.verificationScripts.put(type, scripts);
                return this;
            }
            public Builder restoreTestDatabase(String v) {
                this.restoreTestDatabase = v == null || v.isBlank() ? null : v.trim();
                return this;
            }

            public GlobalSettings build() { return new GlobalSettings(this); }
        }
    }
}
