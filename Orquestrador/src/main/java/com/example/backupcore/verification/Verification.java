package com.example.backupcore.verification;

import com.example.backupcore.backend.Backend.AbstractStorageBackend;
import com.example.backupcore.backend.Backend.Digests;
import com.example.backupcore.backend.Backend.StorageBackend;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.CommandRunner.CommandResult;
import com.example.backupcore.backend.FileTrees;
import com.example.backupcore.backend.postgres.PostgresBackend;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.GlobalSettings;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Motor de verificação de backups.
 * <p>
 * Inclui:
 * 1. VerificationConfig: paralelismo, timeout de scripts, scripts por storage, relatórios.
 * 2. VerificationResult: resultado de uma estratégia.
 * 3. VerificationReport: consolidação gravada em JSON quando algo falha.
 * 4. VerificationEngine: checksum, size-validation, integrity-check e restore-test.
 */
public final class Verification {

    private Verification() {}

    // ==================================================================================
    // CONFIG
    // ==================================================================================

    public static final class VerificationConfig {
        private final boolean enableParallelChecks;
        private final int maxParallelJobs;
        private final int timeoutSeconds;
        private final Map<StorageType, List<String>> customScripts;
        private final Path reportDirectory;
        private final Path restoreTestRoot;
        private final Map<String, Object> restoreTestConfig;

        private VerificationConfig(Builder b) {
            this.enableParallelChecks = b.enableParallelChecks;
            this.maxParallelJobs = Math.max(1, b.maxParallelJobs);
            this.timeoutSeconds = Math.max(1, b.timeoutSeconds);
            Map<StorageType, List<String>> scripts = new EnumMap<>(StorageType.class);
            b.customScripts.forEach((k, v) -> scripts.put(k, List.copyOf(v)));
            this.customScripts = Collections.unmodifiableMap(scripts);
            this.reportDirectory = Objects.requireNonNull(b.reportDirectory, "reportDirectory");
            this.restoreTestRoot = Objects.requireNonNull(b.restoreTestRoot, "restoreTestRoot");
            this.restoreTestConfig = Collections.unmodifiableMap(new LinkedHashMap<>(b.restoreTestConfig));
        }

        public static Builder builder() { return new Builder(); }

        public Builder toBuilder() {
            Builder b = new Builder()
                    .enableParallelChecks(enableParallelChecks)
                    .maxParallelJobs(maxParallelJobs)
                    .timeoutSeconds(timeoutSeconds)
                    .reportDirectory(reportDirectory)
                    .restoreTestRoot(restoreTestRoot)
                    .restoreTestConfig(restoreTestConfig);
            customScripts.forEach(b::customScripts);
            return b;
        }

        /**
         * Aplica as chaves de verificação da configuração global. Diretórios de
         * relatório e de restore-test são mantidos.
         */
        public VerificationConfig withSettings(GlobalSettings global) {
            Map<String, Object> restoreConfig = new LinkedHashMap<>(restoreTestConfig);
            restoreConfig.remove(PostgresBackend.TARGET_DATABASE_KEY);
            global.restoreTestDatabase().ifPresent(db -> restoreConfig.put(PostgresBackend.TARGET_DATABASE_KEY, db));
            Builder b = toBuilder()
                    .enableParallelChecks(global.parallelVerification())
                    .maxParallelJobs(global.maxParallelJobs())
                    .timeoutSeconds(global.verificationTimeoutSeconds())
                    .restoreTestConfig(restoreConfig);
            b.customScripts.clear();
            global.verificationScripts().forEach(b::customScripts);
            return b.build();
        }

        public boolean enableParallelChecks() { return enableParallelChecks; }
        public int maxParallelJobs() { return maxParallelJobs; }
        public int timeoutSeconds() { return timeoutSeconds; }
        public Map<StorageType, List<String>> customScripts() { return customScripts; }
        public Path reportDirectory() { return reportDirectory; }
        public Path restoreTestRoot() { return restoreTestRoot; }
        /** Repassado como {@code RestoreOptions.config} no restore-test (ex.: targetDatabase). */
        public Map<String, Object> restoreTestConfig() { return restoreTestConfig; }

        public static final class Builder {
            private boolean enableParallelChecks = true;
            private int maxParallelJobs = 3;
            private int timeoutSeconds = 300;
            private Map<StorageType, List<String>> customScripts = new EnumMap<>(StorageType.class);
            private Path reportDirectory = Path.of("backup-reports");
            private Path restoreTestRoot = Path.of("temp", "restore-test");
            private Map<String, Object> restoreTestConfig = new LinkedHashMap<>();

            public Builder enableParallelChecks(boolean v) { this.enableParallelChecks = v; return this; }
            public Builder maxParallelJobs(int v) { this.maxParallelJobs = v; return this; }
            public Builder timeoutSeconds(int v) { this.timeoutSeconds = v; return this; }
            public Builder customScripts(StorageType type, List<String> scripts) { this.customScripts.put(type, scripts); return this; }
            public Builder reportDirectory(Path v) { this.reportDirectory = v; return this; }
            public Builder restoreTestRoot(Path v) { this.restoreTestRoot = v; return this; }
            public Builder restoreTestConfig(Map<String, Object> v) { this.restoreTestConfig = new LinkedHashMap<>(v); return this; }

            public VerificationConfig build() { return new VerificationConfig(this); }
        }
    }

    // ==================================================================================
    // RESULTADO
    // ==================================================================================

    public static final class VerificationResult {
        private final VerificationType type;
        private final boolean passed;
        private final Map<String, Object> details;
        private final List<String> errors;
        private final List<String> warnings;
        private final long durationMs;
        private final Instant timestamp;

        VerificationResult(VerificationType type, Map<String, Object> details, List<String> errors,
                           List<String> warnings, long durationMs, Instant timestamp) {
            this.type = type;
            this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
            this.errors = List.copyOf(errors);
            this.warnings = List.copyOf(warnings);
            this.passed = this.errors.isEmpty();
            this.durationMs = durationMs;
            this.timestamp = timestamp;
        }

        public VerificationType type() { return type; }
        public boolean passed() { return passed; }
        public Map<String, Object> details() { return details; }
        public List<String> errors() { return errors; }
        public List<String> warnings() { return warnings; }
        public long durationMs() { return durationMs; }
        public Instant timestamp() { return timestamp; }
    }

    /** Acumulador mutável de uma estratégia em execução. */
    private static final class Findings {
        final Map<String, Object> details = new LinkedHashMap<>();
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
    }

    // ==================================================================================
    // RELATÓRIO (DTO Jackson)
    // ==================================================================================

    public static final class VerificationReport {
        @JsonProperty("backup_id") public String backupId;
        @JsonProperty("storage_type") public String storageType;
        @JsonProperty("backup_type") public String backupKind;
        @JsonProperty("backup_size") public long backupSize;
        @JsonProperty("verification_timestamp") public String verificationTimestamp;
        @JsonProperty("overall_result") public OverallResult overallResult;
        @JsonProperty("verifications") public List<CheckEntry> verifications = new ArrayList<>();
        @JsonProperty("metadata") public ReportMetadata metadata;

        public static final class OverallResult {
            @JsonProperty("passed") public boolean passed;
            @JsonProperty("success_rate") public double successRate;
            @JsonProperty("total_duration") public long totalDuration;
            @JsonProperty("total_checks") public int totalChecks;
            @JsonProperty("passed_checks") public int passedChecks;
            @JsonProperty("failed_checks") public int failedChecks;
        }

        public static final class CheckEntry {
            @JsonProperty("type") public String type;
            @JsonProperty("passed") public boolean passed;
            @JsonProperty("duration") public long duration;
            @JsonProperty("errors") public List<String> errors;
            @JsonProperty("warnings") public List<String> warnings;
            @JsonProperty("details") public Map<String, Object> details;
        }

        public static final class ReportMetadata {
            @JsonProperty("backup_created") public String backupCreated;
            @JsonProperty("backup_completed") public String backupCompleted;
            @JsonProperty("files") public int files;
            @JsonProperty("compression") public String compression;
            @JsonProperty("version") public String version;
        }
    }

    /** Resultado de {@link VerificationEngine#comprehensiveVerify}. */
    public static final class ComprehensiveOutcome {
        private final boolean passed;
        private final VerificationReport report;
        private final Path reportPath;

        ComprehensiveOutcome(boolean passed, VerificationReport report, Path reportPath) {
            this.passed = passed;
            this.report = report;
            this.reportPath = reportPath;
        }

        public boolean passed() { return passed; }
        public VerificationReport report() { return report; }
        public Optional<Path> reportPath() { return Optional.ofNullable(reportPath); }
    }

    // ==================================================================================
    // ENGINE
    // ==================================================================================

    public static final class VerificationEngine implements AutoCloseable {
        private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

        // trocado por reconfigure; cada operação lê um snapshot
        private volatile VerificationConfig config;
        private final CommandRunner commandRunner;
        private final ObjectMapper mapper;
        // Pools separados: estratégias em paralelo esperam pelos digests de arquivos.
        // O limite de paralelismo vem do tamanho dos blocos, não do pool.
        private final ExecutorService checkExecutor;
        private final ExecutorService fileExecutor;

        public VerificationEngine(VerificationConfig config, CommandRunner commandRunner) {
            this.config = Objects.requireNonNull(config, "config");
            this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
            this.mapper = new ObjectMapper();
            this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
            this.mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            this.checkExecutor = Executors.newCachedThreadPool(daemonFactory("verify-check"));
            this.fileExecutor = Executors.newCachedThreadPool(daemonFactory("verify-file"));
        }

        public VerificationConfig config() { return config; }

        /** Reaplica paralelismo, timeout, scripts e banco do restore-test a partir da config global. */
        public void reconfigure(GlobalSettings global) {
            Objects.requireNonNull(global, "global");
            VerificationConfig next = config.withSettings(global);
            this.config = next;
            log.info("Verificação reconfigurada: paralelo={}, blocos={}, timeout={}s, scripts={}",
                    next.enableParallelChecks(), next.maxParallelJobs(), next.timeoutSeconds(),
                    next.customScripts().keySet());
        }

        /**
         * Executa uma estratégia. Nunca lança: erros viram entradas em {@code errors}.
         *
         * @param handler backend do tipo de storage; obrigatório para integrity-check e restore-test
         */
        public VerificationResult verifyBackup(BackupMetadata metadata, VerificationType type, StorageBackend handler) {
            Objects.requireNonNull(metadata, "metadata");
            Objects.requireNonNull(type, "type");
            long start = System.nanoTime();
            Instant timestamp = Instant.now();
            Findings findings = new Findings();
            log.info("Iniciando verificação {} do backup {}", type.id(), metadata.id());
            try {
                switch (type) {
                    case CHECKSUM:
                        verifyChecksums(metadata, findings);
                        break;
                    case SIZE_VALIDATION:
                        verifySizes(metadata, findings);
                        break;
                    case INTEGRITY_CHECK:
                        verifyIntegrity(metadata, findings, handler);
                        break;
                    case RESTORE_TEST:
                        verifyRestoreTest(metadata, findings, handler);
                        break;
                    default:
                        throw new IllegalArgumentException("Tipo de verificação não suportado: " + type);
                }
            } catch (RuntimeException e) {
                findings.errors.add(String.valueOf(e.getMessage()));
                log.error("Erro na verificação {} do backup {}", type.id(), metadata.id(), e);
            }
            long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            VerificationResult result = new VerificationResult(type, findings.details, findings.errors,
                    findings.warnings, durationMs, timestamp);
            if (result.passed()) {
                log.info("Verificação {} do backup {} aprovada ({} ms)", type.id(), metadata.id(), durationMs);
            } else {
                log.warn("Verificação {} do backup {} reprovada: {}", type.id(), metadata.id(), String.join(", ", result.errors()));
            }
            return result;
        }

        /** Várias estratégias, em blocos paralelos de {@code maxParallelJobs} ou em sequência. */
        public List<VerificationResult> verifyBackupComprehensive(BackupMetadata metadata,
                                                                  List<VerificationType> types,
                                                                  StorageBackend handler) {
            return runChunked(types, type -> () -> verifyBackup(metadata, type, handler), checkExecutor);
        }

        public VerificationReport createVerificationReport(BackupMetadata metadata, List<VerificationResult> results) {
            VerificationReport report = new VerificationReport();
            report.backupId = metadata.id();
            report.storageType = metadata.storageType().id();
            report.backupKind = metadata.backupKind() == null ? null : metadata.backupKind().id();
            report.backupSize = metadata.size();
            report.verificationTimestamp = Instant.now().toString();

            int passedCount = (int) results.stream().filter(VerificationResult::passed).count();
            VerificationReport.OverallResult overall = new VerificationReport.OverallResult();
            overall.totalChecks = results.size();
            overall.passedChecks = passedCount;
            overall.failedChecks = results.size() - passedCount;
            overall.passed = passedCount == results.size();
            overall.successRate = results.isEmpty() ? 0.0 : passedCount * 100.0 / results.size();
            overall.totalDuration = results.stream().mapToLong(VerificationResult::durationMs).sum();
            report.overallResult = overall;

            for (VerificationResult r : results) {
                VerificationReport.CheckEntry entry = new VerificationReport.CheckEntry();
                entry.type = r.type().id();
                entry.passed = r.passed();
                entry.duration = r.durationMs();
                entry.errors = r.errors();
                entry.warnings = r.warnings();
                entry.details = r.details();
                report.verifications.add(entry);
            }

            VerificationReport.ReportMetadata md = new VerificationReport.ReportMetadata();
            md.backupCreated = metadata.startTime() == null ? null : metadata.startTime().toString();
            md.backupCompleted = metadata.endTime() == null ? null : metadata.endTime().toString();
            md.files = metadata.files().size();
            md.compression = metadata.compression() == null ? null : metadata.compression().id();
            md.version = metadata.version();
            report.metadata = md;
            return report;
        }

        /** Grava em {@code <reports>/verification-<id>-<epochMillis>.json}. */
        public Path saveVerificationReport(VerificationReport report) throws IOException {
            Path reportDirectory = config.reportDirectory();
            Files.createDirectories(reportDirectory);
            Path reportPath = reportDirectory
                    .resolve("verification-" + report.backupId + "-" + System.currentTimeMillis() + ".json");
            mapper.writeValue(reportPath.toFile(), report);
            log.info("Relatório de verificação salvo: {}", reportPath);
            return reportPath;
        }

        /** checksum + size-validation. */
        public boolean quickVerify(BackupMetadata metadata, StorageBackend handler) {
            return verifyBackupComprehensive(metadata,
                    List.of(VerificationType.CHECKSUM, VerificationType.SIZE_VALIDATION), handler)
                    .stream().allMatch(VerificationResult::passed);
        }

        /**
         * checksum + size-validation + integrity-check, com relatório gravado somente em caso
         * de falha.
         */
        public ComprehensiveOutcome comprehensiveVerify(BackupMetadata metadata, StorageBackend handler) {
            List<VerificationResult> results = verifyBackupComprehensive(metadata,
                    List.of(VerificationType.CHECKSUM, VerificationType.SIZE_VALIDATION, VerificationType.INTEGRITY_CHECK),
                    handler);
            VerificationReport report = createVerificationReport(metadata, results);
            boolean passed = report.overallResult.passed;
            Path reportPath = null;
            if (!passed) {
                try {
                    reportPath = saveVerificationReport(report);
                } catch (IOException e) {
                    log.warn("Falha ao salvar relatório de verificação de {}: {}", metadata.id(), e.getMessage());
                }
            }
            return new ComprehensiveOutcome(passed, report, reportPath);
        }

        @Override
        public void close() {
            checkExecutor.shutdownNow();
            fileExecutor.shutdownNow();
        }

        // =====================
        // ESTRATÉGIAS
        // =====================

        private void verifyChecksums(BackupMetadata metadata, Findings findings) {
            List<String> files = metadata.files();
            List<Map<String, Object>> checked = runChunked(files,
                    file -> () -> checkFile(file, metadata.checksums().get(file)), fileExecutor);

            int valid = 0;
            for (Map<String, Object> fileResult : checked) {
                String name = String.valueOf(fileResult.get("file"));
                if (Boolean.TRUE.equals(fileResult.get("valid"))) {
                    valid++;
                } else if (!Boolean.TRUE.equals(fileResult.get("exists"))) {
                    findings.errors.add("Arquivo não encontrado: " + name);
                } else {
                    findings.errors.add("Checksum divergente: " + name);
                }
            }
            findings.details.put("totalFiles", files.size());
            findings.details.put("verifiedFiles", valid);
            findings.details.put("failedFiles", files.size() - valid);
            findings.details.put("filesChecked", checked);
        }

        private Map<String, Object> checkFile(String file, String expected) {
            Path path = Path.of(file);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", fileName(path));
            boolean exists = Files.isRegularFile(path);
            out.put("exists", exists);
            boolean valid = false;
            if (!exists) {
                out.put("error", "ausente");
            } else if (!Files.isReadable(path)) {
                out.put("error", "sem permissão de leitura");
            } else if (expected == null) {
                out.put("error", "sem checksum registrado");
            } else {
                try {
                    valid = Digests.sha256Hex(path).equalsIgnoreCase(expected);
                } catch (IOException e) {
                    out.put("error", e.getMessage());
                }
            }
            out.put("valid", valid);
            return out;
        }

        private void verifySizes(BackupMetadata metadata, Findings findings) {
            int existing = 0;
            int missing = 0;
            int empty = 0;
            long totalSize = 0;
            for (String file : metadata.files()) {
                Path path = Path.of(file);
                try {
                    long size = Files.size(path);
                    existing++;
                    totalSize += size;
                    if (size == 0) empty++;
                } catch (IOException e) {
                    missing++;
                    findings.errors.add("Arquivo ausente: " + fileName(path));
                }
            }
            long expected = metadata.size() > 0 ? metadata.size() : metadata.compressedSize().orElse(0L);
            findings.details.put("totalFiles", metadata.files().size());
            findings.details.put("existingFiles", existing);
            findings.details.put("missingFiles", missing);
            findings.details.put("emptyFiles", empty);
            findings.details.put("totalSize", totalSize);
            findings.details.put("expectedSize", expected);
            findings.details.put("averageFileSize", existing > 0 ? (double) totalSize / existing : 0.0);

            if (empty > 0) {
                findings.warnings.add(empty + " arquivo(s) vazio(s)");
            }
            if (missing == 0 && expected > 0 && totalSize != expected) {
                findings.warnings.add("Tamanho observado " + totalSize + " difere do registrado " + expected);
            }
        }

        private void verifyIntegrity(BackupMetadata metadata, Findings findings, StorageBackend handler) {
            if (handler == null) {
                findings.errors.add("Nenhum backend informado para integrity-check");
                return;
            }
            boolean valid = handler.verifyBackup(metadata, VerificationType.INTEGRITY_CHECK);
            findings.details.put("storageType", metadata.storageType().id());
            findings.details.put("integrityCheckPassed", valid);
            findings.details.put("method", "storage-specific");
            if (!valid) {
                findings.errors.add("Verificação de integridade do backend falhou");
            }

            List<String> scripts = config.customScripts().getOrDefault(metadata.storageType(), List.of());
            if (scripts.isEmpty()) {
                return;
            }
            List<Map<String, Object>> scriptResults = new ArrayList<>();
            for (String script : scripts) {
                scriptResults.add(runScript(script, metadata));
            }
            findings.details.put("customScripts", scriptResults);
            long failed = scriptResults.stream().filter(r -> !Boolean.TRUE.equals(r.get("success"))).count();
            if (failed > 0) {
                findings.errors.add(failed + " script(s) de verificação falharam");
            }
        }

        private Map<String, Object> runScript(String script, BackupMetadata metadata) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("script", script);
            List<String> command = List.of(script, metadata.id(), destinationPath(metadata));
            try {
                CommandResult result = commandRunner.run(command, Map.of(),
                        Duration.ofSeconds(config.timeoutSeconds()), CancellationToken.none());
                out.put("success", result.success());
                out.put("output", result.stdout());
                if (!result.success()) {
                    out.put("error", result.stderr());
                }
            } catch (IOException e) {
                out.put("success", false);
                out.put("output", "");
                out.put("error", e.getMessage());
            }
            return out;
        }

        /**
         * Restore real em {@code restoreTestRoot/<id>} com overwrite e sem verificação
         * aninhada. O diretório é removido em qualquer saída; falha na limpeza vira aviso.
         */
        private void verifyRestoreTest(BackupMetadata metadata, Findings findings, StorageBackend handler) {
            if (handler == null) {
                findings.errors.add("Nenhum backend informado para restore-test");
                return;
            }
            VerificationConfig cfg = config;
            Path testDir = cfg.restoreTestRoot().resolve(metadata.id()).toAbsolutePath().normalize();
            try {
                Files.createDirectories(testDir);
                RestoreOptions options = RestoreOptions.builder(metadata.id())
                        .targetPath(testDir.toString())
                        .overwrite(true)
                        .verify(false)
                        .restoreTest(true)
                        .config(cfg.restoreTestConfig())
                        .build();
                boolean success = handler.restoreBackup(metadata, options);
                findings.details.put("restoreSuccess", success);
                findings.details.put("testDirectory", testDir.toString());
                findings.details.put("method", "test-restore");
                if (!success) {
                    findings.errors.add("Restore de teste falhou");
                } else {
                    int restored = Files.exists(testDir) ? FileTrees.regularFiles(testDir).size() : 0;
                    findings.details.put("restoredFiles", restored);
                    if (restored == 0) {
                        findings.warnings.add("Nenhum arquivo encontrado após o restore");
                    }
                }
            } catch (IOException | RuntimeException e) {
                findings.errors.add("Erro no restore de teste: " + e.getMessage());
            } finally {
                try {
                    FileTrees.deleteRecursively(testDir);
                } catch (IOException e) {
                    findings.warnings.add("Falha ao limpar diretório de teste: " + e.getMessage());
                }
            }
        }

        // =====================
        // HELPERS
        // =====================

        private <T, R> List<R> runChunked(List<T> items, java.util.function.Function<T, Supplier<R>> task, ExecutorService executor) {
            VerificationConfig cfg = config;
            List<R> results = new ArrayList<>();
            if (!cfg.enableParallelChecks()) {
                for (T item : items) results.add(task.apply(item).get());
                return results;
            }
            int chunkSize = cfg.maxParallelJobs();
            for (int i = 0; i < items.size(); i += chunkSize) {
                List<CompletableFuture<R>> futures = new ArrayList<>();
                for (T item : items.subList(i, Math.min(items.size(), i + chunkSize))) {
                    futures.add(CompletableFuture.supplyAsync(task.apply(item), executor));
                }
                for (CompletableFuture<R> f : futures) {
                    try {
                        results.add(f.join());
                    } catch (CompletionException e) {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        throw new IllegalStateException("Verificação paralela falhou: " + cause.getMessage(), cause);
                    }
                }
            }
            return results;
        }

        private static String destinationPath(BackupMetadata metadata) {
            Object root = metadata.metadata().get(AbstractStorageBackend.BACKUP_ROOT_KEY);
            if (root != null) return String.valueOf(root);
            return metadata.destination() != null ? metadata.destination().path() : "";
        }

        private static String fileName(Path path) {
            Path name = path.getFileName();
            return name == null ? path.toString() : name.toString();
        }

        private static java.util.concurrent.ThreadFactory daemonFactory(String prefix) {
            AtomicInteger seq = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
