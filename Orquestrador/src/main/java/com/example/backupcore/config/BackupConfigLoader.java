package com.example.backupcore.config;

import com.example.backupcore.model.BackupSettings.BackupConfig;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupSettings.BackupSchedule;
import com.example.backupcore.model.BackupSettings.GlobalSettings;
import com.example.backupcore.model.BackupSettings.RetentionPolicy;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.BackupKind;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.DestinationType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.example.backupcore.schedule.CronScheduler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monta o {@link BackupConfig} a partir do {@link AppConfig} e, se houver, de um arquivo
 * JSON ({@code BACKUP_CONFIG_FILE}) que sobrepõe os padrões.
 * <p>
 * Regras de merge do JSON: campos de topo substituem; {@code storageConfigs} mescla por
 * {@code type}; {@code destinations} substitui a lista inteira quando presente.
 */
public final class BackupConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(BackupConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BackupConfigLoader() {}

    public static BackupConfig load(AppConfig app) {
        BackupConfig config = fromAppConfig(app);
        if (app.configFile().isPresent()) {
            Path file = Path.of(app.configFile().get());
            if (!Files.isRegularFile(file)) {
                throw new IllegalStateException("BACKUP_CONFIG_FILE não encontrado: " + file);
            }
            try {
                config = merge(config, MAPPER.readTree(file.toFile()));
            } catch (IOException e) {
                throw new IllegalStateException("Falha ao ler " + file + ": " + e.getMessage(), e);
            }
            log.info("Configuração de backup mesclada com {}", file);
        }
        return validate(config);
    }

    /** Padrões vindos só de variáveis de ambiente / .env. */
    public static BackupConfig fromAppConfig(AppConfig app) {
        CompressionType compression = parse(() -> CompressionType.fromId(app.defaultCompression()),
                AppConfig.BACKUP_DEFAULT_COMPRESSION);

        GlobalSettings.Builder global = GlobalSettings.builder()
                .maxParallelJobs(app.maxParallelJobs())
                .enableVerification(app.verificationEnabled())
                .verificationTypes(verificationTypes(app.verificationTypes()))
                .cleanupCron(app.cleanupCron())
                .parallelVerification(app.verificationParallel())
                .verificationTimeoutSeconds(app.verificationTimeoutSeconds())
                .restoreTestDatabase(app.restoreTestDatabase().orElse(null));
        for (StorageType type : StorageType.values()) {
            List<String> scripts = app.verificationScripts(type.name());
            if (!scripts.isEmpty()) global.verificationScripts(type, scripts);
        }

        BackupConfig.Builder b = BackupConfig.builder()
                .enabled(app.backupEnabled())
                .defaultSchedule(BackupSchedule.builder()
                        .cron(app.defaultCron())
                        .timezone(app.defaultTimezone())
                        .enabled(app.scheduleEnabled())
                        .build())
                .retentionPolicy(RetentionPolicy.builder()
                        .dailyRetentionDays(app.dailyRetentionDays())
                        .weeklyRetentionWeeks(app.weeklyRetentionWeeks())
                        .monthlyRetentionMonths(app.monthlyRetentionMonths())
                        .maxBackups(app.maxBackups())
                        .autoCleanup(app.autoCleanup())
                        .build())
                .global(global.build());

        DestinationType destinationType = parse(() -> DestinationType.fromId(app.destinationType()),
                AppConfig.BACKUP_DESTINATION_TYPE);
        b.addDestination(BackupDestination.builder(destinationType, app.destinationPath()).build());

        if (app.postgresEnabled()) {
            b.addStorageConfig(StorageBackupConfig.builder(StorageType.POSTGRES)
                    .compression(compression)
                    .build());
        }
        if (app.fileSystemEnabled()) {
            b.addStorageConfig(StorageBackupConfig.builder(StorageType.FILE_SYSTEM)
                    .compression(compression)
                    .option("paths", app.fileSystemPaths())
                    .build());
        }
        return b.build();
    }

    // =====================
    // MERGE JSON
    // =====================

    public static BackupConfig merge(BackupConfig base, JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) return base;
        if (!root.isObject()) {
            throw new IllegalStateException("Config de backup deve ser um objeto JSON");
        }
        BackupConfig.Builder b = base.toBuilder();
        if (root.has("enabled")) b.enabled(root.get("enabled").asBoolean());

        if (root.has("storageConfigs")) {
            Map<StorageType, StorageBackupConfig> byType = new LinkedHashMap<>();
            for (StorageBackupConfig c : base.storageConfigs()) byType.put(c.type(), c);
            for (JsonNode node : root.get("storageConfigs")) {
                StorageType type = parse(() -> StorageType.fromId(node.path("type").asText("")), "storageConfigs.type");
                StorageBackupConfig existing = byType.get(type);
                StorageBackupConfig.Builder sb = existing != null ? existing.toBuilder() : StorageBackupConfig.builder(type);
                byType.put(type, mergeStorage(sb, node).build());
            }
            b.storageConfigs(new ArrayList<>(byType.values()));
        }

        if (root.has("destinations")) {
            List<BackupDestination> destinations = new ArrayList<>();
            for (JsonNode node : root.get("destinations")) {
                DestinationType type = parse(() -> DestinationType.fromId(node.path("type").asText("")), "destinations.type");
                BackupDestination.Builder db = BackupDestination.builder(type, node.path("path").asText(""));
                if (node.has("credentials")) {
                    db.credentials(MAPPER.convertValue(node.get("credentials"), new TypeReference<Map<String, String>>() {}));
                }
                if (node.has("options")) {
                    db.options(MAPPER.convertValue(node.get("options"), new TypeReference<Map<String, Object>>() {}));
                }
                destinations.add(db.build());
            }
            b.destinations(destinations);
        }

        if (root.has("defaultSchedule")) {
            b.defaultSchedule(mergeSchedule(base.defaultSchedule(), root.get("defaultSchedule")));
        }

        if (root.has("retentionPolicy")) {
            JsonNode n = root.get("retentionPolicy");
            RetentionPolicy p = base.retentionPolicy();
            b.retentionPolicy(RetentionPolicy.builder()
                    .dailyRetentionDays(n.path("dailyRetentionDays").asInt(p.dailyRetentionDays()))
                    .weeklyRetentionWeeks(n.path("weeklyRetentionWeeks").asInt(p.weeklyRetentionWeeks()))
                    .monthlyRetentionMonths(n.path("monthlyRetentionMonths").asInt(p.monthlyRetentionMonths()))
                    .maxBackups(n.path("maxBackups").asInt(p.maxBackups()))
                    .autoCleanup(n.path("autoCleanup").asBoolean(p.autoCleanup()))
                    .build());
        }

        if (root.has("global")) {
            JsonNode n = root.get("global");
            GlobalSettings.Builder gb = base.global().toBuilder();
            if (n.has("maxParallelJobs")) gb.maxParallelJobs(n.get("maxParallelJobs").asInt());
            if (n.has("enableVerification")) gb.enableVerification(n.get("enableVerification").asBoolean());
            if (n.has("verificationTypes")) gb.verificationTypes(verificationTypes(textList(n.get("verificationTypes"))));
            if (n.has("cleanupCron")) gb.cleanupCron(n.get("cleanupCron").asText());
            if (n.has("parallelVerification")) gb.parallelVerification(n.get("parallelVerification").asBoolean());
            if (n.has("verificationTimeoutSeconds")) gb.verificationTimeoutSeconds(n.get("verificationTimeoutSeconds").asInt());
            if (n.has("restoreTestDatabase")) gb.restoreTestDatabase(n.get("restoreTestDatabase").asText());
            if (n.has("verificationScripts")) {
                // mescla por tipo, como storageConfigs
                Map<StorageType, List<String>> scripts = new LinkedHashMap<>(base.global().verificationScripts());
                n.get("verificationScripts").fields().forEachRemaining(entry -> scripts.put(
                        parse(() -> StorageType.fromId(entry.getKey()), "verificationScripts"),
                        textList(entry.getValue())));
                gb.verificationScripts(scripts);
            }
            b.global(gb.build());
        }
        return b.build();
    }

    private static StorageBackupConfig.Builder mergeStorage(StorageBackupConfig.Builder sb, JsonNode node) {
        if (node.has("enabled")) sb.enabled(node.get("enabled").asBoolean());
        String kind = node.has("backupKind") ? node.get("backupKind").asText() : node.path("backupType").asText(null);
        if (kind != null) sb.backupKind(parse(() -> BackupKind.fromId(kind), "backupKind"));
        if (node.has("compression")) {
            String compression = node.get("compression").asText();
            sb.compression(parse(() -> CompressionType.fromId(compression), "compression"));
        }
        if (node.has("preBackupHooks")) sb.preBackupHooks(textList(node.get("preBackupHooks")));
        if (node.has("postBackupHooks")) sb.postBackupHooks(textList(node.get("postBackupHooks")));
        if (node.has("options")) {
            Map<String, Object> options = MAPPER.convertValue(node.get("options"), new TypeReference<Map<String, Object>>() {});
            options.forEach(sb::option);
        }
        if (node.has("schedule")) {
            sb.schedule(mergeSchedule(BackupSchedule.builder().build(), node.get("schedule")));
        }
        return sb;
    }

    private static BackupSchedule mergeSchedule(BackupSchedule base, JsonNode n) {
        return BackupSchedule.builder()
                .cron(n.path("cron").asText(base.cron()))
                .timezone(n.path("timezone").asText(base.timezone()))
                .enabled(n.path("enabled").asBoolean(base.enabled()))
                .timeoutMinutes(n.path("timeoutMinutes").asInt(base.timeoutMinutes()))
                .retries(n.path("retries").asInt(base.retries()))
                .build();
    }

    // =====================
    // VALIDAÇÃO
    // =====================

    /**
     * Rejeita configurações que o orquestrador não consegue executar.
     *
     * @throws IllegalStateException com a primeira violação encontrada
     */
    public static BackupConfig validate(BackupConfig config) {
        int maxParallel = config.global().maxParallelJobs();
        if (maxParallel < 1 || maxParallel > 10) {
            throw new IllegalStateException("maxParallelJobs fora de [1, 10]: " + maxParallel);
        }
        if (config.destinations().isEmpty()) {
            throw new IllegalStateException("Pelo menos um destino de backup é obrigatório");
        }
        for (BackupDestination d : config.destinations()) {
            if (d.path().isBlank()) {
                throw new IllegalStateException("Destino " + d.type().id() + " sem path");
            }
        }
        checkSchedule(config.defaultSchedule(), "defaultSchedule");
        if (config.global().verificationTimeoutSeconds() < 1) {
            throw new IllegalStateException("verificationTimeoutSeconds deve ser >= 1");
        }
        if (!CronScheduler.isValid(config.global().cleanupCron())) {
            throw new IllegalStateException("cleanupCron inválido: " + config.global().cleanupCron());
        }
        RetentionPolicy r = config.retentionPolicy();
        if (r.dailyRetentionDays() < 0 || r.weeklyRetentionWeeks() < 0 || r.monthlyRetentionMonths() < 0) {
            throw new IllegalStateException("Janelas de retenção não podem ser negativas");
        }
        if (r.maxBackups() < 1) {
            throw new IllegalStateException("maxBackups deve ser >= 1");
        }
        Set<StorageType> seen = EnumSet.noneOf(StorageType.class);
        for (StorageBackupConfig c : config.storageConfigs()) {
            if (!seen.add(c.type())) {
                throw new IllegalStateException("Tipo de storage duplicado: " + c.type().id());
            }
            if (c.schedule().isPresent()) {
                checkSchedule(c.schedule().get(), "schedule de " + c.type().id());
            }
        }
        return config;
    }

    private static void checkSchedule(BackupSchedule schedule, String what) {
        if (schedule.cron().isBlank() || !CronScheduler.isValid(schedule.cron())) {
            throw new IllegalStateException("Cron inválido em " + what + ": '" + schedule.cron() + "'");
        }
        try {
            ZoneId.of(schedule.timezone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Timezone inválido em " + what + ": " + schedule.timezone(), e);
        }
    }

    // =====================
    // HELPERS
    // =====================

    private static List<VerificationType> verificationTypes(List<String> ids) {
        List<VerificationType> out = new ArrayList<>();
        for (String id : ids) {
            out.add(parse(() -> VerificationType.fromId(id), AppConfig.BACKUP_VERIFICATION_TYPES));
        }
        return out;
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) out.add(item.asText());
        } else if (!node.isNull()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }

    private static <T> T parse(java.util.function.Supplier<T> parser, String key) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Valor inválido em " + key + ": " + e.getMessage(), e);
        }
    }
}
