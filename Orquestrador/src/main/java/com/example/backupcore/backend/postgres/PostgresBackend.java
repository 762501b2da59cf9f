package com.example.backupcore.backend.postgres;

import com.example.backupcore.backend.Backend.AbstractStorageBackend;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.config.AppConfig;
import com.example.backupcore.errors.BackupException;
import com.example.backupcore.errors.ExternalToolException;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.StorageType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Backend Postgres sobre pg_dump / pg_dumpall / pg_restore / psql.
 * <p>
 * Autenticação sempre via PGPASSWORD no ambiente do processo filho (nunca em argv).
 * Restore com {@code overwrite=true} é destrutivo: pg_restore recebe --clean --if-exists e,
 * no formato plain, o banco é derrubado e recriado antes do psql. Restore-test nunca toca o
 * banco configurado: usa um banco temporário criado e removido a cada execução.
 */
public class PostgresBackend extends AbstractStorageBackend {

    static final Duration MAIN_TIMEOUT = Duration.ofHours(1);
    static final Duration AUX_TIMEOUT = Duration.ofMinutes(5);
    static final int RESTORE_JOBS = 4;
    static final int MAX_IDENTIFIER_LENGTH = 63;
    static final int MAX_SCRATCH_SUFFIX = 40;

    /** Chave de {@code RestoreOptions.config} que redireciona o restore para outro banco. */
    public static final String TARGET_DATABASE_KEY = "targetDatabase";

    static final String BACKUP_BASENAME = "postgres_backup";
    static final String SCHEMA_FILE = "postgres_schema.sql";
    static final String GLOBALS_FILE = "postgres_globals.sql";

    /** Formatos do pg_dump. */
    public enum DumpFormat {
        CUSTOM("custom", "dump"),
        TAR("tar", "tar"),
        DIRECTORY("directory", "dir"),
        PLAIN("plain", "sql");

        private final String id;
        private final String extension;

        DumpFormat(String id, String extension) {
            this.id = id;
            this.extension = extension;
        }

        public String id() { return id; }
        public String extension() { return extension; }

        /** Formato desconhecido cai em plain (extensão .sql), como o pg_dump sem --format. */
        public static DumpFormat fromId(String raw) {
            if (raw == null || raw.isBlank()) return CUSTOM;
            for (DumpFormat f : values()) {
                if (f.id.equalsIgnoreCase(raw.trim())) return f;
            }
            return PLAIN;
        }
    }

    /**
     * Opções do bag {@code options} da StorageBackupConfig relevantes ao pg_dump.
     */
    static final class DumpOptions {
        final DumpFormat format;
        final boolean includeData;
        final List<String> excludeTables;
        final Integer compressLevel;
        final Integer jobs;
        final boolean includeSchemaOnly;
        final boolean includeGlobals;

        DumpOptions(DumpFormat format, boolean includeData, List<String> excludeTables,
                    Integer compressLevel, Integer jobs, boolean includeSchemaOnly, boolean includeGlobals) {
            this.format = format;
            this.includeData = includeData;
            this.excludeTables = List.copyOf(excludeTables);
            this.compressLevel = compressLevel;
            this.jobs = jobs;
            this.includeSchemaOnly = includeSchemaOnly;
            this.includeGlobals = includeGlobals;
        }

        static DumpOptions from(Map<String, Object> options) {
            Object format = options.get("format");
            return new DumpOptions(
                    DumpFormat.fromId(format == null ? null : String.valueOf(format)),
                    !Boolean.FALSE.equals(asBoolean(options.get("includeData"))),
                    asStringList(options.get("excludeTables")),
                    asInteger(options.get("compressLevel")),
                    asInteger(options.get("jobs")),
                    Boolean.TRUE.equals(asBoolean(options.get("includeSchemaOnly"))),
                    Boolean.TRUE.equals(asBoolean(options.get("includeGlobals"))));
        }
    }

    private final Supplier<Optional<PostgresConnection>> connectionResolver;
    private volatile Optional<PostgresConnection> cachedConnection;

    public PostgresBackend(AppConfig config, CommandRunner commandRunner, Path restoreTestRoot) {
        this(() -> PostgresConnection.resolve(config), commandRunner, restoreTestRoot);
    }

    public PostgresBackend(Supplier<Optional<PostgresConnection>> connectionResolver,
                           CommandRunner commandRunner, Path restoreTestRoot) {
        super(StorageType.POSTGRES, commandRunner, restoreTestRoot);
        this.connectionResolver = Objects.requireNonNull(connectionResolver, "connectionResolver");
    }

    // ==== CONEXÃO ====

    /** Resolvida uma vez e mantida em cache; vazio = não configurado. */
    Optional<PostgresConnection> connection() {
        Optional<PostgresConnection> current = cachedConnection;
        if (current == null) {
            synchronized (this) {
                current = cachedConnection;
                if (current == null) {
                    current = connectionResolver.get();
                    cachedConnection = current;
                    current.ifPresent(c -> log.info("Postgres configurado: {}", c));
                }
            }
        }
        return current;
    }

    private PostgresConnection requireConnection() throws BackupException {
        return connection().orElseThrow(() -> BackupException.notConfigured("conexão PostgreSQL"));
    }

    /** Ponto de extensão para testes (conexões JDBC falsas). */
    protected Connection openJdbc(PostgresConnection connection) throws SQLException {
        return connection.open();
    }

    // ==== PROBES ====

    @Override
    public boolean isAvailable() {
        Optional<PostgresConnection> connection = connection();
        if (connection.isEmpty()) {
            return false;
        }
        return ping(connection.get());
    }

    private boolean ping(PostgresConnection connection) {
        try (Connection c = openJdbc(connection);
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException | RuntimeException e) {
            log.debug("Postgres indisponível: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, Object> getStorageInfo() throws IOException {
        PostgresConnection connection = requireConnection();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", StorageType.POSTGRES.id());
        info.put("host", connection.host());
        info.put("port", connection.port());
        info.put("database", connection.database());
        try (Connection c = openJdbc(connection);
             Statement st = c.createStatement()) {
            try (ResultSet rs = st.executeQuery("SELECT version()")) {
                if (rs.next()) info.put("version", rs.getString(1));
            }
            try (ResultSet rs = st.executeQuery("SELECT pg_database_size(current_database())")) {
                if (rs.next()) info.put("size", rs.getLong(1));
            }
            try (ResultSet rs = st.executeQuery(
                    "SELECT count(*) FROM information_schema.tables "
                            + "WHERE table_schema NOT IN ('pg_catalog', 'information_schema')")) {
                if (rs.next()) info.put("tableCount", rs.getLong(1));
            }
            List<String> schemas = new ArrayList<>();
            try (ResultSet rs = st.executeQuery(
                    "SELECT schema_name FROM information_schema.schemata "
                            + "WHERE schema_name NOT LIKE 'pg_%' AND schema_name <> 'information_schema' "
                            + "ORDER BY schema_name")) {
                while (rs.next()) schemas.add(rs.getString(1));
            }
            info.put("schemas", schemas);
        } catch (SQLException e) {
            throw new IOException("Falha ao coletar info do Postgres: " + e.getMessage(), e);
        }
        return info;
    }

    @Override
    public long getEstimatedSize() {
        Optional<PostgresConnection> connection = connection();
        if (connection.isEmpty()) return 0L;
        try (Connection c = openJdbc(connection.get());
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT pg_database_size(current_database())")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException | RuntimeException e) {
            log.debug("Estimativa de tamanho indisponível: {}", e.getMessage());
            return 0L;
        }
    }

    // ==== BACKUP ====

    @Override
    protected List<Path> doCreateBackup(StorageBackupConfig config, Path backupDir, CancellationToken token) throws IOException {
        PostgresConnection connection = requireConnection();
        if (!commandRunner.isCommandAvailable("pg_dump")) {
            throw BackupException.toolMissing("pg_dump");
        }
        DumpOptions options = DumpOptions.from(config.options());
        Map<String, String> env = authEnvironment(connection);
        List<Path> outputs = new ArrayList<>();

        Path backupPath = backupDir.resolve(BACKUP_BASENAME + "." + options.format.extension());
        log.info("Iniciando pg_dump ({}) de {}", options.format.id(), connection.database());
        commandRunner.runChecked(buildDumpCommand(connection, options, backupPath), env, MAIN_TIMEOUT, token);
        outputs.add(backupPath);

        if (options.includeSchemaOnly) {
            Path schemaPath = backupDir.resolve(SCHEMA_FILE);
            commandRunner.runChecked(buildSchemaCommand(connection, schemaPath), env, AUX_TIMEOUT, token);
            outputs.add(schemaPath);
        }

        if (options.includeGlobals) {
            if (commandRunner.isCommandAvailable("pg_dumpall")) {
                Path globalsPath = backupDir.resolve(GLOBALS_FILE);
                commandRunner.runChecked(buildGlobalsCommand(connection, globalsPath), env, AUX_TIMEOUT, token);
                outputs.add(globalsPath);
            } else {
                log.warn("pg_dumpall não encontrado; dump de globals ignorado");
            }
        }

        log.info("Backup PostgreSQL gerou {} artefato(s)", outputs.size());
        return outputs;
    }

    static List<String> buildDumpCommand(PostgresConnection connection, DumpOptions options, Path output) {
        List<String> cmd = new ArrayList<>(List.of(
                "pg_dump",
                "--host", connection.host(),
                "--port", Integer.toString(connection.port()),
                "--username", connection.user(),
                "--dbname", connection.database(),
                "--format", options.format.id(),
                "--file", output.toString(),
                "--verbose",
                "--no-password"));
        if (!options.includeData) {
            cmd.add("--schema-only");
        }
        for (String table : options.excludeTables) {
            cmd.add("--exclude-table");
            cmd.add(table);
        }
        if (options.compressLevel != null && options.format == DumpFormat.CUSTOM) {
            cmd.add("--compress");
            cmd.add(options.compressLevel.toString());
        }
        if (options.jobs != null && options.format == DumpFormat.DIRECTORY) {
            cmd.add("--jobs");
            cmd.add(options.jobs.toString());
        }
        return cmd;
    }

    static List<String> buildSchemaCommand(PostgresConnection connection, Path output) {
        return List.of(
                "pg_dump",
                "--host", connection.host(),
                "--port", Integer.toString(connection.port()),
                "--username", connection.user(),
                "--dbname", connection.database(),
                "--schema-only",
                "--file", output.toString(),
                "--no-password");
    }

    static List<String> buildGlobalsCommand(PostgresConnection connection, Path output) {
        return List.of(
                "pg_dumpall",
                "--host", connection.host(),
                "--port", Integer.toString(connection.port()),
                "--username", connection.user(),
                "--globals-only",
                "--file", output.toString(),
                "--no-password");
    }

    // ==== RESTORE ====

    @Override
    protected boolean doRestoreBackup(List<Path> files, BackupMetadata metadata,
                                      RestoreOptions options, CancellationToken token) throws IOException {
        PostgresConnection base = requireConnection();
        Optional<String> requested = Optional.ofNullable(options.config().get(TARGET_DATABASE_KEY))
                .map(String::valueOf)
                .map(String::trim)
                .filter(s -> !s.isEmpty());

        Path backupFile = selectMainBackup(files)
                .orElseThrow(() -> new BackupException(BackupException.Code.NOT_FOUND,
                        "No suitable PostgreSQL backup file found"));
        DumpFormat format = detectFormat(backupFile);

        if (options.restoreTest()) {
            return restoreIntoScratch(backupFile, format, metadata, base, requested, token);
        }

        PostgresConnection target = requested.map(base::withDatabase).orElse(base);
        log.info("Restaurando {} (formato {}) em {}", backupFile.getFileName(), format.id(), target.database());
        try {
            restoreMain(backupFile, format, target, options.overwrite(), token);
            Optional<Path> globals = files.stream()
                    .filter(f -> f.getFileName().toString().equals(GLOBALS_FILE))
                    .findFirst();
            if (globals.isPresent()) {
                restoreGlobals(globals.get(), target, token);
            }
        } catch (ExternalToolException e) {
            log.error("Restore PostgreSQL falhou ({}): stderr={}", e.getMessage(), e.stderr().strip());
            return false;
        }
        log.info("Banco PostgreSQL {} restaurado", target.database());
        return true;
    }

    /**
     * Restore-test: cria um banco temporário, restaura nele e o remove em qualquer saída.
     * Globals (roles, tablespaces) valem para o cluster inteiro e não são reaplicados.
     * Um alvo explícito igual ao banco configurado ou ao banco administrativo é recusado.
     */
    private boolean restoreIntoScratch(Path backupFile, DumpFormat format, BackupMetadata metadata,
                                       PostgresConnection live, Optional<String> requested,
                                       CancellationToken token) throws IOException {
        String scratchName = requested.orElseGet(() -> scratchDatabaseName(live.database(), metadata.id()));
        if (scratchName.equals(live.database()) || scratchName.equals(PostgresConnection.ADMIN_DATABASE)) {
            throw BackupException.unsafeTarget("restore-test não pode usar o banco " + scratchName);
        }
        PostgresConnection scratch = live.withDatabase(scratchName);
        log.info("Restore-test do backup {} no banco temporário {}", metadata.id(), scratchName);
        resetDatabase(scratch, true);
        try {
            restoreMain(backupFile, format, scratch, false, token);
            return true;
        } catch (ExternalToolException e) {
            log.error("Restore-test PostgreSQL falhou ({}): stderr={}", e.getMessage(), e.stderr().strip());
            return false;
        } finally {
            try {
                resetDatabase(scratch, false);
            } catch (IOException e) {
                log.warn("Banco temporário {} não foi removido: {}", scratchName, e.getMessage());
            }
        }
    }

    /** {@code <banco>_restore_test_<id>}, dentro do limite de 63 caracteres do Postgres. */
    static String scratchDatabaseName(String liveDatabase, String backupId) {
        String suffix = "_restore_test_" + backupId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (suffix.length() > MAX_SCRATCH_SUFFIX) {
            suffix = suffix.substring(0, MAX_SCRATCH_SUFFIX);
        }
        int room = MAX_IDENTIFIER_LENGTH - suffix.length();
        String prefix = liveDatabase.length() > room ? liveDatabase.substring(0, room) : liveDatabase;
        return prefix + suffix;
    }

    private void restoreMain(Path backupFile, DumpFormat format, PostgresConnection target,
                             boolean overwrite, CancellationToken token) throws IOException {
        if (format == DumpFormat.PLAIN) {
            restoreWithPsql(backupFile, target, overwrite, token);
        } else {
            restoreWithPgRestore(backupFile, format, target, overwrite, token);
        }
    }

    /**
     * Arquivo principal: nome começando com postgres_backup; no formato directory, o próprio
     * diretório postgres_backup.dir que contém os arquivos restaurados.
     */
    static Optional<Path> selectMainBackup(Collection<Path> files) {
        for (Path file : files) {
            for (Path p = file; p != null; p = p.getParent()) {
                Path name = p.getFileName();
                if (name != null && name.toString().equals(BACKUP_BASENAME + "." + DumpFormat.DIRECTORY.extension())) {
                    return Optional.of(p);
                }
            }
        }
        return files.stream()
                .filter(f -> {
                    String name = f.getFileName().toString();
                    return name.startsWith(BACKUP_BASENAME)
                            && !name.equals(SCHEMA_FILE)
                            && !name.equals(GLOBALS_FILE);
                })
                .findFirst();
    }

    /**
     * Formato pela extensão; sem extensão conhecida, pelo cabeçalho do arquivo
     * (PGDMP = custom, "ustar" = tar, SQL legível = plain). Sem pistas: custom.
     */
    DumpFormat detectFormat(Path file) {
        if (Files.isDirectory(file)) return DumpFormat.DIRECTORY;
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".dump")) return DumpFormat.CUSTOM;
        if (name.endsWith(".tar")) return DumpFormat.TAR;
        if (name.endsWith(".sql")) return DumpFormat.PLAIN;
        Optional<DumpFormat> sniffed = sniffFormat(file);
        if (sniffed.isPresent()) {
            log.warn("Extensão de {} não reconhecida; formato detectado pelo conteúdo: {}", name, sniffed.get().id());
            return sniffed.get();
        }
        log.warn("Formato de {} indeterminado; assumindo custom", name);
        return DumpFormat.CUSTOM;
    }

    static Optional<DumpFormat> sniffFormat(Path file) {
        byte[] head = new byte[512];
        int read;
        try (InputStream in = Files.newInputStream(file)) {
            read = in.readNBytes(head, 0, head.length);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (read >= 5 && new String(head, 0, 5, StandardCharsets.US_ASCII).equals("PGDMP")) {
            return Optional.of(DumpFormat.CUSTOM);
        }
        if (read >= 262 && new String(head, 257, 5, StandardCharsets.US_ASCII).equals("ustar")) {
            return Optional.of(DumpFormat.TAR);
        }
        String text = new String(head, 0, read, StandardCharsets.UTF_8).stripLeading();
        if (text.startsWith("--") || text.startsWith("SET ") || text.startsWith("CREATE ")
                || text.startsWith("SELECT ") || text.startsWith("BEGIN")) {
            return Optional.of(DumpFormat.PLAIN);
        }
        return Optional.empty();
    }

    private void restoreWithPgRestore(Path backupFile, DumpFormat format, PostgresConnection connection,
                                      boolean overwrite, CancellationToken token) throws BackupException {
        if (!commandRunner.isCommandAvailable("pg_restore")) {
            throw BackupException.toolMissing("pg_restore");
        }
        commandRunner.runChecked(buildRestoreCommand(connection, format, backupFile, overwrite),
                authEnvironment(connection), MAIN_TIMEOUT, token);
    }

    static List<String> buildRestoreCommand(PostgresConnection connection, DumpFormat format,
                                            Path backupFile, boolean overwrite) {
        List<String> cmd = new ArrayList<>(List.of(
                "pg_restore",
                "--host", connection.host(),
                "--port", Integer.toString(connection.port()),
                "--username", connection.user(),
                "--dbname", connection.database(),
                "--verbose",
                "--no-password"));
        if (overwrite) {
            cmd.add("--clean");
            cmd.add("--if-exists");
        }
        if (format == DumpFormat.CUSTOM || format == DumpFormat.DIRECTORY) {
            cmd.add("--jobs");
            cmd.add(Integer.toString(RESTORE_JOBS));
        }
        cmd.add(backupFile.toString());
        return cmd;
    }

    private void restoreWithPsql(Path backupFile, PostgresConnection connection,
                                 boolean overwrite, CancellationToken token) throws IOException {
        if (!commandRunner.isCommandAvailable("psql")) {
            throw BackupException.toolMissing("psql");
        }
        if (overwrite) {
            recreateDatabase(connection);
        }
        commandRunner.runChecked(buildPsqlCommand(connection, backupFile), authEnvironment(connection), MAIN_TIMEOUT, token);
    }

    static List<String> buildPsqlCommand(PostgresConnection connection, Path file) {
        return List.of(
                "psql",
                "--host", connection.host(),
                "--port", Integer.toString(connection.port()),
                "--username", connection.user(),
                "--dbname", connection.database(),
                "--file", file.toString(),
                "--no-password");
    }

    private void restoreGlobals(Path globalsFile, PostgresConnection connection, CancellationToken token) throws BackupException {
        if (!commandRunner.isCommandAvailable("psql")) {
            log.warn("psql não encontrado; restore de globals ignorado");
            return;
        }
        PostgresConnection admin = connection.withDatabase(PostgresConnection.ADMIN_DATABASE);
        commandRunner.runChecked(buildPsqlCommand(admin, globalsFile), authEnvironment(admin), AUX_TIMEOUT, token);
    }

    /**
     * DESTRUTIVO. No banco administrativo: encerra as outras sessões do alvo, depois
     * DROP DATABASE IF EXISTS e CREATE DATABASE. Só é chamado com overwrite explícito.
     */
    void recreateDatabase(PostgresConnection connection) throws IOException {
        log.warn("Recriando banco {} (overwrite solicitado)", connection.database());
        resetDatabase(connection, true);
    }

    /** Encerra sessões e remove o banco; com {@code create}, cria de novo vazio. */
    private void resetDatabase(PostgresConnection connection, boolean create) throws IOException {
        String database = connection.database();
        PostgresConnection admin = connection.withDatabase(PostgresConnection.ADMIN_DATABASE);
        try (Connection c = openJdbc(admin)) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT pg_terminate_backend(pid) FROM pg_stat_activity "
                            + "WHERE datname = ? AND pid <> pg_backend_pid()")) {
                ps.setString(1, database);
                try (ResultSet rs = ps.executeQuery()) {
                    int terminated = 0;
                    while (rs.next()) terminated++;
                    log.info("{} sessão(ões) encerrada(s) em {}", terminated, database);
                }
            }
            try (Statement st = c.createStatement()) {
                st.execute("DROP DATABASE IF EXISTS " + quoteIdentifier(database));
                if (create) {
                    st.execute("CREATE DATABASE " + quoteIdentifier(database));
                }
            }
        } catch (SQLException e) {
            throw new IOException("Falha ao " + (create ? "recriar" : "remover") + " banco "
                    + database + ": " + e.getMessage(), e);
        }
    }

    // ==== VERIFICAÇÃO / CLEANUP ====

    @Override
    protected boolean verifyIntegrity(BackupMetadata metadata) throws IOException {
        if (!super.verifyIntegrity(metadata)) {
            return false;
        }
        Optional<PostgresConnection> connection = connection();
        return connection.isPresent() && ping(connection.get());
    }

    @Override
    public void cleanup() {
        synchronized (this) {
            cachedConnection = null;
        }
        super.cleanup();
    }

    // ==== HELPERS ====

    private static Map<String, String> authEnvironment(PostgresConnection connection) {
        return connection.password().isEmpty() ? Map.of() : Map.of("PGPASSWORD", connection.password());
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static Boolean asBoolean(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean) return (Boolean) value;
        String s = String.valueOf(value).trim();
        return s.equalsIgnoreCase("true") || s.equals("1") || s.equalsIgnoreCase("yes");
    }

    private static Integer asInteger(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> asStringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?>) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !String.valueOf(item).isBlank()) out.add(String.valueOf(item).trim());
            }
        } else if (value != null) {
            for (String part : String.valueOf(value).split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }
}
