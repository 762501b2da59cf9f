package com.example.backupcore.backend.postgres;

import com.example.backupcore.backend.Backend.BackupArtifacts;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.CommandRunner.CommandResult;
import com.example.backupcore.errors.BackupException;
import com.example.backupcore.errors.ExternalToolException;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PostgresBackendTest {

    private static final PostgresConnection CONNECTION =
            new PostgresConnection("db.local", 5432, "cipher", "backup", "pw-secreta", false);

    @TempDir
    Path tmp;

    @Test
    void dumpCommandNeverCarriesThePassword() {
        PostgresBackend.DumpOptions options = PostgresBackend.DumpOptions.from(Map.of(
                "format", "custom",
                "compressLevel", 6,
                "excludeTables", List.of("audit_log", "tmp_*"),
                "jobs", 8));

        List<String> cmd = PostgresBackend.buildDumpCommand(CONNECTION, options, tmp.resolve("out.dump"));

        assertEquals("pg_dump", cmd.get(0));
        assertFalse(String.join(" ", cmd).contains("pw-secreta"));
        assertTrue(cmd.containsAll(List.of("--verbose", "--no-password", "--format", "custom")));
        assertEquals("6", cmd.get(cmd.indexOf("--compress") + 1));
        assertEquals(2, cmd.stream().filter("--exclude-table"::equals).count());
        // --jobs só vale no formato directory
        assertFalse(cmd.contains("--jobs"));
    }

    @Test
    void schemaOnlyWhenDataIsExcluded() {
        PostgresBackend.DumpOptions options = PostgresBackend.DumpOptions.from(Map.of(
                "format", "directory", "includeData", "false", "jobs", "4"));

        List<String> cmd = PostgresBackend.buildDumpCommand(CONNECTION, options, tmp.resolve("out.dir"));

        assertTrue(cmd.contains("--schema-only"));
        assertEquals("4", cmd.get(cmd.indexOf("--jobs") + 1));
    }

    @Test
    void restoreCommandCleansOnlyWhenOverwriting() {
        Path file = tmp.resolve("postgres_backup.dump");

        List<String> safe = PostgresBackend.buildRestoreCommand(CONNECTION, PostgresBackend.DumpFormat.CUSTOM, file, false);
        List<String> destructive = PostgresBackend.buildRestoreCommand(CONNECTION, PostgresBackend.DumpFormat.TAR, file, true);

        assertFalse(safe.contains("--clean"));
        assertEquals(String.valueOf(PostgresBackend.RESTORE_JOBS), safe.get(safe.indexOf("--jobs") + 1));
        assertTrue(destructive.containsAll(List.of("--clean", "--if-exists")));
        assertFalse(destructive.contains("--jobs"));
        assertEquals(file.toString(), destructive.get(destructive.size() - 1));
    }

    @Test
    void unknownFormatFallsBackToPlain() {
        assertEquals(PostgresBackend.DumpFormat.CUSTOM, PostgresBackend.DumpFormat.fromId(null));
        assertEquals(PostgresBackend.DumpFormat.TAR, PostgresBackend.DumpFormat.fromId("TAR"));
        assertEquals(PostgresBackend.DumpFormat.PLAIN, PostgresBackend.DumpFormat.fromId("xml"));
    }

    @Test
    void selectsMainBackupIgnoringSchemaAndGlobals() {
        Path dir = tmp.resolve("postgres_backup.dir");
        assertEquals(Optional.of(tmp.resolve("postgres_backup.sql")), PostgresBackend.selectMainBackup(List.of(
                tmp.resolve(PostgresBackend.GLOBALS_FILE),
                tmp.resolve(PostgresBackend.SCHEMA_FILE),
                tmp.resolve("postgres_backup.sql"))));
        assertEquals(Optional.of(dir), PostgresBackend.selectMainBackup(List.of(dir.resolve("toc.dat"))));
        assertTrue(PostgresBackend.selectMainBackup(List.of(tmp.resolve("outro.bin"))).isEmpty());
    }

    @Test
    void sniffsFormatFromFileHeader() throws IOException {
        Path custom = tmp.resolve("a");
        Files.write(custom, "PGDMP-binario".getBytes(StandardCharsets.US_ASCII));
        Path plain = tmp.resolve("b");
        Files.writeString(plain, "\n-- PostgreSQL database dump\nSET statement_timeout = 0;\n");
        Path unknown = tmp.resolve("c");
        Files.write(unknown, new byte[]{1, 2, 3});

        assertEquals(Optional.of(PostgresBackend.DumpFormat.CUSTOM), PostgresBackend.sniffFormat(custom));
        assertEquals(Optional.of(PostgresBackend.DumpFormat.PLAIN), PostgresBackend.sniffFormat(plain));
        assertTrue(PostgresBackend.sniffFormat(unknown).isEmpty());

        PostgresBackend backend = backend(Optional.of(CONNECTION), mock(CommandRunner.class));
        assertEquals(PostgresBackend.DumpFormat.PLAIN, backend.detectFormat(plain));
        assertEquals(PostgresBackend.DumpFormat.CUSTOM, backend.detectFormat(unknown));
    }

    @Test
    void quotesIdentifiers() {
        assertEquals("\"we\"\"ird\"", PostgresBackend.quoteIdentifier("we\"ird"));
    }

    @Test
    void unavailableWithoutConnection() {
        PostgresBackend backend = backend(Optional.empty(), mock(CommandRunner.class));

        assertFalse(backend.isAvailable());
        assertEquals(0L, backend.getEstimatedSize());
        BackupException e = assertThrows(BackupException.class, () -> backend.createBackup(
                StorageBackupConfig.builder(StorageType.POSTGRES).build(), "b1", tmp, CancellationToken.none()));
        assertEquals(BackupException.Code.NOT_CONFIGURED, e.code());
    }

    @Test
    void missingPgDumpIsToolMissing() {
        CommandRunner runner = mock(CommandRunner.class);
        when(runner.isCommandAvailable("pg_dump")).thenReturn(false);
        PostgresBackend backend = backend(Optional.of(CONNECTION), runner);

        BackupException e = assertThrows(BackupException.class, () -> backend.createBackup(
                StorageBackupConfig.builder(StorageType.POSTGRES).build(), "b1", tmp, CancellationToken.none()));
        assertEquals(BackupException.Code.TOOL_MISSING, e.code());
    }

    @Test
    void createBackupCompressesDumpAndPassesPasswordThroughEnvironment() throws IOException {
        CommandRunner runner = mock(CommandRunner.class);
        when(runner.isCommandAvailable("pg_dump")).thenReturn(true);
        when(runner.runChecked(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    List<String> cmd = invocation.getArgument(0);
                    Path out = Path.of(cmd.get(cmd.indexOf("--file") + 1));
                    Files.writeString(out, "-- dump\nCREATE TABLE t (id int);\n");
                    return new CommandResult(0, "", "", Duration.ofMillis(5));
                });
        PostgresBackend backend = backend(Optional.of(CONNECTION), runner);

        BackupArtifacts artifacts = backend.createBackup(StorageBackupConfig.builder(StorageType.POSTGRES)
                .compression(CompressionType.GZIP)
                .option("format", "plain")
                .build(), "b1", tmp, CancellationToken.none());

        assertEquals(1, artifacts.files().size());
        String file = artifacts.files().get(0);
        assertTrue(file.endsWith("postgres_backup.sql.gz"), file);
        assertTrue(file.contains("compressed"));
        assertEquals(artifacts.checksums().keySet(), Set.copyOf(artifacts.files()));
        assertNotNull(artifacts.compressedSize());
        assertEquals(List.of("postgres_backup.sql"), artifacts.originalFiles());
        verify(runner).runChecked(anyList(), eq(Map.of("PGPASSWORD", "pw-secreta")),
                eq(PostgresBackend.MAIN_TIMEOUT), any(CancellationToken.class));
    }

    // =====================
    // RESTORE
    // =====================

    @Test
    void plainRestoreWithOverwriteRecreatesDatabaseBeforePsql() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.sql");

        boolean ok = recorder.backend().restoreBackup(metadata, RestoreOptions.builder("b1")
                .overwrite(true)
                .verify(false)
                .build());

        assertTrue(ok);
        assertEquals(List.of(
                "jdbc@postgres",
                "sql:DROP DATABASE IF EXISTS \"cipher\"",
                "sql:CREATE DATABASE \"cipher\"",
                "psql@cipher@" + PostgresBackend.MAIN_TIMEOUT), recorder.events);
    }

    @Test
    void plainRestoreWithoutOverwriteLeavesDatabaseInPlace() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.sql");

        assertTrue(recorder.backend().restoreBackup(metadata, RestoreOptions.builder("b1").verify(false).build()));

        assertEquals(List.of("psql@cipher@" + PostgresBackend.MAIN_TIMEOUT), recorder.events);
    }

    @Test
    void globalsAreReplayedAgainstAdminDatabaseAfterMainRestore() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.dump", PostgresBackend.GLOBALS_FILE);

        assertTrue(recorder.backend().restoreBackup(metadata, RestoreOptions.builder("b1").verify(false).build()));

        assertEquals(List.of(
                "pg_restore@cipher@" + PostgresBackend.MAIN_TIMEOUT,
                "psql@postgres@" + PostgresBackend.AUX_TIMEOUT), recorder.events);
        List<String> globalsCmd = recorder.commands.get(1);
        assertTrue(globalsCmd.get(globalsCmd.indexOf("--file") + 1).endsWith(PostgresBackend.GLOBALS_FILE));
        assertFalse(recorder.commands.get(0).contains("--clean"));
    }

    @Test
    void targetDatabaseRedirectsTheRestore() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.tar");

        assertTrue(recorder.backend().restoreBackup(metadata, RestoreOptions.builder("b1")
                .verify(false)
                .overwrite(true)
                .config(Map.of(PostgresBackend.TARGET_DATABASE_KEY, "cipher_copia"))
                .build()));

        assertEquals(List.of("pg_restore@cipher_copia@" + PostgresBackend.MAIN_TIMEOUT), recorder.events);
        assertTrue(recorder.commands.get(0).containsAll(List.of("--clean", "--if-exists")));
    }

    @Test
    void failingToolMakesRestoreReturnFalse() throws IOException {
        Recorder recorder = new Recorder();
        recorder.failOn = "pg_restore";
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.dump");

        assertFalse(recorder.backend().restoreBackup(metadata, RestoreOptions.builder("b1").verify(false).build()));
    }

    @Test
    void restoreWithoutMainBackupFileIsNotFound() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", PostgresBackend.SCHEMA_FILE);

        BackupException e = assertThrows(BackupException.class, () -> recorder.backend()
                .restoreBackup(metadata, RestoreOptions.builder("b1").verify(false).build()));
        assertEquals(BackupException.Code.NOT_FOUND, e.code());
        assertTrue(recorder.events.isEmpty());
    }

    // =====================
    // RESTORE-TEST
    // =====================

    @Test
    void restoreTestUsesScratchDatabaseAndDropsIt() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.dump", PostgresBackend.GLOBALS_FILE);

        assertTrue(recorder.backend().verifyBackup(metadata, VerificationType.RESTORE_TEST));

        assertEquals(List.of(
                "jdbc@postgres",
                "sql:DROP DATABASE IF EXISTS \"cipher_restore_test_b1\"",
                "sql:CREATE DATABASE \"cipher_restore_test_b1\"",
                "pg_restore@cipher_restore_test_b1@" + PostgresBackend.MAIN_TIMEOUT,
                "jdbc@postgres",
                "sql:DROP DATABASE IF EXISTS \"cipher_restore_test_b1\""), recorder.events);
        assertFalse(recorder.commands.get(0).contains("--clean"));
        assertFalse(Files.exists(tmp.resolve("restore-test").resolve("b1")));
    }

    @Test
    void restoreTestDropsScratchDatabaseEvenWhenRestoreFails() throws IOException {
        Recorder recorder = new Recorder();
        recorder.failOn = "psql";
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.sql");

        assertFalse(recorder.backend().verifyBackup(metadata, VerificationType.RESTORE_TEST));

        assertEquals("sql:DROP DATABASE IF EXISTS \"cipher_restore_test_b1\"",
                recorder.events.get(recorder.events.size() - 1));
        assertTrue(recorder.events.stream().noneMatch(e -> e.contains("@cipher@")));
    }

    @Test
    void restoreTestRefusesTheLiveDatabase() throws IOException {
        Recorder recorder = new Recorder();
        BackupMetadata metadata = storedBackup("b1", "postgres_backup.dump");

        for (String target : List.of("cipher", PostgresConnection.ADMIN_DATABASE)) {
            BackupException e = assertThrows(BackupException.class, () -> recorder.backend().restoreBackup(metadata,
                    RestoreOptions.builder("b1")
                            .restoreTest(true)
                            .overwrite(true)
                            .verify(false)
                            .config(Map.of(PostgresBackend.TARGET_DATABASE_KEY, target))
                            .build()));
            assertEquals(BackupException.Code.UNSAFE_TARGET, e.code());
        }
        assertTrue(recorder.events.isEmpty());
    }

    @Test
    void scratchDatabaseNameFitsPostgresIdentifierLimit() {
        assertEquals("cipher_restore_test_b1", PostgresBackend.scratchDatabaseName("cipher", "b1"));
        assertEquals("cipher_restore_test_3f2a_9c", PostgresBackend.scratchDatabaseName("cipher", "3F2A-9C"));

        String name = PostgresBackend.scratchDatabaseName("x".repeat(80), "0123456789abcdef0123456789abcdef");
        assertEquals(PostgresBackend.MAX_IDENTIFIER_LENGTH, name.length());
        assertTrue(name.startsWith("xxx"));
        assertTrue(name.contains("_restore_test_"));
    }

    // =====================
    // ARTEFATOS AUXILIARES
    // =====================

    @Test
    void createAddsSchemaAndGlobalsArtifactsWhenRequested() throws IOException {
        CommandRunner runner = writingRunner();
        when(runner.isCommandAvailable(anyString())).thenReturn(true);
        PostgresBackend backend = backend(Optional.of(CONNECTION), runner);

        BackupArtifacts artifacts = backend.createBackup(StorageBackupConfig.builder(StorageType.POSTGRES)
                .compression(CompressionType.NONE)
                .option("includeSchemaOnly", true)
                .option("includeGlobals", "true")
                .build(), "b1", tmp, CancellationToken.none());

        assertEquals(List.of("postgres_backup.dump", PostgresBackend.SCHEMA_FILE, PostgresBackend.GLOBALS_FILE),
                artifacts.originalFiles());
        verify(runner).runChecked(argThat(cmd -> cmd.get(0).equals("pg_dumpall") && cmd.contains("--globals-only")),
                anyMap(), eq(PostgresBackend.AUX_TIMEOUT), any(CancellationToken.class));
        verify(runner).runChecked(argThat(cmd -> cmd.get(0).equals("pg_dump") && cmd.contains("--schema-only")),
                anyMap(), eq(PostgresBackend.AUX_TIMEOUT), any(CancellationToken.class));
    }

    @Test
    void globalsAreSkippedWhenPgDumpallIsMissing() throws IOException {
        CommandRunner runner = writingRunner();
        when(runner.isCommandAvailable("pg_dump")).thenReturn(true);
        when(runner.isCommandAvailable("pg_dumpall")).thenReturn(false);
        PostgresBackend backend = backend(Optional.of(CONNECTION), runner);

        BackupArtifacts artifacts = backend.createBackup(StorageBackupConfig.builder(StorageType.POSTGRES)
                .compression(CompressionType.NONE)
                .option("includeGlobals", true)
                .build(), "b1", tmp, CancellationToken.none());

        assertEquals(List.of("postgres_backup.dump"), artifacts.originalFiles());
        verify(runner, times(1)).runChecked(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class));
    }

    private CommandRunner writingRunner() throws BackupException {
        CommandRunner runner = mock(CommandRunner.class);
        when(runner.runChecked(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    List<String> cmd = invocation.getArgument(0);
                    Files.writeString(Path.of(cmd.get(cmd.indexOf("--file") + 1)), "-- " + cmd.get(0) + "\n");
                    return new CommandResult(0, "", "", Duration.ofMillis(1));
                });
        return runner;
    }

    /** Backup já armazenado, sem compressão, com os arquivos informados. */
    private BackupMetadata storedBackup(String id, String... names) throws IOException {
        Path dir = Files.createDirectories(tmp.resolve("armazenado").resolve(id));
        List<String> files = new ArrayList<>();
        for (String name : names) {
            files.add(Files.writeString(dir.resolve(name), "conteudo " + name).toString());
        }
        return new BackupMetadata(id, StorageType.POSTGRES)
                .compression(CompressionType.NONE)
                .files(files);
    }

    /**
     * Registra, em ordem, conexões JDBC abertas, DDL executado e ferramentas chamadas
     * ({@code ferramenta@banco@timeout}).
     */
    private final class Recorder {
        final List<String> events = new ArrayList<>();
        final List<List<String>> commands = new ArrayList<>();
        final CommandRunner runner = mock(CommandRunner.class);
        String failOn;

        Recorder() throws BackupException {
            when(runner.isCommandAvailable(anyString())).thenReturn(true);
            when(runner.runChecked(anyList(), anyMap(), any(Duration.class), any(CancellationToken.class)))
                    .thenAnswer(invocation -> {
                        List<String> cmd = invocation.getArgument(0);
                        Duration timeout = invocation.getArgument(2);
                        commands.add(cmd);
                        events.add(cmd.get(0) + "@" + cmd.get(cmd.indexOf("--dbname") + 1) + "@" + timeout);
                        if (cmd.get(0).equals(failOn)) {
                            throw new ExternalToolException(cmd.get(0), 1, "", "erro simulado");
                        }
                        return new CommandResult(0, "", "", Duration.ofMillis(1));
                    });
        }

        PostgresBackend backend() {
            return new PostgresBackend(() -> Optional.of(CONNECTION), runner, tmp.resolve("restore-test")) {
                @Override
                protected Connection openJdbc(PostgresConnection c) throws SQLException {
                    events.add("jdbc@" + c.database());
                    return fakeConnection();
                }
            };
        }

        private Connection fakeConnection() throws SQLException {
            Connection connection = mock(Connection.class);
            PreparedStatement terminate = mock(PreparedStatement.class);
            ResultSet sessions = mock(ResultSet.class);
            Statement statement = mock(Statement.class);
            when(connection.prepareStatement(anyString())).thenReturn(terminate);
            when(terminate.executeQuery()).thenReturn(sessions);
            when(connection.createStatement()).thenReturn(statement);
            when(statement.execute(anyString())).thenAnswer(invocation -> {
                events.add("sql:" + invocation.getArgument(0));
                return false;
            });
            return connection;
        }
    }

    private PostgresBackend backend(Optional<PostgresConnection> connection, CommandRunner runner) {
        return new PostgresBackend(() -> connection, runner, tmp.resolve("restore-test")) {
            @Override
            protected Connection openJdbc(PostgresConnection c) throws SQLException {
                throw new SQLException("sem banco nos testes");
            }
        };
    }
}
