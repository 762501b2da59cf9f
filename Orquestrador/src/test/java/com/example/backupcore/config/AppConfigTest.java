package com.example.backupcore.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertTrue(config.backupEnabled());
        assertEquals(3, config.maxParallelJobs());
        assertEquals("0 2 * * *", config.defaultCron());
        assertEquals("UTC", config.defaultTimezone());
        assertEquals(List.of("checksum", "size-validation"), config.verificationTypes());
        assertEquals("./backups", config.destinationPath());
        assertEquals("gzip", config.defaultCompression());
        assertFalse(config.postgresEnabled());
        assertTrue(config.configFile().isEmpty());
    }

    @Test
    void parallelJobsAreClampedToTheAllowedRange() {
        assertEquals(10, AppConfig.fromMap(Map.of(AppConfig.BACKUP_MAX_PARALLEL_JOBS, "50")).maxParallelJobs());
        assertEquals(1, AppConfig.fromMap(Map.of(AppConfig.BACKUP_MAX_PARALLEL_JOBS, "0")).maxParallelJobs());
        assertEquals(3, AppConfig.fromMap(Map.of(AppConfig.BACKUP_MAX_PARALLEL_JOBS, "muitos")).maxParallelJobs());
    }

    @Test
    void booleanParserAcceptsCommonSpellings() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.BACKUP_POSTGRES_ENABLED, "YES",
                AppConfig.BACKUP_FILE_SYSTEM_ENABLED, "1",
                AppConfig.BACKUP_ENABLED, "nao"));

        assertTrue(config.postgresEnabled());
        assertTrue(config.fileSystemEnabled());
        assertFalse(config.backupEnabled());
    }

    @Test
    void overridesWinAndCanBeRemoved() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_DEFAULT_CRON, "0 1 * * *"));

        config.override(AppConfig.BACKUP_DEFAULT_CRON, "*/5 * * * *");
        assertEquals("*/5 * * * *", config.defaultCron());

        config.override(AppConfig.BACKUP_DEFAULT_CRON, null);
        assertEquals("0 1 * * *", config.defaultCron());
    }

    @Test
    void listSplitsOnCommasAndDropsBlanks() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_FILE_SYSTEM_PATHS, " /data , ,/etc/app "));

        assertEquals(List.of("/data", "/etc/app"), config.fileSystemPaths());
    }

    @Test
    void toStringNeverContainsSecrets() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.STORAGE_DATABASE_PASSWORD, "s3cr3t",
                AppConfig.CIPHER_PG_URL, "postgresql://u:hunter2@db/app"));

        String text = config.toString();
        assertFalse(text.contains("s3cr3t"));
        assertFalse(text.contains("hunter2"));
        assertTrue(text.contains("pgPassword=set"));
    }

    @Test
    void requireFailsForMissingKey() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertThrows(IllegalStateException.class, () -> config.require(AppConfig.BACKUP_CONFIG_FILE));
    }
}
