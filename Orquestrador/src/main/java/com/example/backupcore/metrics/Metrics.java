package com.example.backupcore.metrics;

import com.example.backupcore.model.BackupTypes.StorageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Métricas do ciclo de vida dos jobs. Fire-and-forget: o orquestrador engole qualquer
 * falha do sink.
 */
public final class Metrics {

    private Metrics() {}

    public static final String JOB_STARTED = "backup_job_started";
    public static final String JOB_COMPLETED = "backup_job_completed";
    public static final String JOB_FAILED = "backup_job_failed";
    public static final String JOB_CANCELLED = "backup_job_cancelled";
    public static final String RESTORE_SUCCESS = "backup_restore_success";
    public static final String RESTORE_FAILURE = "backup_restore_failure";
    public static final String RESTORE_ERROR = "backup_restore_error";
    public static final String JOB_DURATION_MS = "backup_job_duration_ms";
    public static final String BACKUP_SIZE_BYTES = "backup_size_bytes";

    public interface MetricsSink {
        void increment(String name, StorageType storageType);

        void histogram(String name, double value, StorageType storageType);
    }

    /** Sink padrão: só loga em debug. */
    public static final class LoggingMetricsSink implements MetricsSink {
        private static final Logger log = LoggerFactory.getLogger(LoggingMetricsSink.class);

        @Override
        public void increment(String name, StorageType storageType) {
            log.debug("metric {} +1 storage_type={}", name, storageType.id());
        }

        @Override
        public void histogram(String name, double value, StorageType storageType) {
            log.debug("metric {} = {} storage_type={}", name, value, storageType.id());
        }
    }
}
