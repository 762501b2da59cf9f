package com.example.backupcore.model;

import java.util.Locale;

/**
 * Enumerações compartilhadas pelo orquestrador, backends e verificação.
 * Cada valor tem um id "de fio" (kebab-case) usado em config, JSON e métricas.
 */
public final class BackupTypes {

    private BackupTypes() {}

    public enum StorageType {
        SQLITE("sqlite"),
        POSTGRES("postgres"),
        REDIS("redis"),
        NEO4J("neo4j"),
        QDRANT("qdrant"),
        MILVUS("milvus"),
        CHROMA("chroma"),
        PINECONE("pinecone"),
        PGVECTOR("pgvector"),
        FAISS("faiss"),
        WEAVIATE("weaviate"),
        FILE_SYSTEM("file-system"),
        MONITORING_DATA("monitoring-data");

        private final String id;

        StorageType(String id) { this.id = id; }

        public String id() { return id; }

        public static StorageType fromId(String raw) {
            return lookup(StorageType.class, values(), raw);
        }
    }

    /** Tipo do backup; a semântica de incremental/diferencial é do backend. */
    public enum BackupKind {
        FULL("full"),
        INCREMENTAL("incremental"),
        DIFFERENTIAL("differential");

        private final String id;

        BackupKind(String id) { this.id = id; }

        public String id() { return id; }

        public static BackupKind fromId(String raw) {
            return lookup(BackupKind.class, values(), raw);
        }
    }

    public enum CompressionType {
        NONE("none", ""),
        GZIP("gzip", ".gz"),
        ZSTD("zstd", ".zst");

        private final String id;
        private final String extension;

        CompressionType(String id, String extension) {
            this.id = id;
            this.extension = extension;
        }

        public String id() { return id; }
        public String extension() { return extension; }

        public static CompressionType fromId(String raw) {
            return lookup(CompressionType.class, values(), raw);
        }
    }

    public enum DestinationType {
        LOCAL("local"),
        AWS_S3("aws-s3"),
        AZURE_BLOB("azure-blob"),
        GCP_STORAGE("gcp-storage"),
        FTP("ftp"),
        SFTP("sftp");

        private final String id;

        DestinationType(String id) { this.id = id; }

        public String id() { return id; }

        public static DestinationType fromId(String raw) {
            return lookup(DestinationType.class, values(), raw);
        }
    }

    public enum BackupStatus {
        PENDING("pending"),
        IN_PROGRESS("in-progress"),
        COMPLETED("completed"),
        FAILED("failed"),
        CANCELLED("cancelled");

        private final String id;

        BackupStatus(String id) { this.id = id; }

        public String id() { return id; }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }

        public static BackupStatus fromId(String raw) {
            return lookup(BackupStatus.class, values(), raw);
        }
    }

    public enum VerificationType {
        CHECKSUM("checksum"),
        INTEGRITY_CHECK("integrity-check"),
        RESTORE_TEST("restore-test"),
        SIZE_VALIDATION("size-validation");

        private final String id;

        VerificationType(String id) { this.id = id; }

        public String id() { return id; }

        public static VerificationType fromId(String raw) {
            return lookup(VerificationType.class, values(), raw);
        }
    }

    /**
     * Aceita o id de fio ("file-system") ou o nome do enum ("FILE_SYSTEM").
     */
    private static <E extends Enum<E>> E lookup(Class<E> type, E[] values, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(type.getSimpleName() + " vazio");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (E value : values) {
            if (value.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException(type.getSimpleName() + " desconhecido: " + raw);
    }
}
