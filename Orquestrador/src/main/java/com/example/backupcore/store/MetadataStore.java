package com.example.backupcore.store;

import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Histórico durável de metadados, indexado pelo id do backup. O orquestrador mantém um
 * cache em memória por cima; este contrato é a fonte de verdade entre reinícios.
 */
public interface MetadataStore {

    void save(BackupMetadata metadata) throws IOException;

    Optional<BackupMetadata> find(String backupId) throws IOException;

    boolean delete(String backupId) throws IOException;

    /** Todos os registros, em ordem de inserção. */
    List<BackupMetadata> all() throws IOException;

    static MetadataStore inMemory() {
        return new InMemoryMetadataStore();
    }

    // ==================================================================================
    // EM MEMÓRIA (padrão)
    // ==================================================================================

    final class InMemoryMetadataStore implements MetadataStore {
        private final Map<String, BackupMetadata> records = new LinkedHashMap<>();

        @Override
        public synchronized void save(BackupMetadata metadata) {
            records.put(metadata.id(), metadata.copy());
        }

        @Override
        public synchronized Optional<BackupMetadata> find(String backupId) {
            return Optional.ofNullable(records.get(backupId)).map(BackupMetadata::copy);
        }

        @Override
        public synchronized boolean delete(String backupId) {
            return records.remove(backupId) != null;
        }

        @Override
        public synchronized List<BackupMetadata> all() {
            List<BackupMetadata> out = new ArrayList<>();
            for (BackupMetadata m : records.values()) out.add(m.copy());
            return out;
        }
    }

    // ==================================================================================
    // ARQUIVO JSON
    // ==================================================================================

    /**
     * Índice num único arquivo JSON, carregado no construtor e regravado (tmp + move) a cada
     * alteração. Suficiente para históricos de centenas de backups.
     */
    final class JsonFileMetadataStore implements MetadataStore {
        private static final Logger log = LoggerFactory.getLogger(JsonFileMetadataStore.class);

        static final class IndexDto {
            @JsonProperty("version") public int version = 1;
            @JsonProperty("backups") public List<MetadataJson.MetadataDto> backups = new ArrayList<>();
        }

        private final Path indexFile;
        private final Map<String, BackupMetadata> records = new LinkedHashMap<>();

        public JsonFileMetadataStore(Path indexFile) throws IOException {
            this.indexFile = Objects.requireNonNull(indexFile, "indexFile");
            if (Files.exists(indexFile)) {
                IndexDto index = MetadataJson.mapper().readValue(indexFile.toFile(), IndexDto.class);
                for (MetadataJson.MetadataDto dto : index.backups) {
                    BackupMetadata m = MetadataJson.fromDto(dto);
                    records.put(m.id(), m);
                }
                log.info("Índice de metadados carregado de {}: {} registro(s)", indexFile, records.size());
            }
        }

        @Override
        public synchronized void save(BackupMetadata metadata) throws IOException {
            records.put(metadata.id(), metadata.copy());
            flush();
        }

        @Override
        public synchronized Optional<BackupMetadata> find(String backupId) {
            return Optional.ofNullable(records.get(backupId)).map(BackupMetadata::copy);
        }

        @Override
        public synchronized boolean delete(String backupId) throws IOException {
            boolean removed = records.remove(backupId) != null;
            if (removed) flush();
            return removed;
        }

        @Override
        public synchronized List<BackupMetadata> all() {
            List<BackupMetadata> out = new ArrayList<>();
            for (BackupMetadata m : records.values()) out.add(m.copy());
            return out;
        }

        private void flush() throws IOException {
            IndexDto index = new IndexDto();
            for (BackupMetadata m : records.values()) index.backups.add(MetadataJson.toDto(m));
            MetadataJson.writeAtomically(indexFile, index);
        }
    }
}
