package com.example.backupcore.destination;

import com.example.backupcore.backend.FileTrees;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupTypes.DestinationType;
import com.example.backupcore.store.MetadataJson;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handlers de destino: para onde os artefatos vão depois de produzidos no scratch do job.
 * Só o destino local é implementado aqui; S3, Azure, GCP, FTP e SFTP entram pela mesma
 * interface.
 */
public final class Destinations {

    private Destinations() {}

    /** Abstração para envio/remoção das cópias de um backup num destino. */
    public interface DestinationHandler {

        DestinationType type();

        /**
         * Copia os arquivos (absolutos, dentro de {@code root}) para o destino, preservando o
         * layout relativo a {@code root}.
         *
         * @return caminhos armazenados, na mesma ordem de {@code files}
         */
        List<String> upload(List<Path> files, Path root, BackupDestination destination, BackupMetadata metadata) throws IOException;

        /** Remove as cópias deste backup no destino. Ausência não é erro. */
        void delete(List<String> files, BackupDestination destination, BackupMetadata metadata) throws IOException;

        /** Diretório (ou prefixo) onde o backup fica neste destino. */
        String locationOf(BackupDestination destination, BackupMetadata metadata);

        /** Publica os metadados finais junto das cópias. Padrão: nada. */
        default void writeMetadata(BackupDestination destination, BackupMetadata metadata) throws IOException {
        }
    }

    // ---- Local ----------------------------------------------------------

    /**
     * Copia para {@code <path>/<storageType>/<backupId>/} e grava {@code metadata.json} ao lado.
     */
    public static final class LocalDestinationHandler implements DestinationHandler {
        private static final Logger log = LoggerFactory.getLogger(LocalDestinationHandler.class);

        public static final String METADATA_FILE = "metadata.json";

        @Override
        public DestinationType type() {
            return DestinationType.LOCAL;
        }

        @Override
        public String locationOf(BackupDestination destination, BackupMetadata metadata) {
            return backupDir(destination, metadata).toString();
        }

        @Override
        public List<String> upload(List<Path> files, Path root, BackupDestination destination, BackupMetadata metadata) throws IOException {
            Path dir = backupDir(destination, metadata);
            Files.createDirectories(dir);
            List<String> stored = new ArrayList<>();
            for (Path file : files) {
                Path relative = FileTrees.relativeTo(root, file.toAbsolutePath().normalize());
                Path dest = FileTrees.resolveInside(dir, relative);
                Path parent = dest.getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.copy(file, dest, StandardCopyOption.REPLACE_EXISTING);
                stored.add(dest.toString());
            }
            log.info("Backup {} copiado para {} ({} arquivo(s))", metadata.id(), dir, stored.size());
            return stored;
        }

        @Override
        public void writeMetadata(BackupDestination destination, BackupMetadata metadata) throws IOException {
            MetadataJson.write(backupDir(destination, metadata).resolve(METADATA_FILE), metadata);
        }

        @Override
        public void delete(List<String> files, BackupDestination destination, BackupMetadata metadata) throws IOException {
            Path dir = backupDir(destination, metadata);
            if (!Files.exists(dir)) {
                log.debug("Nada a remover em {}", dir);
                return;
            }
            FileTrees.deleteRecursively(dir);
            log.info("Backup {} removido de {}", metadata.id(), dir);
        }

        private static Path backupDir(BackupDestination destination, BackupMetadata metadata) {
            return Path.of(destination.path())
                    .resolve(metadata.storageType().id())
                    .resolve(metadata.id())
                    .toAbsolutePath()
                    .normalize();
        }
    }
}
