package com.example.backupcore.backend;

import com.example.backupcore.errors.BackupException;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.model.BackupTypes.VerificationType;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contrato de backends de storage e a implementação base compartilhada.
 * <p>
 * Inclui:
 * 1. StorageBackend: capacidade que cada tipo de storage implementa.
 * 2. BackupArtifacts: o que um createBackup produziu (arquivos, checksums, tamanhos).
 * 3. Digests: SHA-256 em streaming.
 * 4. AbstractStorageBackend: compressão, checksums, restore e verificações padrão.
 */
public final class Backend {

    private Backend() {}

    // ==================================================================================
    // CONTRATO
    // ==================================================================================

    public interface StorageBackend {

        StorageType storageType();

        /** Sonda barata de liveness. Nunca lança; falha = indisponível. */
        boolean isAvailable();

        /** Descrição da origem (versão, tamanho, etc.) gravada como sourceConfig. */
        Map<String, Object> getStorageInfo() throws IOException;

        /** Estimativa best-effort; 0 em caso de falha. */
        long getEstimatedSize();

        /**
         * Gera os artefatos do backup somente dentro de {@code destinationDir}.
         * Reexecutar com o mesmo id sobrescreve o diretório do backup.
         */
        BackupArtifacts createBackup(StorageBackupConfig config,
                                     String backupId,
                                     Path destinationDir,
                                     CancellationToken token) throws IOException;

        /**
         * Restaura a partir dos metadados. Falhas esperadas retornam {@code false};
         * falhas inesperadas propagam.
         */
        boolean restoreBackup(BackupMetadata metadata, RestoreOptions options, CancellationToken token) throws IOException;

        default boolean restoreBackup(BackupMetadata metadata, RestoreOptions options) throws IOException {
            return restoreBackup(metadata, options, CancellationToken.none());
        }

        /** Verificação específica do backend; nunca lança. */
        boolean verifyBackup(BackupMetadata metadata, VerificationType type);

        /**
         * Remove artefatos locais listados nos metadados. Destinos remotos ficam com os
         * handlers de destino.
         */
        default void deleteBackup(BackupMetadata metadata) throws IOException {
            for (String file : metadata.files()) {
                Files.deleteIfExists(Path.of(file));
            }
        }

        /** Libera recursos (conexões, caches) no shutdown. */
        void cleanup();
    }

    // ==================================================================================
    // RESULTADO DO CREATE
    // ==================================================================================

    public static final class BackupArtifacts {
        private final Path root;
        private final List<String> files;
        private final Map<String, String> checksums;
        private final Map<String, Long> sizes;
        private final long totalSize;
        private final Long compressedSize;
        private final List<String> originalFiles;
        private final Map<String, Object> sourceInfo;

        public BackupArtifacts(Path root,
                               List<String> files,
                               Map<String, String> checksums,
                               Map<String, Long> sizes,
                               Long compressedSize,
                               List<String> originalFiles,
                               Map<String, Object> sourceInfo) {
            this.root = Objects.requireNonNull(root, "root");
            this.files = List.copyOf(files);
            this.checksums = Collections.unmodifiableMap(new LinkedHashMap<>(checksums));
            this.sizes = Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
            this.totalSize = sizes.values().stream().mapToLong(Long::longValue).sum();
            this.compressedSize = compressedSize;
            this.originalFiles = List.copyOf(originalFiles);
            this.sourceInfo = Collections.unmodifiableMap(new LinkedHashMap<>(sourceInfo));
        }

        /** Diretório do backup (destinationDir/tipo/id). */
        public Path root() { return root; }
        public List<String> files() { return files; }
        public Map<String, String> checksums() { return checksums; }
        public Map<String, Long> sizes() { return sizes; }
        public long totalSize() { return totalSize; }
        public Long compressedSize() { return compressedSize; }
        public List<String> originalFiles() { return originalFiles; }
        public Map<String, Object> sourceInfo() { return sourceInfo; }
    }

    // ==================================================================================
    // DIGESTS
    // ==================================================================================

    public static final class Digests {

        private Digests() {}

        public static String sha256Hex(Path file) throws IOException {
            MessageDigest digest;
            try {
                digest = MessageDigest.getInstance("SHA-256");
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 indisponivel", e);
            }
            try (InputStream in = new DigestInputStream(new BufferedInputStream(Files.newInputStream(file)), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(digest.digest());
        }
    }

    // ==================================================================================
    // BASE
    // ==================================================================================

    /**
     * Fluxo comum: diretório do backup → dump específico → compressão em {@code compressed/}
     * → checksums/tamanhos. No restore: checksum opcional → descompressão → restore específico.
     */
    public abstract static class AbstractStorageBackend implements StorageBackend {

        protected final Logger log = LoggerFactory.getLogger(getClass());

        static final String COMPRESSED_DIR = "compressed";
        static final String STAGING_DIR = "restore-staging";
        /** Chave do bag de metadados com o diretório do backup no destino primário. */
        public static final String BACKUP_ROOT_KEY = "backupRoot";

        private final StorageType storageType;
        protected final CommandRunner commandRunner;
        private final Path restoreTestRoot;

        protected AbstractStorageBackend(StorageType storageType, CommandRunner commandRunner, Path restoreTestRoot) {
            this.storageType = Objects.requireNonNull(storageType, "storageType");
            this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
            this.restoreTestRoot = Objects.requireNonNull(restoreTestRoot, "restoreTestRoot");
        }

        @Override
        public final StorageType storageType() {
            return storageType;
        }

        // ---- ganchos do backend concreto ----

        /** Produz os arquivos crus dentro de {@code backupDir}. Pode devolver diretórios. */
        protected abstract List<Path> doCreateBackup(StorageBackupConfig config, Path backupDir, CancellationToken token) throws IOException;

        /** Aplica os arquivos já descomprimidos na origem. */
        protected abstract boolean doRestoreBackup(List<Path> files, BackupMetadata metadata,
                                                   RestoreOptions options, CancellationToken token) throws IOException;

        // =====================
        // CREATE
        // =====================

        @Override
        public BackupArtifacts createBackup(StorageBackupConfig config,
                                            String backupId,
                                            Path destinationDir,
                                            CancellationToken token) throws IOException {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(backupId, "backupId");
            CancellationToken effective = token != null ? token : CancellationToken.none();

            Path backupDir = destinationDir.resolve(storageType.id()).resolve(backupId).toAbsolutePath().normalize();
            if (Files.exists(backupDir)) {
                FileTrees.deleteRecursively(backupDir);
            }
            Files.createDirectories(backupDir);
            log.info("Iniciando backup {} de {} em {}", backupId, storageType.id(), backupDir);

            List<Path> rawOutputs = doCreateBackup(config, backupDir, effective);
            effective.throwIfCancelled("backup " + backupId);

            List<Path> rawFiles = new ArrayList<>();
            for (Path output : rawOutputs) {
                Path absolute = output.toAbsolutePath().normalize();
                if (!absolute.startsWith(backupDir)) {
                    throw new IOException("Backend escreveu fora do diretório do backup: " + absolute);
                }
                rawFiles.addAll(FileTrees.regularFiles(absolute));
            }

            List<Path> files = compressFiles(rawFiles, config.compression(), backupDir, effective);

            Map<String, String> checksums = new LinkedHashMap<>();
            Map<String, Long> sizes = new LinkedHashMap<>();
            List<String> fileNames = new ArrayList<>();
            for (Path file : files) {
                String key = file.toString();
                fileNames.add(key);
                checksums.put(key, Digests.sha256Hex(file));
                sizes.put(key, Files.size(file));
            }
            long total = sizes.values().stream().mapToLong(Long::longValue).sum();
            Long compressedSize = config.compression() != CompressionType.NONE ? total : null;

            Map<String, Object> sourceInfo;
            try {
                sourceInfo = getStorageInfo();
            } catch (IOException e) {
                log.warn("Não foi possível coletar info do storage {}: {}", storageType.id(), e.getMessage());
                sourceInfo = Map.of();
            }

            log.info("Backup {} de {} concluído: {} arquivo(s), {} bytes", backupId, storageType.id(), files.size(), total);
            return new BackupArtifacts(backupDir, fileNames, checksums, sizes, compressedSize,
                    rawFiles.stream().map(p -> FileTrees.relativeTo(backupDir, p).toString()).toList(),
                    sourceInfo);
        }

        /**
         * Comprime cada arquivo cru para {@code compressed/<relativo><ext>} e remove o original.
         */
        protected List<Path> compressFiles(List<Path> files, CompressionType compression,
                                           Path backupDir, CancellationToken token) throws IOException {
            if (compression == null || compression == CompressionType.NONE) {
                return files;
            }
            Path compressedDir = backupDir.resolve(COMPRESSED_DIR);
            List<Path> out = new ArrayList<>();
            for (Path file : files) {
                token.throwIfCancelled("compressão");
                Path relative = FileTrees.relativeTo(backupDir, file);
                Path target = compressedDir.resolve(relative.toString() + compression.extension());
                Path parent = target.getParent();
                if (parent != null) Files.createDirectories(parent);
                try (InputStream in = new BufferedInputStream(Files.newInputStream(file));
                     OutputStream os = compressingStream(compression, Files.newOutputStream(target))) {
                    in.transferTo(os);
                }
                Files.delete(file);
                out.add(target);
            }
            return out;
        }

        // =====================
        // RESTORE
        // =====================

        @Override
        public boolean restoreBackup(BackupMetadata metadata, RestoreOptions options, CancellationToken token) throws IOException {
            Objects.requireNonNull(metadata, "metadata");
            Objects.requireNonNull(options, "options");
            CancellationToken effective = token != null ? token : CancellationToken.none();
            log.info("Iniciando restore de {} a partir do backup {}", storageType.id(), metadata.id());

            if (options.verify() && !verifyChecksums(metadata)) {
                throw BackupException.verificationFailed(metadata.id(), "checksums divergentes antes do restore");
            }

            List<String> selected = options.files().orElse(metadata.files());
            if (selected.isEmpty()) {
                log.warn("Backup {} não lista arquivos para restaurar", metadata.id());
                return false;
            }
            Path root = backupRoot(metadata, selected);
            Path staging = null;
            Path target;
            if (options.targetPath().isPresent()) {
                target = Path.of(options.targetPath().get());
            } else if (metadata.compression() != null && metadata.compression() != CompressionType.NONE) {
                // cópias descomprimidas nunca ficam ao lado dos artefatos armazenados
                Files.createDirectories(stagingRoot());
                staging = Files.createTempDirectory(stagingRoot(), metadata.id() + "-");
                target = staging;
            } else {
                target = root;
            }

            try {
                List<Path> decompressed = decompressFiles(selected, metadata.compression(), root, target, effective);
                boolean success = doRestoreBackup(decompressed, metadata, options, effective);
                if (success) {
                    log.info("Restore de {} concluído a partir do backup {}", storageType.id(), metadata.id());
                } else {
                    log.error("Restore de {} falhou a partir do backup {}", storageType.id(), metadata.id());
                }
                return success;
            } finally {
                if (staging != null) {
                    try {
                        FileTrees.deleteRecursively(staging);
                    } catch (IOException e) {
                        log.warn("Falha ao limpar staging de restore {}: {}", staging, e.getMessage());
                    }
                }
            }
        }

        /** Raiz dos diretórios temporários de restore sem {@code targetPath}. */
        protected Path stagingRoot() {
            return restoreTestRoot.resolveSibling(STAGING_DIR);
        }

        /**
         * Descomprime (ou copia) os arquivos para {@code target}, mantendo o layout relativo e
         * removendo o prefixo {@code compressed/}. Arquivos já no lugar certo não são copiados.
         */
        protected List<Path> decompressFiles(List<String> files, CompressionType compression,
                                             Path root, Path target, CancellationToken token) throws IOException {
            CompressionType effective = compression != null ? compression : CompressionType.NONE;
            Files.createDirectories(target);
            List<Path> out = new ArrayList<>();
            for (String raw : files) {
                token.throwIfCancelled("descompressão");
                Path source = Path.of(raw).toAbsolutePath().normalize();
                Path relative = FileTrees.relativeTo(root, source);
                if (relative.getNameCount() > 1 && relative.getName(0).toString().equals(COMPRESSED_DIR)) {
                    relative = relative.subpath(1, relative.getNameCount());
                }
                String name = relative.toString();
                boolean compressed = effective != CompressionType.NONE && name.endsWith(effective.extension());
                if (compressed) {
                    name = name.substring(0, name.length() - effective.extension().length());
                }
                Path destination = FileTrees.resolveInside(target, Path.of(name));
                if (destination.equals(source)) {
                    out.add(destination);
                    continue;
                }
                Path parent = destination.getParent();
                if (parent != null) Files.createDirectories(parent);
                if (compressed) {
                    try (InputStream in = decompressingStream(effective, Files.newInputStream(source));
                         OutputStream os = new BufferedOutputStream(Files.newOutputStream(destination))) {
                        in.transferTo(os);
                    }
                } else {
                    Files.copy(source, destination, java.nio.file.StandardCopyOption.REPLACE_EXISTING);
                }
                out.add(destination);
            }
            return out;
        }

        /**
         * Diretório do backup: {@code metadata.backupRoot} quando registrado, senão o ancestral
         * de {@code compressed/}, senão o diretório do primeiro arquivo.
         */
        protected Path backupRoot(BackupMetadata metadata, List<String> files) {
            Object recorded = metadata.metadata().get(BACKUP_ROOT_KEY);
            if (recorded != null && !String.valueOf(recorded).isBlank()) {
                return Path.of(String.valueOf(recorded)).toAbsolutePath().normalize();
            }
            Path first = Path.of(files.get(0)).toAbsolutePath().normalize();
            for (Path p = first.getParent(); p != null; p = p.getParent()) {
                if (p.getFileName() != null && p.getFileName().toString().equals(COMPRESSED_DIR) && p.getParent() != null) {
                    return p.getParent();
                }
            }
            Path parent = first.getParent();
            return parent != null ? parent : first;
        }

        // =====================
        // VERIFICAÇÃO
        // =====================

        @Override
        public boolean verifyBackup(BackupMetadata metadata, VerificationType type) {
            log.info("Verificando backup {} via {}", metadata.id(), type.id());
            try {
                switch (type) {
                    case CHECKSUM:
                        return verifyChecksums(metadata);
                    case SIZE_VALIDATION:
                        return verifySizes(metadata);
                    case INTEGRITY_CHECK:
                        return verifyIntegrity(metadata);
                    case RESTORE_TEST:
                        return verifyRestoreTest(metadata);
                    default:
                        throw new IllegalArgumentException("Tipo de verificação não suportado: " + type);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Verificação {} do backup {} falhou", type.id(), metadata.id(), e);
                return false;
            }
        }

        protected boolean verifyChecksums(BackupMetadata metadata) {
            for (String file : metadata.files()) {
                if (!metadata.checksums().containsKey(file)) {
                    log.error("Arquivo {} sem checksum registrado", file);
                    return false;
                }
            }
            for (Map.Entry<String, String> entry : metadata.checksums().entrySet()) {
                try {
                    String actual = Digests.sha256Hex(Path.of(entry.getKey()));
                    if (!actual.equalsIgnoreCase(entry.getValue())) {
                        log.error("Checksum divergente em {}", entry.getKey());
                        return false;
                    }
                } catch (IOException e) {
                    log.error("Falha ao calcular checksum de {}: {}", entry.getKey(), e.getMessage());
                    return false;
                }
            }
            return true;
        }

        protected boolean verifySizes(BackupMetadata metadata) {
            for (String file : metadata.files()) {
                try {
                    if (Files.size(Path.of(file)) == 0) {
                        log.error("Arquivo {} tem tamanho zero", file);
                        return false;
                    }
                } catch (IOException e) {
                    log.error("Falha ao verificar tamanho de {}: {}", file, e.getMessage());
                    return false;
                }
            }
            return true;
        }

        /** Padrão: checksums + tamanhos. Backends concretos acrescentam checagens próprias. */
        protected boolean verifyIntegrity(BackupMetadata metadata) throws IOException {
            return verifyChecksums(metadata) && verifySizes(metadata);
        }

        /**
         * Restore real num diretório descartável ({@code overwrite=true}, {@code verify=false},
         * {@code restoreTest=true}). O diretório é removido em qualquer saída.
         */
        protected boolean verifyRestoreTest(BackupMetadata metadata) throws IOException {
            Path tempDir = restoreTestRoot.resolve(metadata.id());
            try {
                Files.createDirectories(tempDir);
                return restoreBackup(metadata, RestoreOptions.builder(metadata.id())
                        .targetPath(tempDir.toString())
                        .overwrite(true)
                        .verify(false)
                        .restoreTest(true)
                        .build(), CancellationToken.none());
            } finally {
                try {
                    FileTrees.deleteRecursively(tempDir);
                } catch (IOException e) {
                    log.warn("Falha ao limpar diretório de restore-test {}: {}", tempDir, e.getMessage());
                }
            }
        }

        @Override
        public void cleanup() {
            log.info("Cleanup concluído para o backend {}", storageType.id());
        }

        // =====================
        // STREAMS
        // =====================

        static OutputStream compressingStream(CompressionType compression, OutputStream raw) throws IOException {
            OutputStream buffered = new BufferedOutputStream(raw);
            switch (compression) {
                case GZIP:
                    return new GZIPOutputStream(buffered);
                case ZSTD:
                    return new ZstdOutputStream(buffered, 3);
                default:
                    return buffered;
            }
        }

        static InputStream decompressingStream(CompressionType compression, InputStream raw) throws IOException {
            InputStream buffered = new BufferedInputStream(raw);
            switch (compression) {
                case GZIP:
                    return new GZIPInputStream(buffered);
                case ZSTD:
                    return new ZstdInputStream(buffered);
                default:
                    return buffered;
            }
        }
    }
}
