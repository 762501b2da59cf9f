package com.example.backupcore.backend.filesystem;

import com.example.backupcore.backend.Backend.AbstractStorageBackend;
import com.example.backupcore.backend.Backend.Digests;
import com.example.backupcore.backend.CancellationToken;
import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.FileTrees;
import com.example.backupcore.errors.BackupException;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.RestoreOptions;
import com.example.backupcore.model.BackupSettings.StorageBackupConfig;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Backend de diretórios locais: empacota os caminhos configurados num zip e grava um
 * manifesto JSON com tamanho, mtime e SHA-256 de cada arquivo.
 * <p>
 * Opções: {@code paths} (lista), {@code excludePatterns} (glob, ou "regex:..."),
 * {@code followSymlinks} (padrão false, evita loops de filesystem).
 */
public class FileSystemBackend extends AbstractStorageBackend {

    static final String ARCHIVE_FILE = "filesystem_backup.zip";
    static final String MANIFEST_FILE = "filesystem_manifest.json";

    private final List<Path> defaultPaths;
    private final ObjectMapper mapper;

    public FileSystemBackend(List<Path> defaultPaths, CommandRunner commandRunner, Path restoreTestRoot) {
        super(StorageType.FILE_SYSTEM, commandRunner, restoreTestRoot);
        this.defaultPaths = List.copyOf(Objects.requireNonNull(defaultPaths, "defaultPaths"));
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    // ==================================================================================
    // MANIFESTO (DTO Jackson)
    // ==================================================================================

    static final class ManifestDto {
        @JsonProperty("created_at")
        public String createdAt;
        @JsonProperty("roots")
        public Map<String, String> roots = new LinkedHashMap<>();
        @JsonProperty("files")
        public List<ManifestEntry> files = new ArrayList<>();
    }

    static final class ManifestEntry {
        @JsonProperty("entry")
        public String entry;
        @JsonProperty("size")
        public long size;
        @JsonProperty("modified_at")
        public String modifiedAt;
        @JsonProperty("sha256")
        public String sha256;
    }

    // ==================================================================================
    // PROBES
    // ==================================================================================

    @Override
    public boolean isAvailable() {
        try {
            return defaultPaths.stream().allMatch(p -> Files.isDirectory(p) && Files.isReadable(p));
        } catch (RuntimeException e) {
            log.debug("Verificação de disponibilidade falhou: {}", e.toString());
            return false;
        }
    }

    @Override
    public Map<String, Object> getStorageInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", StorageType.FILE_SYSTEM.id());
        info.put("paths", defaultPaths.stream().map(Path::toString).toList());
        info.put("size", getEstimatedSize());
        return info;
    }

    @Override
    public long getEstimatedSize() {
        long total = 0;
        for (Path root : defaultPaths) {
            try {
                for (Path file : FileTrees.regularFiles(root)) {
                    total += Files.size(file);
                }
            } catch (IOException | RuntimeException e) {
                log.debug("Estimativa de tamanho de {} falhou: {}", root, e.toString());
                return 0L;
            }
        }
        return total;
    }

    // ==================================================================================
    // BACKUP
    // ==================================================================================

    @Override
    protected List<Path> doCreateBackup(StorageBackupConfig config, Path backupDir, CancellationToken token) throws IOException {
        List<Path> roots = resolvePaths(config.options().get("paths"));
        if (roots.isEmpty()) {
            throw BackupException.notConfigured("paths do backend file-system");
        }
        List<PathMatcher> exclusions = compileExclusions(config.options().get("excludePatterns"));
        boolean followSymlinks = Boolean.parseBoolean(String.valueOf(config.options().getOrDefault("followSymlinks", "false")));

        Path archive = backupDir.resolve(ARCHIVE_FILE);
        ManifestDto manifest = new ManifestDto();
        manifest.createdAt = java.time.Instant.now().toString();
        Set<String> usedPrefixes = new HashSet<>();

        try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(archive)))) {
            for (Path root : roots) {
                Path normalizedRoot = root.toAbsolutePath().normalize();
                if (!Files.isDirectory(normalizedRoot)) {
                    throw new IOException("Caminho de backup inexistente: " + normalizedRoot);
                }
                String prefix = uniquePrefix(normalizedRoot, usedPrefixes);
                manifest.roots.put(prefix, normalizedRoot.toString());
                archiveTree(normalizedRoot, prefix, exclusions, followSymlinks, zip, manifest, token);
            }
        }

        Path manifestPath = backupDir.resolve(MANIFEST_FILE);
        mapper.writeValue(manifestPath.toFile(), manifest);
        log.info("Arquivo file-system criado: {} arquivo(s) de {} raiz(es)", manifest.files.size(), roots.size());
        return List.of(archive, manifestPath);
    }

    private void archiveTree(Path root, String prefix, List<PathMatcher> exclusions, boolean followSymlinks,
                             ZipOutputStream zip, ManifestDto manifest, CancellationToken token) throws IOException {
        Set<FileVisitOption> options = followSymlinks ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : EnumSet.noneOf(FileVisitOption.class);
        Files.walkFileTree(root, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(root.relativize(dir), exclusions)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                token.throwIfCancelled("backup file-system");
                if (!attrs.isRegularFile() || isExcluded(root.relativize(file), exclusions)) {
                    return FileVisitResult.CONTINUE;
                }
                String entryName = prefix + "/" + root.relativize(file).toString().replace('\\', '/');
                ZipEntry entry = new ZipEntry(entryName);
                entry.setTime(attrs.lastModifiedTime().toMillis());
                zip.putNextEntry(entry);
                MessageDigest digest = sha256();
                try (InputStream in = new DigestInputStream(new BufferedInputStream(Files.newInputStream(file)), digest)) {
                    in.transferTo(zip);
                }
                zip.closeEntry();

                ManifestEntry m = new ManifestEntry();
                m.entry = entryName;
                m.size = attrs.size();
                m.modifiedAt = attrs.lastModifiedTime().toInstant().toString();
                m.sha256 = HexFormat.of().formatHex(digest.digest());
                manifest.files.add(m);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Ignorando arquivo ilegível {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    // ==================================================================================
    // RESTORE
    // ==================================================================================

    /**
     * Extrai o zip para {@code targetPath} ou, sem alvo, de volta às raízes originais.
     * Sem overwrite, arquivos existentes são preservados.
     */
    @Override
    protected boolean doRestoreBackup(List<Path> files, BackupMetadata metadata,
                                      RestoreOptions options, CancellationToken token) throws IOException {
        Path archive = findByName(files, ARCHIVE_FILE);
        Path manifestPath = findByName(files, MANIFEST_FILE);
        if (archive == null || manifestPath == null) {
            log.error("Backup {} sem {} ou {}", metadata.id(), ARCHIVE_FILE, MANIFEST_FILE);
            return false;
        }
        ManifestDto manifest = mapper.readValue(manifestPath.toFile(), ManifestDto.class);
        Path explicitTarget = options.targetPath().map(Path::of).orElse(null);

        int restored = 0;
        int skipped = 0;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            for (ManifestEntry m : manifest.files) {
                token.throwIfCancelled("restore file-system");
                ZipEntry entry = zip.getEntry(m.entry);
                if (entry == null) {
                    log.error("Entrada {} ausente no arquivo {}", m.entry, archive);
                    return false;
                }
                Path destination = destinationFor(m.entry, manifest, explicitTarget);
                if (Files.exists(destination) && !options.overwrite()) {
                    skipped++;
                    continue;
                }
                Path parent = destination.getParent();
                if (parent != null) Files.createDirectories(parent);
                try (InputStream in = zip.getInputStream(entry);
                     OutputStream out = new BufferedOutputStream(Files.newOutputStream(destination))) {
                    in.transferTo(out);
                }
                restored++;
            }
        }
        // cópias descomprimidas temporárias, nunca os artefatos armazenados
        for (Path staged : List.of(archive, manifestPath)) {
            if (!metadata.files().contains(staged.toString())) {
                Files.deleteIfExists(staged);
            }
        }
        log.info("Restore file-system do backup {}: {} restaurado(s), {} preservado(s)", metadata.id(), restored, skipped);
        return true;
    }

    private Path destinationFor(String entryName, ManifestDto manifest, Path explicitTarget) throws IOException {
        int slash = entryName.indexOf('/');
        String prefix = slash >= 0 ? entryName.substring(0, slash) : "";
        String relative = slash >= 0 ? entryName.substring(slash + 1) : entryName;
        if (explicitTarget != null) {
            return FileTrees.resolveInside(explicitTarget, Path.of(entryName));
        }
        String originalRoot = manifest.roots.get(prefix);
        if (originalRoot == null) {
            throw new IOException("Raiz desconhecida no manifesto: " + prefix);
        }
        return FileTrees.resolveInside(Path.of(originalRoot), Path.of(relative));
    }

    // ==================================================================================
    // VERIFICAÇÃO
    // ==================================================================================

    /**
     * Além de checksums/tamanhos dos artefatos, relê cada entrada do zip e compara com o
     * SHA-256 do manifesto.
     */
    @Override
    protected boolean verifyIntegrity(BackupMetadata metadata) throws IOException {
        if (!super.verifyIntegrity(metadata)) {
            return false;
        }
        if (metadata.files().isEmpty()) {
            return false;
        }
        Path scratch = Files.createTempDirectory("fs-integrity-");
        try {
            List<Path> files = decompressFiles(metadata.files(), metadata.compression(),
                    backupRoot(metadata, metadata.files()), scratch, CancellationToken.none());
            return archiveMatchesManifest(findByName(files, ARCHIVE_FILE), findByName(files, MANIFEST_FILE));
        } finally {
            try {
                FileTrees.deleteRecursively(scratch);
            } catch (IOException e) {
                log.warn("Falha ao limpar {}: {}", scratch, e.getMessage());
            }
        }
    }

    private boolean archiveMatchesManifest(Path archive, Path manifestPath) throws IOException {
        if (archive == null || manifestPath == null) {
            log.error("Backup sem {} ou {}", ARCHIVE_FILE, MANIFEST_FILE);
            return false;
        }
        ManifestDto manifest = mapper.readValue(manifestPath.toFile(), ManifestDto.class);
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            for (ManifestEntry m : manifest.files) {
                ZipEntry entry = zip.getEntry(m.entry);
                if (entry == null) {
                    log.error("Entrada {} ausente no zip", m.entry);
                    return false;
                }
                MessageDigest digest = sha256();
                try (InputStream in = new DigestInputStream(zip.getInputStream(entry), digest)) {
                    in.transferTo(OutputStream.nullOutputStream());
                }
                if (!HexFormat.of().formatHex(digest.digest()).equalsIgnoreCase(m.sha256)) {
                    log.error("SHA-256 divergente para {}", m.entry);
                    return false;
                }
            }
        }
        return true;
    }

    // ==================================================================================
    // HELPERS
    // ==================================================================================

    private List<Path> resolvePaths(Object option) {
        List<Path> out = new ArrayList<>();
        if (option instanceof Collection<?>) {
            for (Object item : (Collection<?>) option) {
                if (item != null && !String.valueOf(item).isBlank()) out.add(Path.of(String.valueOf(item).trim()));
            }
        } else if (option != null) {
            for (String part : String.valueOf(option).split(",")) {
                if (!part.isBlank()) out.add(Path.of(part.trim()));
            }
        }
        return out.isEmpty() ? defaultPaths : out;
    }

    static List<PathMatcher> compileExclusions(Object option) {
        List<String> patterns = new ArrayList<>();
        if (option instanceof Collection<?>) {
            for (Object item : (Collection<?>) option) {
                if (item != null) patterns.add(String.valueOf(item));
            }
        } else if (option != null) {
            for (String part : String.valueOf(option).split(",")) patterns.add(part);
        }
        List<PathMatcher> out = new ArrayList<>();
        for (String raw : patterns) {
            String p = raw.trim();
            if (p.isEmpty()) continue;
            if (p.startsWith("regex:")) {
                Pattern regex = Pattern.compile(p.substring("regex:".length()));
                out.add(path -> regex.matcher(path.toString().replace('\\', '/')).matches());
            } else {
                out.add(FileSystems.getDefault().getPathMatcher("glob:" + p));
            }
        }
        return out;
    }

    /** Casa contra o caminho relativo inteiro e contra o nome do arquivo. */
    static boolean isExcluded(Path relative, List<PathMatcher> exclusions) {
        Path name = relative.getFileName();
        for (PathMatcher matcher : exclusions) {
            if (matcher.matches(relative) || (name != null && matcher.matches(name))) {
                return true;
            }
        }
        return false;
    }

    private static String uniquePrefix(Path root, Set<String> used) {
        Path fileName = root.getFileName();
        String base = fileName == null ? "root" : fileName.toString();
        String candidate = base;
        int i = 1;
        while (!used.add(candidate)) {
            candidate = base + "-" + (i++);
        }
        return candidate;
    }

    private static Path findByName(List<Path> files, String name) {
        for (Path f : files) {
            Path fileName = f.getFileName();
            if (fileName != null && fileName.toString().equals(name)) return f;
        }
        return null;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponivel", e);
        }
    }
}
