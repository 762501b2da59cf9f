package com.example.backupcore.backend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utilitários de árvore de arquivos usados por backends, destinos e orquestrador.
 */
public final class FileTrees {

    private FileTrees() {}

    /**
     * Remove a árvore inteira (filhos antes dos pais). Ausente = no-op.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) return;
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }

    /**
     * Arquivos regulares sob {@code path}; se {@code path} já é arquivo, devolve ele mesmo.
     */
    public static List<Path> regularFiles(Path path) throws IOException {
        if (Files.isRegularFile(path)) return List.of(path);
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(path)) return out;
        try (Stream<Path> walk = Files.walk(path)) {
            walk.filter(Files::isRegularFile).sorted().forEach(out::add);
        }
        return out;
    }

    /**
     * Caminho relativo a {@code root} quando contido nele; senão, só o nome do arquivo.
     */
    public static Path relativeTo(Path root, Path file) {
        Path normalizedFile = file.toAbsolutePath().normalize();
        if (root != null) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            if (normalizedFile.startsWith(normalizedRoot) && !normalizedFile.equals(normalizedRoot)) {
                return normalizedRoot.relativize(normalizedFile);
            }
        }
        return normalizedFile.getFileName();
    }

    /**
     * Resolve {@code relative} dentro de {@code base} recusando path traversal.
     */
    public static Path resolveInside(Path base, Path relative) throws IOException {
        Path normalizedBase = base.toAbsolutePath().normalize();
        Path target = normalizedBase.resolve(relative.toString()).normalize();
        if (!target.startsWith(normalizedBase)) {
            throw new IOException("Path traversal detectado: " + relative);
        }
        return target;
    }
}
