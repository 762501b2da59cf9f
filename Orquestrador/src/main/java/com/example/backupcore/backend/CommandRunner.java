package com.example.backupcore.backend;

import com.example.backupcore.errors.BackupException;
import com.example.backupcore.errors.ExternalToolException;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executa ferramentas externas (pg_dump, psql, hooks, scripts de verificação) com
 * ambiente extra, saída capturada, timeout e cancelamento que matam o processo.
 * <p>
 * Segredos vão somente em {@code environment}; nunca como argumento de linha de comando.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public static final class CommandResult {
        private final int exitCode;
        private final String stdout;
        private final String stderr;
        private final Duration duration;

        public CommandResult(int exitCode, String stdout, String stderr, Duration duration) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.duration = duration;
        }

        public int exitCode() { return exitCode; }
        public String stdout() { return stdout; }
        public String stderr() { return stderr; }
        public Duration duration() { return duration; }
        public boolean success() { return exitCode == 0; }
    }

    /**
     * Executa e devolve o resultado mesmo com código != 0.
     *
     * @throws BackupException TIMEOUT se estourar o limite, CANCELLED se o token disparar,
     *                         TOOL_MISSING se o executável não puder ser iniciado
     */
    public CommandResult run(List<String> command,
                             Map<String, String> environment,
                             Duration timeout,
                             CancellationToken token) throws BackupException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        CancellationToken effective = token != null ? token : CancellationToken.none();
        String tool = command.isEmpty() ? "?" : command.get(0);
        effective.throwIfCancelled(tool);

        ProcessBuilder builder = new ProcessBuilder(command);
        if (environment != null) {
            builder.environment().putAll(environment);
        }

        long start = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new BackupException(BackupException.Code.TOOL_MISSING, "Falha ao iniciar " + tool + ": " + e.getMessage(), e);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        Thread outDrain = drain(process.getInputStream(), out, tool + "-stdout");
        Thread errDrain = drain(process.getErrorStream(), err, tool + "-stderr");

        try (CancellationToken.Registration ignored = effective.onCancel(process::destroyForcibly)) {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} excedeu {}s; processo encerrado", tool, timeout.toSeconds());
                throw BackupException.timeout(tool, timeout.toSeconds());
            }
            outDrain.join(TimeUnit.SECONDS.toMillis(5));
            errDrain.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw BackupException.cancelled(tool);
        }
        effective.throwIfCancelled(tool);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        CommandResult result = new CommandResult(process.exitValue(),
                out.toString(StandardCharsets.UTF_8),
                err.toString(StandardCharsets.UTF_8),
                elapsed);
        log.debug("{} terminou com código {} em {}ms", tool, result.exitCode(), elapsed.toMillis());
        return result;
    }

    /**
     * Como {@link #run}, mas código != 0 vira {@link ExternalToolException}.
     */
    public CommandResult runChecked(List<String> command,
                                    Map<String, String> environment,
                                    Duration timeout,
                                    CancellationToken token) throws BackupException {
        CommandResult result = run(command, environment, timeout, token);
        if (!result.success()) {
            throw new ExternalToolException(command.get(0), result.exitCode(), result.stdout(), result.stderr());
        }
        return result;
    }

    /**
     * Equivalente a {@code which}: procura um executável com esse nome no PATH.
     */
    public boolean isCommandAvailable(String tool) {
        if (tool == null || tool.isBlank()) return false;
        if (tool.contains(File.separator)) {
            return Files.isExecutable(Path.of(tool));
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) return false;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            if (Files.isExecutable(Path.of(dir, tool))) {
                return true;
            }
        }
        return false;
    }

    private static Thread drain(InputStream input, ByteArrayOutputStream sink, String name) {
        Thread thread = new Thread(() -> {
            try (InputStream in = input) {
                in.transferTo(sink);
            } catch (IOException e) {
                log.debug("Leitura de {} interrompida: {}", name, e.toString());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
