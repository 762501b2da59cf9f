package com.example.backupcore.backend;

import com.example.backupcore.errors.BackupException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sinal de cancelamento cooperativo repassado a cada chamada de backend e subprocesso.
 * Callbacks registrados (ex.: matar o processo filho) disparam uma única vez.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    /** Token que nunca é cancelado por ninguém além de quem o criou. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
        }
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
    }

    /**
     * Registra um callback de cancelamento. Se já cancelado, executa na hora.
     * Feche o retorno quando a operação protegida terminar.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled && callbacks.remove(callback)) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    public void throwIfCancelled(String what) throws BackupException {
        if (cancelled) {
            throw BackupException.cancelled(what);
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.debug("Callback de cancelamento lançou exceção: {}", e.toString());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
