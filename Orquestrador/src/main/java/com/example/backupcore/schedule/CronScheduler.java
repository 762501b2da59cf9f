package com.example.backupcore.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

/**
 * Agendador cron sobre {@link CronExpression} do Spring e um único
 * {@link ScheduledExecutorService}. Cada entrada se reagenda depois de disparar.
 * <p>
 * Aceita expressões de 5 campos (minuto ... dia-da-semana) e de 6 campos (com segundos).
 */
public class CronScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final ScheduledExecutorService executor;

    public CronScheduler() {
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backup-cron-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Converte "m h dom mon dow" para o formato de 6 campos do Spring. */
    public static CronExpression parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized = fields.length == 5 ? "0 " + trimmed : trimmed;
        return CronExpression.parse(normalized);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException | NullPointerException e) {
            return false;
        }
    }

    /**
     * Agenda {@code task}. Falhas da tarefa são logadas e não interrompem o agendamento.
     *
     * @throws IllegalArgumentException expressão ou timezone inválidos
     */
    public Handle schedule(String name, String expression, String timezone, Runnable task) {
        CronExpression cron = parse(expression);
        ZoneId zone = ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
        Handle handle = new Handle(name, cron, zone, Objects.requireNonNull(task, "task"));
        handle.scheduleNext();
        log.info("Agendado {} com cron '{}' ({}); próxima execução: {}", name, expression, zone,
                handle.nextFireTime().map(Instant::toString).orElse("nunca"));
        return handle;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public final class Handle {
        private final String name;
        private final CronExpression cron;
        private final ZoneId zone;
        private final Runnable task;
        private volatile ScheduledFuture<?> future;
        private volatile Instant nextFire;
        private volatile boolean stopped;

        private Handle(String name, CronExpression cron, ZoneId zone, Runnable task) {
            this.name = name;
            this.cron = cron;
            this.zone = zone;
            this.task = task;
        }

        public String name() { return name; }

        public Optional<Instant> nextFireTime() {
            return stopped ? Optional.empty() : Optional.ofNullable(nextFire);
        }

        public synchronized void stop() {
            stopped = true;
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
            log.debug("Agendamento {} parado", name);
        }

        private synchronized void scheduleNext() {
            if (stopped || executor.isShutdown()) return;
            ZonedDateTime next = cron.next(ZonedDateTime.now(zone));
            if (next == null) {
                nextFire = null;
                log.warn("Cron de {} não tem próxima execução", name);
                return;
            }
            nextFire = next.toInstant();
            long delayMs = Math.max(0, nextFire.toEpochMilli() - System.currentTimeMillis());
            future = executor.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
        }

        private void fire() {
            try {
                log.info("Disparando agendamento {}", name);
                task.run();
            } catch (RuntimeException e) {
                log.error("Execução agendada {} falhou", name, e);
            } finally {
                scheduleNext();
            }
        }
    }
}
