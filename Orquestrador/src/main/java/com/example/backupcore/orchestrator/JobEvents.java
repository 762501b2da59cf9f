package com.example.backupcore.orchestrator;

import com.example.backupcore.model.BackupRecords.BackupJob;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notificações do ciclo de vida dos jobs. O orquestrador só publica no barramento;
 * assinantes (monitoramento, alertas, API) nunca são referenciados por ele.
 */
public final class JobEvents {

    private JobEvents() {}

    public enum JobEventType {
        STARTED, PROGRESS, COMPLETED, FAILED, CANCELLED;

        /** Só eventos de progresso podem ser descartados com a fila cheia. */
        public boolean droppable() {
            return this == PROGRESS;
        }
    }

    public static final class JobEvent {
        private final JobEventType type;
        private final BackupJob job;

        public JobEvent(JobEventType type, BackupJob job) {
            this.type = Objects.requireNonNull(type, "type");
            this.job = Objects.requireNonNull(job, "job");
        }

        public JobEventType type() { return type; }
        /** Snapshot do job no momento do evento. */
        public BackupJob job() { return job; }
    }

    /** Handle para cancelar a assinatura. */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Fila limitada drenada por uma única thread daemon.
     * <p>
     * Com a fila cheia, PROGRESS é descartado com aviso. Os demais eventos tiram da fila um
     * PROGRESS pendente para abrir espaço; sem nenhum, esperam até {@code stateEventWait}.
     */
    public static final class JobEventBus implements AutoCloseable {
        private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

        public static final int DEFAULT_CAPACITY = 1024;
        public static final Duration DEFAULT_STATE_EVENT_WAIT = Duration.ofSeconds(5);

        private final BlockingQueue<JobEvent> queue;
        private final Duration stateEventWait;
        private final List<Consumer<JobEvent>> subscribers = new CopyOnWriteArrayList<>();
        private final Thread dispatcher;
        private volatile boolean running = true;

        public JobEventBus() {
            this(DEFAULT_CAPACITY);
        }

        public JobEventBus(int capacity) {
            this(capacity, DEFAULT_STATE_EVENT_WAIT);
        }

        public JobEventBus(int capacity, Duration stateEventWait) {
            this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
            this.stateEventWait = Objects.requireNonNull(stateEventWait, "stateEventWait");
            this.dispatcher = new Thread(this::dispatchLoop, "backup-events");
            this.dispatcher.setDaemon(true);
            this.dispatcher.start();
        }

        public Subscription subscribe(Consumer<JobEvent> subscriber) {
            Objects.requireNonNull(subscriber, "subscriber");
            subscribers.add(subscriber);
            return () -> subscribers.remove(subscriber);
        }

        public void publish(JobEvent event) {
            if (!running) return;
            if (queue.offer(event)) return;
            if (event.type().droppable()) {
                log.warn("Fila de eventos cheia; descartando {} do job {}", event.type(), event.job().id());
                return;
            }
            if (evictProgress() && queue.offer(event)) return;
            try {
                if (queue.offer(event, stateEventWait.toMillis(), TimeUnit.MILLISECONDS)) return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.error("Fila de eventos cheia por {} ms; evento {} do job {} perdido",
                    stateEventWait.toMillis(), event.type(), event.job().id());
        }

        /** Remove o PROGRESS mais antigo ainda na fila. */
        private boolean evictProgress() {
            for (JobEvent queued : queue) {
                if (queued.type().droppable() && queue.remove(queued)) {
                    log.debug("PROGRESS do job {} descartado para abrir espaço", queued.job().id());
                    return true;
                }
            }
            return false;
        }

        private void dispatchLoop() {
            while (running || !queue.isEmpty()) {
                JobEvent event;
                try {
                    event = queue.poll(200, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (event == null) continue;
                for (Consumer<JobEvent> subscriber : subscribers) {
                    try {
                        subscriber.accept(event);
                    } catch (RuntimeException e) {
                        log.debug("Assinante de eventos falhou: {}", e.toString());
                    }
                }
            }
        }

        /** Para de aceitar eventos e entrega o que já estava na fila. */
        @Override
        public void close() {
            running = false;
            try {
                dispatcher.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
