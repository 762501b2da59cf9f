package com.example.backupcore;

import com.example.backupcore.backend.CommandRunner;
import com.example.backupcore.backend.filesystem.FileSystemBackend;
import com.example.backupcore.backend.postgres.PostgresBackend;
import com.example.backupcore.config.AppConfig;
import com.example.backupcore.config.BackupConfigLoader;
import com.example.backupcore.destination.Destinations.LocalDestinationHandler;
import com.example.backupcore.model.BackupSettings.BackupConfig;
import com.example.backupcore.orchestrator.BackupOrchestrator;
import com.example.backupcore.orchestrator.JobEvents.JobEventType;
import com.example.backupcore.store.MetadataStore;
import com.example.backupcore.verification.Verification.VerificationConfig;
import com.example.backupcore.verification.Verification.VerificationEngine;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrada headless do orquestrador. Monta backends e destinos, inicia a agenda e fica
 * bloqueado até o shutdown hook.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        new Main().run();
    }

    public void run() throws Exception {
        AppConfig app = AppConfig.load();
        BackupConfig backupConfig = BackupConfigLoader.load(app);
        log.info("Config carregada: {}", app);

        CommandRunner commandRunner = new CommandRunner();
        Path tempRoot = Path.of(app.tempPath());
        Path restoreTestRoot = tempRoot.resolve("restore-test");

        MetadataStore store = app.metadataFile().isPresent()
                ? new MetadataStore.JsonFileMetadataStore(Path.of(app.metadataFile().get()))
                : MetadataStore.inMemory();

        VerificationEngine verification = new VerificationEngine(VerificationConfig.builder()
                .reportDirectory(Path.of(app.reportsPath()))
                .restoreTestRoot(restoreTestRoot)
                .build(), commandRunner);

        List<Path> fsPaths = app.fileSystemPaths().stream().map(Path::of).collect(Collectors.toList());

        BackupOrchestrator orchestrator = BackupOrchestrator.builder()
                .config(backupConfig)
                .scratchRoot(tempRoot.resolve("backups"))
                .commandRunner(commandRunner)
                .verificationEngine(verification)
                .metadataStore(store)
                .backend(new PostgresBackend(app, commandRunner, restoreTestRoot))
                .backend(new FileSystemBackend(fsPaths, commandRunner, restoreTestRoot))
                .destinationHandler(new LocalDestinationHandler())
                .build();

        orchestrator.events().subscribe(event -> {
            if (event.type() == JobEventType.PROGRESS) return;
            log.info("[JOB] {} {} ({}) {}%", event.type(), event.job().id(),
                    event.job().storageType().id(), event.job().progress());
        });

        orchestrator.initialize();
        orchestrator.getNextScheduledBackups()
                .forEach((type, at) -> log.info("Próximo backup de {}: {}", type.id(), at));

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            orchestrator.shutdown();
            latch.countDown();
        }, "backup-shutdown"));

        log.info("Orquestrador headless iniciado.");
        latch.await();
    }
}
