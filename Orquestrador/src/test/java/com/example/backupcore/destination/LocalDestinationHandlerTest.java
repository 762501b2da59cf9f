package com.example.backupcore.destination;

import com.example.backupcore.destination.Destinations.LocalDestinationHandler;
import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.example.backupcore.store.MetadataJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalDestinationHandlerTest {

    @TempDir
    Path tmp;

    private final LocalDestinationHandler handler = new LocalDestinationHandler();

    @Test
    void uploadKeepsLayoutUnderTypeAndId() throws IOException {
        Path scratch = Files.createDirectories(tmp.resolve("scratch/compressed"));
        Path dump = Files.writeString(scratch.resolve("dump.sql.gz"), "dados");
        BackupDestination destination = BackupDestination.local(tmp.resolve("destino").toString());
        BackupMetadata metadata = new BackupMetadata("pg-1", StorageType.POSTGRES);

        List<String> stored = handler.upload(List.of(dump), tmp.resolve("scratch"), destination, metadata);

        Path expected = tmp.resolve("destino/postgres/pg-1/compressed/dump.sql.gz").toAbsolutePath().normalize();
        assertEquals(List.of(expected.toString()), stored);
        assertEquals("dados", Files.readString(expected));
        assertEquals(tmp.resolve("destino/postgres/pg-1").toAbsolutePath().normalize().toString(),
                handler.locationOf(destination, metadata));
    }

    @Test
    void writesMetadataNextToCopiesAndDeletesWholeDirectory() throws IOException {
        Path scratch = Files.createDirectories(tmp.resolve("scratch"));
        Path file = Files.writeString(scratch.resolve("a.zip"), "zip");
        BackupDestination destination = BackupDestination.local(tmp.resolve("destino").toString());
        BackupMetadata metadata = new BackupMetadata("fs-1", StorageType.FILE_SYSTEM).size(3);

        List<String> stored = handler.upload(List.of(file), scratch, destination, metadata);
        handler.writeMetadata(destination, metadata.files(stored));

        Path dir = Path.of(handler.locationOf(destination, metadata));
        assertEquals("fs-1", MetadataJson.read(dir.resolve(LocalDestinationHandler.METADATA_FILE)).id());

        handler.delete(stored, destination, metadata);
        assertFalse(Files.exists(dir));
        handler.delete(stored, destination, metadata);
    }
}
