package com.example.backupcore.store;

import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupRecords.ErrorInfo;
import com.example.backupcore.model.BackupSettings.BackupDestination;
import com.example.backupcore.model.BackupTypes.BackupKind;
import com.example.backupcore.model.BackupTypes.BackupStatus;
import com.example.backupcore.model.BackupTypes.CompressionType;
import com.example.backupcore.model.BackupTypes.DestinationType;
import com.example.backupcore.model.BackupTypes.StorageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formato JSON dos metadados (metadata.json e índice durável). Instantes viajam como
 * String ISO-8601; credenciais de destino nunca são gravadas.
 */
public final class MetadataJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private MetadataJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ==== DTOs ====

    static class MetadataDto {
        @JsonProperty("id") public String id;
        @JsonProperty("storage_type") public String storageType;
        @JsonProperty("backup_type") public String backupKind;
        @JsonProperty("status") public String status;
        @JsonProperty("start_time") public String startTime;
        @JsonProperty("end_time") public String endTime;
        @JsonProperty("compression") public String compression;
        @JsonProperty("files") public List<String> files;
        @JsonProperty("checksums") public Map<String, String> checksums;
        @JsonProperty("size") public long size;
        @JsonProperty("compressed_size") public Long compressedSize;
        @JsonProperty("destination") public DestinationDto destination;
        @JsonProperty("tags") public List<String> tags;
        @JsonProperty("metadata") public Map<String, Object> metadata;
        @JsonProperty("source_config") public Map<String, Object> sourceConfig;
        @JsonProperty("version") public String version;
        @JsonProperty("error") public ErrorDto error;
    }

    static class DestinationDto {
        @JsonProperty("type") public String type;
        @JsonProperty("path") public String path;
        @JsonProperty("options") public Map<String, Object> options;
    }

    static class ErrorDto {
        @JsonProperty("message") public String message;
        @JsonProperty("stack") public String stack;
        @JsonProperty("code") public String code;
    }

    // ==== conversão ====

    static MetadataDto toDto(BackupMetadata m) {
        MetadataDto dto = new MetadataDto();
        dto.id = m.id();
        dto.storageType = m.storageType().id();
        dto.backupKind = m.backupKind() == null ? null : m.backupKind().id();
        dto.status = m.status() == null ? null : m.status().id();
        dto.startTime = m.startTime() == null ? null : m.startTime().toString();
        dto.endTime = m.endTime() == null ? null : m.endTime().toString();
        dto.compression = m.compression() == null ? null : m.compression().id();
        dto.files = new ArrayList<>(m.files());
        dto.checksums = new LinkedHashMap<>(m.checksums());
        dto.size = m.size();
        dto.compressedSize = m.compressedSize().orElse(null);
        if (m.destination() != null) {
            dto.destination = new DestinationDto();
            dto.destination.type = m.destination().type().id();
            dto.destination.path = m.destination().path();
            dto.destination.options = m.destination().options().isEmpty() ? null : new LinkedHashMap<>(m.destination().options());
        }
        dto.tags = new ArrayList<>(m.tags());
        dto.metadata = new LinkedHashMap<>(m.metadata());
        dto.sourceConfig = new LinkedHashMap<>(m.sourceConfig());
        dto.version = m.version();
        if (m.error() != null) {
            dto.error = new ErrorDto();
            dto.error.message = m.error().message();
            dto.error.stack = m.error().stack();
            dto.error.code = m.error().code();
        }
        return dto;
    }

    static BackupMetadata fromDto(MetadataDto dto) {
        BackupMetadata m = new BackupMetadata(dto.id, StorageType.fromId(dto.storageType));
        if (dto.backupKind != null) m.backupKind(BackupKind.fromId(dto.backupKind));
        if (dto.status != null) m.status(BackupStatus.fromId(dto.status));
        if (dto.startTime != null) m.startTime(Instant.parse(dto.startTime));
        if (dto.endTime != null) m.endTime(Instant.parse(dto.endTime));
        if (dto.compression != null) m.compression(CompressionType.fromId(dto.compression));
        if (dto.files != null) m.files(dto.files);
        if (dto.checksums != null) m.checksums(dto.checksums);
        m.size(dto.size);
        m.compressedSize(dto.compressedSize);
        if (dto.destination != null) {
            BackupDestination.Builder b = BackupDestination.builder(DestinationType.fromId(dto.destination.type), dto.destination.path);
            if (dto.destination.options != null) b.options(dto.destination.options);
            m.destination(b.build());
        }
        if (dto.tags != null) m.tags(dto.tags);
        if (dto.metadata != null) m.metadata(dto.metadata);
        if (dto.sourceConfig != null) m.sourceConfig(dto.sourceConfig);
        if (dto.version != null) m.version(dto.version);
        if (dto.error != null) m.error(new ErrorInfo(dto.error.message, dto.error.stack, dto.error.code));
        return m;
    }

    // ==== IO ====

    /** Grava via arquivo temporário + move para não deixar JSON truncado. */
    public static void write(Path file, BackupMetadata metadata) throws IOException {
        writeAtomically(file, toDto(metadata));
    }

    public static BackupMetadata read(Path file) throws IOException {
        return fromDto(MAPPER.readValue(file.toFile(), MetadataDto.class));
    }

    static void writeAtomically(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), value);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
