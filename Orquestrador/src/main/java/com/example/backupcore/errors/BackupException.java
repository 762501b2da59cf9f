package com.example.backupcore.errors;

import java.io.IOException;
import java.util.Objects;

/**
 * Erro tipado do sistema de backup. Estende IOException para seguir o mesmo fluxo de
 * propagação das operações de disco/rede; o {@link Code} diz se vale tentar de novo.
 */
public class BackupException extends IOException {

    public enum Code {
        NOT_CONFIGURED(false),
        NOT_ENABLED(false),
        NO_HANDLER(false),
        UNAVAILABLE(true),
        TOOL_MISSING(false),
        NOT_FOUND(false),
        VERIFICATION_FAILED(false),
        EXTERNAL_TOOL_FAILURE(false),
        TIMEOUT(true),
        CANCELLED(false),
        UNSAFE_TARGET(false),
        SHUTTING_DOWN(false);

        private final boolean retryable;

        Code(boolean retryable) { this.retryable = retryable; }

        public boolean retryable() { return retryable; }
    }

    private final Code code;

    public BackupException(Code code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public BackupException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public Code code() { return code; }

    public boolean retryable() { return code.retryable(); }

    // ==== FÁBRICAS ====

    public static BackupException notConfigured(String what) {
        return new BackupException(Code.NOT_CONFIGURED, "Configuração ausente: " + what);
    }

    public static BackupException notEnabled(String storageType) {
        return new BackupException(Code.NOT_ENABLED, "Backup não habilitado para o storage: " + storageType);
    }

    public static BackupException noHandler(String storageType) {
        return new BackupException(Code.NO_HANDLER, "Nenhum backend registrado para o storage: " + storageType);
    }

    public static BackupException unavailable(String storageType) {
        return new BackupException(Code.UNAVAILABLE, "Storage " + storageType + " indisponível para backup");
    }

    public static BackupException toolMissing(String tool) {
        return new BackupException(Code.TOOL_MISSING, tool + " command not found");
    }

    public static BackupException notFound(String backupId) {
        return new BackupException(Code.NOT_FOUND, "Backup não encontrado: " + backupId);
    }

    public static BackupException verificationFailed(String backupId, String detail) {
        return new BackupException(Code.VERIFICATION_FAILED,
                "Verificação do backup " + backupId + " falhou: " + detail);
    }

    public static BackupException cancelled(String what) {
        return new BackupException(Code.CANCELLED, "Operação cancelada: " + what);
    }

    public static BackupException timeout(String command, long seconds) {
        return new BackupException(Code.TIMEOUT, command + " excedeu o limite de " + seconds + "s e foi encerrado");
    }

    public static BackupException unsafeTarget(String detail) {
        return new BackupException(Code.UNSAFE_TARGET, "Alvo de restore recusado: " + detail);
    }

    public static BackupException shuttingDown() {
        return new BackupException(Code.SHUTTING_DOWN, "Orquestrador em desligamento; novos backups recusados");
    }
}
