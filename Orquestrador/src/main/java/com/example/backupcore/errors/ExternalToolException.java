package com.example.backupcore.errors;

/**
 * Saída não-zero de uma ferramenta externa (pg_dump, pg_restore, psql, scripts).
 * Guarda stdout/stderr capturados para diagnóstico.
 */
public class ExternalToolException extends BackupException {

    private final String command;
    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public ExternalToolException(String command, int exitCode, String stdout, String stderr) {
        super(Code.EXTERNAL_TOOL_FAILURE, buildMessage(command, exitCode, stderr));
        this.command = command;
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public String command() { return command; }
    public int exitCode() { return exitCode; }
    public String stdout() { return stdout; }
    public String stderr() { return stderr; }

    private static String buildMessage(String command, int exitCode, String stderr) {
        String detail = stderr == null || stderr.isBlank() ? "" : ": " + stderr.strip();
        return command + " terminou com código " + exitCode + detail;
    }
}
