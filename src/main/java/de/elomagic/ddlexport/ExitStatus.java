package de.elomagic.ddlexport;

/**
 * Process exit codes of the export command.
 */
public enum ExitStatus {

    // Full or partial export
    SUCCESS(0),
    // Connection or schema enumeration failed
    FAILED(1),
    // Interrupted by the operator (same code as a shell SIGINT)
    CANCELLED(130);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

}
