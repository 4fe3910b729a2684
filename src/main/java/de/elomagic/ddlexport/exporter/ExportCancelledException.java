package de.elomagic.ddlexport.exporter;

/**
 * Thrown inside the export loop when the operator cancelled the run.
 * <p>
 * Not an {@link de.elomagic.ddlexport.AppRuntimeException}, so per object and per type error handling never catches
 * it.
 */
public class ExportCancelledException extends RuntimeException {

    public ExportCancelledException() {
        super("Export cancelled");
    }

}
