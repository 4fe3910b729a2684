package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.AppRuntimeException;

public class ExportConnectionException extends AppRuntimeException {

    public ExportConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
