package de.elomagic.ddlexport.catalog;

import de.elomagic.ddlexport.AppRuntimeException;

public class EnumerationException extends AppRuntimeException {

    public EnumerationException(String message, Throwable cause) {
        super(message, cause);
    }

}
