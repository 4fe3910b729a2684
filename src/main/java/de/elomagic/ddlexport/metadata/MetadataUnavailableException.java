package de.elomagic.ddlexport.metadata;

import de.elomagic.ddlexport.AppRuntimeException;

/**
 * The metadata service could not render the DDL of an object, e.g. because it was dropped meanwhile, privileges are
 * missing or the object subtype is not supported.
 */
public class MetadataUnavailableException extends AppRuntimeException {

    public MetadataUnavailableException(String message) {
        super(message);
    }

    public MetadataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
