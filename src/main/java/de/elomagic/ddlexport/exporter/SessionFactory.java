package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.metadata.MetadataTransformConfig;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface SessionFactory {

    /**
     * Connects to the database and applies the transform configuration to the new session.
     */
    @NotNull
    DatabaseSession open(@NotNull MetadataTransformConfig transformConfig) throws ExportConnectionException;

}
