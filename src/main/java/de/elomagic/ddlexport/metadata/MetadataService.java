package de.elomagic.ddlexport.metadata;

import de.elomagic.ddlexport.dto.ObjectType;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface MetadataService {

    /**
     * Renders the DDL of a single database object.
     *
     * @param type Type of the object
     * @param name Name of the object
     * @param schema Owner of the object
     * @return DDL text, never blank
     * @throws MetadataUnavailableException Thrown when the DDL can't be rendered
     */
    @NotNull
    String getDdl(@NotNull ObjectType type, @NotNull String name, @NotNull String schema) throws MetadataUnavailableException;

}
