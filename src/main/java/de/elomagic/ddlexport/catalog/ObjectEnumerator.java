package de.elomagic.ddlexport.catalog;

import de.elomagic.ddlexport.dto.ObjectDescriptor;
import de.elomagic.ddlexport.dto.ObjectType;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Reads schema and object names from the database catalog.
 */
public interface ObjectEnumerator {

    /**
     * @return Distinct schema names in ascending order
     */
    @NotNull
    List<String> listSchemas() throws EnumerationException;

    /**
     * @return Objects of the given type owned by the schema in ascending order of their names. Empty when the schema
     * has no such objects
     */
    @NotNull
    List<ObjectDescriptor> listObjects(@NotNull String schema, @NotNull ObjectType type) throws EnumerationException;

}
