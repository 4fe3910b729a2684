package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.catalog.ObjectEnumerator;
import de.elomagic.ddlexport.metadata.MetadataService;

import org.jetbrains.annotations.NotNull;

/**
 * Single database session of an export run. Exclusively owned by the {@link ExportOrchestrator}.
 */
public interface DatabaseSession extends AutoCloseable {

    @NotNull
    ObjectEnumerator getEnumerator();

    @NotNull
    MetadataService getMetadataService();

    /**
     * Releases the connection. Must not throw.
     */
    @Override
    void close();

}
