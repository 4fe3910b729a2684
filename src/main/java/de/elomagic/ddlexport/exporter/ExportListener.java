package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.dto.ArtifactEntry;
import de.elomagic.ddlexport.dto.ExportRun;
import de.elomagic.ddlexport.dto.ObjectType;
import de.elomagic.ddlexport.dto.SchemaTarget;

import org.jetbrains.annotations.NotNull;

/**
 * Progress callbacks of the {@link ExportOrchestrator}. All methods are called from the export thread.
 */
public interface ExportListener {

    default void onRunStarted(@NotNull ExportRun run) {
    }

    /**
     * @param index 1-based position of the schema
     */
    default void onSchemaStarted(@NotNull SchemaTarget target, int index, int total) {
    }

    default void onTypeStarted(@NotNull String schema, @NotNull ObjectType type, int objectCount) {
    }

    /**
     * @param index 1-based position of the object within its type
     */
    default void onObjectExported(@NotNull ArtifactEntry entry, int index, int total) {
    }

    default void onRunFinished(@NotNull ExportSummary summary) {
    }

}
