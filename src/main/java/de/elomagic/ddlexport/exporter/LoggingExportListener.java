package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.dto.ArtifactEntry;
import de.elomagic.ddlexport.dto.ExportResult;
import de.elomagic.ddlexport.dto.ExportRun;
import de.elomagic.ddlexport.dto.ObjectType;
import de.elomagic.ddlexport.dto.SchemaTarget;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Reports the export progress into the log.
 */
public class LoggingExportListener implements ExportListener {

    private static final Logger LOGGER = LogManager.getLogger(LoggingExportListener.class);

    private String currentSchema = "";

    @Override
    public void onRunStarted(@NotNull ExportRun run) {
        LOGGER.info("Exporting {} schema(s) {} into '{}'", run.schemas.size(), run.schemas, run.outputRoot);
    }

    @Override
    public void onSchemaStarted(@NotNull SchemaTarget target, int index, int total) {
        currentSchema = "%s %d/%d".formatted(target.name, index, total);
        LOGGER.info("[{}] Exporting schema '{}'", currentSchema, target.name);
    }

    @Override
    public void onTypeStarted(@NotNull String schema, @NotNull ObjectType type, int objectCount) {
        LOGGER.info("[{}] Exporting {} object(s) of type {}", currentSchema, objectCount, type.getLabel());
    }

    @Override
    public void onObjectExported(@NotNull ArtifactEntry entry, int index, int total) {
        LOGGER.info("[{}] {} {}/{} {} ... {}",
                currentSchema,
                entry.descriptor.objectType.getLabel(),
                index,
                total,
                entry.descriptor.name,
                outcome(entry));
    }

    @NotNull
    static String outcome(@NotNull ArtifactEntry entry) {
        if (!entry.result.isSuccess()) {
            return "failed";
        }

        return entry.bodyResult != null && entry.bodyResult.kind == ExportResult.Kind.FAILURE ? "body failed" : "done";
    }

    @Override
    public void onRunFinished(@NotNull ExportSummary summary) {
        LOGGER.info("Export {}: {} schema(s), {} object(s) exported, {} failed, {} artifact(s) written, {} artifact(s) and {} type listing(s) failed",
                summary.getStatus(),
                summary.getSchemasExported(),
                summary.getObjectsExported(),
                summary.getObjectsFailed(),
                summary.getArtifactsWritten(),
                summary.getArtifactsFailed(),
                summary.getTypesFailed());
    }

}
