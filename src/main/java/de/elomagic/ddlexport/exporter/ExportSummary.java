package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.ExitStatus;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Counters of an export run.
 */
public class ExportSummary {

    private ExitStatus status = ExitStatus.FAILED;
    private Path outputRoot;
    private int schemasExported;
    private int objectsExported;
    private int objectsFailed;
    private int typesFailed;
    private int artifactsWritten;
    private int artifactsFailed;

    @NotNull
    public ExitStatus getStatus() {
        return status;
    }

    void setStatus(@NotNull ExitStatus status) {
        this.status = status;
    }

    /**
     * @return Root directory of the run or null when the run failed before it was created
     */
    @Nullable
    public Path getOutputRoot() {
        return outputRoot;
    }

    void setOutputRoot(@NotNull Path outputRoot) {
        this.outputRoot = outputRoot;
    }

    public int getSchemasExported() {
        return schemasExported;
    }

    public int getObjectsExported() {
        return objectsExported;
    }

    /**
     * @return Number of failed DDL requests including failed package body requests
     */
    public int getObjectsFailed() {
        return objectsFailed;
    }

    /**
     * @return Number of (schema, type) pairs whose objects could not be listed
     */
    public int getTypesFailed() {
        return typesFailed;
    }

    public int getArtifactsWritten() {
        return artifactsWritten;
    }

    public int getArtifactsFailed() {
        return artifactsFailed;
    }

    void incrementSchemasExported() {
        schemasExported++;
    }

    void incrementObjectsExported() {
        objectsExported++;
    }

    void incrementObjectsFailed() {
        objectsFailed++;
    }

    void incrementTypesFailed() {
        typesFailed++;
    }

    void incrementArtifactsWritten() {
        artifactsWritten++;
    }

    void incrementArtifactsFailed() {
        artifactsFailed++;
    }

}
