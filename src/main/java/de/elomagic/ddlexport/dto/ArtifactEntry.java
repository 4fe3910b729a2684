package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One block of an artifact file.
 */
public final class ArtifactEntry {

    public final ObjectDescriptor descriptor;
    public final ExportResult result;
    /**
     * Result of the companion package body request. Only set for packages.
     */
    public final ExportResult bodyResult;

    public ArtifactEntry(@NotNull ObjectDescriptor descriptor, @NotNull ExportResult result) {
        this(descriptor, result, null);
    }

    public ArtifactEntry(@NotNull ObjectDescriptor descriptor, @NotNull ExportResult result, @Nullable ExportResult bodyResult) {
        this.descriptor = descriptor;
        this.result = result;
        this.bodyResult = bodyResult;
    }

}
