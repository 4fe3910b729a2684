package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * One invocation of the export.
 */
public final class ExportRun {

    public final Path outputRoot;
    public final Instant startTime;
    public final List<String> schemas;
    public final List<ObjectType> objectTypes;

    public ExportRun(@NotNull Path outputRoot, @NotNull Instant startTime, @NotNull List<String> schemas, @NotNull List<ObjectType> objectTypes) {
        this.outputRoot = outputRoot;
        this.startTime = startTime;
        this.schemas = List.copyOf(schemas);
        this.objectTypes = List.copyOf(objectTypes);
    }

}
