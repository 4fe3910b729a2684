package de.elomagic.ddlexport.writer;

import de.elomagic.ddlexport.dto.ObjectType;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Paths of the export output tree.
 * <pre>
 * &lt;root&gt;/&lt;schema&gt;/00_schema_info.txt
 * &lt;root&gt;/&lt;schema&gt;/tables.sql
 * &lt;root&gt;/&lt;schema&gt;/...
 * </pre>
 */
public class OutputLayout {

    /**
     * Reserved name so that the summary sorts before all artifacts
     */
    public static final String SCHEMA_INFO_FILE_NAME = "00_schema_info.txt";

    private static final DateTimeFormatter RUN_DIRECTORY_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path root;

    public OutputLayout(@NotNull Path root) {
        this.root = root;
    }

    /**
     * Returns the root directory of a single run, e.g. <code>./export/ddl_export_20240131_235959</code>.
     */
    @NotNull
    public static Path resolveRunDirectory(@NotNull Path basePath, @NotNull String prefix, @NotNull Instant startTime, @NotNull ZoneId zone) {
        return basePath.resolve(prefix + "_" + RUN_DIRECTORY_FORMATTER.withZone(zone).format(startTime));
    }

    @NotNull
    public Path getRoot() {
        return root;
    }

    @NotNull
    public Path schemaDirectory(@NotNull String schema) {
        return root.resolve(schema);
    }

    @NotNull
    public Path schemaInfoFile(@NotNull String schema) {
        return schemaDirectory(schema).resolve(SCHEMA_INFO_FILE_NAME);
    }

    @NotNull
    public Path artifactFile(@NotNull String schema, @NotNull ObjectType type) {
        return schemaDirectory(schema).resolve(type.getFileName());
    }

}
