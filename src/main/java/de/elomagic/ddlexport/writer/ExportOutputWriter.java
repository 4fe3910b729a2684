package de.elomagic.ddlexport.writer;

import de.elomagic.ddlexport.AppRuntimeException;
import de.elomagic.ddlexport.dto.ObjectType;
import de.elomagic.ddlexport.dto.SchemaTarget;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Owns the on disk layout of a single export run.
 */
public class ExportOutputWriter {

    private static final Logger LOGGER = LogManager.getLogger(ExportOutputWriter.class);

    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OutputLayout layout;
    private final Charset encoding;
    private final Clock clock;

    public ExportOutputWriter(@NotNull OutputLayout layout, @NotNull Charset encoding, @NotNull Clock clock) {
        this.layout = layout;
        this.encoding = encoding;
        this.clock = clock;
    }

    @NotNull
    public OutputLayout getLayout() {
        return layout;
    }

    public void createRootDirectory() throws AppRuntimeException {
        createDirectory(layout.getRoot());
    }

    public void createSchemaDirectory(@NotNull String schema) throws AppRuntimeException {
        createDirectory(layout.schemaDirectory(schema));
    }

    /**
     * Writes the object counts of the requested types into <code>00_schema_info.txt</code>.
     */
    public void writeSchemaInfo(@NotNull SchemaTarget target, @NotNull List<ObjectType> types) throws AppRuntimeException {
        Path file = layout.schemaInfoFile(target.name);
        LOGGER.debug("Writing schema info file '{}'", file);

        Map<ObjectType, Integer> counts = target.getObjectCounts();

        StringBuilder sb = new StringBuilder();
        sb.append("Schema: ").append(target.name).append('\n');
        sb.append("Generated: ").append(timestamp()).append("\n\n");
        sb.append("Object counts:\n");

        int total = 0;
        for (ObjectType type : types) {
            if (target.failedTypes.contains(type)) {
                sb.append(type.getLabel()).append(": enumeration failed\n");
            } else {
                int count = counts.getOrDefault(type, 0);
                total += count;
                sb.append(type.getLabel()).append(": ").append(count).append('\n');
            }
        }
        sb.append("\nTotal: ").append(total).append('\n');

        try {
            Files.writeString(file, sb.toString(), encoding);
        } catch (IOException ex) {
            throw new AppRuntimeException("Unable to write schema info file '" + file + "': " + ex.getMessage(), ex);
        }
    }

    /**
     * Creates or truncates the artifact file of the given schema and type and writes its header.
     */
    @NotNull
    public ArtifactWriter openArtifact(@NotNull String schema, @NotNull ObjectType type) throws AppRuntimeException {
        Path file = layout.artifactFile(schema, type);
        LOGGER.debug("Opening artifact file '{}'", file);

        return new ArtifactWriter(file, encoding, ArtifactFormatter.formatHeader(schema, type, timestamp()));
    }

    @NotNull
    private String timestamp() {
        return TIMESTAMP_FORMATTER.withZone(clock.getZone()).format(clock.instant());
    }

    private void createDirectory(@NotNull Path path) throws AppRuntimeException {
        try {
            Files.createDirectories(path);
        } catch (IOException ex) {
            throw new AppRuntimeException("Unable to create directory '" + path + "': " + ex.getMessage(), ex);
        }
    }

}
