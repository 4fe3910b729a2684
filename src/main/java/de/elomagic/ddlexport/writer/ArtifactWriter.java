package de.elomagic.ddlexport.writer;

import de.elomagic.ddlexport.AppRuntimeException;
import de.elomagic.ddlexport.dto.ArtifactEntry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append only writer of a single artifact file.
 * <p>
 * Every entry is flushed immediately, so an interrupted export leaves a file that ends with the last completed entry.
 */
public class ArtifactWriter implements Closeable {

    private static final Logger LOGGER = LogManager.getLogger(ArtifactWriter.class);

    private final Path file;
    private final BufferedWriter writer;
    private int entryCount;

    ArtifactWriter(@NotNull Path file, @NotNull Charset encoding, @NotNull String header) throws AppRuntimeException {
        this.file = file;
        try {
            writer = Files.newBufferedWriter(
                    file,
                    encoding,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            writer.write(header);
            writer.flush();
        } catch (IOException ex) {
            throw new AppRuntimeException("Unable to create artifact file '" + file + "': " + ex.getMessage(), ex);
        }
    }

    /**
     * Appends one entry. A formatting problem is written as error marker instead of the entry.
     */
    public void append(@NotNull ArtifactEntry entry) throws AppRuntimeException {
        String text;
        try {
            text = ArtifactFormatter.formatEntry(entry);
        } catch (RuntimeException ex) {
            LOGGER.error("Unable to format entry {}: {}", entry.descriptor, ex.getMessage(), ex);
            text = ArtifactFormatter.formatErrorMarker(entry.descriptor.objectType, entry.descriptor.name);
        }

        try {
            writer.write(text);
            writer.flush();
            entryCount++;
        } catch (IOException ex) {
            throw new AppRuntimeException("Unable to write into artifact file '" + file + "': " + ex.getMessage(), ex);
        }
    }

    public int getEntryCount() {
        return entryCount;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

}
