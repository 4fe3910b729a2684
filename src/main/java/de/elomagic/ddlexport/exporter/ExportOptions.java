package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.AppRuntimeException;
import de.elomagic.ddlexport.Configuration;
import de.elomagic.ddlexport.dto.ObjectType;
import de.elomagic.ddlexport.metadata.MetadataTransformConfig;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Run settings of the {@link ExportOrchestrator}.
 */
public final class ExportOptions {

    public final Path outputBasePath;
    public final String directoryPrefix;
    public final Charset encoding;
    /**
     * Requested types in canonical order
     */
    public final List<ObjectType> objectTypes;
    public final MetadataTransformConfig transformConfig;

    public ExportOptions(
            @NotNull Path outputBasePath,
            @NotNull String directoryPrefix,
            @NotNull Charset encoding,
            @NotNull Set<ObjectType> objectTypes,
            @NotNull MetadataTransformConfig transformConfig) {
        this.outputBasePath = outputBasePath;
        this.directoryPrefix = directoryPrefix;
        this.encoding = encoding;
        this.objectTypes = Arrays.stream(ObjectType.values()).filter(objectTypes::contains).toList();
        this.transformConfig = transformConfig;
    }

    @NotNull
    public static ExportOptions fromConfiguration() throws AppRuntimeException {
        List<String> typeNames = Configuration.getList(Configuration.EXPORT_OBJECT_TYPES);

        Set<ObjectType> types = EnumSet.allOf(ObjectType.class);
        if (!typeNames.isEmpty()) {
            types.clear();
            try {
                typeNames.forEach(name -> types.add(ObjectType.parse(name)));
            } catch (IllegalArgumentException ex) {
                throw new AppRuntimeException(ex.getMessage(), ex);
            }
        }

        return new ExportOptions(
                Paths.get(Configuration.getString(Configuration.OUTPUT_PATH)),
                Configuration.getString(Configuration.OUTPUT_DIRECTORY_PREFIX),
                Charset.forName(Configuration.getString(Configuration.OUTPUT_ENCODING)),
                types,
                MetadataTransformConfig.fromConfiguration());
    }

}
