package de.elomagic.ddlexport.writer;

import de.elomagic.ddlexport.dto.ArtifactEntry;
import de.elomagic.ddlexport.dto.ExportResult;
import de.elomagic.ddlexport.dto.ObjectDescriptor;
import de.elomagic.ddlexport.dto.ObjectType;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

public final class ArtifactFormatter {

    static final String STATEMENT_SEPARATOR = "/";

    private ArtifactFormatter() {
    }

    @NotNull
    public static String formatHeader(@NotNull String schema, @NotNull ObjectType type, @NotNull String timestamp) {
        return """
                -- %s DDL for schema %s
                -- Generated: %s

                """.formatted(type.getLabel(), schema, timestamp);
    }

    /**
     * Formats an entry. A package entry is followed by exactly one block for its body: the body DDL, an error marker
     * or a "no body" marker.
     */
    @NotNull
    public static String formatEntry(@NotNull ArtifactEntry entry) {
        ObjectDescriptor descriptor = entry.descriptor;

        StringBuilder sb = new StringBuilder();
        sb.append(formatBlock(descriptor.objectType, identifier(descriptor), descriptor.name, entry.result));

        if (descriptor.objectType == ObjectType.PACKAGE) {
            ExportResult body = entry.bodyResult == null ? ExportResult.absent() : entry.bodyResult;
            if (body.kind == ExportResult.Kind.ABSENT) {
                sb.append("-- No package body found for %s\n\n".formatted(descriptor.name));
            } else {
                sb.append(formatBlock(ObjectType.PACKAGE_BODY, descriptor.name, descriptor.name, body));
            }
        }

        return sb.toString();
    }

    @NotNull
    public static String formatErrorMarker(@NotNull ObjectType type, @NotNull String name) {
        return "-- Error getting DDL for %s %s\n\n".formatted(type.getLabel(), name);
    }

    @NotNull
    private static String formatBlock(@NotNull ObjectType type, @NotNull String identifier, @NotNull String name, @NotNull ExportResult result) {
        if (!result.isSuccess() || StringUtils.isBlank(result.ddl)) {
            return formatErrorMarker(type, name);
        }

        return "-- %s: %s\n%s\n%s\n\n".formatted(type.getLabel(), identifier, normalizeDdl(result.ddl), STATEMENT_SEPARATOR);
    }

    @NotNull
    private static String identifier(@NotNull ObjectDescriptor descriptor) {
        return descriptor.objectType == ObjectType.INDEX && StringUtils.isNotBlank(descriptor.tableName)
                ? descriptor.name + " ON " + descriptor.tableName
                : descriptor.name;
    }

    /**
     * Unifies line breaks, strips surrounding blanks and a trailing separator line so that every block ends with
     * exactly one separator.
     */
    @NotNull
    static String normalizeDdl(@NotNull String ddl) {
        String s = StringUtils.strip(ddl.replace("\r\n", "\n").replace('\r', '\n'));
        if (s.endsWith("\n" + STATEMENT_SEPARATOR)) {
            s = StringUtils.stripEnd(s.substring(0, s.length() - STATEMENT_SEPARATOR.length()), null);
        }
        return s;
    }

}
