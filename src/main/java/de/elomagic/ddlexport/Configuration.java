package de.elomagic.ddlexport;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

public enum Configuration {

    DATABASE_URL("de.elomagic.ddlexport.database.url", null),
    DATABASE_HOST("de.elomagic.ddlexport.database.host", "localhost"),
    DATABASE_PORT("de.elomagic.ddlexport.database.port", "1521"),
    DATABASE_SERVICE("de.elomagic.ddlexport.database.service", "ORCLPDB1"),
    DATABASE_USERNAME("de.elomagic.ddlexport.database.username", "system"),
    DATABASE_PASSWORD("de.elomagic.ddlexport.database.password", null),

    EXPORT_SCHEMAS("de.elomagic.ddlexport.export.schemas", null),
    EXPORT_OBJECT_TYPES("de.elomagic.ddlexport.export.objectTypes", null),

    TRANSFORM_STORAGE("de.elomagic.ddlexport.transform.storage", "false"),
    TRANSFORM_SEGMENT_ATTRIBUTES("de.elomagic.ddlexport.transform.segmentAttributes", "false"),
    TRANSFORM_SQL_TERMINATOR("de.elomagic.ddlexport.transform.sqlTerminator", "true"),
    TRANSFORM_PRETTY("de.elomagic.ddlexport.transform.pretty", "true"),
    TRANSFORM_CONSTRAINTS_AS_ALTER("de.elomagic.ddlexport.transform.constraintsAsAlter", "true"),

    OUTPUT_PATH("de.elomagic.ddlexport.output.path", "./export"),
    OUTPUT_DIRECTORY_PREFIX("de.elomagic.ddlexport.output.directoryPrefix", "ddl_export"),
    OUTPUT_ENCODING("de.elomagic.ddlexport.output.encoding", "UTF-8");

    private final String key;
    private final String defaultValue;

    Configuration(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    @NotNull
    public String getKey() {
        return key;
    }

    @Nullable
    public static String getString(@NotNull Configuration c) {
        return System.getProperty(c.key, c.defaultValue);
    }

    public static boolean getBoolean(@NotNull Configuration c) {
        return Boolean.parseBoolean(StringUtils.trim(getString(c)));
    }

    public static int getInt(@NotNull Configuration c) {
        String value = StringUtils.trim(getString(c));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new AppRuntimeException("Property '" + c.key + "' must be a number but was '" + value + "'.", ex);
        }
    }

    /**
     * Returns the comma separated values of the property, trimmed and without blank items.
     */
    @NotNull
    public static List<String> getList(@NotNull Configuration c) {
        String value = getString(c);
        if (StringUtils.isBlank(value)) {
            return List.of();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .toList();
    }

}
