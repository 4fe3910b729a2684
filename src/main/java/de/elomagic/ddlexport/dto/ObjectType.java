package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Exported object types. The declaration order is the canonical export order.
 */
public enum ObjectType {

    TABLE("TABLE", "TABLE"),
    INDEX("INDEX", "INDEX"),
    VIEW("VIEW", "VIEW"),
    PROCEDURE("PROCEDURE", "PROCEDURE"),
    FUNCTION("FUNCTION", "FUNCTION"),
    // Specification only. The body is requested separately
    PACKAGE("PACKAGE", "PACKAGE_SPEC"),
    PACKAGE_BODY("PACKAGE BODY", "PACKAGE_BODY"),
    TRIGGER("TRIGGER", "TRIGGER"),
    SEQUENCE("SEQUENCE", "SEQUENCE"),
    SYNONYM("SYNONYM", "SYNONYM"),
    TYPE("TYPE", "TYPE_SPEC"),
    MATERIALIZED_VIEW("MATERIALIZED VIEW", "MATERIALIZED_VIEW"),
    DATABASE_LINK("DATABASE LINK", "DB_LINK");

    private final String label;
    private final String metadataType;

    ObjectType(String label, String metadataType) {
        this.label = label;
        this.metadataType = metadataType;
    }

    /**
     * @return Object type name as used by the database catalog, e.g. <code>PACKAGE BODY</code>
     */
    @NotNull
    public String getLabel() {
        return label;
    }

    /**
     * @return Object type name as expected by <code>DBMS_METADATA.GET_DDL</code>
     */
    @NotNull
    public String getMetadataType() {
        return metadataType;
    }

    /**
     * @return Artifact file name, e.g. <code>materialized_views.sql</code> or <code>indexes.sql</code>
     */
    @NotNull
    public String getFileName() {
        return pluralize(label.toLowerCase(Locale.ROOT).replace(' ', '_')) + ".sql";
    }

    @NotNull
    private static String pluralize(@NotNull String word) {
        if (word.endsWith("x") || word.endsWith("s") || word.endsWith("ch") || word.endsWith("sh")) {
            return word + "es";
        } else if (word.matches(".*[^aeiou]y")) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        return word + "s";
    }

    /**
     * Resolves a type by enum name or catalog label, case insensitive.
     */
    @NotNull
    public static ObjectType parse(@NotNull String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ObjectType type : values()) {
            if (type.name().equals(normalized) || type.label.equals(normalized)) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unsupported object type '" + value + "'.");
    }

}
