package de.elomagic.ddlexport.metadata;

import de.elomagic.ddlexport.Configuration;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session wide formatting options of the metadata service. Applied once when the session is opened.
 */
public final class MetadataTransformConfig {

    public final boolean storage;
    public final boolean segmentAttributes;
    public final boolean sqlTerminator;
    public final boolean pretty;
    public final boolean constraintsAsAlter;

    public MetadataTransformConfig(boolean storage, boolean segmentAttributes, boolean sqlTerminator, boolean pretty, boolean constraintsAsAlter) {
        this.storage = storage;
        this.segmentAttributes = segmentAttributes;
        this.sqlTerminator = sqlTerminator;
        this.pretty = pretty;
        this.constraintsAsAlter = constraintsAsAlter;
    }

    /**
     * No storage and segment clauses, SQL terminators, pretty printed and constraints as separate ALTER statements.
     */
    @NotNull
    public static MetadataTransformConfig defaults() {
        return new MetadataTransformConfig(false, false, true, true, true);
    }

    @NotNull
    public static MetadataTransformConfig fromConfiguration() {
        return new MetadataTransformConfig(
                Configuration.getBoolean(Configuration.TRANSFORM_STORAGE),
                Configuration.getBoolean(Configuration.TRANSFORM_SEGMENT_ATTRIBUTES),
                Configuration.getBoolean(Configuration.TRANSFORM_SQL_TERMINATOR),
                Configuration.getBoolean(Configuration.TRANSFORM_PRETTY),
                Configuration.getBoolean(Configuration.TRANSFORM_CONSTRAINTS_AS_ALTER));
    }

    /**
     * @return Key = <code>DBMS_METADATA</code> transform parameter name, value = parameter value
     */
    @NotNull
    public Map<String, Boolean> toTransformParameters() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put("STORAGE", storage);
        map.put("SEGMENT_ATTRIBUTES", segmentAttributes);
        map.put("SQLTERMINATOR", sqlTerminator);
        map.put("PRETTY", pretty);
        map.put("CONSTRAINTS_AS_ALTER", constraintsAsAlter);
        return map;
    }

    @Override
    public String toString() {
        return toTransformParameters().toString();
    }

}
