package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class ObjectDescriptor {

    public final ObjectType objectType;
    public final String name;
    public final String owningSchema;
    /**
     * Name of the indexed table. Only set for indexes.
     */
    public final String tableName;

    public ObjectDescriptor(@NotNull ObjectType objectType, @NotNull String name, @NotNull String owningSchema) {
        this(objectType, name, owningSchema, null);
    }

    public ObjectDescriptor(@NotNull ObjectType objectType, @NotNull String name, @NotNull String owningSchema, @Nullable String tableName) {
        this.objectType = objectType;
        this.name = name;
        this.owningSchema = owningSchema;
        this.tableName = tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ObjectDescriptor that)) {
            return false;
        }
        return objectType == that.objectType
                && name.equals(that.name)
                && owningSchema.equals(that.owningSchema)
                && Objects.equals(tableName, that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectType, name, owningSchema, tableName);
    }

    @Override
    public String toString() {
        return objectType.getLabel() + " " + owningSchema + "." + name;
    }

}
