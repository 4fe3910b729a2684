package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema currently in export with the enumerated objects of each requested type.
 */
public class SchemaTarget {

    public final String name;
    /**
     * Key = Object type in canonical order
     */
    public final Map<ObjectType, List<ObjectDescriptor>> objects = new EnumMap<>(ObjectType.class);
    /**
     * Types whose object list could not be read
     */
    public final Set<ObjectType> failedTypes = EnumSet.noneOf(ObjectType.class);

    public SchemaTarget(@NotNull String name) {
        this.name = name;
    }

    /**
     * @return Number of objects of each successfully enumerated type
     */
    @NotNull
    public Map<ObjectType, Integer> getObjectCounts() {
        Map<ObjectType, Integer> counts = new EnumMap<>(ObjectType.class);
        objects.forEach((type, list) -> counts.put(type, list.size()));
        return counts;
    }

    @NotNull
    public List<ObjectDescriptor> getObjects(@NotNull ObjectType type) {
        return objects.getOrDefault(type, List.of());
    }

}
