package de.elomagic.ddlexport.catalog;

import de.elomagic.ddlexport.DbUtils;
import de.elomagic.ddlexport.dto.ObjectDescriptor;
import de.elomagic.ddlexport.dto.ObjectType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates objects with the Oracle dictionary views <code>ALL_OBJECTS</code>, <code>ALL_TABLES</code> and
 * <code>ALL_INDEXES</code>.
 * <p>
 * Names are sorted binary, independent of the <code>NLS_SORT</code> setting of the session.
 */
public class OracleObjectEnumerator implements ObjectEnumerator {

    private static final Logger LOGGER = LogManager.getLogger(OracleObjectEnumerator.class);

    private final Connection con;
    private final List<String> schemaAllowList;

    /**
     * @param con Open database connection
     * @param schemaAllowList Schemas to export. When empty, every schema visible to the session will be exported
     */
    public OracleObjectEnumerator(@NotNull Connection con, @NotNull List<String> schemaAllowList) {
        this.con = con;
        this.schemaAllowList = List.copyOf(schemaAllowList);
    }

    @Override
    @NotNull
    public List<String> listSchemas() throws EnumerationException {
        String sql = schemaAllowList.isEmpty()
                ? "SELECT owner FROM all_objects GROUP BY owner ORDER BY NLSSORT(owner, 'NLS_SORT=BINARY')"
                : "SELECT owner FROM all_objects WHERE owner IN (%s) GROUP BY owner ORDER BY NLSSORT(owner, 'NLS_SORT=BINARY')"
                        .formatted(DbUtils.placeholders(schemaAllowList.size()));

        LOGGER.info("Reading database schemas");

        List<String> schemas = new ArrayList<>();
        try (PreparedStatement statement = DbUtils.createPrepareStatement(con, sql, schemaAllowList); ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                schemas.add(rs.getString("owner"));
            }
        } catch (SQLException ex) {
            throw new EnumerationException("Unable to read schemas: " + ex.getMessage(), ex);
        }

        if (!schemaAllowList.isEmpty() && schemas.size() < schemaAllowList.size()) {
            List<String> missing = new ArrayList<>(schemaAllowList);
            missing.removeAll(schemas);
            LOGGER.warn("Schemas {} not found or without objects", missing);
        }

        return schemas;
    }

    @Override
    @NotNull
    public List<ObjectDescriptor> listObjects(@NotNull String schema, @NotNull ObjectType type) throws EnumerationException {
        LOGGER.debug("Reading {} objects of schema '{}'", type.getLabel(), schema);

        try {
            return switch (type) {
                case TABLE -> listTables(schema);
                case INDEX -> listIndexes(schema);
                default -> listCatalogObjects(schema, type);
            };
        } catch (SQLException ex) {
            throw new EnumerationException("Unable to read %s objects of schema '%s': %s".formatted(type.getLabel(), schema, ex.getMessage()), ex);
        }
    }

    @NotNull
    private List<ObjectDescriptor> listCatalogObjects(@NotNull String schema, @NotNull ObjectType type) throws SQLException {
        String sql = """
                SELECT object_name FROM all_objects
                    WHERE owner = ? AND object_type = ?
                    AND object_name NOT LIKE 'BIN$%'
                    ORDER BY NLSSORT(object_name, 'NLS_SORT=BINARY')
                """.replace("\n", " ");

        List<ObjectDescriptor> result = new ArrayList<>();
        try (PreparedStatement statement = DbUtils.createPrepareStatement(con, sql, List.of(schema, type.getLabel())); ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                result.add(new ObjectDescriptor(type, rs.getString("object_name"), schema));
            }
        }

        return result;
    }

    @NotNull
    private List<ObjectDescriptor> listTables(@NotNull String schema) throws SQLException {
        // Nested tables, secondary tables of domain indexes and materialized view containers are created by their owner
        String sql = """
                SELECT t.table_name FROM all_tables t
                    WHERE t.owner = ? AND t.nested = 'NO' AND t.secondary = 'N'
                    AND t.table_name NOT LIKE 'BIN$%'
                    AND NOT EXISTS (SELECT 1 FROM all_mviews m WHERE m.owner = t.owner AND m.mview_name = t.table_name)
                    ORDER BY NLSSORT(t.table_name, 'NLS_SORT=BINARY')
                """.replace("\n", " ");

        List<ObjectDescriptor> result = new ArrayList<>();
        try (PreparedStatement statement = DbUtils.createPrepareStatement(con, sql, List.of(schema)); ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                result.add(new ObjectDescriptor(ObjectType.TABLE, rs.getString("table_name"), schema));
            }
        }

        return result;
    }

    @NotNull
    private List<ObjectDescriptor> listIndexes(@NotNull String schema) throws SQLException {
        // LOB indexes are maintained by the database and have no DDL of their own
        String sql = """
                SELECT index_name, table_name FROM all_indexes
                    WHERE owner = ? AND index_type <> 'LOB'
                    AND index_name NOT LIKE 'BIN$%'
                    ORDER BY NLSSORT(index_name, 'NLS_SORT=BINARY')
                """.replace("\n", " ");

        List<ObjectDescriptor> result = new ArrayList<>();
        try (PreparedStatement statement = DbUtils.createPrepareStatement(con, sql, List.of(schema)); ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                result.add(new ObjectDescriptor(ObjectType.INDEX, rs.getString("index_name"), schema, rs.getString("table_name")));
            }
        }

        return result;
    }

}
