package de.elomagic.ddlexport.metadata;

import de.elomagic.ddlexport.DbUtils;
import de.elomagic.ddlexport.dto.ObjectType;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders DDL with the Oracle package <code>DBMS_METADATA</code>.
 */
public class OracleMetadataService implements MetadataService {

    private static final Logger LOGGER = LogManager.getLogger(OracleMetadataService.class);

    private static final String GET_DDL_SQL = "SELECT DBMS_METADATA.GET_DDL(?, ?, ?) FROM DUAL";

    private final Connection con;
    private final MetadataTransformConfig transformConfig;

    private OracleMetadataService(@NotNull Connection con, @NotNull MetadataTransformConfig transformConfig) {
        this.con = con;
        this.transformConfig = transformConfig;
    }

    /**
     * Creates the service and applies the transform configuration to the database session.
     * <p>
     * The configuration stays active for the lifetime of the connection and is never changed afterwards.
     */
    @NotNull
    public static OracleMetadataService create(@NotNull Connection con, @NotNull MetadataTransformConfig transformConfig) throws SQLException {
        OracleMetadataService service = new OracleMetadataService(con, transformConfig);
        service.applyTransformConfig();
        return service;
    }

    @NotNull
    static String createTransformSql(@NotNull MetadataTransformConfig config) {
        String calls = config.toTransformParameters()
                .entrySet()
                .stream()
                .map(e -> "  DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, '%s', %s);".formatted(
                        e.getKey(),
                        e.getValue() ? "TRUE" : "FALSE"))
                .collect(Collectors.joining("\n"));

        return "BEGIN\n" + calls + "\nEND;";
    }

    private void applyTransformConfig() throws SQLException {
        LOGGER.info("Applying metadata transform parameters {}", transformConfig);

        try (CallableStatement statement = con.prepareCall(createTransformSql(transformConfig))) {
            statement.execute();
        }
    }

    @Override
    @NotNull
    public String getDdl(@NotNull ObjectType type, @NotNull String name, @NotNull String schema) throws MetadataUnavailableException {
        LOGGER.debug("Requesting DDL of {} {}.{}", type.getLabel(), schema, name);

        String ddl;
        try (PreparedStatement statement = DbUtils.createPrepareStatement(con, GET_DDL_SQL, List.of(type.getMetadataType(), name, schema));
             ResultSet rs = statement.executeQuery()) {
            ddl = rs.next() ? rs.getString(1) : null;
        } catch (SQLException ex) {
            throw new MetadataUnavailableException("Unable to get DDL of %s %s.%s: %s".formatted(type.getLabel(), schema, name, ex.getMessage()), ex);
        }

        if (StringUtils.isBlank(ddl)) {
            throw new MetadataUnavailableException("Empty DDL returned for %s %s.%s".formatted(type.getLabel(), schema, name));
        }

        return ddl;
    }

}
