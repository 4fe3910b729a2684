package de.elomagic.ddlexport.exporter;

import de.elomagic.ddlexport.DbUtils;
import de.elomagic.ddlexport.catalog.ObjectEnumerator;
import de.elomagic.ddlexport.catalog.OracleObjectEnumerator;
import de.elomagic.ddlexport.metadata.MetadataService;
import de.elomagic.ddlexport.metadata.MetadataTransformConfig;
import de.elomagic.ddlexport.metadata.OracleMetadataService;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

public class OracleSessionFactory implements SessionFactory {

    private static final Logger LOGGER = LogManager.getLogger(OracleSessionFactory.class);

    private final List<String> schemaAllowList;

    public OracleSessionFactory(@NotNull List<String> schemaAllowList) {
        this.schemaAllowList = List.copyOf(schemaAllowList);
    }

    @Override
    @NotNull
    public DatabaseSession open(@NotNull MetadataTransformConfig transformConfig) throws ExportConnectionException {
        Connection con;
        try {
            con = DbUtils.createConnection();
        } catch (SQLException ex) {
            throw new ExportConnectionException("Unable to connect to database: " + ex.getMessage(), ex);
        }

        try {
            return new OracleDatabaseSession(
                    con,
                    new OracleObjectEnumerator(con, schemaAllowList),
                    OracleMetadataService.create(con, transformConfig));
        } catch (SQLException ex) {
            closeConnection(con);
            throw new ExportConnectionException("Unable to initialize database session: " + ex.getMessage(), ex);
        }
    }

    private static void closeConnection(@NotNull Connection con) {
        try {
            con.close();
            LOGGER.info("Database connection closed");
        } catch (SQLException ex) {
            LOGGER.warn("Unable to close database connection: {}", ex.getMessage(), ex);
        }
    }

    private static class OracleDatabaseSession implements DatabaseSession {

        private final Connection con;
        private final ObjectEnumerator enumerator;
        private final MetadataService metadataService;

        OracleDatabaseSession(@NotNull Connection con, @NotNull ObjectEnumerator enumerator, @NotNull MetadataService metadataService) {
            this.con = con;
            this.enumerator = enumerator;
            this.metadataService = metadataService;
        }

        @Override
        @NotNull
        public ObjectEnumerator getEnumerator() {
            return enumerator;
        }

        @Override
        @NotNull
        public MetadataService getMetadataService() {
            return metadataService;
        }

        @Override
        public void close() {
            closeConnection(con);
        }

    }

}
