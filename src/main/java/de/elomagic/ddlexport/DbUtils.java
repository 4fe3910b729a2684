package de.elomagic.ddlexport;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

public final class DbUtils {

    private static final Logger LOGGER = LogManager.getLogger(DbUtils.class);

    private DbUtils() {
    }

    /**
     * Returns the configured JDBC URL or, when not set, a thin driver URL built from host, port and service name.
     */
    @NotNull
    public static String createUrl() {
        String url = Configuration.getString(Configuration.DATABASE_URL);
        if (StringUtils.isNotBlank(url)) {
            return url.trim();
        }

        return "jdbc:oracle:thin:@//%s:%d/%s".formatted(
                Configuration.getString(Configuration.DATABASE_HOST),
                Configuration.getInt(Configuration.DATABASE_PORT),
                Configuration.getString(Configuration.DATABASE_SERVICE));
    }

    @NotNull
    public static Connection createConnection() throws SQLException {
        String url = createUrl();

        LOGGER.info("Connecting to database '{}' as '{}'", url, Configuration.getString(Configuration.DATABASE_USERNAME));

        return DriverManager.getConnection(
                url,
                Configuration.getString(Configuration.DATABASE_USERNAME),
                Configuration.getString(Configuration.DATABASE_PASSWORD));
    }

    @NotNull
    public static PreparedStatement createPrepareStatement(@NotNull Connection con, @NotNull String sql, @NotNull List<?> values) throws SQLException {
        PreparedStatement statement = con.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);

        for (int i = 0; i < values.size(); i++) {
            statement.setString(i+1, String.valueOf(values.get(i)));
        }

        return statement;
    }

    /**
     * Creates a list of JDBC parameter placeholders like <code>?, ?, ?</code>.
     */
    @NotNull
    public static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

}
