package de.elomagic.ddlexport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DbUtilsTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(Configuration.DATABASE_URL.getKey());
        System.clearProperty(Configuration.DATABASE_HOST.getKey());
        System.clearProperty(Configuration.DATABASE_PORT.getKey());
        System.clearProperty(Configuration.DATABASE_SERVICE.getKey());
    }

    @Test
    void createUrl_buildsThinUrlFromHostPortAndService() {
        System.setProperty(Configuration.DATABASE_HOST.getKey(), "db.example.org");
        System.setProperty(Configuration.DATABASE_PORT.getKey(), "1522");
        System.setProperty(Configuration.DATABASE_SERVICE.getKey(), "HRPROD");

        assertThat(DbUtils.createUrl()).isEqualTo("jdbc:oracle:thin:@//db.example.org:1522/HRPROD");
    }

    @Test
    void createUrl_explicitUrlWins() {
        System.setProperty(Configuration.DATABASE_URL.getKey(), " jdbc:oracle:thin:@tns_alias ");
        System.setProperty(Configuration.DATABASE_HOST.getKey(), "ignored");

        assertThat(DbUtils.createUrl()).isEqualTo("jdbc:oracle:thin:@tns_alias");
    }

    @Test
    void placeholders_joinsQuestionMarks() {
        assertThat(DbUtils.placeholders(3)).isEqualTo("?, ?, ?");
        assertThat(DbUtils.placeholders(1)).isEqualTo("?");
    }

}
