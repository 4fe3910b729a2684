package de.elomagic.ddlexport.writer;

import de.elomagic.ddlexport.dto.ArtifactEntry;
import de.elomagic.ddlexport.dto.ExportResult;
import de.elomagic.ddlexport.dto.ObjectDescriptor;
import de.elomagic.ddlexport.dto.ObjectType;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactFormatterTest {

    private static final ObjectDescriptor EMPLOYEES = new ObjectDescriptor(ObjectType.TABLE, "EMPLOYEES", "HR");
    private static final ObjectDescriptor PKG_UTIL = new ObjectDescriptor(ObjectType.PACKAGE, "PKG_UTIL", "HR");

    @Test
    void formatHeader_containsTypeSchemaAndTimestamp() {
        assertThat(ArtifactFormatter.formatHeader("HR", ObjectType.MATERIALIZED_VIEW, "2024-05-01 10:15:30"))
                .isEqualTo("-- MATERIALIZED VIEW DDL for schema HR\n-- Generated: 2024-05-01 10:15:30\n\n");
    }

    @Test
    void formatEntry_success_stripsDdlAndAppendsSeparator() {
        String ddl = "\n  CREATE TABLE \"HR\".\"EMPLOYEES\"\n   (\t\"ID\" NUMBER\n   ) ;\n  ";

        assertThat(ArtifactFormatter.formatEntry(new ArtifactEntry(EMPLOYEES, ExportResult.success(ddl))))
                .isEqualTo("-- TABLE: EMPLOYEES\nCREATE TABLE \"HR\".\"EMPLOYEES\"\n   (\t\"ID\" NUMBER\n   ) ;\n/\n\n");
    }

    @Test
    void formatEntry_ddlWithOwnTerminator_hasSingleSeparator() {
        String ddl = "CREATE OR REPLACE PROCEDURE \"HR\".\"P\" IS\nBEGIN\n  NULL;\nEND;\r\n/\r\n";
        ObjectDescriptor procedure = new ObjectDescriptor(ObjectType.PROCEDURE, "P", "HR");

        assertThat(ArtifactFormatter.formatEntry(new ArtifactEntry(procedure, ExportResult.success(ddl))))
                .isEqualTo("-- PROCEDURE: P\nCREATE OR REPLACE PROCEDURE \"HR\".\"P\" IS\nBEGIN\n  NULL;\nEND;\n/\n\n");
    }

    @Test
    void formatEntry_failure_writesErrorMarkerOnly() {
        assertThat(ArtifactFormatter.formatEntry(new ArtifactEntry(EMPLOYEES, ExportResult.failure("ORA-31603"))))
                .isEqualTo("-- Error getting DDL for TABLE EMPLOYEES\n\n");
    }

    @Test
    void formatEntry_blankDdl_degradesToErrorMarker() {
        assertThat(ArtifactFormatter.formatEntry(new ArtifactEntry(EMPLOYEES, ExportResult.success("  \n"))))
                .isEqualTo("-- Error getting DDL for TABLE EMPLOYEES\n\n");
    }

    @Test
    void formatEntry_index_isAnnotatedWithTable() {
        ObjectDescriptor index = new ObjectDescriptor(ObjectType.INDEX, "EMP_NAME_IX", "HR", "EMPLOYEES");

        assertThat(ArtifactFormatter.formatEntry(new ArtifactEntry(index, ExportResult.success("CREATE INDEX X;"))))
                .startsWith("-- INDEX: EMP_NAME_IX ON EMPLOYEES\n");
    }

    @Test
    void formatEntry_packageWithBody() {
        ArtifactEntry entry = new ArtifactEntry(PKG_UTIL, ExportResult.success("CREATE PACKAGE A;"), ExportResult.success("CREATE PACKAGE BODY A;"));

        assertThat(ArtifactFormatter.formatEntry(entry))
                .isEqualTo("-- PACKAGE: PKG_UTIL\nCREATE PACKAGE A;\n/\n\n-- PACKAGE BODY: PKG_UTIL\nCREATE PACKAGE BODY A;\n/\n\n");
    }

    @Test
    void formatEntry_packageWithoutBody_writesNoBodyMarker() {
        ArtifactEntry entry = new ArtifactEntry(PKG_UTIL, ExportResult.success("CREATE PACKAGE A;"), ExportResult.absent());

        assertThat(ArtifactFormatter.formatEntry(entry))
                .isEqualTo("-- PACKAGE: PKG_UTIL\nCREATE PACKAGE A;\n/\n\n-- No package body found for PKG_UTIL\n\n");
    }

    @Test
    void formatEntry_packageBodyFailed_writesErrorMarker() {
        ArtifactEntry entry = new ArtifactEntry(PKG_UTIL, ExportResult.success("CREATE PACKAGE A;"), ExportResult.failure("ORA-01031"));

        assertThat(ArtifactFormatter.formatEntry(entry))
                .endsWith("/\n\n-- Error getting DDL for PACKAGE BODY PKG_UTIL\n\n")
                .doesNotContain("No package body");
    }

    @Test
    void formatEntry_packageSpecFailed_stillWritesBodyOutcome() {
        ArtifactEntry entry = new ArtifactEntry(PKG_UTIL, ExportResult.failure("ORA-31603"), ExportResult.absent());

        assertThat(ArtifactFormatter.formatEntry(entry))
                .isEqualTo("-- Error getting DDL for PACKAGE PKG_UTIL\n\n-- No package body found for PKG_UTIL\n\n");
    }

}
