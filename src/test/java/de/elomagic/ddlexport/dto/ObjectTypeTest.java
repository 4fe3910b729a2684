package de.elomagic.ddlexport.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectTypeTest {

    @Test
    void values_areInCanonicalOrder() {
        assertThat(ObjectType.values()).containsExactly(
                ObjectType.TABLE,
                ObjectType.INDEX,
                ObjectType.VIEW,
                ObjectType.PROCEDURE,
                ObjectType.FUNCTION,
                ObjectType.PACKAGE,
                ObjectType.PACKAGE_BODY,
                ObjectType.TRIGGER,
                ObjectType.SEQUENCE,
                ObjectType.SYNONYM,
                ObjectType.TYPE,
                ObjectType.MATERIALIZED_VIEW,
                ObjectType.DATABASE_LINK);
    }

    @Test
    void getFileName_lowerCasesLabelAndPluralizes() {
        assertThat(ObjectType.TABLE.getFileName()).isEqualTo("tables.sql");
        assertThat(ObjectType.INDEX.getFileName()).isEqualTo("indexes.sql");
        assertThat(ObjectType.SYNONYM.getFileName()).isEqualTo("synonyms.sql");
        assertThat(ObjectType.MATERIALIZED_VIEW.getFileName()).isEqualTo("materialized_views.sql");
        assertThat(ObjectType.DATABASE_LINK.getFileName()).isEqualTo("database_links.sql");
        assertThat(ObjectType.PACKAGE_BODY.getFileName()).isEqualTo("package_bodies.sql");
    }

    @Test
    void getMetadataType_usesSpecificationTypesForPackagesAndTypes() {
        assertThat(ObjectType.PACKAGE.getMetadataType()).isEqualTo("PACKAGE_SPEC");
        assertThat(ObjectType.PACKAGE_BODY.getMetadataType()).isEqualTo("PACKAGE_BODY");
        assertThat(ObjectType.TYPE.getMetadataType()).isEqualTo("TYPE_SPEC");
        assertThat(ObjectType.DATABASE_LINK.getMetadataType()).isEqualTo("DB_LINK");
    }

    @Test
    void parse_acceptsNameAndLabel() {
        assertThat(ObjectType.parse("materialized_view")).isEqualTo(ObjectType.MATERIALIZED_VIEW);
        assertThat(ObjectType.parse(" package body ")).isEqualTo(ObjectType.PACKAGE_BODY);
        assertThat(ObjectType.parse("Table")).isEqualTo(ObjectType.TABLE);
    }

    @Test
    void parse_rejectsUnknownType() {
        assertThatThrownBy(() -> ObjectType.parse("JOB"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOB");
    }

}
