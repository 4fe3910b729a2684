package de.elomagic.ddlexport.metadata;

import de.elomagic.ddlexport.dto.ObjectType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OracleMetadataServiceTest {

    private Connection con;
    private CallableStatement transformStatement;
    private PreparedStatement statement;
    private ResultSet rs;

    @BeforeEach
    void setUp() throws SQLException {
        con = mock(Connection.class);
        transformStatement = mock(CallableStatement.class);
        statement = mock(PreparedStatement.class);
        rs = mock(ResultSet.class);

        when(con.prepareCall(anyString())).thenReturn(transformStatement);
        when(con.prepareStatement(anyString(), anyInt(), anyInt())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(rs);
    }

    @Test
    void createTransformSql_setsEverySessionParameter() {
        String sql = OracleMetadataService.createTransformSql(MetadataTransformConfig.defaults());

        assertThat(sql)
                .startsWith("BEGIN\n")
                .endsWith("\nEND;")
                .contains("DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, 'STORAGE', FALSE);")
                .contains("DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, 'SEGMENT_ATTRIBUTES', FALSE);")
                .contains("DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, 'SQLTERMINATOR', TRUE);")
                .contains("DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, 'PRETTY', TRUE);")
                .contains("DBMS_METADATA.SET_TRANSFORM_PARAM(DBMS_METADATA.SESSION_TRANSFORM, 'CONSTRAINTS_AS_ALTER', TRUE);");
    }

    @Test
    void create_appliesTransformConfigOnce() throws SQLException {
        OracleMetadataService service = OracleMetadataService.create(con, MetadataTransformConfig.defaults());

        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("CREATE TABLE A;");
        service.getDdl(ObjectType.TABLE, "A", "HR");
        service.getDdl(ObjectType.TABLE, "B", "HR");

        verify(con, times(1)).prepareCall(anyString());
        verify(transformStatement, times(1)).execute();
        verify(transformStatement).close();
    }

    @Test
    void getDdl_bindsMetadataTypeNameAndSchema() throws SQLException {
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("CREATE OR REPLACE PACKAGE \"HR\".\"PKG_UTIL\" AS END;");

        String ddl = OracleMetadataService.create(con, MetadataTransformConfig.defaults()).getDdl(ObjectType.PACKAGE, "PKG_UTIL", "HR");

        assertThat(ddl).contains("PKG_UTIL");
        verify(statement).setString(1, "PACKAGE_SPEC");
        verify(statement).setString(2, "PKG_UTIL");
        verify(statement).setString(3, "HR");
        verify(rs).close();
        verify(statement).close();
    }

    @Test
    void getDdl_sqlException_isMetadataUnavailable() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("ORA-31603: object \"GONE\" of type TABLE not found in schema \"HR\""));

        OracleMetadataService service = OracleMetadataService.create(con, MetadataTransformConfig.defaults());

        assertThatThrownBy(() -> service.getDdl(ObjectType.TABLE, "GONE", "HR"))
                .isInstanceOf(MetadataUnavailableException.class)
                .hasMessageContaining("ORA-31603")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void getDdl_emptyResult_isMetadataUnavailable() throws SQLException {
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn(null);

        OracleMetadataService service = OracleMetadataService.create(con, MetadataTransformConfig.defaults());

        assertThatThrownBy(() -> service.getDdl(ObjectType.VIEW, "V_EMP", "HR"))
                .isInstanceOf(MetadataUnavailableException.class)
                .hasMessageContaining("V_EMP");
    }

    @Test
    void create_failingTransformCall_isPropagated() throws SQLException {
        when(transformStatement.execute()).thenThrow(new SQLException("ORA-06550"));

        assertThatThrownBy(() -> OracleMetadataService.create(con, MetadataTransformConfig.defaults()))
                .isInstanceOf(SQLException.class);
    }

}
