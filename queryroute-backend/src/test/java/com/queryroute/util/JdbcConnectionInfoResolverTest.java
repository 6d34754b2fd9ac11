package com.queryroute.util;

import com.queryroute.model.SourceDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JdbcConnectionInfoResolver")
class JdbcConnectionInfoResolverTest {

    private final JdbcConnectionInfoResolver resolver = new JdbcConnectionInfoResolver();

    private static SourceDefinition source(String type, String dsn) {
        SourceDefinition source = new SourceDefinition();
        source.setId("src");
        source.setType(type);
        source.setDsn(dsn);
        return source;
    }

    @Test
    @DisplayName("builds a postgres url with the default port")
    void postgres() {
        JdbcConnectionInfo info = resolver.resolve(source("postgresql", "postgres://app:pw@db/shop"));

        assertThat(info.getUrl()).isEqualTo("jdbc:postgresql://db:5432/shop");
        assertThat(info.getUsername()).isEqualTo("app");
        assertThat(info.getPassword()).isEqualTo("pw");
        assertThat(info.driverClassName()).contains("org.postgresql.Driver");
        assertThat(info.getSourceId()).isEqualTo("src");
    }

    @Test
    @DisplayName("registry credentials override the DSN's")
    void registryCredentials() {
        SourceDefinition source = source("mysql", "mysql://app:pw@db:3307/crm");
        source.setUsername("reader");

        JdbcConnectionInfo info = resolver.resolve(source);

        assertThat(info.getUrl()).isEqualTo("jdbc:mysql://db:3307/crm");
        assertThat(info.getUsername()).isEqualTo("reader");
        assertThat(info.getPassword()).isEqualTo("pw");
    }

    @Test
    @DisplayName("doris goes through the mysql driver on its query port")
    void doris() {
        JdbcConnectionInfo info = resolver.resolve(source("doris", "doris://fe/ods"));

        assertThat(info.getUrl()).isEqualTo("jdbc:mysql://fe:9030/ods");
        assertThat(info.driverClassName()).contains("com.mysql.cj.jdbc.Driver");
    }

    @Test
    @DisplayName("oracle urls follow sid, service and TNS forms")
    void oracle() {
        assertThat(resolver.resolve(source("oracle", "oracle://u:p@ora:1521/ORCLPDB")).getUrl())
                .isEqualTo("jdbc:oracle:thin:@//ora:1521/ORCLPDB");
        assertThat(resolver.resolve(source("oracle", "oracle://u:p@ora?sid=XE")).getUrl())
                .isEqualTo("jdbc:oracle:thin:@ora:1521:XE");
        assertThat(resolver.resolve(source("oracle", "oracle://u:p@PRODTNS")).getUrl())
                .isEqualTo("jdbc:oracle:thin:@PRODTNS");
    }

    @Test
    @DisplayName("an explicit jdbc url is used as-is and typed from its prefix")
    void explicitUrl() {
        SourceDefinition source = new SourceDefinition();
        source.setId("mem");
        source.setJdbcUrl("jdbc:h2:mem:x");
        source.setUsername("sa");

        JdbcConnectionInfo info = resolver.resolve(source);

        assertThat(info.getUrl()).isEqualTo("jdbc:h2:mem:x");
        assertThat(info.getDbType()).isEqualTo("h2");
        assertThat(info.driverClassName()).isEmpty();
    }

    @Test
    @DisplayName("the printed form masks the password")
    void printedForm() {
        JdbcConnectionInfo info = resolver.resolve(source("postgres", "postgres://app:secret@db:5433/shop"));

        assertThat(info.maskedUrl()).isEqualTo("jdbc:postgresql://db:5433/shop");
        assertThat(info.toString()).isEqualTo("src [postgres] jdbc:postgresql://db:5433/shop").doesNotContain("secret");
    }

    @Test
    @DisplayName("unknown types are rejected")
    void unsupported() {
        assertThatThrownBy(() -> resolver.resolve(source("sqlite", "sqlite://local/db")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported database type: sqlite");
    }
}
