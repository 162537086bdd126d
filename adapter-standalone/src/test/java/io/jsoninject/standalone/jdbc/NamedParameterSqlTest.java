package io.jsoninject.standalone.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NamedParameterSql")
class NamedParameterSqlTest {

    @Test
    @DisplayName("bind references become positional parameters in order")
    void replacesReferences() {
        NamedParameterSql parsed = NamedParameterSql.parse("select * from emp where deptno = :P1_DEPTNO and job = :job");

        assertThat(parsed.sql()).isEqualTo("select * from emp where deptno = ? and job = ?");
        assertThat(parsed.names()).containsExactly("P1_DEPTNO", "JOB");
    }

    @Test
    @DisplayName("a repeated name is bound once per occurrence")
    void repeatedName() {
        NamedParameterSql parsed = NamedParameterSql.parse("select :ID, :id from dual");

        assertThat(parsed.names()).containsExactly("ID", "ID");
    }

    @Test
    @DisplayName("string literals and quoted identifiers are left alone")
    void quotedTextUntouched() {
        NamedParameterSql parsed =
                NamedParameterSql.parse("select ':NOT_A_BIND', 'it''s :X', \"col:Y\" from t where a = :A");

        assertThat(parsed.sql()).isEqualTo("select ':NOT_A_BIND', 'it''s :X', \"col:Y\" from t where a = ?");
        assertThat(parsed.names()).containsExactly("A");
    }

    @Test
    @DisplayName("comments are left alone")
    void commentsUntouched() {
        NamedParameterSql parsed = NamedParameterSql.parse("select 1 -- :LINE\nfrom t /* :BLOCK */ where b = :B");

        assertThat(parsed.sql()).isEqualTo("select 1 -- :LINE\nfrom t /* :BLOCK */ where b = ?");
        assertThat(parsed.names()).containsExactly("B");
    }

    @Test
    @DisplayName("casts and lone colons are not binds")
    void castsUntouched() {
        NamedParameterSql parsed = NamedParameterSql.parse("select x::text, ': ' , :1 from t");

        assertThat(parsed.sql()).isEqualTo("select x::text, ': ' , :1 from t");
        assertThat(parsed.names()).isEmpty();
    }

    @Test
    @DisplayName("unterminated literal runs to the end of the statement")
    void unterminatedLiteral() {
        NamedParameterSql parsed = NamedParameterSql.parse("select 'open :X");

        assertThat(parsed.sql()).isEqualTo("select 'open :X");
        assertThat(parsed.names()).isEmpty();
    }
}
