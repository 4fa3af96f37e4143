package sh.nebula.registry.store.postgres;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlStatementSplitterTest {

    @Test
    void splitsOnTopLevelSemicolons() {
        assertThat(SqlStatementSplitter.split("CREATE TABLE a (id INT);\nCREATE INDEX b ON a (id);"))
                .containsExactly("CREATE TABLE a (id INT)", "CREATE INDEX b ON a (id)");
    }

    @Test
    void ignoresSemicolonsInsideLiterals() {
        assertThat(SqlStatementSplitter.split("INSERT INTO t VALUES ('a;b'); SELECT 1"))
                .containsExactly("INSERT INTO t VALUES ('a;b')", "SELECT 1");
    }

    @Test
    void dropsComments() {
        String script = """
                -- leading comment; with a semicolon
                CREATE TABLE a (id INT); /* block; comment */
                SELECT 1;
                """;

        assertThat(SqlStatementSplitter.split(script)).containsExactly("CREATE TABLE a (id INT)", "SELECT 1");
    }

    @Test
    void blankScriptHasNoStatements() {
        assertThat(SqlStatementSplitter.split("  \n ")).isEmpty();
        assertThat(SqlStatementSplitter.split(null)).isEmpty();
    }
}
