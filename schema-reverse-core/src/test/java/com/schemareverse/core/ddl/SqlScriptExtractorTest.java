package com.schemareverse.core.ddl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link SqlScriptExtractor}.
 */
class SqlScriptExtractorTest {

    private SqlScriptExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SqlScriptExtractor();
    }

    @Test
    void extract_withMixedScript_separatesStatementKinds() {
        // Given: tables, a routine with a dollar-quoted body, comments and an FK alteration
        String script = """
            CREATE TABLE users (
                id BIGINT PRIMARY KEY,
                name VARCHAR(100) CHECK (length(name) > 0)
            );

            CREATE OR REPLACE FUNCTION touch_user(p_id BIGINT) RETURNS void AS $body$
            BEGIN
                CREATE TABLE IF NOT EXISTS scratch (x INT);
                UPDATE users SET name = name WHERE id = p_id;
            END;
            $body$ LANGUAGE plpgsql;

            CREATE TABLE orders (
                id BIGINT PRIMARY KEY,
                user_id BIGINT
            );

            COMMENT ON TABLE users IS 'People who can log in';
            COMMENT ON COLUMN public.users.name IS 'Display name';
            ALTER TABLE orders ADD CONSTRAINT fk_user FOREIGN KEY (user_id) REFERENCES users (id);
            ALTER TABLE orders OWNER TO app;
            """;

        // When
        SqlScript result = extractor.extract(script);

        // Then
        assertThat(result.createTables()).hasSize(2);
        assertThat(result.createTables().get(0)).startsWith("CREATE TABLE users").endsWith(");");
        assertThat(result.createTables().get(1)).startsWith("CREATE TABLE orders");
        assertThat(result.createFunctions()).hasSize(1);
        assertThat(result.createFunctions().get(0))
            .startsWith("CREATE OR REPLACE FUNCTION touch_user")
            .endsWith("LANGUAGE plpgsql;");
        assertThat(result.tableComment("users")).isEqualTo("People who can log in");
        assertThat(result.columnComments("users")).containsEntry("name", "Display name");
        assertThat(result.alterTables()).hasSize(1);
        assertThat(result.alterTables().get(0)).contains("FOREIGN KEY");
    }

    @Test
    void extract_withEscapedCommentText_unescapesQuotes() {
        String script = "COMMENT ON TABLE app.accounts IS 'The customer''s accounts';";

        SqlScript result = extractor.extract(script);

        assertThat(result.tableComment("accounts")).isEqualTo("The customer's accounts");
        assertThat(result.tableComment("app.accounts")).isEqualTo("The customer's accounts");
    }

    @Test
    void extract_withCreateTableInsideLiteral_ignoresIt() {
        String script = "INSERT INTO notes VALUES ('CREATE TABLE fake (x INT);');";

        assertThat(extractor.extract(script).createTables()).isEmpty();
    }

    @Test
    void extract_withBlankScript_returnsEmpty() {
        assertThat(extractor.extract("  ").isEmpty()).isTrue();
        assertThat(extractor.extract(null).isEmpty()).isTrue();
    }
}
