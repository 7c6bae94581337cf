package com.schemareverse.core.engine;

import com.schemareverse.core.config.ReverseConfig;
import com.schemareverse.core.model.ActionCandidate;
import com.schemareverse.core.model.EntityCandidate;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ParserMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Functional tests for {@link ReverseEngineeringEngine}.
 */
class ReverseEngineeringEngineTest {

    private static final String SCHEMA = """
        CREATE TABLE tb_contact_info (
            pk_contact_info BIGINT PRIMARY KEY,
            id UUID NOT NULL,
            identifier TEXT NOT NULL,
            name TEXT
        );

        CREATE TABLE tb_contact (
            pk_contact BIGINT PRIMARY KEY,
            id UUID NOT NULL,
            identifier TEXT NOT NULL,
            fk_contact_info BIGINT REFERENCES tb_contact_info (pk_contact_info),
            fk_parent_contact BIGINT
        );

        CREATE TABLE tl_contact_info (
            fk_contact_info BIGINT NOT NULL,
            locale TEXT NOT NULL,
            label TEXT,
            PRIMARY KEY (fk_contact_info, locale)
        );

        CREATE TABLE audit_log (
            message TEXT
        );

        COMMENT ON TABLE tb_contact IS 'A contact''s record';

        CREATE FUNCTION refresh_contacts() RETURNS void AS $$
        BEGIN
            FOR r IN SELECT * FROM tb_contact LOOP
                PERFORM 1;
            END LOOP;
        END;
        $$ LANGUAGE plpgsql;
        """;

    @Test
    void analyze_withSchema_scoresClassifiesAndPairs() {
        // Given
        ReverseEngineeringEngine engine = new ReverseEngineeringEngine();

        // When
        ReverseResult result = engine.analyze(SCHEMA);

        // Then: trinity tables are accepted, the bare log table is rejected
        assertThat(result.entities()).extracting(EntityCandidate::name)
            .containsExactly("tb_contact_info", "tb_contact");
        assertThat(result.rejected()).extracting(EntityCandidate::name).containsExactly("audit_log");

        EntityCandidate info = result.entities().get(0);
        assertThat(info.confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(info.classification().vocabularyTable()).isTrue();
        assertThat(info.translationTable()).isEqualTo("tl_contact_info");

        EntityCandidate contact = result.entities().get(1);
        assertThat(contact.baseline()).isCloseTo(0.85, within(1e-9));
        assertThat(contact.constructDelta()).isCloseTo(0.08, within(1e-9));
        assertThat(contact.confidence()).isCloseTo(0.93, within(1e-9));
        assertThat(contact.referencedBy()).containsExactly("public.refresh_contacts");
        assertThat(contact.classification().instanceTable()).isTrue();
        assertThat(contact.table().tableComment()).isEqualTo("A contact's record");

        // And: the routine is an action with a control-flow construct
        assertThat(result.actions()).hasSize(1);
        ActionCandidate action = result.actions().get(0);
        assertThat(action.results()).extracting(r -> r.parserId()).containsExactly(ConstructKind.CONTROL_FLOW);
        assertThat(action.confidence()).isCloseTo(0.78, within(1e-9));

        // And: translation and pairing
        assertThat(result.translationTables()).extracting(t -> t.tableName()).containsExactly("tl_contact_info");
        assertThat(result.pairs()).containsExactly(
            new InfoInstancePair("tb_contact_info", "tb_contact", "contact", "tl_contact_info"));
        assertThat(result.warnings()).isEmpty();
        assertThat(result.parserMetrics().get(ConstructKind.CONTROL_FLOW)).isEqualTo(new ParserMetrics(1, 1, 0));
    }

    @Test
    void analyze_withMalformedStatements_excludesThemWithWarnings() {
        String script = """
            CREATE TABLE good (id BIGINT PRIMARY KEY);
            CREATE TABLE no_columns (PRIMARY KEY (id));
            CREATE FUNCTION no_body() RETURNS int;
            """;

        ReverseResult result = new ReverseEngineeringEngine(ReverseConfig.defaults().withMinimumConfidence(0.0))
            .analyze(script);

        assertThat(result.entities()).extracting(EntityCandidate::name).containsExactly("good");
        assertThat(result.actions()).isEmpty();
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.warnings().get(0)).startsWith("Malformed table:");
        assertThat(result.warnings().get(1)).startsWith("Malformed routine:");
        assertThat(result.hasWarnings()).isTrue();
    }

    @Test
    void analyze_withDisabledParser_ignoresItsConstruct() {
        ReverseConfig config = new ReverseConfig(null, new ReverseConfig.ParserConfig(List.of("control_flow")), null);

        ReverseResult result = new ReverseEngineeringEngine(config).analyze(SCHEMA);

        assertThat(result.actions().get(0).results()).isEmpty();
        assertThat(result.actions().get(0).confidence()).isCloseTo(0.70, within(1e-9));
        assertThat(result.entities()).extracting(EntityCandidate::name).contains("tb_contact");
        assertThat(result.parserMetrics().get(ConstructKind.CONTROL_FLOW).attempts()).isZero();
    }

    @Test
    void analyze_withDynamicSql_lowersReferencedEntity() {
        String script = """
            CREATE TABLE tb_report (pk_report BIGINT PRIMARY KEY, id UUID, identifier TEXT);
            CREATE FUNCTION purge_reports(p_table TEXT) RETURNS void AS $$
            BEGIN
                EXECUTE format('DELETE FROM %I', p_table);
                DELETE FROM tb_report;
            END;
            $$ LANGUAGE plpgsql;
            """;

        ReverseResult result = new ReverseEngineeringEngine().analyze(script);

        assertThat(result.entities()).isEmpty();
        assertThat(result.rejected()).singleElement()
            .satisfies(entity -> assertThat(entity.confidence()).isCloseTo(0.75, within(1e-9)));
    }

    @Test
    void analyze_withDollarQuotedLiteralInBody_recognizesConstructs() {
        String script = """
            CREATE FUNCTION purge_x() RETURNS void AS $fn$
            BEGIN
                EXECUTE $$DELETE FROM tb_x$$;
            EXCEPTION
                WHEN others THEN NULL;
            END;
            $fn$ LANGUAGE plpgsql;
            """;

        ReverseResult result = new ReverseEngineeringEngine().analyze(script);

        assertThat(result.actions()).singleElement().satisfies(action -> {
            assertThat(action.results()).extracting(r -> r.parserId())
                .containsExactly(ConstructKind.EXCEPTION_HANDLER, ConstructKind.DYNAMIC_SQL);
            assertThat(action.confidence()).isCloseTo(0.65, within(1e-9));
        });
    }

    @Test
    void analyze_withSeveralScripts_treatsThemAsOneSchema() {
        ReverseEngineeringEngine engine = new ReverseEngineeringEngine();

        ReverseResult result = engine.analyze(List.of(
            "CREATE TABLE tb_unit_info (pk_unit_info BIGINT PRIMARY KEY, id UUID, identifier TEXT);",
            "CREATE TABLE tb_unit (pk_unit BIGINT PRIMARY KEY, id UUID, identifier TEXT, fk_unit_info BIGINT);"));

        assertThat(result.pairs()).extracting(InfoInstancePair::baseEntityName).containsExactly("unit");
        assertThat(result.getSummary())
            .isEqualTo("Entities: 2 accepted, 0 rejected | Actions: 0 | Pairs: 1 | Translation tables: 0 | Warnings: 0");
    }

    @Test
    void analyze_resetsMetricsBetweenRuns() {
        ReverseEngineeringEngine engine = new ReverseEngineeringEngine();

        engine.analyze(SCHEMA);
        ReverseResult second = engine.analyze("SELECT 1;");

        assertThat(second.parserMetrics().values()).allMatch(metrics -> metrics.attempts() == 0);
        assertThat(second.entities()).isEmpty();
    }

    @Test
    void clamp_keepsValuesInUnitInterval() {
        assertThat(ReverseEngineeringEngine.clamp(1.3)).isEqualTo(1.0);
        assertThat(ReverseEngineeringEngine.clamp(-0.2)).isEqualTo(0.0);
        assertThat(ReverseEngineeringEngine.clamp(0.42)).isEqualTo(0.42);
    }
}
