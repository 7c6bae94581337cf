package com.schemareverse.core.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ParserCoordinator}.
 */
class ParserCoordinatorTest {

    private static final String RECURSIVE_CTE = """
        WITH RECURSIVE tree AS (
            SELECT id FROM nodes WHERE parent_id IS NULL
            UNION ALL
            SELECT n.id FROM nodes n JOIN tree t ON n.parent_id = t.id
        ), leaves AS (
            SELECT id FROM tree
        )
        SELECT * FROM leaves;
        """;

    private ParserCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ParserCoordinator();
    }

    // ==================== Dispatch ====================

    @Test
    void parseWithBestParsers_withRecursiveCte_returnsBoostedDelta() {
        // When
        List<ParserResult> results = coordinator.parseWithBestParsers(RECURSIVE_CTE);

        // Then
        assertThat(results).hasSize(1);
        ParserResult cte = results.get(0);
        assertThat(cte.parserId()).isEqualTo(ConstructKind.CTE);
        assertThat(cte.confidenceDelta()).isCloseTo(0.15, within(1e-9));
        assertThat(cte.metadata()).containsEntry(ConfidencePolicy.CTE_COUNT, 2);
    }

    @Test
    void parseWithBestParsers_withFourPlainCtes_addsMultiCteBonus() {
        String sql = "WITH a AS (SELECT 1), b AS (SELECT 2), c AS (SELECT 3), d AS (SELECT 4) SELECT * FROM a, b, c, d;";

        List<ParserResult> results = coordinator.parseWithBestParsers(sql);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).confidenceDelta()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void parseWithBestParsers_withDynamicFormat_returnsNegativeDelta() {
        String body = "BEGIN EXECUTE format('DELETE FROM %I', tbl); END;";

        List<ParserResult> results = coordinator.parseWithBestParsers(body);

        assertThat(results).extracting(ParserResult::parserId).containsExactly(ConstructKind.DYNAMIC_SQL);
        assertThat(results.get(0).confidenceDelta()).isCloseTo(-0.10, within(1e-9));
        assertThat(results.get(0).metadata()).containsEntry("has_format", true);
    }

    @Test
    void parseWithBestParsers_withSeveralConstructs_keepsDispatchOrder() {
        String body = """
            DECLARE
              c CURSOR FOR SELECT id FROM t;
            BEGIN
              FOR r IN SELECT id FROM t LOOP
                PERFORM process(r.id);
              END LOOP;
            EXCEPTION WHEN OTHERS THEN
              RAISE;
            END;
            """;

        List<ParserResult> results = coordinator.parseWithBestParsers(body);

        assertThat(results).extracting(ParserResult::parserId).containsExactly(
            ConstructKind.EXCEPTION_HANDLER, ConstructKind.CONTROL_FLOW, ConstructKind.CURSOR_OPERATIONS);
        assertThat(ParserResult.totalDelta(results)).isCloseTo(0.05 + 0.08 + 0.08, within(1e-9));
    }

    @Test
    void parseWithBestParsers_withNestedDollarLiteral_parsesWholeBody() {
        String body = "BEGIN EXECUTE format($q$UPDATE %I SET x = 1$q$, tbl); EXCEPTION WHEN others THEN NULL; END;";

        List<ParserResult> results = coordinator.parseWithBestParsers(body);

        assertThat(results).extracting(ParserResult::parserId)
            .containsExactly(ConstructKind.EXCEPTION_HANDLER, ConstructKind.DYNAMIC_SQL);
        assertThat(ParserResult.totalDelta(results)).isCloseTo(-0.05, within(1e-9));
        assertThat(coordinator.getMetrics().get(ConstructKind.DYNAMIC_SQL)).isEqualTo(new ParserMetrics(1, 1, 0));
    }

    @Test
    void parseWithBestParsers_withoutCues_attemptsNothing() {
        List<ParserResult> results = coordinator.parseWithBestParsers("SELECT 1;");

        assertThat(results).isEmpty();
        assertThat(coordinator.getMetrics().values()).allMatch(metrics -> metrics.attempts() == 0);
        assertThat(coordinator.getMetricsSummary()).isEqualTo("Parser Success Rates:");
    }

    @Test
    void parseWithBestParsers_withDisabledKind_skipsIt() {
        ParserCoordinator restricted = new ParserCoordinator(
            ConstructParsers.defaults(), EnumSet.complementOf(EnumSet.of(ConstructKind.CTE)));

        assertThat(restricted.parseWithBestParsers(RECURSIVE_CTE)).isEmpty();
        assertThat(restricted.getMetrics().get(ConstructKind.CTE).attempts()).isZero();
    }

    @Test
    void parse_withMalformedConstruct_returnsFailedResultAndTallies() {
        // When: a handler without THEN reaches the exception parser
        ParserResult result = coordinator.parse(ConstructKind.EXCEPTION_HANDLER,
            "BEGIN x := 1; EXCEPTION WHEN foo bar; END;");

        // Then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.steps()).isEmpty();
        assertThat(result.confidenceDelta()).isZero();
        assertThat(coordinator.getErrorCounts()).containsEntry(ParseErrorKind.MALFORMED_CONSTRUCT, 1);
        assertThat(coordinator.getMetrics().get(ConstructKind.EXCEPTION_HANDLER))
            .isEqualTo(new ParserMetrics(1, 0, 1));
    }

    @Test
    void parse_withAbsentConstruct_countsFailureWithoutError() {
        ParserResult result = coordinator.parse(ConstructKind.WINDOW_FUNCTION, "SELECT 1;");

        assertThat(result.succeeded()).isFalse();
        assertThat(coordinator.getErrorCounts()).isEmpty();
        assertThat(coordinator.getSuccessRates().get(ConstructKind.WINDOW_FUNCTION)).isEqualTo(0.0);
    }

    // ==================== Isolation ====================

    @Test
    void parseWithBestParsers_withThrowingParser_isolatesFailure() {
        // Given: a CTE parser that blows up, next to the real exception parser
        Map<ConstructKind, ConstructParser> parsers = new EnumMap<>(ConstructParsers.defaults());
        parsers.put(ConstructKind.CTE, new ThrowingParser());
        ParserCoordinator isolated = new ParserCoordinator(parsers, EnumSet.allOf(ConstructKind.class));

        // When
        List<ParserResult> results = isolated.parseWithBestParsers(
            "WITH x AS (SELECT 1) SELECT 1; EXCEPTION WHEN OTHERS THEN NULL;");

        // Then
        assertThat(results).extracting(ParserResult::parserId).containsExactly(ConstructKind.EXCEPTION_HANDLER);
        assertThat(isolated.getErrorCounts()).containsEntry(ParseErrorKind.INTERNAL_ERROR, 1);
        assertThat(isolated.getMetrics().get(ConstructKind.CTE)).isEqualTo(new ParserMetrics(1, 0, 1));
    }

    // ==================== Metrics ====================

    @Test
    void getMetricsSummary_listsAttemptedParsersSortedById() {
        coordinator.parse(ConstructKind.CTE, RECURSIVE_CTE);
        coordinator.parse(ConstructKind.CTE, "SELECT 1;");
        coordinator.parse(ConstructKind.AGGREGATE_FILTER, "SELECT count(*) FILTER (WHERE ok) FROM t;");

        assertThat(coordinator.getMetricsSummary()).isEqualTo(
            "Parser Success Rates:\n"
                + "  aggregate      : 100.0% (1 attempts)\n"
                + "  cte            :  50.0% (2 attempts)");
        assertThat(coordinator.getSuccessRates().get(ConstructKind.CTE)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void resetMetrics_zeroesCountersAndIsIdempotent() {
        coordinator.parse(ConstructKind.EXCEPTION_HANDLER, "EXCEPTION WHEN foo bar;");

        coordinator.resetMetrics();
        coordinator.resetMetrics();

        assertThat(coordinator.getMetrics()).hasSize(ConstructKind.values().length);
        assertThat(coordinator.getMetrics().values()).allMatch(metrics -> metrics.equals(ParserMetrics.empty()));
        assertThat(coordinator.getErrorCounts()).isEmpty();
    }

    @Test
    void resetMetrics_thenReplayingSameCalls_reproducesSnapshot() {
        // Given: a success, an absent construct and a malformed block
        runMixedSequence();
        Map<ConstructKind, ParserMetrics> firstMetrics = coordinator.getMetrics();
        Map<ParseErrorKind, Integer> firstErrors = coordinator.getErrorCounts();

        // When
        coordinator.resetMetrics();
        runMixedSequence();

        // Then
        assertThat(coordinator.getMetrics()).isEqualTo(firstMetrics);
        assertThat(coordinator.getErrorCounts()).isEqualTo(firstErrors);
        assertThat(firstMetrics.get(ConstructKind.EXCEPTION_HANDLER)).isEqualTo(new ParserMetrics(1, 0, 1));
        assertThat(firstErrors).containsEntry(ParseErrorKind.MALFORMED_CONSTRUCT, 1);
    }

    @Test
    void getMetrics_returnsSnapshot() {
        Map<ConstructKind, ParserMetrics> before = coordinator.getMetrics();

        coordinator.parse(ConstructKind.CTE, RECURSIVE_CTE);

        assertThat(before.get(ConstructKind.CTE).attempts()).isZero();
        assertThat(coordinator.getMetrics().get(ConstructKind.CTE).successes()).isEqualTo(1);
    }

    private void runMixedSequence() {
        coordinator.parse(ConstructKind.CTE, RECURSIVE_CTE);
        coordinator.parse(ConstructKind.WINDOW_FUNCTION, "SELECT 1;");
        coordinator.parse(ConstructKind.EXCEPTION_HANDLER, "EXCEPTION WHEN foo bar;");
        coordinator.parseWithBestParsers("BEGIN EXECUTE format('DELETE FROM %I', tbl); END;");
    }

    private static final class ThrowingParser implements ConstructParser {

        @Override
        public ConstructKind getKind() {
            return ConstructKind.CTE;
        }

        @Override
        public List<ConstructStep> parse(String text) {
            throw new IllegalStateException("boom");
        }

        @Override
        public Map<String, Object> describe(String text, List<ConstructStep> steps) {
            return Map.of();
        }
    }
}
