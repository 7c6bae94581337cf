package com.schemareverse.core.pattern;

import com.schemareverse.core.model.InfoInstanceDetectionResult;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.model.TableDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InfoInstanceDetector}.
 */
class InfoInstanceDetectorTest {

    private static final TableDescriptor UNIT_INFO = new TableDescriptor("tb_administrative_unit_info",
        List.of("pk_administrative_unit_info", "identifier", "name"));
    private static final TableDescriptor UNIT = new TableDescriptor("tb_administrative_unit",
        List.of("pk_administrative_unit", "fk_administrative_unit_info", "fk_parent_administrative_unit", "path"));
    private static final TableDescriptor CONTACT = new TableDescriptor("tb_contact",
        List.of("pk_contact", "email"));

    private InfoInstanceDetector detector;

    @BeforeEach
    void setUp() {
        detector = new InfoInstanceDetector();
    }

    @Test
    void classify_withInfoSuffix_returnsVocabulary() {
        InfoInstanceDetectionResult result = detector.classify(UNIT_INFO.name(), UNIT_INFO.columns());

        assertThat(result.vocabularyTable()).isTrue();
        assertThat(result.instanceTable()).isFalse();
        assertThat(result.baseEntityName()).isEqualTo("administrative_unit");
        assertThat(result.label()).isEqualTo("vocabulary");
    }

    @Test
    void classify_withVocabularyForeignKey_returnsInstance() {
        InfoInstanceDetectionResult result = detector.classify(UNIT.name(), UNIT.columns());

        assertThat(result.instanceTable()).isTrue();
        assertThat(result.baseEntityName()).isEqualTo("administrative_unit");
        assertThat(result.vocabularyFkColumn()).isEqualTo("fk_administrative_unit_info");
        assertThat(result.parentFkColumn()).isEqualTo("fk_parent_administrative_unit");
    }

    @Test
    void classify_withoutParentColumn_leavesParentNull() {
        InfoInstanceDetectionResult result = detector.classify("TV_Region", List.of("FK_REGION_INFO"));

        assertThat(result.instanceTable()).isTrue();
        assertThat(result.baseEntityName()).isEqualTo("region");
        assertThat(result.vocabularyFkColumn()).isEqualTo("FK_REGION_INFO");
        assertThat(result.parentFkColumn()).isNull();
    }

    @Test
    void classify_withStackedPrefixes_stripsEachInTurn() {
        InfoInstanceDetectionResult vocabulary = detector.classify("tb_tv_region_info", List.of("pk_region_info"));
        InfoInstanceDetectionResult instance = detector.classify("tb_tv_region", List.of("fk_region_info"));

        assertThat(vocabulary.vocabularyTable()).isTrue();
        assertThat(vocabulary.baseEntityName()).isEqualTo("region");
        assertThat(instance.instanceTable()).isTrue();
        assertThat(instance.vocabularyFkColumn()).isEqualTo("fk_region_info");
    }

    @Test
    void classify_withPlainTable_returnsNeither() {
        InfoInstanceDetectionResult result = detector.classify(CONTACT.name(), CONTACT.columns());

        assertThat(result.vocabularyTable()).isFalse();
        assertThat(result.instanceTable()).isFalse();
        assertThat(result.label()).isEqualTo("none");
    }

    @Test
    void classify_withSuffixOnly_returnsNeither() {
        assertThat(detector.classify("_info", List.of()).vocabularyTable()).isFalse();
        assertThat(detector.classify(null, List.of()).label()).isEqualTo("none");
    }

    @Test
    void detectPairs_linksVocabularyAndInstanceOnly() {
        List<InfoInstancePair> pairs = detector.detectPairs(List.of(UNIT_INFO, UNIT, CONTACT), Map.of());

        assertThat(pairs).containsExactly(new InfoInstancePair(
            "tb_administrative_unit_info", "tb_administrative_unit", "administrative_unit", null));
    }

    @Test
    void detectPairs_withTranslationIndex_prefersVocabularyName() {
        Map<String, String> index = Map.of(
            "administrative_unit_info", "tl_administrative_unit_info",
            "administrative_unit", "tl_administrative_unit");

        List<InfoInstancePair> pairs = detector.detectPairs(List.of(UNIT, UNIT_INFO), index);

        assertThat(pairs).singleElement()
            .extracting(InfoInstancePair::translationTable)
            .isEqualTo("tl_administrative_unit_info");
    }

    @Test
    void detectPairs_withVocabularyOnly_returnsEmpty() {
        assertThat(detector.detectPairs(List.of(UNIT_INFO), null)).isEmpty();
    }

    @Test
    void classify_withCustomConventions_usesThem() {
        InfoInstanceDetector custom = new InfoInstanceDetector(List.of("t_"), "_kind");

        assertThat(custom.classify("t_vehicle_kind", List.of()).baseEntityName()).isEqualTo("vehicle");
        assertThat(custom.classify("t_vehicle", List.of("fk_vehicle_kind")).instanceTable()).isTrue();
    }
}
