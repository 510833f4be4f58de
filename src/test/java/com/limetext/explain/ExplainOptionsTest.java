package com.limetext.explain;

import com.limetext.config.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplainOptionsTest {

    @Test
    @DisplayName("默认参数")
    void testDefaults() {
        ExplainOptions options = ExplainOptions.defaults();

        assertEquals(List.of(Constants.DEFAULT_LABEL), options.labels());
        assertNull(options.topLabels());
        assertEquals(Constants.DEFAULT_NUM_FEATURES, options.numFeatures());
        assertEquals(Constants.DEFAULT_NUM_SAMPLES, options.numSamples());
    }

    @Test
    @DisplayName("with 方法返回新实例")
    void testWithers() {
        ExplainOptions options = ExplainOptions.defaults()
            .withLabels(0, 2)
            .withNumFeatures(6)
            .withNumSamples(100)
            .withTopLabels(3);

        assertEquals(List.of(0, 2), options.labels());
        assertEquals(3, options.topLabels());
        assertEquals(6, options.numFeatures());
        assertEquals(100, options.numSamples());
        assertEquals(List.of(1), ExplainOptions.defaults().labels());
    }

    @Test
    @DisplayName("只给 topLabels 时标签可以为空")
    void testTopLabelsWithoutLabels() {
        ExplainOptions options = new ExplainOptions(null, 2, 5, 50);

        assertTrue(options.labels().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "0, 10",
        "10, 0",
        "-3, 10"
    })
    @DisplayName("非法规模参数被拒绝")
    void testInvalidSizes(int numFeatures, int numSamples) {
        assertThrows(IllegalArgumentException.class,
            () -> new ExplainOptions(List.of(1), null, numFeatures, numSamples));
    }

    @Test
    @DisplayName("没有标签也没有 topLabels 时失败")
    void testNoTargets() {
        assertThrows(IllegalArgumentException.class, () -> new ExplainOptions(List.of(), null, 10, 10));
        assertThrows(IllegalArgumentException.class, () -> ExplainOptions.defaults().withTopLabels(0));
    }

    @Test
    @DisplayName("特征选择方式按名称解析")
    void testFeatureSelectionFromName() {
        assertEquals(FeatureSelection.FORWARD_SELECTION, FeatureSelection.fromName("forward_selection"));
        assertEquals(FeatureSelection.LASSO_PATH, FeatureSelection.fromName("LASSO_PATH"));
        assertEquals(FeatureSelection.NONE, FeatureSelection.fromName("none"));
        assertEquals("auto", FeatureSelection.AUTO.wireName());
        assertThrows(IllegalArgumentException.class, () -> FeatureSelection.fromName("highest_weights"));
        assertThrows(IllegalArgumentException.class, () -> FeatureSelection.fromName(null));
    }
}
