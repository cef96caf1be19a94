package io.github.cyfko.formstate.core.config;

import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.spi.EvaluationResult;
import io.github.cyfko.formstate.core.spi.ExpressionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormEngineConfig, its builder and the policies it carries.
 */
@DisplayName("FormEngineConfig Tests")
class FormEngineConfigTest {

    // ==================== Defaults ====================

    @Test
    @DisplayName("Should build with default values")
    void shouldBuildWithDefaults() {
        // When
        FormEngineConfig config = FormEngineConfig.defaults();

        // Then
        assertEquals(NavigationPolicy.LINEAR, config.getNavigationPolicy());
        assertEquals(CachePolicy.defaults(), config.getCachePolicy());
        assertFalse(config.isReviewEnabled());
        assertFalse(config.isReviewFirst());
        assertFalse(config.isReadOnly());
        assertTrue(config.getReferenceExtractor().isEmpty());
        assertEquals(0, config.getAnswerValidators().size());
        assertTrue(config.getLaunchContext().isEmpty());
    }

    @Test
    @DisplayName("Default evaluator should fail every expression")
    void defaultEvaluatorShouldFail() {
        EvaluationResult result = FormEngineConfig.defaults().getExpressionEvaluator()
                .evaluate(Expression.of("1 + 1"), null);

        assertFalse(result.isSuccess());
        assertTrue(result.error().contains("No expression evaluator configured"));
    }

    // ==================== Custom values ====================

    @Test
    @DisplayName("Should keep custom values through toBuilder")
    void shouldKeepCustomValues() {
        ExpressionEvaluator evaluator = (expression, context) -> EvaluationResult.success(true);
        FormEngineConfig config = FormEngineConfig.builder()
                .expressionEvaluator(evaluator)
                .navigationPolicy(NavigationPolicy.NON_LINEAR)
                .reviewEnabled(true)
                .reviewFirst(true)
                .cachePolicy(CachePolicy.strict())
                .launchContext("patient", "p-1")
                .build();

        FormEngineConfig copy = config.toBuilder().readOnly(true).build();

        assertSame(evaluator, copy.getExpressionEvaluator());
        assertEquals(NavigationPolicy.NON_LINEAR, copy.getNavigationPolicy());
        assertTrue(copy.isReviewEnabled());
        assertTrue(copy.isReviewFirst());
        assertTrue(copy.isReadOnly());
        assertFalse(config.isReadOnly(), "the original config must not change");
        assertEquals(Map.of("patient", "p-1"), copy.getLaunchContext());
        assertSame(config.getAnswerValidators(), copy.getAnswerValidators());
    }

    @Test
    @DisplayName("Launch context should be unmodifiable")
    void launchContextShouldBeUnmodifiable() {
        FormEngineConfig config = FormEngineConfig.builder().launchContext("a", 1).build();

        assertThrows(UnsupportedOperationException.class, () -> config.getLaunchContext().put("b", 2));
    }

    @Test
    @DisplayName("Should reject a null evaluator")
    void shouldRejectNullEvaluator() {
        assertThrows(NullPointerException.class, () -> FormEngineConfig.builder().expressionEvaluator(null));
    }

    // ==================== Cache policy ====================

    @Test
    @DisplayName("Cache presets should have their documented sizes")
    void cachePresetsShouldHaveDocumentedSizes() {
        assertEquals(1000, CachePolicy.defaults().cacheSize());
        assertEquals(250, CachePolicy.strict().cacheSize());
        assertEquals(5000, CachePolicy.relaxed().cacheSize());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(2000, CachePolicy.custom(2000).cacheSize());
    }

    @Test
    @DisplayName("Should reject a non-positive cache size")
    void shouldRejectNonPositiveCacheSize() {
        assertThrows(IllegalArgumentException.class, () -> new CachePolicy(true, 0));
    }
}
