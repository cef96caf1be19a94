package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.config.CachePolicy;
import io.github.cyfko.formstate.core.model.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceScanner Tests")
class ReferenceScannerTest {

    @Test
    @DisplayName("Should find answer and variable references")
    void shouldFindReferences() {
        Set<Reference> references = ReferenceScanner.scan(
                "%resource.item.where(linkId = 'height').answer.value * %factor + %resource.item.where(linkId='weight').answer.value");

        assertEquals(Set.of(Reference.answer("height"), Reference.answer("weight"), Reference.variable("factor")), references);
    }

    @Test
    @DisplayName("Should skip environment names")
    void shouldSkipEnvironmentNames() {
        Set<Reference> references = ReferenceScanner.scan("%context.answer.value = %questionnaire.id and %qItem.text.exists()");

        assertTrue(references.isEmpty());
    }

    @Test
    @DisplayName("Should cache scan results by expression text")
    void shouldCacheByText() {
        ReferenceScanner scanner = new ReferenceScanner(CachePolicy.custom(10));

        Set<Reference> first = scanner.extract(Expression.of("%a"));
        Set<Reference> second = scanner.extract(Expression.of("%a"));

        assertSame(first, second);
        assertEquals(1, scanner.cache().size());
        assertEquals(1, scanner.cache().getHits());
    }

    @Test
    @DisplayName("Should not cache when caching is disabled")
    void shouldNotCacheWhenDisabled() {
        ReferenceScanner scanner = new ReferenceScanner(CachePolicy.none());

        assertNull(scanner.cache());
        assertEquals(Set.of(Reference.variable("a")), scanner.extract(Expression.of("%a")));
    }
}
