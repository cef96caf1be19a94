package io.github.cyfko.formstate.core.spi;

import io.github.cyfko.formstate.core.dependency.Reference;
import io.github.cyfko.formstate.core.model.Expression;

import java.util.Set;

/**
 * Statically discovers what an expression reads, so that the dependency graph can be built
 * before anything is evaluated.
 * <p>
 * The default implementation is {@link io.github.cyfko.formstate.core.dependency.ReferenceScanner}.
 * An evaluator with a real parser can provide a more precise one through
 * {@link io.github.cyfko.formstate.core.config.FormEngineConfig.Builder#referenceExtractor}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReferenceExtractor {

    /**
     * @param expression expression to scan
     * @return the answers and variables it reads, never null
     */
    Set<Reference> extract(Expression expression);
}
