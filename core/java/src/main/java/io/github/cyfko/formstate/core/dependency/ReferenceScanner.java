package io.github.cyfko.formstate.core.dependency;

import io.github.cyfko.formstate.core.cache.BoundedLRUCache;
import io.github.cyfko.formstate.core.config.CachePolicy;
import io.github.cyfko.formstate.core.model.Expression;
import io.github.cyfko.formstate.core.spi.ReferenceExtractor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link ReferenceExtractor}: finds references by scanning the expression text.
 * <p>
 * {@code linkId = 'x'} (quotes required, whitespace ignored) is read as a reference to the
 * answers of item {@code x}; {@code %name} as a reference to variable {@code name}. Names the
 * evaluation environment provides itself ({@code %resource}, {@code %context},
 * {@code %questionnaire}, {@code %qItem} and the code system constants) are not variables and
 * are skipped.
 * </p>
 * <p>
 * Scanning is textual, so a reference inside a string literal or a comment is still reported.
 * The only consequence is an extra edge in the dependency graph, never a missing one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ReferenceScanner implements ReferenceExtractor {

    private static final Logger logger = Logger.getLogger(ReferenceScanner.class.getName());

    private static final Pattern LINK_ID = Pattern.compile("linkId\\s*=\\s*'([^']+)'");
    private static final Pattern VARIABLE = Pattern.compile("%([A-Za-z_][A-Za-z0-9_]*)");

    /** Environment names that never denote a declared variable. */
    public static final Set<String> RESERVED_NAMES = Set.of(
            "resource", "rootResource", "context", "questionnaire", "qItem", "ucum", "sct", "loinc", "factory");

    private final BoundedLRUCache<String, Set<Reference>> cache;

    /**
     * @param cachePolicy how scan results are cached
     */
    public ReferenceScanner(CachePolicy cachePolicy) {
        Objects.requireNonNull(cachePolicy, "cachePolicy cannot be null");
        this.cache = cachePolicy.cacheEnabled() ? new BoundedLRUCache<>(cachePolicy.cacheSize()) : null;
    }

    public ReferenceScanner() {
        this(CachePolicy.defaults());
    }

    @Override
    public Set<Reference> extract(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        if (cache == null) {
            return scan(expression.expression());
        }
        return cache.computeIfAbsent(expression.expression(), ReferenceScanner::scan);
    }

    /**
     * Scans an expression text without caching.
     *
     * @return references in order of first appearance
     */
    public static Set<Reference> scan(String text) {
        Set<Reference> references = new LinkedHashSet<>();
        Matcher linkIds = LINK_ID.matcher(text);
        while (linkIds.find()) {
            references.add(Reference.answer(linkIds.group(1)));
        }
        Matcher variables = VARIABLE.matcher(text);
        while (variables.find()) {
            String name = variables.group(1);
            if (!RESERVED_NAMES.contains(name)) {
                references.add(Reference.variable(name));
            }
        }
        logger.finest(() -> String.format("Scanned %d reference(s) in '%s'", references.size(), text));
        return Collections.unmodifiableSet(references);
    }

    /**
     * @return the cache, null when caching is disabled
     */
    BoundedLRUCache<String, Set<Reference>> cache() {
        return cache;
    }
}
