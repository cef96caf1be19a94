package io.github.cyfko.formstate.core.config;

/**
 * Caching of the references scanned out of expression texts.
 * <p>
 * The same expression text typically appears in every instance of a repeated group and in every
 * form loaded by an engine, so scanning results are cached by text.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy policy = CachePolicy.defaults();   // 1000 texts
 * CachePolicy policy = CachePolicy.strict();     // 250 texts, memory constrained hosts
 * CachePolicy policy = CachePolicy.relaxed();    // 5000 texts, many large forms
 * CachePolicy policy = CachePolicy.none();       // scan every time
 * CachePolicy policy = CachePolicy.custom(2000);
 * }</pre>
 *
 * @param cacheEnabled whether scan results are cached
 * @param cacheSize    maximum number of cached expression texts
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return caching enabled with room for 1000 expression texts
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * @return caching enabled with room for 250 expression texts
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 250);
    }

    /**
     * @return caching enabled with room for 5000 expression texts
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 5000);
    }

    /**
     * @return caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
