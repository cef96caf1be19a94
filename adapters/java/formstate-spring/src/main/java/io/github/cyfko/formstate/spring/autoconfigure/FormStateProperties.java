package io.github.cyfko.formstate.spring.autoconfigure;

import io.github.cyfko.formstate.core.config.CachePolicy;
import io.github.cyfko.formstate.core.config.NavigationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code formstate.*} properties.
 *
 * <pre>
 * formstate.navigation-policy=NON_LINEAR
 * formstate.review.enabled=true
 * formstate.review.first=false
 * formstate.read-only=false
 * formstate.cache.enabled=true
 * formstate.cache.size=1000
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "formstate")
public class FormStateProperties {
    private NavigationPolicy navigationPolicy = NavigationPolicy.LINEAR;
    private boolean readOnly;
    private Review review = new Review();
    private Cache cache = new Cache();

    public static class Review {
        private boolean enabled;
        private boolean first;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isFirst() { return first; }
        public void setFirst(boolean first) { this.first = first; }
    }

    public static class Cache {
        private boolean enabled = true;
        private int size = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }

        CachePolicy toPolicy() {
            return enabled ? CachePolicy.custom(size) : CachePolicy.none();
        }
    }

    public NavigationPolicy getNavigationPolicy() { return navigationPolicy; }
    public void setNavigationPolicy(NavigationPolicy navigationPolicy) { this.navigationPolicy = navigationPolicy; }
    public boolean isReadOnly() { return readOnly; }
    public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }
    public Review getReview() { return review; }
    public void setReview(Review review) { this.review = review; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
}
