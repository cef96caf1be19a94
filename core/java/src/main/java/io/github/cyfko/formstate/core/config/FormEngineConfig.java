package io.github.cyfko.formstate.core.config;

import io.github.cyfko.formstate.core.spi.AnswerConstraintValidator;
import io.github.cyfko.formstate.core.spi.ExpressionEvaluator;
import io.github.cyfko.formstate.core.spi.ItemMatcherRegistry;
import io.github.cyfko.formstate.core.spi.ReferenceExtractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Everything an engine and its sessions need, passed explicitly instead of through global state.
 * <p>
 * A config is immutable and may be shared by several engines. Only {@link #getAnswerValidators()}
 * is a live registry: registrations made after the config was built are seen by new validation
 * runs.
 * </p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>expression evaluator: {@link ExpressionEvaluator#unsupported()}</li>
 *   <li>reference extractor: none, the regex based scanner is used</li>
 *   <li>cache policy: {@link CachePolicy#defaults()}</li>
 *   <li>navigation policy: {@link NavigationPolicy#LINEAR}</li>
 *   <li>review page: disabled, not shown first; sessions are editable</li>
 *   <li>mutation and evaluation executors: run on the calling thread</li>
 * </ul>
 *
 * <pre>{@code
 * FormEngineConfig config = FormEngineConfig.builder()
 *     .expressionEvaluator(myFhirPathEvaluator)
 *     .navigationPolicy(NavigationPolicy.NON_LINEAR)
 *     .reviewEnabled(true)
 *     .evaluationExecutor(Executors.newFixedThreadPool(2))
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormEngineConfig {

    private final ExpressionEvaluator expressionEvaluator;
    private final ReferenceExtractor referenceExtractor;
    private final CachePolicy cachePolicy;
    private final NavigationPolicy navigationPolicy;
    private final boolean reviewEnabled;
    private final boolean reviewFirst;
    private final boolean readOnly;
    private final Executor mutationExecutor;
    private final Executor evaluationExecutor;
    private final ItemMatcherRegistry<AnswerConstraintValidator> answerValidators;
    private final Map<String, Object> launchContext;

    private FormEngineConfig(Builder builder) {
        this.expressionEvaluator = builder.expressionEvaluator;
        this.referenceExtractor = builder.referenceExtractor;
        this.cachePolicy = builder.cachePolicy;
        this.navigationPolicy = builder.navigationPolicy;
        this.reviewEnabled = builder.reviewEnabled;
        this.reviewFirst = builder.reviewFirst;
        this.readOnly = builder.readOnly;
        this.mutationExecutor = builder.mutationExecutor;
        this.evaluationExecutor = builder.evaluationExecutor;
        this.answerValidators = builder.answerValidators;
        this.launchContext = Collections.unmodifiableMap(new LinkedHashMap<>(builder.launchContext));
    }

    public static Builder builder() { return new Builder(); }

    public static FormEngineConfig defaults() { return builder().build(); }

    public ExpressionEvaluator getExpressionEvaluator() { return expressionEvaluator; }
    public Optional<ReferenceExtractor> getReferenceExtractor() { return Optional.ofNullable(referenceExtractor); }
    public CachePolicy getCachePolicy() { return cachePolicy; }
    public NavigationPolicy getNavigationPolicy() { return navigationPolicy; }
    public boolean isReviewEnabled() { return reviewEnabled; }
    public boolean isReviewFirst() { return reviewFirst; }
    public boolean isReadOnly() { return readOnly; }
    public Executor getMutationExecutor() { return mutationExecutor; }
    public Executor getEvaluationExecutor() { return evaluationExecutor; }
    public ItemMatcherRegistry<AnswerConstraintValidator> getAnswerValidators() { return answerValidators; }
    public Map<String, Object> getLaunchContext() { return launchContext; }

    /**
     * @return a builder preset with this config's values
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.expressionEvaluator = expressionEvaluator;
        builder.referenceExtractor = referenceExtractor;
        builder.cachePolicy = cachePolicy;
        builder.navigationPolicy = navigationPolicy;
        builder.reviewEnabled = reviewEnabled;
        builder.reviewFirst = reviewFirst;
        builder.readOnly = readOnly;
        builder.mutationExecutor = mutationExecutor;
        builder.evaluationExecutor = evaluationExecutor;
        builder.answerValidators = answerValidators;
        builder.launchContext.putAll(launchContext);
        return builder;
    }

    /**
     * Builder for {@link FormEngineConfig}.
     */
    public static final class Builder {
        private ExpressionEvaluator expressionEvaluator = ExpressionEvaluator.unsupported();
        private ReferenceExtractor referenceExtractor;
        private CachePolicy cachePolicy = CachePolicy.defaults();
        private NavigationPolicy navigationPolicy = NavigationPolicy.LINEAR;
        private boolean reviewEnabled;
        private boolean reviewFirst;
        private boolean readOnly;
        private Executor mutationExecutor = Runnable::run;
        private Executor evaluationExecutor = Runnable::run;
        private ItemMatcherRegistry<AnswerConstraintValidator> answerValidators = new ItemMatcherRegistry<>();
        private final Map<String, Object> launchContext = new LinkedHashMap<>();

        public Builder expressionEvaluator(ExpressionEvaluator evaluator) {
            this.expressionEvaluator = Objects.requireNonNull(evaluator, "expressionEvaluator");
            return this;
        }

        /**
         * @param extractor reference extractor, null to fall back to the regex scanner
         */
        public Builder referenceExtractor(ReferenceExtractor extractor) {
            this.referenceExtractor = extractor;
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public Builder navigationPolicy(NavigationPolicy policy) {
            this.navigationPolicy = Objects.requireNonNull(policy, "navigationPolicy");
            return this;
        }

        /**
         * Whether the review mode exists at all.
         */
        public Builder reviewEnabled(boolean reviewEnabled) {
            this.reviewEnabled = reviewEnabled;
            return this;
        }

        /**
         * Whether sessions open in review mode. Only effective when review is enabled.
         */
        public Builder reviewFirst(boolean reviewFirst) {
            this.reviewFirst = reviewFirst;
            return this;
        }

        /**
         * Read-only sessions open in review mode and cannot go back to editing, whether or not
         * review is enabled.
         */
        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        /**
         * Executor the per-session mutation queue drains on. Tasks are never run concurrently
         * for one session, whatever the executor.
         */
        public Builder mutationExecutor(Executor executor) {
            this.mutationExecutor = Objects.requireNonNull(executor, "mutationExecutor");
            return this;
        }

        /**
         * Executor evaluation passes run on.
         */
        public Builder evaluationExecutor(Executor executor) {
            this.evaluationExecutor = Objects.requireNonNull(executor, "evaluationExecutor");
            return this;
        }

        public Builder answerValidators(ItemMatcherRegistry<AnswerConstraintValidator> registry) {
            this.answerValidators = Objects.requireNonNull(registry, "answerValidators");
            return this;
        }

        public Builder launchContext(String name, Object value) {
            this.launchContext.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder launchContext(Map<String, ?> values) {
            values.forEach(this::launchContext);
            return this;
        }

        public FormEngineConfig build() { return new FormEngineConfig(this); }
    }
}
