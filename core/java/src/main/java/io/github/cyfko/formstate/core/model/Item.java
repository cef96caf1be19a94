package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of the immutable definition tree.
 * <p>
 * Every behavior an item can declare is a typed field: variables, enable conditions, calculated
 * value, dynamic answer options, initial values and constraints. Items are built with
 * {@link #builder(String, ItemType)} and are safe to share between sessions.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Item weight = Item.builder("weight", ItemType.DECIMAL)
 *     .text("Weight (kg)")
 *     .calculatedExpression(Expression.of("%height * 2"))
 *     .build();
 *
 * Item family = Item.builder("family", ItemType.GROUP)
 *     .repeats(true)
 *     .required(true)
 *     .children(Item.builder("name", ItemType.STRING).required(true).build())
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Item {

    /** Default attachment size limit, one mebibyte. */
    public static final long DEFAULT_MAX_SIZE_BYTES = 1024L * 1024L;

    private final String linkId;
    private final ItemType type;
    private final String text;
    private final boolean repeats;
    private final boolean required;
    private final boolean readOnly;
    private final boolean hidden;
    private final ItemControl itemControl;
    private final Integer maxLength;
    private final Object minValue;
    private final Object maxValue;
    private final Integer minOccurs;
    private final Integer maxOccurs;
    private final long maxSizeBytes;
    private final List<String> mimeTypes;
    private final List<AnswerOption> answerOptions;
    private final List<Object> initial;
    private final List<Item> children;
    private final List<Expression> variables;
    private final List<EnableWhen> enableWhen;
    private final EnableBehavior enableBehavior;
    private final Expression enableWhenExpression;
    private final Expression calculatedExpression;
    private final Expression answerExpression;
    private final Expression candidateExpression;
    private final Expression initialExpression;
    private final List<AnswerOptionsToggle> answerOptionsToggles;
    private final List<Constraint> constraints;

    private Item(Builder builder) {
        this.linkId = builder.linkId;
        this.type = builder.type;
        this.text = builder.text;
        this.repeats = builder.repeats;
        this.required = builder.required;
        this.readOnly = builder.readOnly;
        this.hidden = builder.hidden;
        this.itemControl = builder.itemControl;
        this.maxLength = builder.maxLength;
        this.minValue = builder.minValue;
        this.maxValue = builder.maxValue;
        this.minOccurs = builder.minOccurs;
        this.maxOccurs = builder.maxOccurs;
        this.maxSizeBytes = builder.maxSizeBytes;
        this.mimeTypes = List.copyOf(builder.mimeTypes);
        this.answerOptions = List.copyOf(builder.answerOptions);
        this.initial = Collections.unmodifiableList(new ArrayList<>(builder.initial));
        this.children = List.copyOf(builder.children);
        this.variables = List.copyOf(builder.variables);
        this.enableWhen = List.copyOf(builder.enableWhen);
        this.enableBehavior = builder.enableBehavior;
        this.enableWhenExpression = builder.enableWhenExpression;
        this.calculatedExpression = builder.calculatedExpression;
        this.answerExpression = builder.answerExpression;
        this.candidateExpression = builder.candidateExpression;
        this.initialExpression = builder.initialExpression;
        this.answerOptionsToggles = List.copyOf(builder.answerOptionsToggles);
        this.constraints = List.copyOf(builder.constraints);
    }

    public static Builder builder(String linkId, ItemType type) {
        return new Builder(linkId, type);
    }

    public String getLinkId() { return linkId; }
    public ItemType getType() { return type; }
    public String getText() { return text; }
    public boolean isRepeats() { return repeats; }
    public boolean isRequired() { return required; }
    public boolean isReadOnly() { return readOnly; }
    public boolean isHidden() { return hidden; }
    public Optional<ItemControl> getItemControl() { return Optional.ofNullable(itemControl); }
    public Optional<Integer> getMaxLength() { return Optional.ofNullable(maxLength); }
    public Optional<Object> getMinValue() { return Optional.ofNullable(minValue); }
    public Optional<Object> getMaxValue() { return Optional.ofNullable(maxValue); }
    public Optional<Integer> getMinOccurs() { return Optional.ofNullable(minOccurs); }
    public Optional<Integer> getMaxOccurs() { return Optional.ofNullable(maxOccurs); }
    public long getMaxSizeBytes() { return maxSizeBytes; }
    public List<String> getMimeTypes() { return mimeTypes; }
    public List<AnswerOption> getAnswerOptions() { return answerOptions; }
    public List<Object> getInitial() { return initial; }
    public List<Item> getChildren() { return children; }
    public List<Expression> getVariables() { return variables; }
    public List<EnableWhen> getEnableWhen() { return enableWhen; }
    public EnableBehavior getEnableBehavior() { return enableBehavior; }
    public Optional<Expression> getEnableWhenExpression() { return Optional.ofNullable(enableWhenExpression); }
    public Optional<Expression> getCalculatedExpression() { return Optional.ofNullable(calculatedExpression); }
    public Optional<Expression> getAnswerExpression() { return Optional.ofNullable(answerExpression); }
    public Optional<Expression> getCandidateExpression() { return Optional.ofNullable(candidateExpression); }
    public Optional<Expression> getInitialExpression() { return Optional.ofNullable(initialExpression); }
    public List<AnswerOptionsToggle> getAnswerOptionsToggles() { return answerOptionsToggles; }
    public List<Constraint> getConstraints() { return constraints; }

    public boolean isGroup() {
        return type == ItemType.GROUP;
    }

    /**
     * @return true for a repeating group, whose response holds one node per instance
     */
    public boolean isRepeatedGroup() {
        return type == ItemType.GROUP && repeats;
    }

    /**
     * Whether the response keeps this item's children under each answer rather than directly
     * under the item's own response node.
     * <p>
     * This is the case for questions with children. Repeating groups are represented by one
     * response node per instance instead, each owning its children directly.
     * </p>
     */
    public boolean hasNestedItemsUnderAnswers() {
        return !children.isEmpty() && type != ItemType.GROUP;
    }

    /**
     * @return true when the item is enabled conditionally
     */
    public boolean hasEnableCondition() {
        return !enableWhen.isEmpty() || enableWhenExpression != null;
    }

    /**
     * @return true for a top-level group rendered as a page
     */
    public boolean isPage() {
        return type == ItemType.GROUP && itemControl == ItemControl.PAGE;
    }

    /**
     * Looks up a direct child by link id.
     */
    public Optional<Item> child(String childLinkId) {
        return children.stream().filter(c -> c.linkId.equals(childLinkId)).findFirst();
    }

    @Override
    public String toString() {
        return "Item[" + linkId + ":" + type + (repeats ? ", repeats" : "") + "]";
    }

    /**
     * Builder for {@link Item}. Optional fields default to absent, flags to false.
     */
    public static final class Builder {
        private final String linkId;
        private final ItemType type;
        private String text;
        private boolean repeats;
        private boolean required;
        private boolean readOnly;
        private boolean hidden;
        private ItemControl itemControl;
        private Integer maxLength;
        private Object minValue;
        private Object maxValue;
        private Integer minOccurs;
        private Integer maxOccurs;
        private long maxSizeBytes = DEFAULT_MAX_SIZE_BYTES;
        private final List<String> mimeTypes = new ArrayList<>();
        private final List<AnswerOption> answerOptions = new ArrayList<>();
        private final List<Object> initial = new ArrayList<>();
        private final List<Item> children = new ArrayList<>();
        private final List<Expression> variables = new ArrayList<>();
        private final List<EnableWhen> enableWhen = new ArrayList<>();
        private EnableBehavior enableBehavior = EnableBehavior.ALL;
        private Expression enableWhenExpression;
        private Expression calculatedExpression;
        private Expression answerExpression;
        private Expression candidateExpression;
        private Expression initialExpression;
        private final List<AnswerOptionsToggle> answerOptionsToggles = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder(String linkId, ItemType type) {
            this.linkId = Objects.requireNonNull(linkId, "linkId cannot be null");
            this.type = Objects.requireNonNull(type, "type cannot be null");
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder repeats(boolean repeats) {
            this.repeats = repeats;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder itemControl(ItemControl itemControl) {
            this.itemControl = itemControl;
            return this;
        }

        public Builder maxLength(int maxLength) {
            if (maxLength <= 0) {
                throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
            }
            this.maxLength = maxLength;
            return this;
        }

        public Builder minValue(Object minValue) {
            this.minValue = Objects.requireNonNull(minValue, "minValue");
            return this;
        }

        public Builder maxValue(Object maxValue) {
            this.maxValue = Objects.requireNonNull(maxValue, "maxValue");
            return this;
        }

        public Builder minOccurs(int minOccurs) {
            if (minOccurs < 0) {
                throw new IllegalArgumentException("minOccurs must not be negative, got: " + minOccurs);
            }
            this.minOccurs = minOccurs;
            return this;
        }

        public Builder maxOccurs(int maxOccurs) {
            if (maxOccurs <= 0) {
                throw new IllegalArgumentException("maxOccurs must be positive, got: " + maxOccurs);
            }
            this.maxOccurs = maxOccurs;
            return this;
        }

        public Builder maxSizeBytes(long maxSizeBytes) {
            if (maxSizeBytes <= 0) {
                throw new IllegalArgumentException("maxSizeBytes must be positive, got: " + maxSizeBytes);
            }
            this.maxSizeBytes = maxSizeBytes;
            return this;
        }

        public Builder mimeTypes(String... mimeTypes) {
            this.mimeTypes.addAll(Arrays.asList(mimeTypes));
            return this;
        }

        public Builder answerOptions(AnswerOption... options) {
            this.answerOptions.addAll(Arrays.asList(options));
            return this;
        }

        /**
         * Adds plain options, none initially selected.
         */
        public Builder options(Object... values) {
            for (Object value : values) {
                this.answerOptions.add(AnswerOption.of(value));
            }
            return this;
        }

        public Builder initial(Object... values) {
            for (Object value : values) {
                this.initial.add(Objects.requireNonNull(value, "initial value cannot be null"));
            }
            return this;
        }

        public Builder children(Item... children) {
            this.children.addAll(Arrays.asList(children));
            return this;
        }

        public Builder children(List<Item> children) {
            this.children.addAll(children);
            return this;
        }

        public Builder variable(String name, String expression) {
            this.variables.add(Expression.variable(name, expression));
            return this;
        }

        public Builder variable(Expression variable) {
            this.variables.add(Objects.requireNonNull(variable, "variable"));
            return this;
        }

        public Builder enableWhen(EnableWhen... conditions) {
            this.enableWhen.addAll(Arrays.asList(conditions));
            return this;
        }

        public Builder enableBehavior(EnableBehavior enableBehavior) {
            this.enableBehavior = Objects.requireNonNull(enableBehavior, "enableBehavior");
            return this;
        }

        public Builder enableWhenExpression(Expression expression) {
            this.enableWhenExpression = expression;
            return this;
        }

        public Builder enableWhenExpression(String expression) {
            return enableWhenExpression(Expression.of(expression));
        }

        public Builder calculatedExpression(Expression expression) {
            this.calculatedExpression = expression;
            return this;
        }

        public Builder calculatedExpression(String expression) {
            return calculatedExpression(Expression.of(expression));
        }

        public Builder answerExpression(Expression expression) {
            this.answerExpression = expression;
            return this;
        }

        public Builder answerExpression(String expression) {
            return answerExpression(Expression.of(expression));
        }

        public Builder candidateExpression(Expression expression) {
            this.candidateExpression = expression;
            return this;
        }

        public Builder initialExpression(Expression expression) {
            this.initialExpression = expression;
            return this;
        }

        public Builder initialExpression(String expression) {
            return initialExpression(Expression.of(expression));
        }

        public Builder answerOptionsToggle(String expression, Object... options) {
            this.answerOptionsToggles.add(new AnswerOptionsToggle(Expression.of(expression), Arrays.asList(options)));
            return this;
        }

        public Builder answerOptionsToggles(AnswerOptionsToggle... toggles) {
            this.answerOptionsToggles.addAll(Arrays.asList(toggles));
            return this;
        }

        public Builder constraints(Constraint... constraints) {
            this.constraints.addAll(Arrays.asList(constraints));
            return this;
        }

        public Item build() {
            return new Item(this);
        }
    }
}
