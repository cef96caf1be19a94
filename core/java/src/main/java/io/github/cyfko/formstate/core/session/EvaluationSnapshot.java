package io.github.cyfko.formstate.core.session;

import io.github.cyfko.formstate.core.evaluation.ExpressionError;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.navigation.FormMode;
import io.github.cyfko.formstate.core.navigation.PaginationState;
import io.github.cyfko.formstate.core.sync.SyncIssue;
import io.github.cyfko.formstate.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of a session after an evaluation pass.
 * <p>
 * Snapshots are what rendering and submission read. A session publishes a new snapshot atomically
 * after each applied pass; a snapshot obtained earlier never changes.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * EvaluationSnapshot snapshot = session.setAnswer(LinkIdPath.parse("height"), 10).join();
 *
 * snapshot.answers("weight");            // [20]
 * snapshot.isEnabled("address");         // false
 * snapshot.validation("name");           // ValidationResult[not validated]
 * }</pre>
 *
 * <p>Paths are written as {@code group[0]/question}; see {@link LinkIdPath#parse(String)}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluationSnapshot {

    private final long generation;
    private final String formId;
    private final FormMode mode;
    private final boolean closed;
    private final PaginationState pagination;
    private final Map<LinkIdPath, ItemState> items;
    private final Map<LinkIdPath, Boolean> slots;
    private final Map<String, List<Object>> variables;
    private final List<ExpressionError> errors;
    private final Map<LinkIdPath, ValidationResult> validation;
    private final List<SyncIssue> syncIssues;
    private final ResponseDocument response;
    private final ResponseDocument submission;

    private EvaluationSnapshot(Builder builder) {
        this.generation = builder.generation;
        this.formId = Objects.requireNonNull(builder.formId, "formId cannot be null");
        this.mode = Objects.requireNonNull(builder.mode, "mode cannot be null");
        this.closed = builder.closed;
        this.pagination = builder.pagination;
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(builder.items));
        this.slots = Collections.unmodifiableMap(new LinkedHashMap<>(builder.slots));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.errors = List.copyOf(builder.errors);
        this.validation = Collections.unmodifiableMap(new LinkedHashMap<>(builder.validation));
        this.syncIssues = List.copyOf(builder.syncIssues);
        this.response = builder.response == null ? ResponseDocument.empty(formId) : builder.response;
        this.submission = builder.submission == null ? this.response : builder.submission;
    }

    public static Builder builder(String formId) {
        return new Builder(formId);
    }

    /**
     * @return number of mutations the snapshot accounts for
     */
    public long getGeneration() { return generation; }
    public String getFormId() { return formId; }
    public FormMode getMode() { return mode; }

    /**
     * @return true after submission or cancellation
     */
    public boolean isClosed() { return closed; }
    public PaginationState getPagination() { return pagination; }

    /**
     * @return state of every response node, in document order
     */
    public Map<LinkIdPath, ItemState> getItems() { return items; }

    /**
     * @return enabled state of repeated group slots, by unindexed path
     */
    public Map<LinkIdPath, Boolean> getSlots() { return slots; }

    /**
     * @return form-level variables
     */
    public Map<String, List<Object>> getVariables() { return variables; }
    public List<ExpressionError> getErrors() { return errors; }

    /**
     * @return validation results of enabled nodes and repeated group slots, in document order
     */
    public Map<LinkIdPath, ValidationResult> getValidation() { return validation; }
    public List<SyncIssue> getSyncIssues() { return syncIssues; }

    /**
     * @return the whole response, disabled items included
     */
    public ResponseDocument getResponse() { return response; }

    /**
     * @return the response without disabled items, as it would be submitted
     */
    public ResponseDocument getSubmission() { return submission; }

    public Optional<ItemState> item(String path) {
        return item(LinkIdPath.parse(path));
    }

    public Optional<ItemState> item(LinkIdPath path) {
        return Optional.ofNullable(items.get(path));
    }

    /**
     * Whether a node, or a repeated group slot given by its unindexed path, is enabled.
     *
     * @return false for unknown paths
     */
    public boolean isEnabled(String path) {
        LinkIdPath parsed = LinkIdPath.parse(path);
        ItemState state = items.get(parsed);
        if (state != null) return state.enabled();
        return slots.getOrDefault(parsed, false);
    }

    /**
     * @return answers of the node, empty for unknown paths
     */
    public List<Object> answers(String path) {
        return item(path).map(ItemState::answers).orElse(List.of());
    }

    public List<Object> options(String path) {
        return item(path).map(ItemState::options).orElse(List.of());
    }

    /**
     * @return the validation result of a node or slot, {@link ValidationResult#notValidated()}
     * for disabled or unknown paths
     */
    public ValidationResult validation(String path) {
        return validation.getOrDefault(LinkIdPath.parse(path), ValidationResult.notValidated());
    }

    public boolean hasInvalid() {
        return validation.values().stream().anyMatch(ValidationResult::isInvalid);
    }

    public Map<LinkIdPath, ValidationResult> invalidResults() {
        Map<LinkIdPath, ValidationResult> invalid = new LinkedHashMap<>();
        validation.forEach((path, result) -> {
            if (result.isInvalid()) invalid.put(path, result);
        });
        return invalid;
    }

    /**
     * @return expression errors of the item with this link id, across all its nodes
     */
    public List<ExpressionError> errorsFor(String linkId) {
        return errors.stream().filter(e -> linkId.equals(e.linkId())).toList();
    }

    @Override
    public String toString() {
        return "EvaluationSnapshot[form=" + formId + ", generation=" + generation + ", mode=" + mode
                + ", items=" + items.size() + ", errors=" + errors.size() + "]";
    }

    public static final class Builder {
        private final String formId;
        private long generation;
        private FormMode mode = FormMode.INIT;
        private boolean closed;
        private PaginationState pagination = PaginationState.none();
        private final Map<LinkIdPath, ItemState> items = new LinkedHashMap<>();
        private final Map<LinkIdPath, Boolean> slots = new LinkedHashMap<>();
        private final Map<String, List<Object>> variables = new LinkedHashMap<>();
        private final List<ExpressionError> errors = new ArrayList<>();
        private final Map<LinkIdPath, ValidationResult> validation = new LinkedHashMap<>();
        private final List<SyncIssue> syncIssues = new ArrayList<>();
        private ResponseDocument response;
        private ResponseDocument submission;

        private Builder(String formId) {
            this.formId = formId;
        }

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder mode(FormMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder closed(boolean closed) {
            this.closed = closed;
            return this;
        }

        public Builder pagination(PaginationState pagination) {
            this.pagination = Objects.requireNonNull(pagination, "pagination cannot be null");
            return this;
        }

        public Builder item(ItemState item) {
            this.items.put(item.path(), item);
            return this;
        }

        public Builder slot(LinkIdPath path, boolean enabled) {
            this.slots.put(path, enabled);
            return this;
        }

        public Builder variables(Map<String, List<Object>> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public Builder errors(Iterable<ExpressionError> errors) {
            errors.forEach(this.errors::add);
            return this;
        }

        public Builder validation(Map<LinkIdPath, ValidationResult> validation) {
            this.validation.putAll(validation);
            return this;
        }

        public Builder syncIssues(List<SyncIssue> syncIssues) {
            this.syncIssues.addAll(syncIssues);
            return this;
        }

        public Builder response(ResponseDocument response) {
            this.response = response;
            return this;
        }

        public Builder submission(ResponseDocument submission) {
            this.submission = submission;
            return this;
        }

        public EvaluationSnapshot build() {
            return new EvaluationSnapshot(this);
        }
    }
}
