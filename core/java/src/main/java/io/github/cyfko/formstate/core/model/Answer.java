package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One answer of a question node.
 * <p>
 * The value is fixed once created; changing an answer replaces it. The {@code userEdited} flag
 * records a manual entry that calculated values must not overwrite. Items nested under a
 * question live in the {@link #getChildren() children} of each of its answers.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Answer {

    private final Object value;
    private boolean userEdited;
    private final List<ResponseNode> children = new ArrayList<>();
    private ResponseNode owner;

    public Answer(Object value, boolean userEdited) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.userEdited = userEdited;
    }

    public static Answer of(Object value) {
        return new Answer(value, false);
    }

    public static Answer edited(Object value) {
        return new Answer(value, true);
    }

    public Object getValue() {
        return value;
    }

    public boolean isUserEdited() {
        return userEdited;
    }

    public void setUserEdited(boolean userEdited) {
        this.userEdited = userEdited;
    }

    /**
     * @return the node holding this answer, null while detached
     */
    public ResponseNode getOwner() {
        return owner;
    }

    void attachTo(ResponseNode owner) {
        this.owner = owner;
        for (ResponseNode child : children) {
            child.attach(owner, this);
        }
    }

    public List<ResponseNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(ResponseNode child) {
        children.add(child);
        child.attach(owner, this);
    }

    public boolean removeChild(ResponseNode child) {
        return children.remove(child);
    }

    List<ResponseNode> mutableChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "Answer[" + value + (userEdited ? ", edited" : "") + "]";
    }
}
