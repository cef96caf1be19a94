package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable node of a {@link ResponseTree}.
 * <p>
 * A node answers one item. Its {@code nodeId} is stable for the life of the session, survives
 * {@link ResponseTree#deepCopy()} and is never reused, so per-node evaluation results stay attached
 * to the right instance when repeated instances are removed and indices shift.
 * </p>
 * <p>
 * Group nodes own their children directly. Question nodes own answers, and the nodes of nested
 * items live under each answer. The synthetic root has a null link id.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResponseNode {

    private final long nodeId;
    private final String linkId;
    private final boolean repeatedInstance;
    private final List<Answer> answers = new ArrayList<>();
    private final List<ResponseNode> children = new ArrayList<>();
    private ResponseNode parent;
    private Answer parentAnswer;
    private boolean touched;

    ResponseNode(long nodeId, String linkId, boolean repeatedInstance) {
        this.nodeId = nodeId;
        this.linkId = linkId;
        this.repeatedInstance = repeatedInstance;
    }

    public long getNodeId() {
        return nodeId;
    }

    public String getLinkId() {
        return linkId;
    }

    public boolean isRoot() {
        return linkId == null;
    }

    /**
     * @return true when this node is one instance of a repeated group
     */
    public boolean isRepeatedInstance() {
        return repeatedInstance;
    }

    /**
     * @return the node above this one, null for the root
     */
    public ResponseNode getParent() {
        return parent;
    }

    /**
     * @return the answer of the parent question this node is nested under, null otherwise
     */
    public Answer getParentAnswer() {
        return parentAnswer;
    }

    void attach(ResponseNode parent, Answer parentAnswer) {
        this.parent = parent;
        this.parentAnswer = parentAnswer;
    }

    /**
     * @return whether the user has edited this node since it was created
     */
    public boolean isTouched() {
        return touched;
    }

    public void setTouched(boolean touched) {
        this.touched = touched;
    }

    public List<Answer> getAnswers() {
        return Collections.unmodifiableList(answers);
    }

    public boolean hasAnswers() {
        return !answers.isEmpty();
    }

    public void addAnswer(Answer answer) {
        answers.add(answer);
        answer.attachTo(this);
    }

    /**
     * Replaces every answer, nested nodes of the previous answers included.
     */
    public void replaceAnswers(List<Answer> newAnswers) {
        for (Answer old : answers) {
            old.attachTo(null);
        }
        answers.clear();
        for (Answer answer : newAnswers) {
            addAnswer(answer);
        }
    }

    public void clearAnswers() {
        replaceAnswers(List.of());
    }

    /**
     * @return the answer values in order
     */
    public List<Object> answerValues() {
        List<Object> values = new ArrayList<>(answers.size());
        for (Answer answer : answers) {
            values.add(answer.getValue());
        }
        return values;
    }

    public List<ResponseNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(ResponseNode child) {
        children.add(child);
        child.attach(this, null);
    }

    public void addChild(int position, ResponseNode child) {
        children.add(position, child);
        child.attach(this, null);
    }

    public boolean removeChild(ResponseNode child) {
        return children.remove(child);
    }

    /**
     * Every node directly below this one: its own children followed by the nodes nested under
     * each answer.
     */
    public List<ResponseNode> childNodes() {
        List<ResponseNode> all = new ArrayList<>(children);
        for (Answer answer : answers) {
            all.addAll(answer.getChildren());
        }
        return all;
    }

    /**
     * @return the nodes stored next to this one, itself included, in order
     */
    public List<ResponseNode> siblingsContainer() {
        return Collections.unmodifiableList(container());
    }

    private List<ResponseNode> container() {
        if (parentAnswer != null) return parentAnswer.mutableChildren();
        if (parent != null) return parent.children;
        return List.of(this);
    }

    /**
     * Removes this node, and its subtree with it, from wherever it is stored.
     *
     * @return false when the node was already detached
     */
    public boolean detach() {
        if (parent == null && parentAnswer == null) return false;
        boolean removed = container().remove(this);
        attach(null, null);
        return removed;
    }

    /**
     * @return position among the siblings sharing this node's link id
     */
    public int instanceIndex() {
        int index = 0;
        for (ResponseNode sibling : container()) {
            if (sibling == this) return index;
            if (sibling.linkId != null && sibling.linkId.equals(linkId)) index++;
        }
        return -1;
    }

    /**
     * Ancestors of this node up to, and excluding, the root. Nearest first.
     */
    public List<ResponseNode> ancestors() {
        List<ResponseNode> result = new ArrayList<>();
        ResponseNode current = parent;
        while (current != null && !current.isRoot()) {
            result.add(current);
            current = current.parent;
        }
        return result;
    }

    @Override
    public String toString() {
        return "ResponseNode[#" + nodeId + " " + (isRoot() ? "<root>" : linkId) + ", answers=" + answers.size() + "]";
    }
}
