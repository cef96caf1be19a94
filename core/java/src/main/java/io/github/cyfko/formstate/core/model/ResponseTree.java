package io.github.cyfko.formstate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Mutable response of one editing session.
 * <p>
 * The tree owns a synthetic root and hands out node ids. It is mutated only on the session's
 * mutation queue; evaluation passes work on a {@link #deepCopy()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResponseTree {

    private final ResponseNode root;
    private long nextNodeId;

    public ResponseTree() {
        this.root = new ResponseNode(0L, null, false);
        this.nextNodeId = 1L;
    }

    private ResponseTree(ResponseNode root, long nextNodeId) {
        this.root = root;
        this.nextNodeId = nextNodeId;
    }

    public ResponseNode getRoot() {
        return root;
    }

    /**
     * Creates a detached node with a fresh id.
     *
     * @param linkId           link id of the answered item
     * @param repeatedInstance whether the node is an instance of a repeated group
     */
    public ResponseNode newNode(String linkId, boolean repeatedInstance) {
        return new ResponseNode(nextNodeId++, linkId, repeatedInstance);
    }

    /**
     * Copies the whole tree. Node ids, flags and answers are preserved; answer values are shared
     * since they are immutable.
     */
    public ResponseTree deepCopy() {
        ResponseNode rootCopy = new ResponseNode(root.getNodeId(), null, false);
        copyChildren(root, rootCopy);
        return new ResponseTree(rootCopy, nextNodeId);
    }

    private static void copyChildren(ResponseNode source, ResponseNode target) {
        for (ResponseNode child : source.getChildren()) {
            target.addChild(copyNode(child));
        }
        for (Answer answer : source.getAnswers()) {
            Answer answerCopy = new Answer(answer.getValue(), answer.isUserEdited());
            for (ResponseNode nested : answer.getChildren()) {
                answerCopy.addChild(copyNode(nested));
            }
            target.addAnswer(answerCopy);
        }
    }

    private static ResponseNode copyNode(ResponseNode source) {
        ResponseNode copy = new ResponseNode(source.getNodeId(), source.getLinkId(), source.isRepeatedInstance());
        copy.setTouched(source.isTouched());
        copyChildren(source, copy);
        return copy;
    }

    /**
     * @return every node except the root, in document order
     */
    public List<ResponseNode> nodes() {
        List<ResponseNode> result = new ArrayList<>();
        collect(root, result);
        return Collections.unmodifiableList(result);
    }

    private static void collect(ResponseNode node, List<ResponseNode> sink) {
        for (ResponseNode child : node.childNodes()) {
            sink.add(child);
            collect(child, sink);
        }
    }

    public Optional<ResponseNode> findById(long nodeId) {
        if (nodeId == root.getNodeId()) return Optional.of(root);
        return nodes().stream().filter(n -> n.getNodeId() == nodeId).findFirst();
    }

    /**
     * @return every node answering the given item, in document order
     */
    public List<ResponseNode> nodesFor(String linkId) {
        List<ResponseNode> result = new ArrayList<>();
        for (ResponseNode node : nodes()) {
            if (linkId.equals(node.getLinkId())) result.add(node);
        }
        return result;
    }

    /**
     * Resolves a path to a node.
     * <p>
     * On a repeated group an unindexed segment means the first instance. On a question with
     * nested items an unindexed segment followed by more segments descends into the first answer.
     * </p>
     *
     * @return the node, empty when the path leads nowhere
     */
    public Optional<ResponseNode> find(LinkIdPath path) {
        ResponseNode current = root;
        List<LinkIdPath.Segment> segments = path.segments();
        int previousIndex = LinkIdPath.Segment.NO_INDEX;
        for (LinkIdPath.Segment segment : segments) {
            List<ResponseNode> container = containerBelow(current, previousIndex);
            if (container == null) return Optional.empty();
            ResponseNode match = select(container, segment);
            if (match == null) return Optional.empty();
            current = match;
            previousIndex = match.isRepeatedInstance() ? LinkIdPath.Segment.NO_INDEX : segment.index();
        }
        return Optional.of(current);
    }

    /**
     * Resolves the list the nodes of the last segment are stored in, whether or not such nodes
     * exist yet. Used to address the slot of a repeated group.
     *
     * @return the container, empty when the parent path leads nowhere
     */
    public Optional<ResponseNode> findParentOf(LinkIdPath path) {
        if (path.depth() == 1) return Optional.of(root);
        return find(new LinkIdPath(path.segments().subList(0, path.depth() - 1)));
    }

    /**
     * Nodes stored under {@code parent} for the answer (or direct children) selected by the
     * index of the parent's segment.
     */
    public static List<ResponseNode> containerBelow(ResponseNode parent, int answerIndex) {
        if (parent.isRoot() || !parent.getChildren().isEmpty() || !parent.hasAnswers()) {
            return parent.getChildren();
        }
        int index = answerIndex == LinkIdPath.Segment.NO_INDEX ? 0 : answerIndex;
        if (index >= parent.getAnswers().size()) return null;
        return parent.getAnswers().get(index).getChildren();
    }

    private static ResponseNode select(List<ResponseNode> container, LinkIdPath.Segment segment) {
        int wanted = segment.index();
        int seen = 0;
        for (ResponseNode node : container) {
            if (!segment.linkId().equals(node.getLinkId())) continue;
            if (!node.isRepeatedInstance()) return node;
            if (wanted == LinkIdPath.Segment.NO_INDEX || wanted == seen) return node;
            seen++;
        }
        return null;
    }

    /**
     * Computes the path of a node. Instances of repeated groups carry their instance index, and a
     * question above a nested node carries the index of the answer the node is nested under.
     */
    public static LinkIdPath pathOf(ResponseNode node) {
        if (node.isRoot()) {
            throw new IllegalArgumentException("The root has no path");
        }
        List<LinkIdPath.Segment> reversed = new ArrayList<>();
        ResponseNode current = node;
        ResponseNode below = null;
        while (current != null && !current.isRoot()) {
            int index = LinkIdPath.Segment.NO_INDEX;
            if (current.isRepeatedInstance()) {
                index = current.instanceIndex();
            } else if (below != null && below.getParentAnswer() != null) {
                index = current.getAnswers().indexOf(below.getParentAnswer());
            }
            reversed.add(new LinkIdPath.Segment(current.getLinkId(), index));
            below = current;
            current = current.getParent();
        }
        Collections.reverse(reversed);
        return new LinkIdPath(reversed);
    }

    /**
     * Exports the tree.
     *
     * @param formId  id of the form the response answers
     * @param include nodes rejected by this filter are left out together with their subtrees
     */
    public ResponseDocument toDocument(String formId, Predicate<ResponseNode> include) {
        return new ResponseDocument(formId, exportLevel(root.getChildren(), include));
    }

    private static List<ResponseItem> exportLevel(List<ResponseNode> nodes, Predicate<ResponseNode> include) {
        List<ResponseItem> items = new ArrayList<>();
        for (ResponseNode node : nodes) {
            if (!include.test(node)) continue;
            List<ResponseAnswer> answers = new ArrayList<>();
            for (Answer answer : node.getAnswers()) {
                answers.add(new ResponseAnswer(answer.getValue(), answer.isUserEdited(),
                        exportLevel(answer.getChildren(), include)));
            }
            items.add(new ResponseItem(node.getLinkId(), answers, exportLevel(node.getChildren(), include)));
        }
        return items;
    }
}
