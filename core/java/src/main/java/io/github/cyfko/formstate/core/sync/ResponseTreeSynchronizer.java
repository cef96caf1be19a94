package io.github.cyfko.formstate.core.sync;

import io.github.cyfko.formstate.core.exception.SynchronizationException;
import io.github.cyfko.formstate.core.model.Answer;
import io.github.cyfko.formstate.core.model.AnswerOption;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.model.Item;
import io.github.cyfko.formstate.core.model.LinkIdPath;
import io.github.cyfko.formstate.core.model.Quantity;
import io.github.cyfko.formstate.core.model.ResponseAnswer;
import io.github.cyfko.formstate.core.model.ResponseDocument;
import io.github.cyfko.formstate.core.model.ResponseItem;
import io.github.cyfko.formstate.core.model.ResponseNode;
import io.github.cyfko.formstate.core.model.ResponseTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Keeps a response tree structurally aligned with its definition.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Every non-repeating item gets exactly one node among its siblings; missing nodes are
 *       created and seeded from {@code initial} values and initially selected options</li>
 *   <li>Repeated groups get one node per instance and start with none</li>
 *   <li>Group nodes hold their children directly; question nodes hold the nodes of their nested
 *       items under each answer, and an answer without them receives a fresh copy</li>
 *   <li>Nodes are ordered like the items they answer</li>
 *   <li>Orphaned nodes, duplicates of non-repeating items and answers on groups are discarded,
 *       logged and returned as {@link SyncIssue}s</li>
 * </ul>
 * <p>
 * Existing nodes are never re-seeded, which makes synchronization idempotent: synchronizing an
 * already synchronized tree changes nothing.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResponseTreeSynchronizer {

    private static final Logger logger = Logger.getLogger(ResponseTreeSynchronizer.class.getName());

    /**
     * Creates the response tree of a new or resumed session.
     *
     * @param definition the form
     * @param document   response to resume, null for a fresh response
     * @param issues     receives whatever had to be discarded from the document
     * @return a synchronized tree
     */
    public ResponseTree create(FormDefinition definition, ResponseDocument document, List<SyncIssue> issues) {
        Objects.requireNonNull(definition, "definition cannot be null");
        ResponseTree tree = new ResponseTree();
        if (document != null) {
            importLevel(tree, document.items(), definition.getItems(), Holder.of(tree.getRoot()));
        }
        issues.addAll(synchronize(definition, tree));
        return tree;
    }

    private static void importLevel(ResponseTree tree, List<ResponseItem> items, List<Item> levelItems, Holder holder) {
        for (ResponseItem responseItem : items) {
            Item item = levelItems.stream()
                    .filter(i -> i.getLinkId().equals(responseItem.linkId()))
                    .findFirst()
                    .orElse(null);
            ResponseNode node = tree.newNode(responseItem.linkId(), item != null && item.isRepeatedGroup());
            List<Item> childItems = item == null ? List.of() : item.getChildren();
            for (ResponseAnswer responseAnswer : responseItem.answers()) {
                Answer answer = new Answer(responseAnswer.value(), responseAnswer.userEdited());
                node.addAnswer(answer);
                importLevel(tree, responseAnswer.items(), childItems, Holder.of(answer));
            }
            importLevel(tree, responseItem.items(), childItems, Holder.of(node));
            holder.add(node);
        }
    }

    /**
     * Synchronizes the whole tree.
     *
     * @return what had to be discarded
     */
    public List<SyncIssue> synchronize(FormDefinition definition, ResponseTree tree) {
        List<SyncIssue> issues = new ArrayList<>();
        syncChildren(tree, definition.getItems(), Holder.of(tree.getRoot()), "<root>", issues);
        return issues;
    }

    /**
     * Synchronizes one node with the item it answers, recursively.
     *
     * @return what had to be discarded
     */
    public List<SyncIssue> sync(ResponseTree tree, Item item, ResponseNode node) {
        List<SyncIssue> issues = new ArrayList<>();
        syncNode(tree, item, node, issues);
        return issues;
    }

    private void syncNode(ResponseTree tree, Item item, ResponseNode node, List<SyncIssue> issues) {
        String location = location(node);
        if (!item.getType().isQuestion()) {
            if (node.hasAnswers()) {
                report(issues, SyncIssue.Kind.UNEXPECTED_ANSWER, location, item.getLinkId(),
                        node.getAnswers().size() + " answer(s) on " + item.getType() + " item discarded");
                node.clearAnswers();
            }
            syncChildren(tree, item.getChildren(), Holder.of(node), location, issues);
            return;
        }

        for (ResponseNode child : List.copyOf(node.getChildren())) {
            report(issues, SyncIssue.Kind.UNEXPECTED_CHILD, location, child.getLinkId(),
                    "node directly under question discarded, nested items belong under answers");
            child.detach();
        }
        for (Answer answer : node.getAnswers()) {
            if (item.getChildren().isEmpty()) {
                for (ResponseNode child : List.copyOf(answer.getChildren())) {
                    report(issues, SyncIssue.Kind.UNEXPECTED_CHILD, location, child.getLinkId(),
                            "item has no nested items");
                    child.detach();
                }
            } else {
                syncChildren(tree, item.getChildren(), Holder.of(answer), location, issues);
            }
        }
    }

    private void syncChildren(ResponseTree tree, List<Item> items, Holder holder, String location, List<SyncIssue> issues) {
        Map<String, List<ResponseNode>> existing = new LinkedHashMap<>();
        for (ResponseNode node : List.copyOf(holder.nodes())) {
            existing.computeIfAbsent(node.getLinkId(), k -> new ArrayList<>()).add(node);
            node.detach();
        }

        for (Item item : items) {
            List<ResponseNode> matches = existing.remove(item.getLinkId());
            if (item.isRepeatedGroup()) {
                if (matches != null) {
                    for (ResponseNode instance : matches) {
                        holder.add(ensureRepeatedFlag(tree, instance, true));
                        syncNode(tree, item, holder.last(), issues);
                    }
                }
                continue;
            }
            if (matches == null || matches.isEmpty()) {
                holder.add(createNode(tree, item));
                continue;
            }
            ResponseNode kept = ensureRepeatedFlag(tree, matches.get(0), false);
            for (ResponseNode duplicate : matches.subList(1, matches.size())) {
                report(issues, SyncIssue.Kind.DUPLICATE, location, duplicate.getLinkId(),
                        "extra node for non-repeating item discarded");
            }
            holder.add(kept);
            syncNode(tree, item, kept, issues);
        }

        existing.forEach((linkId, orphans) -> report(issues, SyncIssue.Kind.ORPHAN, location, linkId,
                orphans.size() + " node(s) matching no item discarded"));
    }

    /**
     * The repeated flag is fixed at creation; nodes imported with the wrong flag are rebuilt
     * with the same answers and children.
     */
    private static ResponseNode ensureRepeatedFlag(ResponseTree tree, ResponseNode node, boolean repeated) {
        if (node.isRepeatedInstance() == repeated) return node;
        ResponseNode rebuilt = tree.newNode(node.getLinkId(), repeated);
        rebuilt.setTouched(node.isTouched());
        for (ResponseNode child : List.copyOf(node.getChildren())) {
            child.detach();
            rebuilt.addChild(child);
        }
        List<Answer> answers = new ArrayList<>(node.getAnswers());
        node.clearAnswers();
        rebuilt.replaceAnswers(answers);
        return rebuilt;
    }

    /**
     * Creates the node of a new item occurrence, seeded with its initial answers, together with
     * its synchronized subtree.
     */
    public ResponseNode createNode(ResponseTree tree, Item item) {
        ResponseNode node = tree.newNode(item.getLinkId(), item.isRepeatedGroup());
        if (item.getType().isQuestion()) {
            for (Object value : initialValues(item)) {
                node.addAnswer(Answer.of(value));
            }
        }
        syncNode(tree, item, node, new ArrayList<>());
        return node;
    }

    /**
     * Initial answers of an item: its {@code initial} values, except quantities that only name a
     * unit, followed by its initially selected options.
     */
    public static List<Object> initialValues(Item item) {
        List<Object> values = new ArrayList<>();
        for (Object value : item.getInitial()) {
            if (value instanceof Quantity quantity && !quantity.hasValue()) continue;
            values.add(value);
        }
        for (AnswerOption option : item.getAnswerOptions()) {
            if (option.initialSelected()) values.add(option.value());
        }
        return values;
    }

    /**
     * Adds an instance to a repeated group.
     *
     * @param path path of the group; the index of the parent segment selects the answer or
     *             instance the group is nested in
     * @return the new instance
     * @throws SynchronizationException if the path does not lead to a repeated group slot
     */
    public ResponseNode addInstance(FormDefinition definition, ResponseTree tree, LinkIdPath path) {
        Item item = resolveItem(definition, path);
        if (!item.isRepeatedGroup()) {
            throw new SynchronizationException("Item '" + item.getLinkId() + "' is not a repeated group");
        }
        Holder holder = slotHolder(definition, tree, path);
        ResponseNode instance = createNode(tree, item);
        holder.add(instance);
        List<SyncIssue> issues = new ArrayList<>();
        syncChildren(tree, holder.items(definition, path), holder, location(holder), issues);
        logger.fine(() -> String.format("Added instance #%d of '%s'", instance.getNodeId(), path.withoutLastIndex()));
        return instance;
    }

    /**
     * Removes an instance of a repeated group, with its subtree.
     *
     * @param path  path of the group
     * @param index instance index
     * @return the removed instance
     * @throws SynchronizationException if there is no such instance
     */
    public ResponseNode removeInstance(FormDefinition definition, ResponseTree tree, LinkIdPath path, int index) {
        Item item = resolveItem(definition, path);
        if (!item.isRepeatedGroup()) {
            throw new SynchronizationException("Item '" + item.getLinkId() + "' is not a repeated group");
        }
        List<ResponseNode> instances = slotHolder(definition, tree, path).nodes().stream()
                .filter(n -> n.getLinkId().equals(item.getLinkId()))
                .toList();
        if (index < 0 || index >= instances.size()) {
            throw new SynchronizationException("No instance " + index + " of '" + path.withoutLastIndex()
                    + "', it has " + instances.size());
        }
        ResponseNode removed = instances.get(index);
        removed.detach();
        logger.fine(() -> String.format("Removed instance %d (#%d) of '%s'", index, removed.getNodeId(), path.withoutLastIndex()));
        return removed;
    }

    /**
     * Finds the item a path addresses by walking the definition.
     *
     * @throws SynchronizationException if a segment names no item
     */
    public static Item resolveItem(FormDefinition definition, LinkIdPath path) {
        List<Item> level = definition.getItems();
        Item current = null;
        for (LinkIdPath.Segment segment : path.segments()) {
            Optional<Item> match = level.stream().filter(i -> i.getLinkId().equals(segment.linkId())).findFirst();
            if (match.isEmpty()) {
                throw new SynchronizationException("No item '" + segment.linkId() + "' at '" + path + "'");
            }
            current = match.get();
            level = current.getChildren();
        }
        return current;
    }

    private static Holder slotHolder(FormDefinition definition, ResponseTree tree, LinkIdPath path) {
        ResponseNode parent = tree.findParentOf(path)
                .orElseThrow(() -> new SynchronizationException("No response node at the parent of '" + path + "'"));
        if (parent.isRoot()) return Holder.of(parent);
        Item parentItem = resolveItem(definition, new LinkIdPath(path.segments().subList(0, path.depth() - 1)));
        if (!parentItem.getType().isQuestion()) return Holder.of(parent);
        int answerIndex = Math.max(0, path.segments().get(path.depth() - 2).index());
        if (answerIndex >= parent.getAnswers().size()) {
            throw new SynchronizationException("No answer " + answerIndex + " of '" + parentItem.getLinkId()
                    + "' to nest '" + path.lastLinkId() + "' under");
        }
        return Holder.of(parent.getAnswers().get(answerIndex));
    }

    private static String location(ResponseNode node) {
        if (node.isRoot()) return "<root>";
        if (node.getParent() == null && node.getParentAnswer() == null) return node.getLinkId();
        return ResponseTree.pathOf(node).toString();
    }

    private static String location(Holder holder) {
        return holder.answer != null ? location(holder.answer.getOwner()) : location(holder.node);
    }

    private static void report(List<SyncIssue> issues, SyncIssue.Kind kind, String location, String linkId, String message) {
        SyncIssue issue = new SyncIssue(kind, location, linkId, message);
        issues.add(issue);
        logger.warning(() -> String.format("Discarded response data at %s ('%s'): %s", location, linkId, message));
    }

    /**
     * Where a list of sibling nodes lives: directly under a node, or under an answer.
     */
    private static final class Holder {
        private final ResponseNode node;
        private final Answer answer;

        private Holder(ResponseNode node, Answer answer) {
            this.node = node;
            this.answer = answer;
        }

        static Holder of(ResponseNode node) {
            return new Holder(node, null);
        }

        static Holder of(Answer answer) {
            return new Holder(null, answer);
        }

        List<ResponseNode> nodes() {
            return answer != null ? answer.getChildren() : node.getChildren();
        }

        void add(ResponseNode child) {
            if (answer != null) {
                answer.addChild(child);
            } else {
                node.addChild(child);
            }
        }

        ResponseNode last() {
            List<ResponseNode> nodes = nodes();
            return nodes.get(nodes.size() - 1);
        }

        /**
         * @return the items whose nodes live here, given the path of one of them
         */
        List<Item> items(FormDefinition definition, LinkIdPath path) {
            if (path.depth() == 1) return definition.getItems();
            return resolveItem(definition, new LinkIdPath(path.segments().subList(0, path.depth() - 1))).getChildren();
        }
    }
}
