package io.github.cyfko.formstate.core.model;

import io.github.cyfko.formstate.core.exception.FormDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable definition tree of a questionnaire.
 * <p>
 * Besides its top-level items a definition may declare form-level variables, visible to every
 * expression of the form. Link ids must be unique among siblings. The same link id may appear in
 * different branches; lookups by link id then return every match in document order and
 * expressions resolve them against the nearest scope.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormDefinition {

    private final String id;
    private final List<Item> items;
    private final List<Expression> variables;
    private final List<Item> preOrder;
    private final Map<String, List<Item>> itemsByLinkId;
    private final Map<Item, Item> parents;

    public FormDefinition(String id, List<Item> items, List<Expression> variables) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.items = List.copyOf(Objects.requireNonNull(items, "items cannot be null"));
        this.variables = variables == null ? List.of() : List.copyOf(variables);
        this.preOrder = new ArrayList<>();
        this.itemsByLinkId = new LinkedHashMap<>();
        this.parents = new IdentityHashMap<>();
        index(this.items, null);
    }

    public static FormDefinition of(String id, Item... items) {
        return new FormDefinition(id, List.of(items), List.of());
    }

    private void index(List<Item> level, Item parent) {
        Set<String> siblings = new HashSet<>();
        for (Item item : level) {
            if (!siblings.add(item.getLinkId())) {
                throw new FormDefinitionException("Duplicate linkId '" + item.getLinkId() + "' among the children of "
                        + (parent == null ? "form '" + id + "'" : "item '" + parent.getLinkId() + "'"));
            }
            preOrder.add(item);
            itemsByLinkId.computeIfAbsent(item.getLinkId(), k -> new ArrayList<>()).add(item);
            if (parent != null) {
                parents.put(item, parent);
            }
            index(item.getChildren(), item);
        }
    }

    public String getId() {
        return id;
    }

    public List<Item> getItems() {
        return items;
    }

    public List<Expression> getVariables() {
        return variables;
    }

    /**
     * @return the first item with this link id in document order
     */
    public Optional<Item> findItem(String linkId) {
        List<Item> matches = itemsByLinkId.get(linkId);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * @return every item with this link id in document order
     */
    public List<Item> itemsFor(String linkId) {
        return itemsByLinkId.getOrDefault(linkId, List.of());
    }

    /**
     * @return the parent item, empty for top-level items
     */
    public Optional<Item> parentOf(Item item) {
        return Optional.ofNullable(parents.get(item));
    }

    /**
     * Ancestors of an item, nearest first.
     */
    public List<Item> ancestorsOf(Item item) {
        List<Item> ancestors = new ArrayList<>();
        Item current = parents.get(item);
        while (current != null) {
            ancestors.add(current);
            current = parents.get(current);
        }
        return ancestors;
    }

    /**
     * @return position of the item in document (pre-)order, -1 if it is not part of this form
     */
    public int documentIndex(Item item) {
        for (int i = 0; i < preOrder.size(); i++) {
            if (preOrder.get(i) == item) return i;
        }
        return -1;
    }

    /**
     * @return every item in document (pre-)order
     */
    public List<Item> flattened() {
        return Collections.unmodifiableList(preOrder);
    }

    /**
     * Top-level groups rendered as pages. The form is paginated only when every top-level item
     * is such a page; otherwise the list is empty.
     */
    public List<Item> pages() {
        if (items.isEmpty() || !items.stream().allMatch(Item::isPage)) {
            return List.of();
        }
        return items;
    }

    @Override
    public String toString() {
        return "FormDefinition[" + id + ", items=" + preOrder.size() + "]";
    }
}
