package io.github.cyfko.formstate.core.evaluation;

/**
 * The place of a repeated group below one parent node, whatever the number of its instances.
 *
 * @param parentNodeId node id of the parent, the root id at the top level
 * @param linkId       link id of the repeated group
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SlotKey(long parentNodeId, String linkId) {
}
