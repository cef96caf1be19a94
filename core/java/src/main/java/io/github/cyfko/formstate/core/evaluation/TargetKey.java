package io.github.cyfko.formstate.core.evaluation;

/**
 * One evaluation of one expression node: the response node (or slot parent) it ran for and the
 * id of the expression node.
 *
 * @param targetNodeId     id of the response node, or of the slot's parent for slot level conditions
 * @param expressionNodeId id of the expression node in the dependency graph
 * @author Frank KOSSI
 * @since 1.0.0
 */
record TargetKey(long targetNodeId, int expressionNodeId) {
}
