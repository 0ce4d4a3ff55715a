package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;

import java.util.List;
import java.util.Map;

/**
 * Use analysis of the nodes reachable from a set of output bindings.
 *
 * <p>NodeGraph records, for every reachable node:
 * <ul>
 *   <li>each {@link Reference} to it: an operand slot of a parent, or an output binding</li>
 *   <li>the number of distinct parents referencing it, and its in-degree</li>
 *   <li>its position in a topological order where operands precede their users</li>
 * </ul>
 *
 * <p>Built by {@link GraphWalker#walk(List)}.
 */
public final class NodeGraph {

    /**
     * One use of a node.
     *
     * @param parent       the referencing node, or null for an output binding
     * @param operandIndex the operand slot within {@code parent}, or the binding index
     */
    public record Reference(Node parent, int operandIndex) {
        public boolean isOutput() {
            return parent == null;
        }
    }

    private final Map<Long, Node> nodes;
    private final List<Node> topologicalOrder;
    private final Map<Long, List<Reference>> references;
    private final Map<Long, Integer> parentCounts;

    NodeGraph(Map<Long, Node> nodes, List<Node> topologicalOrder,
              Map<Long, List<Reference>> references, Map<Long, Integer> parentCounts) {
        this.nodes = nodes;
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.references = references;
        this.parentCounts = parentCounts;
    }

    /**
     * Returns the reachable node with the given id, or null.
     */
    public Node node(long id) {
        return nodes.get(id);
    }

    public boolean contains(Node node) {
        return nodes.get(node.id()) == node;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Reachable nodes, every node after all of its operands.
     */
    public List<Node> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * All uses of a node: output bindings first, then operand slots in walk order.
     */
    public List<Reference> references(Node node) {
        return references.getOrDefault(node.id(), List.of());
    }

    /**
     * Number of uses, counting every operand slot and output binding.
     *
     * <p>{@code add(s, s)} references {@code s} twice.
     */
    public int referenceCount(Node node) {
        return references(node).size();
    }

    /**
     * Number of distinct parent nodes that have this node as an operand.
     */
    public int parentCount(Node node) {
        return parentCounts.getOrDefault(node.id(), 0);
    }

    /**
     * Number of distinct users: parent nodes plus output bindings.
     *
     * <p>{@code add(s, s)} is one user of {@code s}; a node bound to two
     * output slots has two.
     */
    public int inDegree(Node node) {
        int outputs = 0;
        for (Reference ref : references(node)) {
            if (!ref.isOutput()) {
                break;
            }
            outputs++;
        }
        return parentCount(node) + outputs;
    }

    @Override
    public String toString() {
        return String.format("NodeGraph[nodes=%d]", nodes.size());
    }
}
