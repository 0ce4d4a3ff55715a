package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Depth-first traversal from output roots, using an explicit stack so that
 * expression depth never grows the call stack.
 *
 * <p>Each node is expanded once however many parents share it. Nodes are
 * identified by id; a second object carrying an id already seen, or an id
 * met again on its own path, fails the walk.
 */
public final class GraphWalker {

    private static final Logger LOG = Logger.getLogger(GraphWalker.class.getName());

    private GraphWalker() {}

    /**
     * Walks every node reachable from the roots.
     *
     * @param roots root nodes in output binding order; a root may repeat
     * @return the use analysis
     * @throws CompilationException with {@link Violation#CYCLE} or {@link Violation#IDENTITY_CONFLICT}
     */
    public static NodeGraph walk(List<Node> roots) throws CompilationException {
        Map<Long, Node> visited = new LinkedHashMap<>();
        Set<Long> onPath = new HashSet<>();
        List<Node> order = new ArrayList<>();
        Map<Long, List<NodeGraph.Reference>> references = new HashMap<>();
        Map<Long, Set<Long>> parents = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (int i = 0; i < roots.size(); i++) {
            references.computeIfAbsent(roots.get(i).id(), k -> new ArrayList<>()).add(new NodeGraph.Reference(null, i));
        }
        for (Node root : roots) {
            if (enter(root, visited, onPath, stack)) {
                drain(stack, visited, onPath, order, references, parents);
            }
        }

        Map<Long, Integer> parentCounts = new HashMap<>();
        parents.forEach((id, set) -> parentCounts.put(id, set.size()));

        LOG.fine(() -> String.format("walked %d nodes from %d roots", order.size(), roots.size()));
        return new NodeGraph(visited, order, references, parentCounts);
    }

    private static void drain(Deque<Frame> stack, Map<Long, Node> visited, Set<Long> onPath, List<Node> order,
                              Map<Long, List<NodeGraph.Reference>> references, Map<Long, Set<Long>> parents)
            throws CompilationException {
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<Node> operands = frame.node.operands();
            if (frame.next < operands.size()) {
                int index = frame.next++;
                Node child = operands.get(index);
                references.computeIfAbsent(child.id(), k -> new ArrayList<>())
                        .add(new NodeGraph.Reference(frame.node, index));
                parents.computeIfAbsent(child.id(), k -> new HashSet<>()).add(frame.node.id());
                enter(child, visited, onPath, stack);
            } else {
                stack.pop();
                onPath.remove(frame.node.id());
                order.add(frame.node);
            }
        }
    }

    /**
     * Pushes a node not seen before. Returns false if it was already expanded.
     */
    private static boolean enter(Node node, Map<Long, Node> visited, Set<Long> onPath, Deque<Frame> stack)
            throws CompilationException {
        if (onPath.contains(node.id())) {
            throw new CompilationException(Violation.CYCLE, node,
                    "cyclic reference: node id is already on the current path");
        }
        Node seen = visited.get(node.id());
        if (seen == null) {
            visited.put(node.id(), node);
            onPath.add(node.id());
            stack.push(new Frame(node));
            return true;
        }
        if (seen != node) {
            throw new CompilationException(Violation.IDENTITY_CONFLICT, node,
                    "a different node already uses this id; nodes from different sessions cannot be mixed");
        }
        return false;
    }

    private static final class Frame {
        final Node node;
        int next;

        Frame(Node node) {
            this.node = node;
        }
    }
}
