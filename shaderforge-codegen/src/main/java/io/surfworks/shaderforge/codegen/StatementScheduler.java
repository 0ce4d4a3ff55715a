package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decides which nodes become statements, where they go and in which order.
 *
 * <p>Policy:
 * <ul>
 *   <li>literals and variables are written in place</li>
 *   <li>conditionals are always hoisted into a temporary</li>
 *   <li>terms with more than one user are hoisted, so they are evaluated once</li>
 *   <li>terms with a single user are inlined there, once per operand slot</li>
 * </ul>
 *
 * <p>A hoisted node is placed in the innermost scope enclosing all of its
 * uses. Within a scope, statements follow their dependencies; among
 * statements that are ready at the same time the lower node id goes first.
 */
final class StatementScheduler {

    private static final Logger LOG = Logger.getLogger(StatementScheduler.class.getName());

    /**
     * Where a node's text ends up.
     *
     * @param owner    the hoisted node whose statement holds the text, or the
     *                 conditional whose branch result holds it, or null for an output write
     * @param scope    the scope the statement belongs to
     * @param terminal true for branch results and output writes, which always close their scope
     */
    record Site(Node owner, Scope scope, boolean terminal) {
        static Site statement(Node owner, Scope scope) {
            return new Site(owner, scope, false);
        }

        static Site terminal(Node owner, Scope scope) {
            return new Site(owner, scope, true);
        }
    }

    /**
     * The scheduling result.
     */
    static final class Schedule {
        private final Scope root;
        private final List<Scope> scopes;
        private final Set<Long> hoisted;
        private final Map<Long, Scope> placements;
        private final Map<Scope, List<Node>> ordered;

        Schedule(Scope root, List<Scope> scopes, Set<Long> hoisted,
                 Map<Long, Scope> placements, Map<Scope, List<Node>> ordered) {
            this.root = root;
            this.scopes = List.copyOf(scopes);
            this.hoisted = hoisted;
            this.placements = placements;
            this.ordered = ordered;
        }

        Scope root() {
            return root;
        }

        /**
         * All scopes, each after the scope enclosing it.
         */
        List<Scope> scopes() {
            return scopes;
        }

        boolean isHoisted(Node node) {
            return hoisted.contains(node.id());
        }

        int hoistedCount() {
            return hoisted.size();
        }

        /**
         * The scope a term or conditional is evaluated in.
         */
        Scope scopeOf(Node node) {
            return placements.get(node.id());
        }

        /**
         * Hoisted nodes placed in a scope, in emission order.
         */
        List<Node> statementsIn(Scope scope) {
            return ordered.getOrDefault(scope, List.of());
        }
    }

    private final NodeGraph graph;
    private final ControlFlowLowering lowering;

    StatementScheduler(NodeGraph graph, ControlFlowLowering lowering) {
        this.graph = graph;
        this.lowering = lowering;
    }

    /**
     * True if the node gets its own statement and temporary.
     */
    boolean shouldHoist(Node node) {
        return switch (node.kind()) {
            case LITERAL, VARIABLE -> false;
            case CONDITIONAL -> true;
            case TERM -> graph.inDegree(node) > 1;
        };
    }

    Schedule schedule() {
        List<Node> order = graph.topologicalOrder();
        Scope root = Scope.root();
        List<Scope> scopes = new ArrayList<>();
        scopes.add(root);

        Set<Long> hoisted = new HashSet<>();
        for (Node node : order) {
            if (shouldHoist(node)) {
                hoisted.add(node.id());
            }
        }

        // Users before operands, so every use scope is known when a node is placed.
        Map<Long, Scope> placements = new HashMap<>();
        Map<Long, Site> sites = new HashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            Node node = order.get(i);
            if (node.isAtom()) {
                continue;
            }
            Scope scope = null;
            for (NodeGraph.Reference ref : graph.references(node)) {
                Scope use = ref.isOutput() ? root : lowering.useScope(ref, placements.get(ref.parent().id()));
                scope = scope == null ? use : Scope.commonAncestor(scope, use);
            }
            placements.put(node.id(), scope);
            if (node.kind() == NodeKind.CONDITIONAL) {
                scopes.addAll(lowering.openBranches(node, scope, scopes.size()));
            }
            if (hoisted.contains(node.id())) {
                sites.put(node.id(), Site.statement(node, scope));
            } else {
                sites.put(node.id(), siteOfUse(graph.references(node).get(0), root, sites));
            }
        }

        // Dependencies between statements of the same scope.
        Map<Node, Set<Node>> edges = new HashMap<>();
        Map<Scope, List<Node>> members = new LinkedHashMap<>();
        for (Node node : order) {
            if (!hoisted.contains(node.id())) {
                continue;
            }
            Scope target = placements.get(node.id());
            members.computeIfAbsent(target, s -> new ArrayList<>()).add(node);
            for (NodeGraph.Reference ref : graph.references(node)) {
                Site site = lowering.enclosingSite(siteOfUse(ref, root, sites), target, sites);
                if (!site.terminal()) {
                    edges.computeIfAbsent(node, n -> new LinkedHashSet<>()).add(site.owner());
                }
            }
        }

        Map<Scope, List<Node>> ordered = new HashMap<>();
        for (Map.Entry<Scope, List<Node>> entry : members.entrySet()) {
            ordered.put(entry.getKey(), order(entry.getKey(), entry.getValue(), edges));
        }

        LOG.fine(() -> String.format("hoisted %d of %d nodes into %d scopes",
                hoisted.size(), order.size(), scopes.size()));
        return new Schedule(root, scopes, hoisted, placements, ordered);
    }

    /**
     * Where the text of a use ends up. Parents must already have sites.
     */
    private Site siteOfUse(NodeGraph.Reference ref, Scope root, Map<Long, Site> sites) {
        if (ref.isOutput()) {
            return Site.terminal(null, root);
        }
        Node parent = ref.parent();
        if (parent.kind() == NodeKind.CONDITIONAL && ref.operandIndex() > 0) {
            return Site.terminal(parent, lowering.branch(parent, ref.operandIndex()));
        }
        return sites.get(parent.id());
    }

    /**
     * Kahn's algorithm over one scope's statements, lowest id first among ready ones.
     */
    private static List<Node> order(Scope scope, List<Node> nodes, Map<Node, Set<Node>> edges) {
        Map<Node, Integer> pending = new HashMap<>();
        for (Node node : nodes) {
            pending.putIfAbsent(node, 0);
            for (Node user : edges.getOrDefault(node, Set.of())) {
                pending.merge(user, 1, Integer::sum);
            }
        }
        PriorityQueue<Node> ready = new PriorityQueue<>(Comparator.comparingLong(Node::id));
        for (Node node : nodes) {
            if (pending.get(node) == 0) {
                ready.add(node);
            }
        }
        List<Node> result = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node next = ready.poll();
            result.add(next);
            for (Node user : edges.getOrDefault(next, Set.of())) {
                if (pending.merge(user, -1, Integer::sum) == 0) {
                    ready.add(user);
                }
            }
        }
        if (result.size() != nodes.size()) {
            throw new IllegalStateException("dependency cycle among statements of " + scope);
        }
        return result;
    }

    /**
     * Names every hoisted node, in the order its statement appears in the text.
     */
    void nameTemporaries(Schedule schedule, CompilationContext ctx) {
        Deque<Iterator<Node>> stack = new ArrayDeque<>();
        stack.push(schedule.statementsIn(schedule.root()).iterator());
        while (!stack.isEmpty()) {
            Iterator<Node> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                continue;
            }
            Node node = it.next();
            ctx.allocate(node);
            if (node.kind() == NodeKind.CONDITIONAL) {
                stack.push(schedule.statementsIn(lowering.branch(node, 2)).iterator());
                stack.push(schedule.statementsIn(lowering.branch(node, 1)).iterator());
            }
        }
    }
}
