package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns conditional nodes into if/else blocks.
 *
 * <p>A conditional {@code c ? a : b} placed in scope S lowers to
 * <pre>{@code
 * T t;            // in S
 * if (c) {        // in S
 *   ...           // statements only the then-branch needs
 *   t = a;
 * } else {
 *   ...           // statements only the else-branch needs
 *   t = b;
 * }
 * }</pre>
 *
 * <p>The condition is evaluated in S; each branch value is evaluated in its
 * own branch scope. Anything used by a single branch is therefore computed
 * inside that branch only, while values both branches share are placed in S
 * before the {@code if}.
 */
final class ControlFlowLowering {

    private final Map<Long, Scope[]> branches = new HashMap<>();

    /**
     * Opens the then- and else-scopes of a conditional placed in {@code enclosing}.
     *
     * @param firstIndex creation number for the then-scope; the else-scope gets the next one
     * @return the two new scopes
     */
    List<Scope> openBranches(Node conditional, Scope enclosing, int firstIndex) {
        Scope thenScope = enclosing.branch(conditional, Scope.Branch.THEN, firstIndex);
        Scope elseScope = enclosing.branch(conditional, Scope.Branch.ELSE, firstIndex + 1);
        branches.put(conditional.id(), new Scope[] {thenScope, elseScope});
        return List.of(thenScope, elseScope);
    }

    /**
     * The branch scope evaluating operand 1 (then) or 2 (else) of a conditional.
     */
    Scope branch(Node conditional, int operandIndex) {
        Scope[] scopes = branches.get(conditional.id());
        if (scopes == null) {
            throw new IllegalStateException("Conditional #" + conditional.id() + " has not been lowered");
        }
        return switch (operandIndex) {
            case 1 -> scopes[0];
            case 2 -> scopes[1];
            default -> throw new IllegalArgumentException("Operand " + operandIndex + " is not a branch");
        };
    }

    /**
     * The scope a use is evaluated in.
     *
     * @param ref         an operand reference
     * @param parentScope the scope the referencing node is evaluated in
     */
    Scope useScope(NodeGraph.Reference ref, Scope parentScope) {
        if (ref.parent().kind() == NodeKind.CONDITIONAL && ref.operandIndex() > 0) {
            return branch(ref.parent(), ref.operandIndex());
        }
        return parentScope;
    }

    /**
     * Climbs from a site to the statement of {@code target} that contains it:
     * either the site itself or the if-block holding the branch it sits in.
     */
    StatementScheduler.Site enclosingSite(StatementScheduler.Site site, Scope target,
                                          Map<Long, StatementScheduler.Site> sites) {
        StatementScheduler.Site current = site;
        while (current.scope() != target) {
            if (current.scope().isRoot()) {
                throw new IllegalStateException(site + " is not nested in " + target);
            }
            current = sites.get(current.scope().owner().id());
        }
        return current;
    }

    /**
     * Builds the statement tree of {@code main} from a schedule whose
     * temporaries are named and bound.
     *
     * <p>Scopes are filled innermost first, so every branch list is complete
     * before the block holding it is built.
     *
     * @return statements of the root scope
     */
    List<Statement> lower(StatementScheduler.Schedule schedule, CompilationContext ctx) {
        List<Scope> scopes = schedule.scopes();
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Scope scope = scopes.get(i);
            List<Statement> out = ctx.statements(scope);
            for (Node node : schedule.statementsIn(scope)) {
                String name = ctx.nameOf(node);
                switch (node.kind()) {
                    case TERM -> out.add(new Statement.ValueBinding(node.type(), name, CodeEmitter.definition(node, ctx)));
                    case CONDITIONAL -> {
                        out.add(new Statement.Declaration(node.type(), name));
                        out.add(new Statement.ControlBlock(
                                CodeEmitter.expression(node.operand(0), ctx),
                                branchBody(node, 1, name, ctx),
                                branchBody(node, 2, name, ctx)));
                    }
                    case LITERAL, VARIABLE ->
                            throw new IllegalStateException("Atom #" + node.id() + " cannot be hoisted");
                }
            }
        }
        return ctx.statements(schedule.root());
    }

    private List<Statement> branchBody(Node conditional, int operandIndex, String result, CompilationContext ctx) {
        List<Statement> body = new ArrayList<>(ctx.statements(branch(conditional, operandIndex)));
        body.add(new Statement.Assignment(result, CodeEmitter.expression(conditional.operand(operandIndex), ctx)));
        return body;
    }
}
