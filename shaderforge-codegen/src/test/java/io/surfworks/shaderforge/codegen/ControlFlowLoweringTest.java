package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.ShaderSession;
import io.surfworks.shaderforge.graph.ShaderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ControlFlowLowering}.
 */
class ControlFlowLoweringTest {

    private ShaderSession s;
    private Node a;
    private Node b;

    @BeforeEach
    void setUp() {
        s = new ShaderSession();
        a = s.uniform("a", ShaderType.FLOAT);
        b = s.uniform("b", ShaderType.FLOAT);
    }

    @Test
    @DisplayName("A conditional lowers to a declaration and an if/else block")
    void declarationAndBlock() throws CompilationException {
        Node pick = s.conditional(s.lessThan(a, b), a, b);

        CompiledProgram program = new ShaderCompiler().compile(Map.of("gl_PointSize", pick));

        assertEquals(List.of(
                new Statement.Declaration(ShaderType.FLOAT, "t0"),
                new Statement.ControlBlock("a < b",
                        List.of(new Statement.Assignment("t0", "a")),
                        List.of(new Statement.Assignment("t0", "b")))), program.statements());
    }

    @Test
    @DisplayName("Branch-local bindings precede the branch result")
    void branchLocalBindings() throws CompilationException {
        Node k = s.multiply(a, b);
        Node pick = s.conditional(s.lessThan(a, b), 0.0, s.add(k, s.negate(k)));

        CompiledProgram program = new ShaderCompiler().compile(Map.of("gl_PointSize", pick));

        Statement.ControlBlock block = (Statement.ControlBlock) program.statements().get(1);
        assertEquals(List.of(new Statement.Assignment("t0", "0.0")), block.thenBranch());
        assertEquals(List.of(
                new Statement.ValueBinding(ShaderType.FLOAT, "t1", "a * b"),
                new Statement.Assignment("t0", "t1 + -t1")), block.elseBranch());
    }

    @Test
    @DisplayName("A conditional used as a condition is lowered first")
    void conditionalCondition() throws CompilationException {
        Node flag = s.conditional(s.greaterThan(a, 0.0), true, false);
        Node pick = s.conditional(flag, a, b);

        CompiledProgram program = new ShaderCompiler().compile(Map.of("gl_PointSize", pick));

        assertEquals(4, program.statements().size());
        assertEquals(new Statement.Declaration(ShaderType.BOOL, "t0"), program.statements().get(0));
        Statement.ControlBlock second = (Statement.ControlBlock) program.statements().get(3);
        assertEquals("t0", second.condition());
    }

    @Test
    @DisplayName("Branch scopes are looked up by operand index")
    void branchLookup() throws CompilationException {
        Node pick = s.conditional(s.lessThan(a, b), a, b);
        ControlFlowLowering lowering = new ControlFlowLowering();

        assertThrows(IllegalStateException.class, () -> lowering.branch(pick, 1));

        List<Scope> scopes = lowering.openBranches(pick, Scope.root(), 1);
        assertSame(scopes.get(0), lowering.branch(pick, 1));
        assertSame(scopes.get(1), lowering.branch(pick, 2));
        assertEquals(Scope.Branch.THEN, scopes.get(0).branch());
        assertEquals(Scope.Branch.ELSE, scopes.get(1).branch());
        assertSame(pick, scopes.get(0).owner());
        assertThrows(IllegalArgumentException.class, () -> lowering.branch(pick, 0));
    }

    @Test
    @DisplayName("Uses through the condition stay in the enclosing scope")
    void useScopes() {
        Node test = s.lessThan(a, b);
        Node pick = s.conditional(test, a, b);
        ControlFlowLowering lowering = new ControlFlowLowering();
        Scope root = Scope.root();
        List<Scope> scopes = lowering.openBranches(pick, root, 1);

        assertSame(root, lowering.useScope(new NodeGraph.Reference(pick, 0), root));
        assertSame(scopes.get(0), lowering.useScope(new NodeGraph.Reference(pick, 1), root));
        assertSame(scopes.get(1), lowering.useScope(new NodeGraph.Reference(pick, 2), root));
        assertSame(scopes.get(0), lowering.useScope(new NodeGraph.Reference(test, 0), scopes.get(0)));
    }
}
