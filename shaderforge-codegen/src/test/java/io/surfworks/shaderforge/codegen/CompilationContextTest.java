package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.codegen.CompilationContext.Rendering;
import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.Op;
import io.surfworks.shaderforge.graph.ShaderSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link CompilationContext}.
 */
class CompilationContextTest {

    private final ShaderSession s = new ShaderSession();

    @Test
    @DisplayName("Temporaries count up from the prefix")
    void sequentialNames() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), Set.of());

        assertEquals("t0", ctx.allocate(s.literal(1.0)));
        assertEquals("t1", ctx.allocate(s.literal(2.0)));
        assertEquals(2, ctx.temporaryCount());
    }

    @Test
    @DisplayName("Variable names are never reused")
    void skipsVariableNames() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), List.of("t0", "t2"));

        assertEquals("t1", ctx.allocate(s.literal(1.0)));
        assertEquals("t3", ctx.allocate(s.literal(2.0)));
    }

    @Test
    @DisplayName("Keywords and type names are skipped")
    void skipsKeywords() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults().withTemporaryPrefix("vec"), Set.of());

        assertEquals("vec0", ctx.allocate(s.literal(1.0)));
        assertEquals("vec1", ctx.allocate(s.literal(2.0)));
        assertEquals("vec5", ctx.allocate(s.literal(3.0)));
    }

    @Test
    @DisplayName("Built-in function names are skipped")
    void skipsBuiltinFunctions() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults().withTemporaryPrefix("exp"), Set.of());

        assertEquals("exp0", ctx.allocate(s.literal(1.0)));
        assertEquals("exp1", ctx.allocate(s.literal(2.0)));
        assertEquals("exp3", ctx.allocate(s.literal(3.0)));
    }

    @Test
    @DisplayName("A node gets one temporary")
    void allocateOnce() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), Set.of());
        Node node = s.literal(1.0);
        ctx.allocate(node);

        assertThrows(IllegalStateException.class, () -> ctx.allocate(node));
        assertEquals("t0", ctx.nameOf(node));
    }

    @Test
    @DisplayName("Lookups of unknown nodes fail loudly")
    void unknownNodes() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), Set.of());
        Node node = s.literal(1.0);

        assertThrows(IllegalStateException.class, () -> ctx.nameOf(node));
        assertNull(ctx.bound(node));
    }

    @Test
    @DisplayName("Bound renderings are keyed by node id")
    void renderings() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), Set.of());
        Node node = s.add(1.0, 2.0);
        Rendering name = new Rendering("t0", Op.Precedence.PRIMARY);

        ctx.bind(node, name);

        assertSame(name, ctx.bound(node));
        assertNull(ctx.bound(node.operand(0)));
    }

    @Test
    @DisplayName("Each scope accumulates its own statement list")
    void statementLists() {
        CompilationContext ctx = new CompilationContext(CompilerConfig.defaults(), Set.of());
        Scope root = Scope.root();
        Scope branch = root.branch(s.literal(true), Scope.Branch.THEN, 1);

        ctx.statements(root).add(new Statement.Assignment("gl_PointSize", "1.0"));

        assertEquals(1, ctx.statements(root).size());
        assertEquals(0, ctx.statements(branch).size());
        assertSame(ctx.config(), ctx.config());
    }
}
