package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.codegen.CompilationContext.Rendering;
import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.Op;
import io.surfworks.shaderforge.graph.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Renders expressions and statements as GLSL ES 1.00 text.
 *
 * <p>Float literals always carry a fractional part; operands of infix and
 * prefix operators are parenthesised only where precedence requires it.
 * Expression text is produced once per statement directly into its buffer,
 * so memory stays proportional to the output however deep terms nest.
 */
final class CodeEmitter {

    private final CompilerConfig config;

    CodeEmitter(CompilerConfig config) {
        this.config = config;
    }

    // ==================== Expressions ====================

    /**
     * Binds the text every atom, temporary and conditional stands for.
     * Inlined terms stay unbound and are written out on demand by
     * {@link #expression} and {@link #definition}.
     *
     * @throws EmissionException for a literal with no GLSL representation
     */
    void bindNames(NodeGraph graph, StatementScheduler.Schedule schedule, CompilationContext ctx)
            throws EmissionException {
        for (Node node : graph.topologicalOrder()) {
            switch (node.kind()) {
                case LITERAL -> ctx.bind(node, literal(node));
                case VARIABLE -> ctx.bind(node, new Rendering(node.variable().name(), Op.Precedence.PRIMARY));
                case TERM -> {
                    if (schedule.isHoisted(node)) {
                        ctx.bind(node, new Rendering(ctx.nameOf(node), Op.Precedence.PRIMARY));
                    }
                }
                case CONDITIONAL -> ctx.bind(node, new Rendering(ctx.nameOf(node), Op.Precedence.PRIMARY));
            }
        }
    }

    /**
     * Renders a literal node.
     *
     * @throws EmissionException for NaN or infinite floats
     */
    static Rendering literal(Node node) throws EmissionException {
        Object value = node.value();
        String text;
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new EmissionException(node, "float literal " + d + " has no GLSL representation");
            }
            text = Double.toString(d);
        } else if (value instanceof Integer i) {
            text = Integer.toString(i);
        } else if (value instanceof Boolean b) {
            text = Boolean.toString(b);
        } else {
            throw new IllegalStateException("Unexpected literal value " + value);
        }
        int precedence = text.startsWith("-") ? Op.Precedence.UNARY : Op.Precedence.PRIMARY;
        return new Rendering(text, precedence);
    }

    /**
     * The text a use of {@code node} stands for: its bound name or literal,
     * or for an inlined term the full expression.
     */
    static String expression(Node node, CompilationContext ctx) {
        Deque<Object> work = new ArrayDeque<>();
        work.push(node);
        return write(work, ctx);
    }

    /**
     * The expression a hoisted term's temporary is initialised with.
     */
    static String definition(Node term, CompilationContext ctx) {
        Deque<Object> work = new ArrayDeque<>();
        pushTerm(term, work, ctx);
        return write(work, ctx);
    }

    /**
     * Drains a work stack of text fragments and nodes into one buffer.
     * Inlined terms are expanded in place, so the stack only ever holds the
     * pending pieces of the current path and no intermediate text is kept.
     */
    private static String write(Deque<Object> work, CompilationContext ctx) {
        StringBuilder sb = new StringBuilder();
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String text) {
                sb.append(text);
                continue;
            }
            Node node = (Node) item;
            Rendering bound = ctx.bound(node);
            if (bound != null) {
                sb.append(bound.text());
            } else {
                pushTerm(node, work, ctx);
            }
        }
        return sb.toString();
    }

    /**
     * Pushes the pieces of one operator application, last piece first.
     */
    private static void pushTerm(Node term, Deque<Object> work, CompilationContext ctx) {
        Op op = term.op();
        List<Node> operands = term.operands();
        switch (op.form()) {
            case INFIX -> {
                Node left = operands.get(0);
                Node right = operands.get(1);
                pushOperand(right, precedence(right, ctx) <= op.precedence(), work);
                work.push(" " + op.symbol() + " ");
                pushOperand(left, precedence(left, ctx) < op.precedence(), work);
            }
            case PREFIX -> {
                Node operand = operands.get(0);
                pushOperand(operand, precedence(operand, ctx) <= Op.Precedence.UNARY, work);
                work.push(op.symbol());
            }
            case CALL, CONSTRUCTOR -> {
                work.push(")");
                for (int i = operands.size() - 1; i >= 0; i--) {
                    work.push(operands.get(i));
                    if (i > 0) {
                        work.push(", ");
                    }
                }
                work.push(op.symbol() + "(");
            }
            case SWIZZLE -> {
                Node vector = operands.get(0);
                work.push("." + term.selector());
                pushOperand(vector, precedence(vector, ctx) < Op.Precedence.POSTFIX, work);
            }
        }
    }

    private static void pushOperand(Node operand, boolean parenthesize, Deque<Object> work) {
        if (parenthesize) {
            work.push(")");
            work.push(operand);
            work.push("(");
        } else {
            work.push(operand);
        }
    }

    /**
     * Precedence of the text standing for a node at a use.
     */
    private static int precedence(Node node, CompilationContext ctx) {
        Rendering bound = ctx.bound(node);
        return bound != null ? bound.precedence() : node.op().precedence();
    }

    // ==================== Program text ====================

    /**
     * Writes the complete shader source.
     *
     * @param stage        the shader stage
     * @param declarations variables to declare, already in output order
     * @param body         statements of {@code main}
     * @param outputs      output slot writes, emitted after the body
     */
    String emit(ShaderStage stage, List<Variable> declarations, List<Statement> body,
                List<Statement.Assignment> outputs) {
        StringBuilder sb = new StringBuilder();
        if (config.versionDirective() != null) {
            sb.append("#version ").append(config.versionDirective()).append('\n');
        }
        if (stage == ShaderStage.FRAGMENT) {
            sb.append("precision ").append(config.floatPrecision()).append(" float;\n");
        }
        for (Variable variable : declarations) {
            sb.append(variable.declaration()).append('\n');
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }

        List<Statement> main = new ArrayList<>(body);
        main.addAll(outputs);

        sb.append("void main() {\n");
        Deque<Block> stack = new ArrayDeque<>();
        stack.push(new Block(main.iterator(), 1, null));
        while (!stack.isEmpty()) {
            Block block = stack.peek();
            if (!block.statements.hasNext()) {
                stack.pop();
                if (block.closing != null) {
                    line(sb, block.depth - 1, block.closing);
                }
                continue;
            }
            Statement statement = block.statements.next();
            if (statement instanceof Statement.ValueBinding binding) {
                line(sb, block.depth, binding.type().keyword() + " " + binding.name() + " = " + binding.expression() + ";");
            } else if (statement instanceof Statement.Declaration declaration) {
                line(sb, block.depth, declaration.type().keyword() + " " + declaration.name() + ";");
            } else if (statement instanceof Statement.Assignment assignment) {
                line(sb, block.depth, assignment.target() + " = " + assignment.expression() + ";");
            } else if (statement instanceof Statement.ControlBlock control) {
                line(sb, block.depth, "if (" + control.condition() + ") {");
                stack.push(new Block(control.elseBranch().iterator(), block.depth + 1, "}"));
                stack.push(new Block(control.thenBranch().iterator(), block.depth + 1, "} else {"));
            } else {
                throw new IllegalStateException("Unexpected statement " + statement);
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void line(StringBuilder sb, int depth, String text) {
        sb.append(config.indent().repeat(depth)).append(text).append('\n');
    }

    private static final class Block {
        final Iterator<Statement> statements;
        final int depth;
        final String closing;

        Block(Iterator<Statement> statements, int depth, String closing) {
            this.statements = statements;
            this.depth = depth;
            this.closing = closing;
        }
    }
}
