package io.surfworks.shaderforge.codegen;

import io.surfworks.shaderforge.graph.BuiltinVariable;
import io.surfworks.shaderforge.graph.Node;
import io.surfworks.shaderforge.graph.NodeKind;
import io.surfworks.shaderforge.graph.Op;
import io.surfworks.shaderforge.graph.Storage;
import io.surfworks.shaderforge.graph.Variable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles output bindings into GLSL ES source.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>resolve output slots and infer the stage</li>
 *   <li>walk the graph from the bound roots</li>
 *   <li>collect variable declarations</li>
 *   <li>schedule: decide hoisting, place statements in scopes, order them</li>
 *   <li>name temporaries and bind atoms</li>
 *   <li>lower conditionals into if/else blocks</li>
 *   <li>emit the text</li>
 * </ol>
 *
 * <p>Compilation is all-or-nothing. Each call uses its own
 * {@link CompilationContext}, so a compiler may be shared between threads.
 *
 * <pre>{@code
 * ShaderSession s = new ShaderSession();
 * Node color = s.uniform("uColor", ShaderType.VEC4);
 * String source = new ShaderCompiler()
 *         .compile(Map.of("gl_FragColor", color))
 *         .source();
 * }</pre>
 */
public final class ShaderCompiler {

    private static final Logger LOG = Logger.getLogger(ShaderCompiler.class.getName());

    private final CompilerConfig config;

    public ShaderCompiler() {
        this(CompilerConfig.defaults());
    }

    public ShaderCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles built-in output slots, processed in slot-name order.
     */
    public CompiledProgram compile(Map<String, Node> outputs) throws CompilationException {
        return compile(OutputBindings.of(outputs));
    }

    /**
     * Compiles output bindings, emitting the output writes in binding order.
     *
     * @throws CompilationException if the bindings or the graph violate a constraint
     */
    public CompiledProgram compile(OutputBindings outputs) throws CompilationException {
        if (outputs.isEmpty()) {
            throw new CompilationException(Violation.NO_OUTPUTS, "at least one output slot must be bound");
        }
        List<OutputBindings.Binding> bindings = outputs.bindings();
        List<OutputSlot> slots = resolveSlots(bindings);
        ShaderStage stage = inferStage(bindings, slots);

        List<Node> roots = new ArrayList<>(bindings.size());
        for (OutputBindings.Binding binding : bindings) {
            roots.add(binding.value());
        }
        NodeGraph graph = GraphWalker.walk(roots);
        checkShapes(graph, stage);
        List<Variable> declarations = collectDeclarations(graph, slots, stage);

        Set<String> variableNames = new HashSet<>();
        for (Variable variable : declarations) {
            variableNames.add(variable.name());
        }
        CompilationContext ctx = new CompilationContext(config, variableNames);
        ControlFlowLowering lowering = new ControlFlowLowering();
        StatementScheduler scheduler = new StatementScheduler(graph, lowering);

        StatementScheduler.Schedule schedule = scheduler.schedule();
        scheduler.nameTemporaries(schedule, ctx);
        CodeEmitter emitter = new CodeEmitter(config);
        emitter.bindNames(graph, schedule, ctx);
        List<Statement> body = lowering.lower(schedule, ctx);

        List<Statement.Assignment> writes = new ArrayList<>(bindings.size());
        for (int i = 0; i < bindings.size(); i++) {
            String expression = CodeEmitter.expression(bindings.get(i).value(), ctx);
            writes.add(new Statement.Assignment(slots.get(i).name(), expression));
        }
        String source = emitter.emit(stage, declarations, body, writes);

        LOG.fine(() -> String.format("compiled %s shader: %d nodes, %d temporaries, %d outputs",
                stage, graph.size(), ctx.temporaryCount(), bindings.size()));
        return new CompiledProgram(stage, declarations, body, writes, slots, ctx.temporaryCount(), source);
    }

    // ==================== Validation ====================

    private static List<OutputSlot> resolveSlots(List<OutputBindings.Binding> bindings) throws CompilationException {
        List<OutputSlot> slots = new ArrayList<>(bindings.size());
        Set<String> bound = new HashSet<>();
        for (OutputBindings.Binding binding : bindings) {
            OutputSlot slot = resolveSlot(binding);
            if (!bound.add(slot.name())) {
                throw new CompilationException(Violation.CONFLICTING_DECLARATION, binding.value(),
                        "output slot " + slot.name() + " is bound more than once");
            }
            if (binding.value().type() != slot.type()) {
                throw new CompilationException(Violation.TYPE_MISMATCH, binding.value(),
                        "output slot " + slot.name() + " expects " + slot.type() + ", got " + binding.value().type());
            }
            slots.add(slot);
        }
        return slots;
    }

    private static OutputSlot resolveSlot(OutputBindings.Binding binding) throws CompilationException {
        Node target = binding.target();
        if (target == null) {
            return OutputSlot.builtin(binding.slotName())
                    .orElseThrow(() -> new CompilationException(Violation.UNKNOWN_OUTPUT_SLOT, binding.value(),
                            "unknown output slot '" + binding.slotName() + "'"));
        }
        if (target.kind() != NodeKind.VARIABLE || target.variable().storage() != Storage.VARYING) {
            throw new CompilationException(Violation.UNKNOWN_OUTPUT_SLOT, target,
                    "only varying variables can be written as outputs");
        }
        return OutputSlot.varying(target.variable());
    }

    private static ShaderStage inferStage(List<OutputBindings.Binding> bindings, List<OutputSlot> slots)
            throws CompilationException {
        ShaderStage stage = slots.get(0).stage();
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i).stage() != stage) {
                throw new CompilationException(Violation.STAGE_MISMATCH, bindings.get(i).value(),
                        "output slot " + slots.get(i).name() + " belongs to the " + slots.get(i).stage()
                                + " stage but " + slots.get(0).name() + " to the " + stage + " stage");
            }
        }
        return stage;
    }

    /**
     * Rejects computed samplers, terms whose arity does not fit their
     * operator's form, and biased texture lookups outside the fragment stage.
     */
    private static void checkShapes(NodeGraph graph, ShaderStage stage) throws CompilationException {
        for (Node node : graph.topologicalOrder()) {
            if (node.isAtom()) {
                continue;
            }
            if (node.type().isSampler()) {
                throw new CompilationException(Violation.UNSUPPORTED_OPERATOR, node,
                        "sampler values cannot be computed, only read from uniforms");
            }
            if (node.kind() != NodeKind.TERM) {
                continue;
            }
            int arity = node.operands().size();
            boolean valid = switch (node.op().form()) {
                case INFIX -> arity == 2;
                case PREFIX -> arity == 1;
                case SWIZZLE -> arity == 1 && node.selector() != null;
                case CALL, CONSTRUCTOR -> arity > 0;
            };
            if (!valid) {
                throw new CompilationException(Violation.UNSUPPORTED_OPERATOR, node,
                        "cannot render " + node.op() + " with " + arity + " operands");
            }
            if (stage == ShaderStage.VERTEX && arity == 3
                    && (node.op() == Op.TEXTURE_2D || node.op() == Op.TEXTURE_CUBE)) {
                throw new CompilationException(Violation.UNSUPPORTED_OPERATOR, node,
                        node.op().symbol() + " with a bias is only available to fragment shaders");
            }
        }
    }

    private static List<Variable> collectDeclarations(NodeGraph graph, List<OutputSlot> slots, ShaderStage stage)
            throws CompilationException {
        Map<String, Variable> byName = new HashMap<>();
        for (OutputSlot slot : slots) {
            if (!slot.isBuiltin()) {
                byName.put(slot.name(), slot.varying());
            }
        }
        for (Node node : graph.topologicalOrder()) {
            if (node.kind() != NodeKind.VARIABLE) {
                continue;
            }
            Variable variable = node.variable();
            checkStage(node, variable, stage);
            Variable previous = byName.putIfAbsent(variable.name(), variable);
            if (previous != null && !previous.equals(variable)) {
                throw new CompilationException(Violation.CONFLICTING_DECLARATION, node,
                        "variable " + variable.name() + " is declared as " + describe(previous)
                                + " and as " + describe(variable));
            }
        }

        List<Variable> declarations = new ArrayList<>();
        for (Variable variable : byName.values()) {
            if (variable.storage() != Storage.BUILTIN) {
                declarations.add(variable);
            }
        }
        declarations.sort(Comparator.comparing(Variable::storage).thenComparing(Variable::name));
        return declarations;
    }

    private static void checkStage(Node node, Variable variable, ShaderStage stage) throws CompilationException {
        switch (variable.storage()) {
            case ATTRIBUTE -> {
                if (stage == ShaderStage.FRAGMENT) {
                    throw new CompilationException(Violation.STAGE_MISMATCH, node,
                            "attribute " + variable.name() + " cannot be read by a fragment shader");
                }
            }
            case VARYING -> {
                if (stage == ShaderStage.VERTEX) {
                    throw new CompilationException(Violation.STAGE_MISMATCH, node,
                            "varying " + variable.name() + " cannot be read by a vertex shader");
                }
            }
            case BUILTIN -> {
                if (stage == ShaderStage.VERTEX && BuiltinVariable.isBuiltin(variable.name())) {
                    throw new CompilationException(Violation.STAGE_MISMATCH, node,
                            variable.name() + " is only available to fragment shaders");
                }
            }
        }
    }

    private static String describe(Variable variable) {
        return variable.storage().name().toLowerCase(Locale.ROOT) + " " + variable.type();
    }
}
