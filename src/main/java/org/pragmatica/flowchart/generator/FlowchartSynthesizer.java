package org.pragmatica.flowchart.generator;

import org.pragmatica.flowchart.tree.AstNode.Assign;
import org.pragmatica.flowchart.tree.AstNode.Binary;
import org.pragmatica.flowchart.tree.AstNode.Block;
import org.pragmatica.flowchart.tree.AstNode.Break;
import org.pragmatica.flowchart.tree.AstNode.Continue;
import org.pragmatica.flowchart.tree.AstNode.Delete;
import org.pragmatica.flowchart.tree.AstNode.DoWhile;
import org.pragmatica.flowchart.tree.AstNode.ExprStatement;
import org.pragmatica.flowchart.tree.AstNode.Expression;
import org.pragmatica.flowchart.tree.AstNode.For;
import org.pragmatica.flowchart.tree.AstNode.FuncDef;
import org.pragmatica.flowchart.tree.AstNode.Identifier;
import org.pragmatica.flowchart.tree.AstNode.If;
import org.pragmatica.flowchart.tree.AstNode.Index;
import org.pragmatica.flowchart.tree.AstNode.InitList;
import org.pragmatica.flowchart.tree.AstNode.Literal;
import org.pragmatica.flowchart.tree.AstNode.New;
import org.pragmatica.flowchart.tree.AstNode.Postfix;
import org.pragmatica.flowchart.tree.AstNode.Program;
import org.pragmatica.flowchart.tree.AstNode.Return;
import org.pragmatica.flowchart.tree.AstNode.Statement;
import org.pragmatica.flowchart.tree.AstNode.Unary;
import org.pragmatica.flowchart.tree.AstNode.VarDecl;
import org.pragmatica.flowchart.tree.AstNode.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a flowchart graph from a parsed program.
 *
 * <p>Synthesis is a pure function of the tree: each call gets fresh builder state, and the same
 * tree always yields the same node ids, labels and edges. Every statement kind is handled, so
 * synthesis never fails.
 */
public final class FlowchartSynthesizer {
    private static final Logger LOG = LoggerFactory.getLogger(FlowchartSynthesizer.class);

    static final Set<String> IO_NAMES = Set.of("cin", "cout", "cerr", "scanf", "printf",
                                               "read", "write", "ReadLine", "WriteLine");

    private final FlowchartConfig config;

    private FlowchartSynthesizer(FlowchartConfig config) {
        this.config = config;
    }

    public static FlowchartSynthesizer create() {
        return create(FlowchartConfig.DEFAULT);
    }

    public static FlowchartSynthesizer create(FlowchartConfig config) {
        return new FlowchartSynthesizer(Objects.requireNonNull(config, "config"));
    }

    public FlowGraph synthesize(Program program, String name) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(name, "name");
        var graph = new Builder(config, name).build(program);
        LOG.debug("Synthesized flowchart '{}' with {} nodes and {} edges",
                  name, graph.nodes().size(), graph.edges().size());
        return graph;
    }

    /**
     * Dangling predecessor waiting for the next emitted node, with the label its edge will carry.
     */
    private record Exit(String from, Optional<String> label) {
        static Exit of(String from) {
            return new Exit(from, Optional.empty());
        }

        static Exit labeled(String from, String label) {
            return new Exit(from, Optional.of(label));
        }
    }

    /**
     * Per-call builder. Each visit starts from the current {@code tail} and leaves the
     * construct's exits in it.
     */
    private static final class Builder implements Statement.Visitor<Void> {
        private final FlowchartConfig config;
        private final String name;
        private final List<FlowNode> nodes = new ArrayList<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private final Map<String, Integer> decisionEdges = new HashMap<>();
        private List<Exit> tail = List.of();
        private int nextId;

        Builder(FlowchartConfig config, String name) {
            this.config = config;
            this.name = name;
        }

        FlowGraph build(Program program) {
            emit(NodeShape.TERMINATOR, config.startLabel());
            program.accept(this);
            emit(NodeShape.TERMINATOR, config.endLabel());
            return new FlowGraph(name, nodes, edges);
        }

        // === Graph primitives ===

        /**
         * Add a node and wire every pending exit into it.
         */
        private String emit(NodeShape shape, String label) {
            var id = "n" + nextId++;
            nodes.add(new FlowNode(id, shape, label));
            for (var exit : tail) {
                connect(exit.from(), id, exit.label());
            }
            tail = List.of(Exit.of(id));
            return id;
        }

        /**
         * Add an edge. The first two edges out of a decision node without an explicit label are
         * labeled yes and no.
         */
        private void connect(String from, String to, Optional<String> label) {
            if (!isDecision(from)) {
                edges.add(new FlowEdge(from, to, label));
                return;
            }
            int count = decisionEdges.merge(from, 1, Integer::sum);
            var effective = label.or(() -> autoLabel(count));
            edges.add(new FlowEdge(from, to, effective));
        }

        private Optional<String> autoLabel(int edgeNumber) {
            return switch (edgeNumber) {
                case 1 -> Optional.of(config.yesLabel());
                case 2 -> Optional.of(config.noLabel());
                default -> Optional.empty();
            };
        }

        private boolean isDecision(String id) {
            return decisionEdges.containsKey(id);
        }

        private String emitDecision(String label) {
            var id = emit(NodeShape.DECISION, label);
            decisionEdges.put(id, 0);
            return id;
        }

        private void closeLoop(String target) {
            for (var exit : tail) {
                connect(exit.from(), target, exit.label());
            }
        }

        private void emitSimple(String label, boolean mentionsIo) {
            emit(mentionsIo ? NodeShape.IO : NodeShape.PROCESS, label);
        }

        // === Sequences ===

        @Override
        public Void visitProgram(Program program) {
            program.children().forEach(child -> child.accept(this));
            return null;
        }

        @Override
        public Void visitBlock(Block block) {
            block.children().forEach(child -> child.accept(this));
            return null;
        }

        // === Branches and loops ===

        @Override
        public Void visitIf(If stmt) {
            var decision = emitDecision(LabelRenderer.render(stmt.condition()));
            var thenExists = hasContent(stmt.thenBranch());
            var elseExists = stmt.elseBranch().map(Builder::hasContent).orElse(false);

            var exits = new ArrayList<Exit>();
            if (thenExists) {
                tail = List.of(Exit.labeled(decision, config.yesLabel()));
                stmt.thenBranch().accept(this);
                exits.addAll(tail);
            }
            if (elseExists) {
                tail = List.of(Exit.labeled(decision, config.noLabel()));
                stmt.elseBranch().get().accept(this);
                exits.addAll(tail);
            }
            tail = exits.isEmpty()
                   ? List.of(Exit.of(decision))
                   : List.copyOf(exits);
            return null;
        }

        private static boolean hasContent(Statement branch) {
            return !(branch instanceof Block block) || !block.isEmpty();
        }

        @Override
        public Void visitWhile(While stmt) {
            var decision = emitDecision(LabelRenderer.render(stmt.condition()));
            tail = List.of(Exit.labeled(decision, config.yesLabel()));
            stmt.body().accept(this);
            closeLoop(decision);
            tail = List.of(Exit.labeled(decision, config.noLabel()));
            return null;
        }

        @Override
        public Void visitDoWhile(DoWhile stmt) {
            var entry = tail;
            stmt.body().accept(this);
            var decision = emitDecision(LabelRenderer.render(stmt.condition()));
            // back edge targets whatever preceded the loop
            for (var exit : entry) {
                connect(decision, exit.from(), Optional.of(config.yesLabel()));
            }
            tail = List.of(Exit.labeled(decision, config.noLabel()));
            return null;
        }

        @Override
        public Void visitFor(For stmt) {
            emit(NodeShape.LOOP_PREP, stmt.init().map(Builder::statementLabel).orElse(""));
            var decision = emitDecision(stmt.condition()
                                            .map(LabelRenderer::render)
                                            .orElse("true"));
            tail = List.of(Exit.labeled(decision, config.yesLabel()));
            stmt.body().accept(this);
            if (stmt.update().isPresent()) {
                emit(NodeShape.LOOP_PREP, LabelRenderer.render(stmt.update().get()));
            }
            closeLoop(decision);
            tail = List.of(Exit.labeled(decision, config.noLabel()));
            return null;
        }

        // === Single-node statements ===

        @Override
        public Void visitVarDecl(VarDecl decl) {
            emitSimple(declarationLabel(decl), decl.initializer().map(IoDetector::mentionsIo).orElse(false));
            return null;
        }

        @Override
        public Void visitFuncDef(FuncDef func) {
            emit(NodeShape.CALL, func.returnType() + " " + func.name() + "()");
            func.body().ifPresent(body -> body.accept(this));
            return null;
        }

        @Override
        public Void visitReturn(Return stmt) {
            emitSimple(statementLabel(stmt), stmt.value().map(IoDetector::mentionsIo).orElse(false));
            return null;
        }

        @Override
        public Void visitBreak(Break stmt) {
            emit(NodeShape.PROCESS, "break");
            return null;
        }

        @Override
        public Void visitContinue(Continue stmt) {
            emit(NodeShape.PROCESS, "continue");
            return null;
        }

        @Override
        public Void visitDelete(Delete stmt) {
            emit(NodeShape.PROCESS, statementLabel(stmt));
            return null;
        }

        @Override
        public Void visitExprStatement(ExprStatement stmt) {
            emitSimple(LabelRenderer.render(stmt.expression()), IoDetector.mentionsIo(stmt.expression()));
            return null;
        }

        // === Labels ===

        private static String declarationLabel(VarDecl decl) {
            var sb = new StringBuilder();
            if (decl.constant()) {
                sb.append("const ");
            }
            sb.append(decl.type()).append(' ').append(decl.name()).append(decl.arraySuffix());
            decl.initializer().ifPresent(value -> sb.append(" = ").append(LabelRenderer.render(value)));
            return sb.toString();
        }

        /**
         * Best-effort one-line text for any statement.
         */
        private static String statementLabel(Statement statement) {
            if (statement instanceof VarDecl decl) {
                return declarationLabel(decl);
            }
            if (statement instanceof ExprStatement expr) {
                return LabelRenderer.render(expr.expression());
            }
            if (statement instanceof Return ret) {
                return ret.value()
                          .map(value -> "return " + LabelRenderer.render(value))
                          .orElse("return");
            }
            if (statement instanceof Delete delete) {
                return (delete.array() ? "delete[] " : "delete ") + LabelRenderer.render(delete.target());
            }
            return statement.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Whether an expression mentions one of the input/output names.
     */
    private static final class IoDetector implements Expression.Visitor<Boolean> {
        private static final IoDetector INSTANCE = new IoDetector();

        static boolean mentionsIo(Expression expression) {
            return expression.accept(INSTANCE);
        }

        @Override
        public Boolean visitBinary(Binary expr) {
            return mentionsIo(expr.left()) || mentionsIo(expr.right());
        }

        @Override
        public Boolean visitUnary(Unary expr) {
            return mentionsIo(expr.operand());
        }

        @Override
        public Boolean visitPostfix(Postfix expr) {
            return mentionsIo(expr.operand());
        }

        @Override
        public Boolean visitIndex(Index expr) {
            return mentionsIo(expr.target()) || mentionsIo(expr.index());
        }

        @Override
        public Boolean visitAssign(Assign expr) {
            return mentionsIo(expr.target()) || mentionsIo(expr.value());
        }

        @Override
        public Boolean visitLiteral(Literal expr) {
            return false;
        }

        @Override
        public Boolean visitIdentifier(Identifier expr) {
            return IO_NAMES.contains(expr.name());
        }

        @Override
        public Boolean visitInitList(InitList expr) {
            return expr.elements().stream().anyMatch(IoDetector::mentionsIo);
        }

        @Override
        public Boolean visitNew(New expr) {
            return expr.size().map(IoDetector::mentionsIo).orElse(false);
        }
    }
}
