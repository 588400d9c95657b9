package org.pragmatica.flowchart.generator;

import org.junit.jupiter.api.Test;
import org.pragmatica.flowchart.lexer.Lexer;
import org.pragmatica.flowchart.parser.CppParser;
import org.pragmatica.flowchart.tree.AstNode.Program;
import org.pragmatica.flowchart.tree.SourceLocation;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FlowchartSynthesizerTest {

    private static Program program(String source) {
        return CppParser.parse(Lexer.scan(source).tokens()).program().orElseThrow();
    }

    private static FlowGraph graph(String source) {
        return FlowchartSynthesizer.create().synthesize(program(source), "test");
    }

    private static FlowNode nodeLabeled(FlowGraph graph, String label) {
        return graph.nodes().stream()
                    .filter(node -> node.label().equals(label))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no node labeled " + label + " in " + graph.nodes()));
    }

    private static FlowNode end(FlowGraph graph) {
        return graph.nodes().get(graph.nodes().size() - 1);
    }

    @Test
    void synthesize_emptyProgram_connectsStartToEnd() {
        var graph = FlowchartSynthesizer.create().synthesize(new Program(List.of(), SourceLocation.START), "empty");

        assertThat(graph.name()).isEqualTo("empty");
        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactly("n0", "n1");
        assertThat(graph.nodes()).extracting(FlowNode::shape).containsOnly(NodeShape.TERMINATOR);
        assertThat(graph.edges()).containsExactly(FlowEdge.between("n0", "n1"));
    }

    @Test
    void synthesize_ifElse_branchesConvergeOnNextNode() {
        var graph = graph("if (a > b) { x = a; } else { x = b; }");

        var decisions = graph.nodesOf(NodeShape.DECISION);
        assertThat(decisions).hasSize(1);
        var decision = decisions.get(0);
        assertThat(decision.label()).isEqualTo("a > b");

        var outgoing = graph.outgoing(decision.id());
        assertThat(outgoing).hasSize(2);
        assertThat(outgoing).extracting(FlowEdge::label)
                            .containsExactly(Optional.of("yes"), Optional.of("no"));

        var thenNode = graph.node(outgoing.get(0).to()).orElseThrow();
        var elseNode = graph.node(outgoing.get(1).to()).orElseThrow();
        assertThat(thenNode).isNotEqualTo(elseNode);
        assertThat(thenNode.shape()).isEqualTo(NodeShape.PROCESS);
        assertThat(elseNode.shape()).isEqualTo(NodeShape.PROCESS);
        assertThat(thenNode.label()).isEqualTo("x = a");
        assertThat(elseNode.label()).isEqualTo("x = b");

        var end = end(graph);
        assertThat(graph.outgoing(thenNode.id())).extracting(FlowEdge::to).containsExactly(end.id());
        assertThat(graph.outgoing(elseNode.id())).extracting(FlowEdge::to).containsExactly(end.id());
    }

    @Test
    void synthesize_ifElse_convergesOnFollowingStatement() {
        var graph = graph("int a = 1; if (a > 0) { a = 2; } else { a = 3; } a = 4;");

        var after = nodeLabeled(graph, "a = 4");
        assertThat(graph.incoming(after.id()))
            .extracting(FlowEdge::from)
            .containsExactlyInAnyOrder(nodeLabeled(graph, "a = 2").id(), nodeLabeled(graph, "a = 3").id());
    }

    @Test
    void synthesize_ifWithoutElse_exitsThroughThenBranch() {
        var graph = graph("if (x) { y = 1; }");

        var decision = graph.nodesOf(NodeShape.DECISION).get(0);
        var thenNode = nodeLabeled(graph, "y = 1");
        assertThat(graph.outgoing(decision.id()))
            .containsExactly(FlowEdge.labeled(decision.id(), thenNode.id(), "yes"));
        assertThat(graph.outgoing(thenNode.id())).extracting(FlowEdge::to).containsExactly(end(graph).id());
    }

    @Test
    void synthesize_ifWithEmptyBranches_exitsThroughDecision() {
        var graph = graph("if (x) { } else { }");

        var decision = graph.nodesOf(NodeShape.DECISION).get(0);
        assertThat(graph.outgoing(decision.id()))
            .containsExactly(FlowEdge.labeled(decision.id(), end(graph).id(), "yes"));
    }

    @Test
    void synthesize_while_hasBackEdgeFromLastBodyNode() {
        var graph = graph("while (x < n) { x = x + 1; }");

        var decisions = graph.nodesOf(NodeShape.DECISION);
        assertThat(decisions).hasSize(1);
        var decision = decisions.get(0);
        var body = nodeLabeled(graph, "x = x + 1");

        assertThat(graph.incoming(decision.id())).contains(FlowEdge.between(body.id(), decision.id()));
        assertThat(graph.outgoing(decision.id()))
            .containsExactly(FlowEdge.labeled(decision.id(), body.id(), "yes"),
                             FlowEdge.labeled(decision.id(), end(graph).id(), "no"));
    }

    @Test
    void synthesize_doWhile_loopsBackToEntryPredecessor() {
        var graph = graph("int i = 0; do { i = i + 1; cout << i; } while (i < 3);");

        var decision = graph.nodesOf(NodeShape.DECISION).get(0);
        var entry = nodeLabeled(graph, "int i = 0");
        var first = nodeLabeled(graph, "i = i + 1");
        var last = nodeLabeled(graph, "cout << i");

        assertThat(last.shape()).isEqualTo(NodeShape.IO);
        assertThat(graph.incoming(first.id())).containsExactly(FlowEdge.between(entry.id(), first.id()));
        assertThat(graph.incoming(decision.id())).containsExactly(FlowEdge.between(last.id(), decision.id()));
        assertThat(graph.outgoing(decision.id()))
            .containsExactly(FlowEdge.labeled(decision.id(), entry.id(), "yes"),
                             FlowEdge.labeled(decision.id(), end(graph).id(), "no"));
    }

    @Test
    void synthesize_doWhileAtProgramStart_loopsBackToStart() {
        var graph = graph("do { x = x + 1; } while (x < 3);");

        assertThat(graph.outgoing("n2"))
            .containsExactly(FlowEdge.labeled("n2", "n0", "yes"),
                             FlowEdge.labeled("n2", "n3", "no"));
    }

    @Test
    void synthesize_for_desugarsIntoInitDecisionAndUpdate() {
        var graph = graph("for (int i = 0; i < 10; i++) { cout << i; }");

        var init = nodeLabeled(graph, "int i = 0");
        var decision = nodeLabeled(graph, "i < 10");
        var body = nodeLabeled(graph, "cout << i");
        var update = nodeLabeled(graph, "i++");

        assertThat(init.shape()).isEqualTo(NodeShape.LOOP_PREP);
        assertThat(decision.shape()).isEqualTo(NodeShape.DECISION);
        assertThat(update.shape()).isEqualTo(NodeShape.LOOP_PREP);
        assertThat(graph.edges()).contains(
            FlowEdge.between(init.id(), decision.id()),
            FlowEdge.labeled(decision.id(), body.id(), "yes"),
            FlowEdge.between(body.id(), update.id()),
            FlowEdge.between(update.id(), decision.id()),
            FlowEdge.labeled(decision.id(), end(graph).id(), "no"));
    }

    @Test
    void synthesize_forWithoutClauses_usesTrueConditionAndDirectBackEdge() {
        var graph = graph("int k = 0; for (;;) { k = k + 1; }");

        var decision = nodeLabeled(graph, "true");
        var body = nodeLabeled(graph, "k = k + 1");
        var prep = graph.nodesOf(NodeShape.LOOP_PREP);

        assertThat(prep).extracting(FlowNode::label).containsExactly("");
        assertThat(graph.edges()).contains(FlowEdge.between(prep.get(0).id(), decision.id()),
                                           FlowEdge.between(body.id(), decision.id()));
    }

    @Test
    void synthesize_breakAndContinue_areNotRewired() {
        var graph = graph("int i = 0; while (i < 5) { if (i > 2) { break; } continue; }");

        var breakNode = nodeLabeled(graph, "break");
        var continueNode = nodeLabeled(graph, "continue");
        var loop = nodeLabeled(graph, "i < 5");

        assertThat(breakNode.shape()).isEqualTo(NodeShape.PROCESS);
        assertThat(graph.outgoing(breakNode.id())).extracting(FlowEdge::to).containsExactly(continueNode.id());
        assertThat(graph.outgoing(continueNode.id())).extracting(FlowEdge::to).containsExactly(loop.id());
    }

    @Test
    void synthesize_functionDefinition_emitsCallNodeThenBody() {
        var graph = graph("int main() { int x = 1; return x; }");

        var call = nodeLabeled(graph, "int main()");
        assertThat(call.shape()).isEqualTo(NodeShape.CALL);
        assertThat(graph.outgoing(call.id())).extracting(FlowEdge::to)
                                             .containsExactly(nodeLabeled(graph, "int x = 1").id());
        assertThat(nodeLabeled(graph, "return x").shape()).isEqualTo(NodeShape.PROCESS);
    }

    @Test
    void synthesize_ioStatements_useIoShape() {
        var graph = graph("int n; cin >> n; int twice = n * 2; cout << twice << endl;");

        assertThat(nodeLabeled(graph, "cin >> n").shape()).isEqualTo(NodeShape.IO);
        assertThat(nodeLabeled(graph, "int twice = n * 2").shape()).isEqualTo(NodeShape.PROCESS);
        assertThat(nodeLabeled(graph, "cout << twice << endl").shape()).isEqualTo(NodeShape.IO);
        assertThat(nodeLabeled(graph, "int n").shape()).isEqualTo(NodeShape.PROCESS);
    }

    @Test
    void synthesize_ioNames_coverStreamsAndConsoleCalls() {
        var graph = graph("int n = 1; cerr << n; n << 2;");

        assertThat(nodeLabeled(graph, "cerr << n").shape()).isEqualTo(NodeShape.IO);
        assertThat(nodeLabeled(graph, "n << 2").shape()).isEqualTo(NodeShape.PROCESS);
        assertThat(FlowchartSynthesizer.IO_NAMES).contains("ReadLine", "WriteLine", "scanf", "printf");
    }

    @Test
    void synthesize_declarationLabels_renderConstArraysAndDelete() {
        var graph = graph("const int c = 5; int a[2] = {1, 2}; int* p = new int[c]; delete[] p;");

        nodeLabeled(graph, "const int c = 5");
        nodeLabeled(graph, "int a[] = {1, 2}");
        nodeLabeled(graph, "int* p = new int[c]");
        assertThat(nodeLabeled(graph, "delete[] p").shape()).isEqualTo(NodeShape.PROCESS);
    }

    @Test
    void synthesize_nestedIfInsideWhile_feedsBothExitsIntoBackEdge() {
        var graph = graph("int i = 0; while (i < 9) { if (i > 4) { i = i + 2; } else { i = i + 1; } }");

        var loop = nodeLabeled(graph, "i < 9");
        assertThat(graph.incoming(loop.id())).extracting(FlowEdge::from)
                                             .contains(nodeLabeled(graph, "i = i + 2").id(),
                                                       nodeLabeled(graph, "i = i + 1").id());
    }

    @Test
    void synthesize_isDeterministic() {
        var tree = program("int i = 0; while (i < 3) { if (i > 1) { i = 5; } i++; }");
        var synthesizer = FlowchartSynthesizer.create();

        assertThat(synthesizer.synthesize(tree, "d")).isEqualTo(synthesizer.synthesize(tree, "d"));
    }

    @Test
    void synthesize_customConfig_relabelsTerminatorsAndBranches() {
        var config = new FlowchartConfig("Begin", "Finish", "T", "F");
        var graph = FlowchartSynthesizer.create(config)
                                        .synthesize(program("if (a) { b = 1; } else { b = 2; }"), "cfg");

        assertThat(graph.nodes().get(0).label()).isEqualTo("Begin");
        assertThat(end(graph).label()).isEqualTo("Finish");
        assertThat(graph.edges()).extracting(FlowEdge::label).contains(Optional.of("T"), Optional.of("F"));
    }
}
