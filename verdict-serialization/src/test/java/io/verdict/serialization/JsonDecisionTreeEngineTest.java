package io.verdict.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verdict.core.VerdictConfig;
import io.verdict.core.VerdictFactory;
import io.verdict.core.engine.DecisionTreeEngine;
import io.verdict.core.exception.TreeStructureException;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.walk.WalkResult;
import io.verdict.core.walk.WalkStep;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/// Engine, walker and JSON definitions working together.
@DisplayName("Engine with JSON definitions")
class JsonDecisionTreeEngineTest {

    private static final String APPROVAL =
            """
            {
              "id": "approval",
              "version": "1.0",
              "startNodeId": "start",
              "nodes": {
                "start": {"id": "start", "prompt": "Do you approve?", "type": "SingleChoice",
                          "choices": [{"key": "yes", "label": "Yes", "nextNodeId": "end_yes"},
                                      {"key": "no", "label": "No", "nextNodeId": "end_no"}]},
                "end_yes": {"id": "end_yes", "prompt": "Approved", "type": "End"},
                "end_no": {"id": "end_no", "prompt": "Rejected", "type": "End"}
              }
            }
            """;

    @TempDir Path tempDir;

    private final JacksonDecisionTreeParser parser = new JacksonDecisionTreeParser();

    @Test
    void shouldRecordApprovalForAffirmativeAnswer() throws Exception {
        DecisionTreeEngine engine = VerdictFactory.createEngine(parser);
        engine.load(APPROVAL);

        WalkResult result =
                VerdictFactory.createWalker(engine).walk((node, number) -> "Yes please");

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.outcome()).isEqualTo("Approved");
        assertThat(result.steps())
                .containsExactly(
                        new WalkStep(1, "start", "Do you approve?", "Yes please", "end_yes"));
    }

    @Test
    void shouldLazilyLoadConfiguredDefinitionFile() throws Exception {
        Path file = tempDir.resolve("rules.json");
        Files.writeString(file, TreeResources.read(TreeResources.SUPPORT_TRIAGE));
        DecisionTreeEngine engine =
                VerdictFactory.createEngine(
                        VerdictConfig.fromProperties(
                                Map.of(VerdictConfig.DEFINITION_PATH_KEY, file.toString())),
                        parser);

        DecisionTree tree = engine.ensureLoaded();

        DecisionNode start = engine.getStartNode();
        assertThat(tree.getId()).isEqualTo("support-triage");
        assertThat(engine.resolveNext(start, "it's a BILLING issue")).contains("q_billing");
        DecisionNode billing = engine.getNode("q_billing").orElseThrow();
        assertThat(engine.resolveNext(billing, "42")).contains("end_refund");
        assertThat(engine.resolveNext(billing, "I think around 150 dollars"))
                .contains("end_escalate");
    }

    @Test
    void shouldBehaveIdenticallyAfterRoundTrip() throws Exception {
        DecisionTree original = parser.parse(TreeResources.read(TreeResources.SUPPORT_TRIAGE));
        DecisionTreeEngine first = VerdictFactory.createEngine(parser);
        DecisionTreeEngine second = VerdictFactory.createEngine(parser);
        first.load(original);
        second.load(parser.format(original));

        for (String response : new String[] {"billing", "technical", "other", "75", "120"}) {
            for (DecisionNode node : original.getNodes().values()) {
                DecisionNode twin = second.getNode(node.getId()).orElseThrow();
                assertThat(second.resolveNext(twin, response))
                        .as("node %s, response %s", node.getId(), response)
                        .isEqualTo(first.resolveNext(node, response));
            }
        }
    }

    @Test
    void shouldRejectDanglingReferenceAndKeepPreviousTree() throws Exception {
        DecisionTreeEngine engine = VerdictFactory.createEngine(parser);
        engine.load(APPROVAL);
        String dangling = APPROVAL.replace("\"end_no\"}", "\"ghost\"}");

        assertThatThrownBy(() -> engine.load(dangling))
                .isInstanceOf(TreeStructureException.class)
                .hasMessageContaining("ghost");

        assertThat(engine.getTree().getId()).isEqualTo("approval");
    }
}
