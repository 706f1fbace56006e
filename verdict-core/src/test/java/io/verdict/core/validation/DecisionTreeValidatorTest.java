package io.verdict.core.validation;

import static io.verdict.core.TreeFixtures.end;
import static io.verdict.core.TreeFixtures.number;
import static io.verdict.core.TreeFixtures.singleChoice;
import static io.verdict.core.TreeFixtures.text;
import static io.verdict.core.TreeFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.verdict.core.TreeFixtures;
import io.verdict.core.exception.TreeCycleException;
import io.verdict.core.exception.TreeErrorKind;
import io.verdict.core.exception.TreeStructureException;
import io.verdict.core.exception.UnreachableNodesException;
import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.Rule;
import io.verdict.core.tree.RuleOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DecisionTreeValidator")
class DecisionTreeValidatorTest {

    private final DecisionTreeValidator validator = new DecisionTreeValidator();

    private <T extends Throwable> T failure(DecisionTree tree, Class<T> type) {
        return catchThrowableOfType(() -> validator.validate(tree), type);
    }

    @Test
    @DisplayName("accepts sound trees")
    void shouldAcceptSoundTrees() {
        assertThatCode(() -> validator.validate(TreeFixtures.billingTree()))
                .doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(TreeFixtures.approvalTree()))
                .doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("start node")
    class StartNode {

        @Test
        void shouldRejectMissingStartNodeId() {
            var tree = tree("t", "", end("a", "A"));

            var error = failure(tree, TreeStructureException.class);

            assertThat(error.getKind()).isEqualTo(TreeErrorKind.STRUCTURE);
            assertThat(error).hasMessage("Decision tree must have a startNodeId");
        }

        @Test
        void shouldRejectStartNodeNotInNodes() {
            var tree = tree("t", "missing", end("a", "A"));

            var error = failure(tree, TreeStructureException.class);

            assertThat(error).hasMessage("Start node 'missing' not found in nodes");
            assertThat(error.getReferencedNodeId()).isEqualTo("missing");
        }

        @Test
        void shouldRejectEmptyTree() {
            var tree = DecisionTree.builder().startNodeId("a").build();

            assertThat(validator.check(tree).kind()).isEqualTo(TreeErrorKind.STRUCTURE);
        }
    }

    @Nested
    @DisplayName("references")
    class References {

        @Test
        void shouldNameDanglingChoiceTarget() {
            var tree =
                    tree(
                            "t",
                            "q",
                            singleChoice("q", "Pick", null, Choice.of("a", "ghost")),
                            end("e", "E"));

            var error = failure(tree, TreeStructureException.class);

            assertThat(error.getNodeId()).isEqualTo("q");
            assertThat(error.getReferencedNodeId()).isEqualTo("ghost");
            assertThat(error.getMessage()).contains("'ghost'").contains("choice 'a'");
        }

        @Test
        void shouldNameDanglingRuleTarget() {
            var tree =
                    tree(
                            "t",
                            "q",
                            number(
                                    "q",
                                    "How many?",
                                    "e",
                                    Rule.of(RuleOperator.LESS_THAN, "5", "ghost")),
                            end("e", "E"));

            var error = failure(tree, TreeStructureException.class);

            assertThat(error.getReferencedNodeId()).isEqualTo("ghost");
            assertThat(error.getMessage()).contains("rule #1 (LessThan 5)");
        }

        @Test
        void shouldNameDanglingDefaultTarget() {
            var tree = tree("t", "q", text("q", "Say something", "ghost"));

            var error = failure(tree, TreeStructureException.class);

            assertThat(error)
                    .hasMessage("Node 'q' defaultNextNodeId references non-existent node 'ghost'");
        }

        @Test
        void shouldAllowEmptyTargets() {
            var tree =
                    tree(
                            "t",
                            "q",
                            singleChoice("q", "Pick", "e", Choice.of("a", ""), Choice.of("b", "e")),
                            end("e", "E"));

            assertThat(validator.check(tree).valid()).isTrue();
        }

        @Test
        void shouldRejectNodeIdDifferentFromKey() {
            var tree =
                    DecisionTree.builder()
                            .startNodeId("a")
                            .node("a", end("b", "B"))
                            .build();

            var error = failure(tree, TreeStructureException.class);

            assertThat(error).hasMessage("Node key 'a' does not match node id 'b'");
        }

        @Test
        void shouldValidateReferencesOfEndNodesToo() {
            DecisionNode end = end("e", "E").toBuilder().defaultNextNodeId("ghost").build();
            var tree = tree("t", "q", text("q", "Say", "e"), end);

            assertThat(validator.check(tree).kind()).isEqualTo(TreeErrorKind.STRUCTURE);
        }
    }

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        void shouldReportCyclePath() {
            var tree =
                    tree(
                            "t",
                            "a",
                            text("a", "A", "b"),
                            singleChoice("b", "B", "e", Choice.of("again", "a")),
                            end("e", "E"));

            var error = failure(tree, TreeCycleException.class);

            assertThat(error.getKind()).isEqualTo(TreeErrorKind.CYCLE);
            assertThat(error.getCycle()).containsExactly("a", "b", "a");
            assertThat(error).hasMessage("Decision tree contains a cycle: a -> b -> a");
        }

        @Test
        void shouldPassOnceBackEdgeIsRemoved() {
            var tree =
                    tree(
                            "t",
                            "a",
                            text("a", "A", "b"),
                            singleChoice("b", "B", "e", Choice.of("again", "e")),
                            end("e", "E"));

            assertThat(validator.check(tree)).isEqualTo(ValidationResult.success());
        }

        @Test
        void shouldDetectSelfLoop() {
            var tree = tree("t", "a", text("a", "A", "a"));

            var error = failure(tree, TreeCycleException.class);

            assertThat(error.getCycle()).containsExactly("a", "a");
        }

        @Test
        void shouldReportOnlyTheLoopingPart() {
            var tree =
                    tree(
                            "t",
                            "root",
                            text("root", "R", "a"),
                            text("a", "A", "b"),
                            text("b", "B", "a"));

            var error = failure(tree, TreeCycleException.class);

            assertThat(error.getCycle()).containsExactly("a", "b", "a");
        }

        @Test
        void shouldTreatEndNodesAsLeaves() {
            DecisionNode end = end("e", "E").toBuilder().defaultNextNodeId("a").build();
            var tree = tree("t", "a", text("a", "A", "e"), end);

            assertThat(validator.check(tree).valid()).isTrue();
        }

        @Test
        void shouldAcceptDiamondShapes() {
            var tree =
                    tree(
                            "t",
                            "a",
                            singleChoice("a", "A", null, Choice.of("x", "b"), Choice.of("y", "c")),
                            text("b", "B", "d"),
                            text("c", "C", "d"),
                            end("d", "D"));

            assertThat(validator.check(tree).valid()).isTrue();
        }

        @Test
        void shouldReportCycleBeforeUnreachableNodes() {
            var tree =
                    tree(
                            "t",
                            "a",
                            text("a", "A", "a"),
                            end("orphan", "O"));

            assertThat(validator.check(tree).kind()).isEqualTo(TreeErrorKind.CYCLE);
        }
    }

    @Nested
    @DisplayName("reachability")
    class Reachability {

        @Test
        void shouldListEveryUnreachableNodeInDeclarationOrder() {
            var tree =
                    tree(
                            "t",
                            "a",
                            end("x", "X"),
                            text("a", "A", "e"),
                            end("e", "E"),
                            end("y", "Y"));

            var error = failure(tree, UnreachableNodesException.class);

            assertThat(error.getKind()).isEqualTo(TreeErrorKind.UNREACHABLE);
            assertThat(error.getUnreachableNodeIds()).containsExactly("x", "y");
            assertThat(error).hasMessage("Decision tree contains unreachable nodes: x, y");
        }

        @Test
        void shouldPassOnceEdgesAreAdded() {
            var tree =
                    tree(
                            "t",
                            "a",
                            end("x", "X"),
                            singleChoice("a", "A", "e", Choice.of("1", "x"), Choice.of("2", "y")),
                            end("e", "E"),
                            end("y", "Y"));

            assertThat(validator.check(tree).valid()).isTrue();
        }

        @Test
        void shouldFollowEdgesOutOfEndNodes() {
            DecisionNode end = end("e", "E").toBuilder().defaultNextNodeId("z").build();
            var tree = tree("t", "a", text("a", "A", "e"), end, end("z", "Z"));

            assertThat(validator.check(tree).valid()).isTrue();
        }

        @Test
        void shouldReportUnreachableCycleAsUnreachable() {
            var tree =
                    tree(
                            "t",
                            "a",
                            end("a", "A"),
                            text("b", "B", "c"),
                            text("c", "C", "b"));

            var error = failure(tree, UnreachableNodesException.class);

            assertThat(error.getUnreachableNodeIds()).containsExactly("b", "c");
        }

        @Test
        void shouldFollowDefaultEdgeOfUnknownNodeType() {
            DecisionNode custom =
                    DecisionNode.builder().id("a").type("Slider").defaultNextNodeId("e").build();
            var tree = tree("t", "a", custom, end("e", "E"));

            assertThat(validator.check(tree).valid()).isTrue();
        }
    }

    @Test
    @DisplayName("check reports failure kind and message without throwing")
    void shouldReportFailureAsResult() {
        var tree = tree("t", "a", text("a", "A", "ghost"));

        var result = validator.check(tree);

        assertThat(result.valid()).isFalse();
        assertThat(result.kind()).isEqualTo(TreeErrorKind.STRUCTURE);
        assertThat(result.message()).contains("ghost");
    }
}
