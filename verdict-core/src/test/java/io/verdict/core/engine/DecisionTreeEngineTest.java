package io.verdict.core.engine;

import static io.verdict.core.TreeFixtures.text;
import static io.verdict.core.TreeFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.verdict.core.TreeFixtures;
import io.verdict.core.VerdictConfig;
import io.verdict.core.VerdictFactory;
import io.verdict.core.exception.TreeCycleException;
import io.verdict.core.exception.TreeParseException;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.DecisionTreeParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("DecisionTreeEngine")
@ExtendWith(MockitoExtension.class)
class DecisionTreeEngineTest {

    @Mock private DecisionTreeParser parser;

    @TempDir Path tempDir;

    private DecisionTreeEngine engine() {
        return VerdictFactory.createEngine(parser);
    }

    private static DecisionTree cyclicTree() {
        return tree("looping", "a", text("a", "A", "b"), text("b", "B", "a"));
    }

    @Nested
    @DisplayName("before loading")
    class BeforeLoading {

        @Test
        void shouldReportNoTree() {
            var engine = engine();

            assertThat(engine.isLoaded()).isFalse();
            assertThat(engine.currentTree()).isEmpty();
            assertThatThrownBy(engine::getTree)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No decision tree loaded");
            assertThatThrownBy(engine::getStartNode).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        void shouldPublishValidTree() throws Exception {
            var engine = engine();
            var tree = TreeFixtures.billingTree();

            assertThat(engine.load(tree)).isSameAs(tree);

            assertThat(engine.isLoaded()).isTrue();
            assertThat(engine.getTree()).isSameAs(tree);
            assertThat(engine.getStartNode().getId()).isEqualTo("q_issue");
            assertThat(engine.getNode("end_refund")).map(DecisionNode::getPrompt)
                    .contains("Refund issued");
            assertThat(engine.getNode("missing")).isEmpty();
        }

        @Test
        void shouldParseDefinitionText() throws Exception {
            var tree = TreeFixtures.approvalTree();
            when(parser.parse("definition")).thenReturn(tree);
            var engine = engine();

            engine.load("definition");

            assertThat(engine.getTree()).isSameAs(tree);
        }

        @Test
        void shouldKeepPreviousTreeWhenReloadFailsValidation() throws Exception {
            var engine = engine();
            var original = TreeFixtures.approvalTree();
            engine.load(original);

            assertThatThrownBy(() -> engine.load(cyclicTree()))
                    .isInstanceOf(TreeCycleException.class);

            assertThat(engine.getTree()).isSameAs(original);
        }

        @Test
        void shouldKeepPreviousTreeWhenReloadFailsParsing() throws Exception {
            when(parser.parse("{broken")).thenThrow(new TreeParseException("Unexpected end"));
            var engine = engine();
            var original = TreeFixtures.approvalTree();
            engine.load(original);

            assertThatThrownBy(() -> engine.load("{broken"))
                    .isInstanceOf(TreeParseException.class)
                    .hasMessage("Unexpected end");

            assertThat(engine.getTree()).isSameAs(original);
        }

        @Test
        void shouldNotPublishInvalidFirstTree() {
            var engine = engine();

            assertThatThrownBy(() -> engine.load(cyclicTree()))
                    .isInstanceOf(TreeCycleException.class);

            assertThat(engine.isLoaded()).isFalse();
        }

        @Test
        void shouldReplaceTreeOnSuccessfulReload() throws Exception {
            var engine = engine();
            engine.load(TreeFixtures.approvalTree());
            var replacement = TreeFixtures.billingTree();

            engine.load(replacement);

            assertThat(engine.getTree()).isSameAs(replacement);
        }
    }

    @Nested
    @DisplayName("file loading")
    class FileLoading {

        @Test
        void shouldReadUtf8File() throws Exception {
            Path file = tempDir.resolve("tree.json");
            Files.writeString(file, "{\"prompt\":\"Café?\"}", StandardCharsets.UTF_8);
            var tree = TreeFixtures.approvalTree();
            when(parser.parse("{\"prompt\":\"Café?\"}")).thenReturn(tree);

            assertThat(engine().loadFromFile(file)).isSameAs(tree);
        }

        @Test
        void shouldLoadConfiguredFileOnlyOnce() throws Exception {
            Path file = tempDir.resolve("rules.json");
            Files.writeString(file, "rules");
            var tree = TreeFixtures.billingTree();
            when(parser.parse("rules")).thenReturn(tree);
            var engine =
                    VerdictFactory.createEngine(
                            VerdictConfig.builder().definitionPath(file).build(), parser);

            assertThat(engine.ensureLoaded()).isSameAs(tree);
            assertThat(engine.ensureLoaded()).isSameAs(tree);

            verify(parser, times(1)).parse("rules");
        }

        @Test
        void shouldNotReadFileWhenTreeAlreadyLoaded() throws Exception {
            var engine =
                    VerdictFactory.createEngine(
                            VerdictConfig.builder()
                                    .definitionPath(tempDir.resolve("absent.json"))
                                    .build(),
                            parser);
            var tree = TreeFixtures.approvalTree();
            engine.load(tree);

            assertThat(engine.ensureLoaded()).isSameAs(tree);
        }

        @Test
        void shouldPropagateMissingFile() {
            var engine =
                    VerdictFactory.createEngine(
                            VerdictConfig.builder()
                                    .definitionPath(tempDir.resolve("absent.json"))
                                    .build(),
                            parser);

            assertThatThrownBy(engine::ensureLoaded).isInstanceOf(NoSuchFileException.class);
            assertThat(engine.isLoaded()).isFalse();
        }
    }

    @Nested
    @DisplayName("traversal")
    class Traversal {

        @Test
        void shouldResolveAndLookUpNextNode() throws Exception {
            var engine = engine();
            engine.load(TreeFixtures.billingTree());
            DecisionNode start = engine.getStartNode();

            assertThat(engine.resolveNext(start, "Billing")).contains("q_billing");
            DecisionNode billing = engine.nextNode(start, "Billing").orElseThrow();
            assertThat(engine.nextNode(billing, "42")).map(DecisionNode::getId)
                    .contains("end_refund");
            assertThat(engine.nextNode(billing, "I think around 150 dollars"))
                    .map(DecisionNode::getId)
                    .contains("end_escalate");
        }

        @Test
        void shouldResolveNothingFromEndNode() throws Exception {
            var engine = engine();
            engine.load(TreeFixtures.approvalTree());

            assertThat(engine.nextNode(engine.getNode("end_yes").orElseThrow(), "yes")).isEmpty();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        void shouldLoadDefinitionOnceUnderConcurrentFirstAccess() throws Exception {
            Path file = tempDir.resolve("rules.json");
            Files.writeString(file, "rules");
            var tree = TreeFixtures.billingTree();
            var counting = new CountingParser(tree);
            var engine =
                    VerdictFactory.createEngine(
                            VerdictConfig.builder().definitionPath(file).build(), counting);

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<DecisionTree>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(
                            executor.submit(
                                    () -> {
                                        start.await();
                                        return engine.ensureLoaded();
                                    }));
                }
                start.countDown();

                for (Future<DecisionTree> result : results) {
                    assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(tree);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(counting.parseCount.get()).isEqualTo(1);
        }

        @Test
        void shouldOnlyEverExposeFullyValidatedTrees() throws Exception {
            var engine = engine();
            var first = TreeFixtures.approvalTree();
            var second = TreeFixtures.billingTree();
            engine.load(first);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<?> reloads =
                        executor.submit(
                                () -> {
                                    for (int i = 0; i < 50; i++) {
                                        try {
                                            engine.load(i % 2 == 0 ? second : first);
                                            engine.load(cyclicTree());
                                        } catch (Exception expected) {
                                            // cyclic candidates are rejected
                                        }
                                    }
                                });

                while (!reloads.isDone()) {
                    assertThat(engine.getTree()).isIn(first, second);
                }
                reloads.get(10, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            assertThat(engine.getTree()).isIn(first, second);
        }
    }

    private static final class CountingParser implements DecisionTreeParser {
        private final DecisionTree tree;
        private final AtomicInteger parseCount = new AtomicInteger();

        private CountingParser(DecisionTree tree) {
            this.tree = tree;
        }

        @Override
        public DecisionTree parse(String text) {
            parseCount.incrementAndGet();
            return tree;
        }

        @Override
        public String format(DecisionTree tree) {
            return "";
        }
    }
}
