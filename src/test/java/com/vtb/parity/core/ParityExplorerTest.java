package com.vtb.parity.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.parity.StubTarget;
import com.vtb.parity.TestFixtures;
import com.vtb.parity.bundle.BundleFiles;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.evaluator.BridgeUnavailableException;
import com.vtb.parity.evaluator.EvalResult;
import com.vtb.parity.evaluator.ExpressionEvaluator;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.FieldRule;
import com.vtb.parity.reports.ChainsLogWriter;
import com.vtb.parity.reports.ExploreSummary;
import com.vtb.parity.reports.ReplaySummary;
import com.vtb.parity.reports.SummaryWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParityExplorerTest {

    private static final ExpressionEvaluator UNUSED = (expression, bindings) -> EvalResult.failure("не используется");

    @TempDir
    Path output;

    private StubTarget serverA;
    private StubTarget serverB;
    private final SpecificationModel specification = TestFixtures.itemsSpecification();

    @BeforeEach
    void setUp() throws Exception {
        serverA = StubTarget.start(TestFixtures.itemsApi("pen"));
        serverB = StubTarget.start(TestFixtures.itemsApi("pen"));
    }

    @AfterEach
    void tearDown() {
        serverA.close();
        serverB.close();
    }

    private static ParityConfig config(boolean chains) {
        ParityConfig config = ParityConfig.load();
        config.getExecutor().setTimeoutMs(2000L);
        config.getExecutor().setParallelism(2);
        config.getGeneration().setCasesPerOperation(3);
        config.getGeneration().setSeed(5L);
        config.getChains().setEnabled(chains);
        config.getChains().setMaxDepth(2);
        return config;
    }

    private ParityRuntime runtime(ParityConfig config, ComparisonRuleSet rules, ExpressionEvaluator evaluator) {
        return new ParityRuntime(config, rules, "test", TestFixtures.target(serverA.baseUrl()),
            TestFixtures.target(serverB.baseUrl()), evaluator);
    }

    private void itemDiffersOnB() {
        serverB.respondWith(request -> request.signature().equals("GET /items/abc123")
            ? StubTarget.Reply.json(200, "{\"id\":\"abc123\",\"name\":\"pencil\"}")
            : TestFixtures.itemsApi("pen").apply(request));
    }

    @Test
    void testIdenticalTargetsProduceNoBundles() throws Exception {
        ExploreSummary summary;
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityExplorer(runtime).explore(specification, output);
        }

        assertEquals(5, summary.getOperations());
        assertEquals(15, summary.getTotalCases(), "По 3 кейса на каждую из 5 операций");
        assertEquals(2, summary.getTotalChains(), "При глубине 2: listItems -> getItem и createItem -> getItem");
        assertEquals(0, summary.getMismatches());
        assertEquals(17, summary.getMatches());
        assertTrue(summary.getBundles().isEmpty());
        assertFalse(Files.exists(output.resolve(BundleFiles.MISMATCHES_DIR)));
        assertTrue(Files.isRegularFile(output.resolve(SummaryWriter.EXPLORE_FILE)));
        assertEquals(2, Files.readAllLines(output.resolve(ChainsLogWriter.FILE)).size());
    }

    @Test
    void testChainMismatchesWrittenAsBundles() throws Exception {
        itemDiffersOnB();

        ExploreSummary summary;
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityExplorer(runtime).explore(specification, output);
        }

        assertEquals(2, summary.getMismatches());
        assertEquals(Integer.valueOf(1), summary.getMismatchesByOperation().get("listItems -> getItem"));
        assertEquals(Integer.valueOf(1), summary.getMismatchesByOperation().get("createItem -> getItem"));
        assertEquals(2, summary.getBundles().size());
        for (String bundle : summary.getBundles()) {
            Path directory = Path.of(bundle);
            assertEquals(output.resolve(BundleFiles.MISMATCHES_DIR), directory.getParent());
            assertTrue(Files.isRegularFile(directory.resolve(BundleFiles.CHAIN_FILE)));
        }

        JsonNode written = new ObjectMapper().readTree(output.resolve(SummaryWriter.EXPLORE_FILE).toFile());
        assertEquals(15, written.get("total_cases").asInt());
        assertEquals(2, written.get("mismatches").asInt());
        assertEquals(5, written.get("seed").asInt());
        assertEquals(serverA.baseUrl(), written.get("target_a").asText());

        List<String> chains = Files.readAllLines(output.resolve(ChainsLogWriter.FILE));
        assertEquals(2, chains.size());
        assertTrue(chains.stream().allMatch(line -> line.startsWith("MISMATCH")), chains.toString());
    }

    @Test
    void testChainsDisabled() throws Exception {
        ExploreSummary summary;
        try (ParityRuntime runtime = runtime(config(false), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityExplorer(runtime).explore(specification, output);
        }

        assertEquals(0, summary.getTotalChains());
        assertFalse(Files.exists(output.resolve(ChainsLogWriter.FILE)));
    }

    @Test
    void testUnavailableEvaluatorAbortsRun() {
        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().getBody().put("$.name", FieldRule.expression("a == b"));
        ExpressionEvaluator broken = (expression, bindings) -> {
            throw new BridgeUnavailableException("воркер не запускается");
        };

        try (ParityRuntime runtime = runtime(config(false), rules, broken)) {
            BridgeUnavailableException error = assertThrows(BridgeUnavailableException.class,
                () -> new ParityExplorer(runtime).explore(specification, output));
            assertEquals("воркер не запускается", error.getMessage());
        }
    }

    @Test
    void testFailingComparisonCountedAsErrorAndSummaryWritten() throws Exception {
        ComparisonRuleSet rules = ComparisonRuleSet.empty();
        rules.getDefaultRules().getBody().put("$.name", FieldRule.expression("a == b"));
        ExpressionEvaluator failing = (expression, bindings) -> {
            throw new IllegalStateException("неожиданный сбой");
        };

        ExploreSummary summary;
        try (ParityRuntime runtime = runtime(config(true), rules, failing)) {
            summary = new ParityExplorer(runtime).explore(specification, output);
        }

        assertTrue(summary.getErrors() > 0, "Сбой сравнения считается ошибкой кейса");
        assertEquals(17, summary.getTotalCases() + summary.getTotalChains() + summary.getErrors(),
            "Остальные кейсы и цепочки выполнены");
        assertTrue(summary.getNotices().stream().anyMatch(notice -> notice.contains("неожиданный сбой")),
            summary.getNotices().toString());
        JsonNode written = new ObjectMapper().readTree(output.resolve(SummaryWriter.EXPLORE_FILE).toFile());
        assertEquals(summary.getErrors(), written.get("errors").asInt());
    }

    @Test
    void testOutOfRangeBoundsReportedAsGenerationFailure(@TempDir Path specs) throws Exception {
        Path spec = specs.resolve("huge.yaml");
        Files.writeString(spec, String.join("\n",
            "openapi: 3.0.3",
            "info: {title: huge, version: '1'}",
            "paths:",
            "  /counters:",
            "    get:",
            "      operationId: listCounters",
            "      parameters:",
            "        - name: from",
            "          in: query",
            "          required: true",
            "          schema: {type: integer, minimum: 100000000000000000000}",
            "      responses:",
            "        '200': {description: ok}",
            ""));
        OpenAPIParser parser = new OpenAPIParser();
        parser.parseFromFile(spec.toString());

        ExploreSummary summary;
        try (ParityRuntime runtime = runtime(config(false), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityExplorer(runtime).explore(parser.buildModel(), output);
        }

        assertEquals(1, summary.getGenerationFailures());
        assertEquals(0, summary.getTotalCases());
        assertTrue(Files.isRegularFile(output.resolve(SummaryWriter.EXPLORE_FILE)));
    }

    @Test
    void testReplayAfterFix() throws Exception {
        itemDiffersOnB();
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            new ParityExplorer(runtime).explore(specification, output);
        }
        serverB.respondWith(TestFixtures.itemsApi("pen"));
        Path replayOut = output.resolve("replay");

        ReplaySummary summary;
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityReplayer(runtime).replay(output, replayOut);
        }

        assertEquals(2, summary.getTotalBundles());
        assertEquals(2, summary.getNowMatch());
        assertEquals(0, summary.getStillMismatch());
        assertTrue(Files.isRegularFile(replayOut.resolve(SummaryWriter.REPLAY_FILE)));
        assertTrue(Files.isDirectory(replayOut.resolve(BundleFiles.FIXED_DIR)));
    }

    @Test
    void testReplayStillMismatching() throws Exception {
        itemDiffersOnB();
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            new ParityExplorer(runtime).explore(specification, output);
        }
        Path replayOut = output.resolve("replay");

        ReplaySummary summary;
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            summary = new ParityReplayer(runtime).replay(output.resolve(BundleFiles.MISMATCHES_DIR), replayOut);
        }

        assertEquals(2, summary.getStillMismatch());
        assertEquals(0, summary.getSkipped());
        assertTrue(summary.getCorrupted().isEmpty());
    }

    @Test
    void testReplayRefusesToOverwriteInput() {
        try (ParityRuntime runtime = runtime(config(true), ComparisonRuleSet.empty(), UNUSED)) {
            assertThrows(IllegalArgumentException.class, () -> new ParityReplayer(runtime).replay(output, output));
        }
    }
}
