package com.vtb.parity.dynamic;

import com.vtb.parity.StubTarget;
import com.vtb.parity.TestFixtures;
import com.vtb.parity.comparator.ExpressionLibrary;
import com.vtb.parity.comparator.ResponseComparator;
import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.evaluator.EvalResult;
import com.vtb.parity.generation.CaseGenerator;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.ComparisonRuleSet;
import com.vtb.parity.models.DegradedPolicy;
import com.vtb.parity.models.GenerationMode;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepExecution;
import com.vtb.parity.models.StepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ChainRunnerTest {

    private final SpecificationModel specification = TestFixtures.itemsSpecification();
    private final CaseGenerator generator = new CaseGenerator(11L, GenerationMode.POSITIVE);
    private StubTarget serverA;
    private StubTarget serverB;
    private DualExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        serverA = StubTarget.start(TestFixtures.itemsApi("pen"));
        serverB = StubTarget.start(TestFixtures.itemsApi("pen"));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
        serverA.close();
        serverB.close();
    }

    private ChainRunner runner(DegradedPolicy policy) {
        return runner(policy, serverA.baseUrl(), serverB.baseUrl());
    }

    private ChainRunner runner(DegradedPolicy policy, String urlA, String urlB) {
        ExecutorSettings settings = TestFixtures.settings(2000, policy);
        TelemetryCollector telemetry = new TelemetryCollector();
        executor = new DualExecutor(
            new TargetClient("A", TestFixtures.target(urlA), settings, telemetry),
            new TargetClient("B", TestFixtures.target(urlB), settings, telemetry));
        ResponseComparator comparator = new ResponseComparator(ComparisonRuleSet.empty(),
            ExpressionLibrary.loadDefault(), (expression, bindings) -> EvalResult.failure("не используется"));
        return new ChainRunner(executor, comparator, settings);
    }

    private static Function<StubTarget.Received, StubTarget.Reply> createsWithoutId() {
        return request -> request.method.equals("POST")
            ? StubTarget.Reply.json(201, "{}")
            : TestFixtures.itemsApi("pen").apply(request);
    }

    @Test
    void testChainResolvesLinkedParameter() {
        Chain chain = TestFixtures.chain(specification, generator, 4, "createItem", "getItem");

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE).runChain(chain);

        assertEquals(ExecutionOutcome.Status.MATCH, outcome.getStatus());
        assertEquals(2, outcome.executedSteps());
        StepExecution second = outcome.getTargetA().get(1);
        assertEquals("abc123", second.getRequest().getPathParameters().get("item_id"),
            "item_id должен прийти из тела ответа createItem");
        assertFalse(second.isDegraded());
        assertEquals(1, serverA.count("GET", "/items/abc123"));
        assertEquals(1, serverB.count("GET", "/items/abc123"));
    }

    @Test
    void testChainHaltsAtFirstMismatch() {
        serverB.respondWith(request -> request.signature().equals("GET /items/abc123")
            ? StubTarget.Reply.json(200, "{\"id\":\"abc123\",\"name\":\"pencil\"}")
            : TestFixtures.itemsApi("pen").apply(request));
        Chain chain = TestFixtures.chain(specification, generator, 4, "createItem", "getItem", "deleteItem");

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE).runChain(chain);

        assertEquals(ExecutionOutcome.Status.MISMATCH, outcome.getStatus());
        assertEquals(1, outcome.getMismatchStep());
        assertEquals("$.name", outcome.getMismatches().get(0).getPath());
        assertEquals(2, outcome.getTargetA().size());
        assertEquals(0, serverA.count("DELETE", "/items"), "После расхождения шаги не выполняются");
        assertEquals(0, serverB.count("DELETE", "/items"));
    }

    @Test
    void testDegradedStepExecutedUnderExecutePolicy() {
        serverA.respondWith(createsWithoutId());
        serverB.respondWith(createsWithoutId());
        Chain chain = TestFixtures.chain(specification, generator, 4, "createItem", "getItem");

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE).runChain(chain);

        assertEquals(ExecutionOutcome.Status.MATCH, outcome.getStatus(), "Обе цели дали 404 на заглушку");
        StepExecution second = outcome.getTargetA().get(1);
        assertTrue(second.isDegraded());
        assertEquals(Set.of("item_id"), second.getRequest().getUnresolvedParameters());
    }

    @Test
    void testDegradedStepTruncatesUnderSkipPolicy() {
        serverA.respondWith(createsWithoutId());
        serverB.respondWith(createsWithoutId());
        Chain chain = TestFixtures.chain(specification, generator, 4, "createItem", "getItem");

        ExecutionOutcome outcome = runner(DegradedPolicy.SKIP).runChain(chain);

        assertEquals(ExecutionOutcome.Status.TRUNCATED, outcome.getStatus());
        assertEquals(1, outcome.executedSteps());
        assertNotNull(outcome.getReason());
        assertEquals(0, serverA.count("GET", "/items/"));
    }

    @Test
    void testChainBoundedByMaxDepth() {
        Chain chain = TestFixtures.chain(specification, generator, 2, "createItem", "getItem", "deleteItem");

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE).runChain(chain);

        assertEquals(ExecutionOutcome.Status.MATCH, outcome.getStatus());
        assertEquals(2, outcome.executedSteps());
        assertEquals(0, serverA.count("DELETE", "/items"));
    }

    @Test
    void testCaseStatusMismatch() {
        serverB.respondWith(request -> StubTarget.Reply.json(500, "{\"error\":\"boom\"}"));
        RequestCase requestCase = generator.generateOne(specification.find("createItem").orElseThrow(), Set.of());

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE).runCase(requestCase);

        assertEquals(ExecutionOutcome.Status.MISMATCH, outcome.getStatus());
        assertEquals(0, outcome.getMismatchStep());
        assertEquals("status_code", outcome.getMismatches().get(0).getPath());
    }

    @Test
    void testBothTargetsDownIsError() throws Exception {
        RequestCase requestCase = generator.generateOne(specification.find("listItems").orElseThrow(), Set.of());

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE,
            StubTarget.closedPortUrl(), StubTarget.closedPortUrl()).runCase(requestCase);

        assertEquals(ExecutionOutcome.Status.ERROR, outcome.getStatus());
        assertTrue(outcome.getMismatches().isEmpty());
    }

    @Test
    void testOneTargetDownIsTransportMismatch() throws Exception {
        RequestCase requestCase = generator.generateOne(specification.find("listItems").orElseThrow(), Set.of());

        ExecutionOutcome outcome = runner(DegradedPolicy.EXECUTE,
            serverA.baseUrl(), StubTarget.closedPortUrl()).runCase(requestCase);

        assertEquals(ExecutionOutcome.Status.MISMATCH, outcome.getStatus());
        assertEquals(ResponseComparator.TRANSPORT_PATH, outcome.getMismatches().get(0).getPath());
    }

    @Test
    void testApplyLinkStripsLeadingSlashFromPathValue() {
        RequestCase template = RequestCase.builder()
            .operationId("getItem")
            .method("GET")
            .pathTemplate("/items/{item_id}")
            .pathParameters(Map.of("item_id", "stub00"))
            .renderedPath("/items/stub00")
            .unresolvedParameters(Set.of("item_id"))
            .build();
        LinkSpec link = LinkSpec.builder()
            .name("ByLocation")
            .parameter("path.item_id", "$response.header.Location")
            .build();
        StepResult previous = StepResult.builder()
            .statusCode(201)
            .headers(StepResult.normalizeHeaders(Map.of("Location", List.of("/abc123"))))
            .build();

        RequestCase applied = ChainRunner.applyLink(template, link, null, previous);

        assertTrue(applied.isResolved());
        assertEquals("/items/abc123", applied.getRenderedPath());
    }
}
