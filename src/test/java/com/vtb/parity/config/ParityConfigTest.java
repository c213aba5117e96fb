package com.vtb.parity.config;

import com.vtb.parity.models.DegradedPolicy;
import com.vtb.parity.models.GenerationMode;
import com.vtb.parity.models.TargetSide;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParityConfigTest {

    @TempDir
    Path directory;

    @Test
    void testDefaultsFromClasspath() {
        ParityConfig config = ParityConfig.load();

        assertEquals("http://localhost:8001", config.getTargets().get("a").getBaseUrl());
        assertEquals("http://localhost:8002", config.getTargets().get("b").getBaseUrl());
        assertEquals(30_000L, config.getExecutor().getTimeoutMs());
        assertEquals(TargetSide.A, config.getExecutor().getSourceOfTruth());
        assertEquals(DegradedPolicy.EXECUTE, config.getExecutor().getDegradedPolicy());
        assertEquals(5_000L, config.getEvaluator().getWorkerDeadlineMs());
        assertEquals(3, config.getEvaluator().getMaxRestarts());
        assertEquals(10, config.getGeneration().getCasesPerOperation());
        assertEquals(42L, config.getGeneration().getSeed());
        assertEquals(GenerationMode.POSITIVE, config.getGeneration().getMode());
        assertTrue(config.getChains().isEnabled());
        assertEquals(4, config.getChains().getMaxDepth());
        assertTrue(config.getSecrets().getRedactFields().isEmpty());
    }

    @Test
    void testUserFileOverridesPerKey() throws Exception {
        Path file = directory.resolve("parity.yaml");
        Files.writeString(file, String.join("\n",
            "targets:",
            "  staging:",
            "    baseUrl: https://staging.example.com",
            "    headers:",
            "      Authorization: Bearer ${PARITY_TOKEN}",
            "executor:",
            "  timeoutMs: 1500",
            "  degradedPolicy: SKIP",
            "generation:",
            "  seed: 7",
            "  mode: EXPLORATORY",
            "chains:",
            "  enabled: false",
            "secrets:",
            "  redactFields: [Authorization, \"$.password\"]",
            "someFutureSection: 1",
            ""));

        ParityConfig config = ParityConfig.load(file);

        assertEquals(1500L, config.getExecutor().getTimeoutMs());
        assertEquals(DegradedPolicy.SKIP, config.getExecutor().getDegradedPolicy());
        assertEquals(4, config.getExecutor().getParallelism(), "Незаданные ключи берутся из значений по умолчанию");
        assertEquals(7L, config.getGeneration().getSeed());
        assertEquals(10, config.getGeneration().getCasesPerOperation());
        assertEquals(GenerationMode.EXPLORATORY, config.getGeneration().getMode());
        assertFalse(config.getChains().isEnabled());
        assertEquals(List.of("Authorization", "$.password"), config.getSecrets().getRedactFields());
        assertTrue(config.getTargets().containsKey("a"), "Цели по умолчанию сохраняются");
        assertTrue(config.getTargets().containsKey("staging"));
    }

    @Test
    void testCallTimeoutExceedsWorkerDeadline() {
        ParityConfig.Evaluation evaluation = new ParityConfig.Evaluation();
        evaluation.setWorkerDeadlineMs(8_000L);
        evaluation.setCallTimeoutMs(2_000L);

        evaluation.ensureDefaults();

        assertEquals(16_000L, evaluation.getCallTimeoutMs());
    }

    @Test
    void testMissingUserFile() {
        assertThrows(ConfigException.class, () -> ParityConfig.load(directory.resolve("absent.yaml")));
    }

    @Test
    void testBrokenUserFile() throws Exception {
        Path file = directory.resolve("broken.yaml");
        Files.writeString(file, "executor:\n  timeoutMs: [");

        assertThrows(ConfigException.class, () -> ParityConfig.load(file));
    }

    @Test
    void testResolveTargetByNameExpandsEnvironment() {
        ParityConfig config = ParityConfig.load();
        ParityConfig.Target staging = new ParityConfig.Target();
        staging.setBaseUrl("https://${PARITY_HOST}/api");
        staging.setHeaders(Map.of("Authorization", "Bearer ${PARITY_TOKEN}"));
        config.getTargets().put("staging", staging);

        ParityConfig.Target resolved = config.resolveTarget("staging",
            Map.of("PARITY_HOST", "staging.example.com", "PARITY_TOKEN", "t0k$n"));

        assertEquals("https://staging.example.com/api", resolved.getBaseUrl());
        assertEquals("Bearer t0k$n", resolved.getHeaders().get("Authorization"));
        assertEquals("https://${PARITY_HOST}/api", staging.getBaseUrl(), "Исходная цель не изменяется");
    }

    @Test
    void testResolveTargetByUrl() {
        ParityConfig.Target resolved = ParityConfig.load().resolveTarget("HTTP://127.0.0.1:9000", Map.of());

        assertEquals("HTTP://127.0.0.1:9000", resolved.getBaseUrl());
        assertTrue(resolved.getHeaders().isEmpty());
    }

    @Test
    void testResolveTargetFailures() {
        ParityConfig config = ParityConfig.load();

        ConfigException unknown = assertThrows(ConfigException.class, () -> config.resolveTarget("prod", Map.of()));
        assertTrue(unknown.getMessage().contains("prod"));
        assertThrows(ConfigException.class, () -> config.resolveTarget(" ", Map.of()));

        ParityConfig.Target secured = new ParityConfig.Target();
        secured.setBaseUrl("http://localhost:1");
        secured.setHeaders(Map.of("X-Key", "${MISSING_PARITY_KEY}"));
        config.getTargets().put("secured", secured);
        ConfigException missing = assertThrows(ConfigException.class, () -> config.resolveTarget("secured", Map.of()));
        assertTrue(missing.getMessage().contains("MISSING_PARITY_KEY"));
    }

    @Test
    void testExpandEnvironmentLeavesPlainValues() {
        assertEquals("plain", ParityConfig.expandEnvironment("plain", Map.of()));
        assertNull(ParityConfig.expandEnvironment(null, Map.of()));
        assertEquals("a-1-b-2", ParityConfig.expandEnvironment("a-${X}-b-${Y}", Map.of("X", "1", "Y", "2")));
    }
}
