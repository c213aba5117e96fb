package com.vtb.parity.core;

import com.vtb.parity.dynamic.ExecutionOutcome;
import com.vtb.parity.models.StepExecution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Счётчики explore. Пополняются из параллельных задач.
 */
class RunStats {

    private int cases;
    private int chains;
    private int matches;
    private int mismatches;
    private int errors;
    private int truncated;
    private int degradedSteps;
    private int generationFailures;
    private final Map<String, Integer> mismatchesByOperation = new LinkedHashMap<>();
    private final List<String> bundles = new ArrayList<>();
    private final List<String> notices = new ArrayList<>();

    synchronized void record(ExecutionOutcome outcome) {
        if (outcome.isChain()) {
            chains++;
        } else {
            cases++;
        }
        degradedSteps += (int) outcome.getTargetA().stream().filter(StepExecution::isDegraded).count();
        switch (outcome.getStatus()) {
            case MATCH -> matches++;
            case MISMATCH -> {
                mismatches++;
                mismatchesByOperation.merge(outcome.sequenceKey(), 1, Integer::sum);
            }
            case ERROR -> errors++;
            case TRUNCATED -> truncated++;
        }
    }

    synchronized void generationFailed(String operationId, String message) {
        generationFailures++;
        notices.add("Генерация для " + operationId + " не удалась: " + message);
    }

    /**
     * Сбой вне сравнения: кейс или цепочка не выполнены, считаются ошибкой
     */
    synchronized void failed(String sequenceKey, RuntimeException failure) {
        errors++;
        notices.add("Сбой " + sequenceKey + ": " + failure);
    }

    synchronized void bundleWritten(String location) {
        bundles.add(location);
    }

    synchronized void notice(String message) {
        notices.add(message);
    }

    synchronized int getCases() {
        return cases;
    }

    synchronized int getChains() {
        return chains;
    }

    synchronized int getMatches() {
        return matches;
    }

    synchronized int getMismatches() {
        return mismatches;
    }

    synchronized int getErrors() {
        return errors;
    }

    synchronized int getTruncated() {
        return truncated;
    }

    synchronized int getDegradedSteps() {
        return degradedSteps;
    }

    synchronized int getGenerationFailures() {
        return generationFailures;
    }

    synchronized Map<String, Integer> getMismatchesByOperation() {
        return new LinkedHashMap<>(mismatchesByOperation);
    }

    synchronized List<String> getBundles() {
        return new ArrayList<>(bundles);
    }

    synchronized List<String> getNotices() {
        return new ArrayList<>(notices);
    }
}
