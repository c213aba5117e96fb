package com.vtb.parity.dynamic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Счётчики обращений к целям. Общий для параллельных исполнителей.
 * Хранятся только агрегаты по каждой цели, поэтому память не растёт с числом запросов.
 */
public class TelemetryCollector {

    private final Map<String, TelemetrySummary> targets = new LinkedHashMap<>();

    public synchronized void recordResponse(String target, String endpoint, int statusCode, long durationMs) {
        TelemetrySummary counters = counters(target);
        counters.setTotalResponses(counters.getTotalResponses() + 1);
        counters.setTotalLatencyMs(counters.getTotalLatencyMs() + Math.max(0, durationMs));
        if (statusCode >= 200 && statusCode < 300) {
            counters.setSuccessResponses(counters.getSuccessResponses() + 1);
        } else if (statusCode == 429) {
            counters.setRateLimitResponses(counters.getRateLimitResponses() + 1);
        } else if (statusCode >= 400 && statusCode < 500) {
            counters.setClientErrors(counters.getClientErrors() + 1);
        } else if (statusCode >= 500) {
            counters.setServerErrors(counters.getServerErrors() + 1);
        }
    }

    public synchronized void recordTimeout(String target, String endpoint) {
        TelemetrySummary counters = counters(target);
        counters.setTimeouts(counters.getTimeouts() + 1);
    }

    public synchronized void recordConnectionFailure(String target, String endpoint, String message) {
        TelemetrySummary counters = counters(target);
        counters.setConnectionFailures(counters.getConnectionFailures() + 1);
    }

    public synchronized void recordNetworkError(String target, String endpoint, String message) {
        TelemetrySummary counters = counters(target);
        counters.setNetworkErrors(counters.getNetworkErrors() + 1);
    }

    private TelemetrySummary counters(String target) {
        return targets.computeIfAbsent(target, name -> TelemetrySummary.builder().build());
    }

    /**
     * Сумма по всем целям
     */
    public synchronized TelemetrySummary summarize() {
        TelemetrySummary total = TelemetrySummary.builder().build();
        for (TelemetrySummary counters : targets.values()) {
            total.setTotalResponses(total.getTotalResponses() + counters.getTotalResponses());
            total.setSuccessResponses(total.getSuccessResponses() + counters.getSuccessResponses());
            total.setClientErrors(total.getClientErrors() + counters.getClientErrors());
            total.setRateLimitResponses(total.getRateLimitResponses() + counters.getRateLimitResponses());
            total.setServerErrors(total.getServerErrors() + counters.getServerErrors());
            total.setTimeouts(total.getTimeouts() + counters.getTimeouts());
            total.setConnectionFailures(total.getConnectionFailures() + counters.getConnectionFailures());
            total.setNetworkErrors(total.getNetworkErrors() + counters.getNetworkErrors());
            total.setTotalLatencyMs(total.getTotalLatencyMs() + counters.getTotalLatencyMs());
        }
        return total;
    }

    /**
     * Копия счётчиков одной цели; пустые счётчики, если к цели не обращались
     */
    public synchronized TelemetrySummary summarize(String target) {
        TelemetrySummary counters = targets.get(target);
        return counters != null ? counters.toBuilder().build() : TelemetrySummary.builder().build();
    }

    public List<String> buildNotices() {
        TelemetrySummary summary = summarize();
        List<String> notices = new ArrayList<>();
        if (summary.getTimeouts() > 0) {
            notices.add("Таймауты при обращении к целям: " + summary.getTimeouts());
        }
        if (summary.getConnectionFailures() > 0) {
            notices.add("Цели недоступны (отказ соединения): " + summary.getConnectionFailures());
        }
        if (summary.getNetworkErrors() > 0) {
            notices.add("Сетевые ошибки: " + summary.getNetworkErrors());
        }
        if (summary.getRateLimitResponses() > 0) {
            notices.add("Ответов 429 (rate limit): " + summary.getRateLimitResponses()
                + ", имеет смысл снизить executor.requestsPerSecond");
        }
        if (summary.getServerErrors() > 0) {
            notices.add("Цели вернули " + summary.getServerErrors() + " ответов 5xx");
        }
        return notices;
    }
}
