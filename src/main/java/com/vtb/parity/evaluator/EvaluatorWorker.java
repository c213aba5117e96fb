package com.vtb.parity.evaluator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Процесс-воркер вычислителя выражений.
 *
 * Читает запросы из stdin построчно, отвечает в stdout. Каждое выражение выполняется
 * с собственным дедлайном; по истечении выполнение отменяется и возвращается
 * {@link EvaluatorProtocol#TIMEOUT_ERROR}. Запросы обрабатываются параллельно,
 * ответы помечены id запроса.
 */
@Slf4j
public class EvaluatorWorker {

    static final long DEFAULT_DEADLINE_MS = 5000;

    private final ExpressionEngine engine;
    private final long deadlineMs;
    private final ExecutorService evaluationPool;
    private final ExecutorService requestPool;

    public EvaluatorWorker(ExpressionEngine engine, long deadlineMs) {
        this.engine = engine;
        this.deadlineMs = deadlineMs > 0 ? deadlineMs : DEFAULT_DEADLINE_MS;
        this.evaluationPool = Executors.newCachedThreadPool(daemonThreads("jexl-eval"));
        this.requestPool = Executors.newCachedThreadPool(daemonThreads("worker-request"));
    }

    public static void main(String[] args) throws IOException {
        long deadline = parseDeadline(args);
        EvaluatorWorker worker = new EvaluatorWorker(new JexlExpressionEngine(), deadline);
        worker.serve(System.in, System.out);
    }

    static long parseDeadline(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--deadline-ms".equals(args[i])) {
                try {
                    return Long.parseLong(args[i + 1]);
                } catch (NumberFormatException e) {
                    log.warn("Некорректный --deadline-ms '{}', используется {} мс", args[i + 1], DEFAULT_DEADLINE_MS);
                }
            }
        }
        return DEFAULT_DEADLINE_MS;
    }

    /**
     * Цикл обслуживания до конца входного потока
     */
    public void serve(InputStream in, OutputStream out) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));

        write(writer, EvaluatorProtocol.Response.ready());
        log.debug("Воркер вычислителя готов, дедлайн {} мс", deadlineMs);

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            final String message = line;
            requestPool.execute(() -> reply(writer, process(message)));
        }

        log.debug("stdin закрыт, воркер завершается");
        requestPool.shutdown();
        try {
            if (!requestPool.awaitTermination(deadlineMs + 1000, TimeUnit.MILLISECONDS)) {
                log.warn("Не все запросы завершились до остановки воркера");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        evaluationPool.shutdownNow();
    }

    /**
     * Обработать одну строку запроса и построить ответ. Никогда не бросает исключений.
     */
    public EvaluatorProtocol.Response process(String line) {
        EvaluatorProtocol.Request request;
        try {
            request = EvaluatorProtocol.decodeRequest(line);
        } catch (JsonProcessingException e) {
            return EvaluatorProtocol.Response.failure(null, "malformed request: " + e.getOriginalMessage());
        }

        Map<String, Object> bindings = new LinkedHashMap<>();
        if (request.getBindings() != null) {
            request.getBindings().forEach((name, value) ->
                bindings.put(name, value == null ? null : EvaluatorProtocol.MAPPER.convertValue(value, Object.class)));
        }

        Future<Object> future = evaluationPool.submit(() -> engine.evaluate(request.getExpression(), bindings));
        try {
            Object result = future.get(deadlineMs, TimeUnit.MILLISECONDS);
            JsonNode node = result == null
                ? NullNode.getInstance()
                : EvaluatorProtocol.MAPPER.valueToTree(result);
            return EvaluatorProtocol.Response.success(request.getId(), node);
        } catch (TimeoutException e) {
            future.cancel(true);
            return EvaluatorProtocol.Response.failure(request.getId(), EvaluatorProtocol.TIMEOUT_ERROR);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String message = cause instanceof EvaluationException
                ? cause.getMessage()
                : "evaluation error: " + cause;
            return EvaluatorProtocol.Response.failure(request.getId(), message);
        } catch (IllegalArgumentException e) {
            return EvaluatorProtocol.Response.failure(request.getId(), "result is not JSON-serializable: " + e.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return EvaluatorProtocol.Response.failure(request.getId(), "evaluation interrupted");
        }
    }

    private void reply(Writer writer, EvaluatorProtocol.Response response) {
        try {
            write(writer, response);
        } catch (IOException e) {
            log.warn("Не удалось отправить ответ {}: {}", response.getId(), e.getMessage());
        }
    }

    private static void write(Writer writer, EvaluatorProtocol.Response response) throws IOException {
        String encoded = EvaluatorProtocol.encode(response);
        synchronized (writer) {
            writer.write(encoded);
            writer.write('\n');
            writer.flush();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
