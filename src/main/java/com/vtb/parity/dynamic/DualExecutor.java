package com.vtb.parity.dynamic;

import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepResult;
import com.vtb.parity.models.TransportErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Выполнение одного запроса против обеих целей одновременно.
 * Всегда возвращает пару результатов; ошибки транспорта становятся терминальными результатами.
 *
 * Слоты ограничителя частоты берутся до отправки, поэтому ожидание очереди
 * не расходует бюджет времени самих вызовов.
 */
@Slf4j
public class DualExecutor implements AutoCloseable {

    /** Запас поверх callTimeout клиента на планирование потоков */
    private static final long JOIN_MARGIN_MS = 2_000L;

    private final TargetClient targetA;
    private final TargetClient targetB;
    private final RequestThrottle throttle;
    private final ExecutorService pool;

    public DualExecutor(TargetClient targetA, TargetClient targetB) {
        this(targetA, targetB, new RequestThrottle(0));
    }

    public DualExecutor(TargetClient targetA, TargetClient targetB, RequestThrottle throttle) {
        this.targetA = targetA;
        this.targetB = targetB;
        this.throttle = throttle;
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "parity-target-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.pool = Executors.newCachedThreadPool(factory);
    }

    public TargetClient getTargetA() {
        return targetA;
    }

    public TargetClient getTargetB() {
        return targetB;
    }

    public StepPair runStep(RequestCase request, long timeoutMs) {
        try {
            throttle.acquire(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            StepResult interrupted = StepResult.terminal(TransportErrorKind.TRANSPORT, "interrupted", 0);
            return new StepPair(interrupted, interrupted);
        }
        Future<StepResult> futureA = pool.submit(() -> targetA.execute(request, timeoutMs));
        Future<StepResult> futureB = pool.submit(() -> targetB.execute(request, timeoutMs));
        StepResult a = await(futureA, targetA.getName(), timeoutMs);
        StepResult b = await(futureB, targetB.getName(), timeoutMs);
        return new StepPair(a, b);
    }

    private StepResult await(Future<StepResult> future, String target, long timeoutMs) {
        try {
            return future.get(timeoutMs + JOIN_MARGIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Вызов не завершился за {} мс", target, timeoutMs + JOIN_MARGIN_MS);
            return StepResult.terminal(TransportErrorKind.TIMEOUT, "timeout after " + timeoutMs + " ms", timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[{}] Ошибка выполнения запроса: {}", target, cause.toString());
            return StepResult.terminal(TransportErrorKind.TRANSPORT, cause.toString(), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return StepResult.terminal(TransportErrorKind.TRANSPORT, "interrupted", 0);
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
