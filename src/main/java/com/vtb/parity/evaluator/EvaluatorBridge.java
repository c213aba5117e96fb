package com.vtb.parity.evaluator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.parity.config.ParityConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Мост к процессу-воркеру вычислителя.
 *
 * Один воркер на запуск, общий для всех потоков сравнения. Запросы мультиплексируются по id:
 * поток-читатель разбирает ответы и завершает ожидающий {@link CompletableFuture}, вызывающий
 * ждёт ответ не дольше {@code callTimeoutMs}. Молчание воркера дольше этого срока считается
 * зависанием, конец потока падением; в обоих случаях воркер перезапускается, не более
 * {@code maxRestarts} раз, после чего мост недоступен до конца запуска.
 */
@Slf4j
public class EvaluatorBridge implements ExpressionEvaluator, AutoCloseable {

    private final ParityConfig.Evaluation settings;
    private final List<String> command;
    private final AtomicLong sequence = new AtomicLong();
    private final Object lifecycle = new Object();

    private WorkerProcess worker;
    private int restarts;
    private boolean unavailable;
    private boolean closed;

    public EvaluatorBridge(ParityConfig.Evaluation settings) {
        this(settings, defaultCommand(settings));
    }

    public EvaluatorBridge(ParityConfig.Evaluation settings, List<String> command) {
        this.settings = settings;
        this.command = List.copyOf(command);
    }

    /**
     * Команда запуска воркера: из настроек, иначе текущая JVM с текущим classpath
     */
    public static List<String> defaultCommand(ParityConfig.Evaluation settings) {
        if (settings.getCommand() != null && !settings.getCommand().isEmpty()) {
            return List.copyOf(settings.getCommand());
        }
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(EvaluatorWorker.class.getName());
        command.add("--deadline-ms");
        command.add(String.valueOf(settings.getWorkerDeadlineMs()));
        return command;
    }

    /**
     * Запустить воркер заранее, чтобы ошибка запуска проявилась до начала прогона
     */
    public void start() {
        acquire();
    }

    @Override
    public EvalResult evaluate(String expression, Map<String, JsonNode> bindings) {
        while (true) {
            WorkerProcess current = acquire();
            String id = Long.toString(sequence.incrementAndGet());
            CompletableFuture<EvaluatorProtocol.Response> pending = current.register(id);

            try {
                current.send(new EvaluatorProtocol.Request(id, expression, new LinkedHashMap<>(bindings)));
            } catch (IOException e) {
                current.forget(id);
                log.warn("Не удалось отправить выражение воркеру: {}", e.getMessage());
                recover(current, "ошибка записи: " + e.getMessage());
                continue;
            }

            try {
                EvaluatorProtocol.Response response = pending.get(settings.getCallTimeoutMs(), TimeUnit.MILLISECONDS);
                return response.isSuccess()
                    ? EvalResult.success(response.getResult())
                    : EvalResult.failure(response.getError());
            } catch (TimeoutException e) {
                current.forget(id);
                log.warn("Воркер не ответил за {} мс на запрос {}", settings.getCallTimeoutMs(), id);
                recover(current, "нет ответа за " + settings.getCallTimeoutMs() + " мс");
                return EvalResult.failure(EvaluatorProtocol.CALL_TIMEOUT_ERROR);
            } catch (ExecutionException e) {
                log.warn("Воркер завершился во время вычисления: {}", e.getCause().getMessage());
                recover(current, e.getCause().getMessage());
            } catch (InterruptedException e) {
                current.forget(id);
                Thread.currentThread().interrupt();
                return EvalResult.failure("evaluation interrupted");
            }
        }
    }

    public int getRestarts() {
        synchronized (lifecycle) {
            return restarts;
        }
    }

    public boolean isUnavailable() {
        synchronized (lifecycle) {
            return unavailable;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycle) {
            closed = true;
            if (worker != null) {
                worker.shutdown();
                worker = null;
            }
        }
    }

    private WorkerProcess acquire() {
        synchronized (lifecycle) {
            if (closed) {
                throw new IllegalStateException("Мост вычислителя закрыт");
            }
            if (unavailable) {
                throw new BridgeUnavailableException("Вычислитель недоступен: исчерпан лимит перезапусков (" + settings.getMaxRestarts() + ")");
            }
            if (worker == null) {
                worker = spawn();
            }
            return worker;
        }
    }

    /**
     * Заменить сбойный воркер. Если другой поток уже сделал это, ничего не делает.
     */
    private void recover(WorkerProcess failed, String reason) {
        synchronized (lifecycle) {
            if (worker != failed) {
                return;
            }
            failed.destroy();
            worker = null;
            if (restarts >= settings.getMaxRestarts()) {
                unavailable = true;
                log.error("Вычислитель недоступен после {} перезапусков, последняя причина: {}", restarts, reason);
                throw new BridgeUnavailableException("Вычислитель недоступен после " + restarts + " перезапусков: " + reason);
            }
            restarts++;
            log.warn("Перезапуск воркера вычислителя ({}/{}): {}", restarts, settings.getMaxRestarts(), reason);
            worker = spawn();
        }
    }

    private WorkerProcess spawn() {
        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            unavailable = true;
            throw new BridgeUnavailableException("Не удалось запустить воркер вычислителя: " + e.getMessage(), e);
        }

        WorkerProcess started = new WorkerProcess(process);
        try {
            started.awaitReady(settings.getStartupTimeoutMs());
        } catch (IOException e) {
            started.destroy();
            unavailable = true;
            throw new BridgeUnavailableException("Воркер вычислителя не сообщил о готовности: " + e.getMessage(), e);
        }
        log.debug("Воркер вычислителя запущен (pid {})", process.pid());
        return started;
    }

    /**
     * Один запущенный процесс с потоком-читателем ответов
     */
    private static final class WorkerProcess {

        private final Process process;
        private final Writer stdin;
        private final Map<String, CompletableFuture<EvaluatorProtocol.Response>> pending = new ConcurrentHashMap<>();
        private final CompletableFuture<Void> ready = new CompletableFuture<>();
        private volatile IOException failure;

        WorkerProcess(Process process) {
            this.process = process;
            this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            Thread reader = new Thread(this::pump, "evaluator-reader-" + process.pid());
            reader.setDaemon(true);
            reader.start();
        }

        CompletableFuture<EvaluatorProtocol.Response> register(String id) {
            CompletableFuture<EvaluatorProtocol.Response> future = new CompletableFuture<>();
            pending.put(id, future);
            IOException dead = failure;
            if (dead != null) {
                pending.remove(id);
                future.completeExceptionally(dead);
            }
            return future;
        }

        void forget(String id) {
            pending.remove(id);
        }

        void send(EvaluatorProtocol.Request request) throws IOException {
            String line = EvaluatorProtocol.encode(request);
            synchronized (stdin) {
                stdin.write(line);
                stdin.write('\n');
                stdin.flush();
            }
        }

        void awaitReady(long timeoutMs) throws IOException {
            try {
                ready.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new IOException("нет сигнала готовности за " + timeoutMs + " мс", e);
            } catch (ExecutionException e) {
                throw new IOException(e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("ожидание готовности прервано", e);
            }
        }

        void shutdown() {
            try {
                stdin.close();
                if (!process.waitFor(2, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (IOException e) {
                log.debug("Ошибка закрытия stdin воркера: {}", e.getMessage());
                process.destroyForcibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }

        void destroy() {
            process.destroyForcibly();
        }

        private void pump() {
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    dispatch(line);
                }
                fail(new IOException("воркер завершился (код " + exitCode() + ")"));
            } catch (IOException e) {
                fail(new IOException("поток воркера оборван: " + e.getMessage(), e));
            }
        }

        private void dispatch(String line) {
            if (line.isBlank()) {
                return;
            }
            EvaluatorProtocol.Response response;
            try {
                response = EvaluatorProtocol.decodeResponse(line);
            } catch (JsonProcessingException e) {
                log.warn("Некорректная строка от воркера: {}", line);
                return;
            }
            if (response.isReadyMessage()) {
                ready.complete(null);
                return;
            }
            CompletableFuture<EvaluatorProtocol.Response> future =
                response.getId() != null ? pending.remove(response.getId()) : null;
            if (future == null) {
                log.debug("Ответ без ожидающего запроса (id {}), вероятно после таймаута", response.getId());
                return;
            }
            future.complete(response);
        }

        private void fail(IOException cause) {
            failure = cause;
            ready.completeExceptionally(cause);
            pending.values().forEach(future -> future.completeExceptionally(cause));
            pending.clear();
        }

        private String exitCode() {
            try {
                return process.waitFor(1, TimeUnit.SECONDS) ? String.valueOf(process.exitValue()) : "?";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "?";
            }
        }
    }
}
