package com.vtb.parity.dynamic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vtb.parity.config.ConfigException;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.models.RequestCase;
import com.vtb.parity.models.StepResult;
import com.vtb.parity.models.TransportErrorKind;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * HTTP-клиент одной цели.
 *
 * Любая ошибка транспорта превращается в терминальный {@link StepResult}, исключения наружу не выходят.
 * Весь вызов, включая чтение тела, ограничен callTimeout.
 */
@Slf4j
public class TargetClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USER_AGENT = "API-Parity/1.0";

    private final String name;
    private final ParityConfig.Target target;
    private final TelemetryCollector telemetryCollector;
    private final OkHttpClient httpClient;
    private final Map<Long, OkHttpClient> clientsByTimeout = new ConcurrentHashMap<>();

    public TargetClient(String name, ParityConfig.Target target, ExecutorSettings settings,
                        TelemetryCollector telemetryCollector) {
        this.name = name;
        this.target = target;
        this.telemetryCollector = telemetryCollector;
        this.httpClient = configure(new OkHttpClient.Builder(), settings.timeoutMs())
            .followRedirects(false)
            .retryOnConnectionFailure(false)
            .build();
    }

    public String getName() {
        return name;
    }

    public String getBaseUrl() {
        return target.getBaseUrl();
    }

    /**
     * Проверка доступности цели перед запуском. Любой HTTP-ответ считается успехом.
     */
    public void checkReachable(long timeoutMs) {
        HttpUrl base = HttpUrl.parse(target.getBaseUrl());
        if (base == null) {
            throw new ConfigException("Некорректный baseUrl цели " + name + ": " + target.getBaseUrl());
        }
        Request request = new Request.Builder().url(base).get().header("User-Agent", USER_AGENT).build();
        try (Response response = client(timeoutMs).newCall(request).execute()) {
            log.info("Цель {} доступна: {} (HTTP {})", name, base, response.code());
        } catch (IOException e) {
            throw new ConfigException("Цель " + name + " недоступна (" + base + "): " + e.getMessage(), e);
        }
    }

    public StepResult execute(RequestCase requestCase, long timeoutMs) {
        HttpUrl url = buildUrl(requestCase);
        if (url == null) {
            return StepResult.terminal(TransportErrorKind.TRANSPORT,
                "invalid url: " + target.getBaseUrl() + requestCase.getRenderedPath(), 0);
        }
        String endpoint = requestCase.getMethod() + " " + url.encodedPath();

        Request request;
        try {
            request = buildRequest(requestCase, url);
        } catch (IllegalArgumentException | IOException e) {
            log.warn("[{}] Запрос {} не может быть отправлен: {}", name, endpoint, e.getMessage());
            return StepResult.terminal(TransportErrorKind.TRANSPORT, "invalid request: " + e.getMessage(), 0);
        }

        long start = System.nanoTime();
        try (Response response = client(timeoutMs).newCall(request).execute()) {
            byte[] bytes = readBody(response);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetryCollector.recordResponse(name, endpoint, response.code(), durationMs);
            log.debug("[{}] {} -> {} за {} мс", name, endpoint, response.code(), durationMs);
            return toStepResult(response, bytes, durationMs);
        } catch (InterruptedIOException timeout) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetryCollector.recordTimeout(name, endpoint);
            log.warn("[{}] Таймаут {} ({} мс)", name, endpoint, timeoutMs);
            return StepResult.terminal(TransportErrorKind.TIMEOUT,
                "timeout after " + timeoutMs + " ms", durationMs);
        } catch (ConnectException | UnknownHostException | NoRouteToHostException refused) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetryCollector.recordConnectionFailure(name, endpoint, refused.getMessage());
            log.warn("[{}] Нет соединения для {}: {}", name, endpoint, refused.getMessage());
            return StepResult.terminal(TransportErrorKind.CONNECTION_FAILURE,
                String.valueOf(refused.getMessage()), durationMs);
        } catch (IOException ioe) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            telemetryCollector.recordNetworkError(name, endpoint, ioe.getMessage());
            log.warn("[{}] Сетевая ошибка {}: {}", name, endpoint, ioe.getMessage());
            return StepResult.terminal(TransportErrorKind.TRANSPORT,
                ioe.getClass().getSimpleName() + ": " + ioe.getMessage(), durationMs);
        }
    }

    private OkHttpClient client(long timeoutMs) {
        if (timeoutMs <= 0) {
            return httpClient;
        }
        return clientsByTimeout.computeIfAbsent(timeoutMs,
            timeout -> configure(httpClient.newBuilder(), timeout).build());
    }

    private static OkHttpClient.Builder configure(OkHttpClient.Builder builder, long timeoutMs) {
        return builder
            .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    HttpUrl buildUrl(RequestCase requestCase) {
        String base = target.getBaseUrl();
        if (base == null) {
            return null;
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = requestCase.getRenderedPath() != null ? requestCase.getRenderedPath() : "";
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        HttpUrl parsed = HttpUrl.parse(base + path);
        if (parsed == null) {
            return null;
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        requestCase.getQuery().forEach((key, values) -> {
            for (String value : values) {
                builder.addQueryParameter(key, value);
            }
        });
        return builder.build();
    }

    private Request buildRequest(RequestCase requestCase, HttpUrl url) throws IOException {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .header("User-Agent", USER_AGENT);

        if (target.getHeaders() != null) {
            target.getHeaders().forEach((header, value) -> {
                if (header != null && value != null) {
                    builder.header(header, value);
                }
            });
        }
        requestCase.getHeaders().forEach((header, values) -> {
            builder.removeHeader(header);
            values.forEach(value -> builder.addHeader(header, value));
        });
        if (!requestCase.getCookies().isEmpty()) {
            builder.header("Cookie", requestCase.getCookies().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; ")));
        }

        String method = requestCase.getMethod() != null ? requestCase.getMethod().toUpperCase(Locale.ROOT) : "GET";
        RequestBody body = requestBody(requestCase);
        switch (method) {
            case "GET", "HEAD" -> builder.method(method, null);
            case "POST", "PUT", "PATCH" -> builder.method(method,
                body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }
        return builder.build();
    }

    private RequestBody requestBody(RequestCase requestCase) throws IOException {
        JsonNode body = requestCase.getBody();
        String mediaType = requestCase.getMediaType();
        if (body == null || mediaType == null) {
            return null;
        }
        String lower = mediaType.toLowerCase(Locale.ROOT);
        if (lower.contains("json")) {
            return RequestBody.create(MAPPER.writeValueAsBytes(body), MediaType.parse(mediaType));
        }
        if (lower.startsWith("application/x-www-form-urlencoded")) {
            FormBody.Builder form = new FormBody.Builder(StandardCharsets.UTF_8);
            fields(body).forEachRemaining(entry -> form.add(entry.getKey(), text(entry.getValue())));
            return form.build();
        }
        if (lower.startsWith("multipart/form-data")) {
            MultipartBody.Builder multipart = new MultipartBody.Builder().setType(MultipartBody.FORM);
            fields(body).forEachRemaining(entry -> multipart.addFormDataPart(entry.getKey(), text(entry.getValue())));
            if (!body.isObject() || body.isEmpty()) {
                multipart.addFormDataPart("value", text(body));
            }
            return multipart.build();
        }
        if (XmlBodies.isXml(lower)) {
            Optional<byte[]> xml = XmlBodies.write(body);
            if (xml.isPresent()) {
                return RequestBody.create(xml.get(), MediaType.parse(mediaType));
            }
            log.debug("[{}] Тело {} не сводится к одному корневому элементу, отправляется как текст",
                name, requestCase.getCaseId());
        }
        return RequestBody.create(text(body).getBytes(StandardCharsets.UTF_8), MediaType.parse(mediaType));
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode body) {
        return body.isObject() ? body.fields() : java.util.Collections.emptyIterator();
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static byte[] readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.bytes() : new byte[0];
    }

    private StepResult toStepResult(Response response, byte[] bytes, long durationMs) {
        Map<String, List<String>> headers = StepResult.normalizeHeaders(response.headers().toMultimap());
        StepResult.StepResultBuilder result = StepResult.builder()
            .statusCode(response.code())
            .headers(headers)
            .elapsedMs(durationMs);
        if (bytes.length == 0) {
            return result.build();
        }
        String contentType = response.header("Content-Type", "");
        String lower = contentType.toLowerCase(Locale.ROOT);
        if (lower.contains("json")) {
            try {
                return result.body(MAPPER.readTree(bytes)).build();
            } catch (IOException e) {
                log.debug("[{}] Тело с Content-Type {} не является JSON, сохраняется как бинарное", name, contentType);
            }
        } else if (XmlBodies.isXml(lower)) {
            try {
                return result.body(XmlBodies.read(bytes)).build();
            } catch (IOException e) {
                log.debug("[{}] Тело с Content-Type {} не является XML, сохраняется как бинарное", name, contentType);
            }
        } else if (lower.startsWith("text/")) {
            Charset charset = Optional.ofNullable(MediaType.parse(contentType))
                .map(type -> type.charset(StandardCharsets.UTF_8))
                .orElse(StandardCharsets.UTF_8);
            return result.body(TextNode.valueOf(new String(bytes, charset))).build();
        }
        return result.bodyBase64(Base64.getEncoder().encodeToString(bytes)).build();
    }
}
