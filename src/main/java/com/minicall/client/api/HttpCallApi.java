package com.minicall.client.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallMessageResult;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.rtc.dto.RtcCredentialDto;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * 基于 JDK HttpClient 的 {@link CallApi} / {@link CredentialProvider} 实现。
 *
 * <p>每次请求都从 accessTokenSupplier 取最新的 accessToken（Bearer）。响应统一按
 * {@code Result<T>} 信封解析：401 -> {@link CallAuthException}；IO 错误或 5xx ->
 * {@link CallTransportException}；服务端缺配置（50001）及其余非 ok -> {@link CallRejectedException}。</p>
 */
@Slf4j
public class HttpCallApi implements CallApi, CredentialProvider {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final Supplier<String> accessTokenSupplier;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpCallApi(String baseUrl, Supplier<String> accessTokenSupplier) {
        this(baseUrl, accessTokenSupplier, HttpClient.newHttpClient(), defaultObjectMapper(), DEFAULT_TIMEOUT);
    }

    public HttpCallApi(String baseUrl, Supplier<String> accessTokenSupplier, HttpClient httpClient,
                       ObjectMapper objectMapper, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessTokenSupplier = Objects.requireNonNull(accessTokenSupplier, "accessTokenSupplier");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<CallSessionDto> startCall(long conversationId, CallType callType) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversationId", conversationId);
        body.put("callType", (callType == null ? CallType.VOICE : callType).getDesc());
        return send("POST", "/call/session", body, CallSessionDto.class);
    }

    @Override
    public CompletableFuture<CallSessionDto> getCall(long callId) {
        return send("GET", "/call/session/" + callId, null, CallSessionDto.class);
    }

    @Override
    public CompletableFuture<CallHistoryResponse> getHistory(Long conversationId, int limit, int offset) {
        StringBuilder path = new StringBuilder("/call/session/history?limit=").append(limit).append("&offset=").append(offset);
        if (conversationId != null) {
            path.append("&conversationId=").append(conversationId);
        }
        return send("GET", path.toString(), null, CallHistoryResponse.class);
    }

    @Override
    public CompletableFuture<CallSessionDto> accept(long callId) {
        return send("POST", "/call/session/" + callId + "/accept", null, CallSessionDto.class);
    }

    @Override
    public CompletableFuture<CallSessionDto> reject(long callId) {
        return send("POST", "/call/session/" + callId + "/reject", null, CallSessionDto.class);
    }

    @Override
    public CompletableFuture<CallSessionDto> end(long callId) {
        return send("POST", "/call/session/" + callId + "/end", null, CallSessionDto.class);
    }

    @Override
    public CompletableFuture<CallMessageResult> sendCallMessage(long callId, CallStatus status, Integer durationSeconds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status == null ? null : status.getDesc());
        body.put("durationSeconds", durationSeconds);
        return send("POST", "/call/session/" + callId + "/message", body, CallMessageResult.class);
    }

    @Override
    public CompletableFuture<RtcCredentialDto> fetchCredential(String channel) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", channel);
        return send("POST", "/call/token", body, RtcCredentialDto.class);
    }

    private <T> CompletableFuture<T> send(String method, String path, Object body, Class<T> dataClass) {
        String token = accessTokenSupplier.get();
        if (token == null || token.isBlank()) {
            return CompletableFuture.failedFuture(new CallAuthException("not_signed_in"));
        }

        HttpRequest request;
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Accept", "application/json");
            if (body != null) {
                b.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
            } else if ("GET".equals(method)) {
                b.GET();
            } else {
                b.method(method, HttpRequest.BodyPublishers.noBody());
            }
            request = b.build();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new CallClientException("build_request_failed: " + path, e));
        }

        JavaType type = objectMapper.getTypeFactory().constructParametricType(Result.class, dataClass);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        throw new CallTransportException(method + " " + path + " failed: " + cause, cause);
                    }
                    return this.<T>decode(method, path, resp, type);
                });
    }

    private <T> T decode(String method, String path, HttpResponse<String> resp, JavaType type) {
        int status = resp.statusCode();
        if (status == 401) {
            throw new CallAuthException("unauthorized");
        }

        Result<T> result;
        try {
            result = objectMapper.readValue(resp.body(), type);
        } catch (Exception e) {
            if (status >= 400 && status < 500) {
                throw new CallRejectedException(status, 0, "http_" + status);
            }
            throw new CallTransportException(method + " " + path + " invalid_response: http_" + status, e);
        }

        if (status >= 500) {
            if (result != null && result.code() == ApiCodes.SERVER_CONFIG_ERROR) {
                // 服务端缺配置，重试没有意义
                throw new CallRejectedException(status, result.code(), result.message());
            }
            throw new CallTransportException(result == null ? "http_" + status : result.message(), status);
        }
        if (result == null || !result.ok() || status >= 400) {
            int code = result == null ? 0 : result.code();
            String message = result == null ? "http_" + status : result.message();
            log.debug("call api rejected: {} {} status={}, code={}, message={}", method, path, status, code, message);
            throw new CallRejectedException(status, code, message);
        }
        return result.data();
    }
}
