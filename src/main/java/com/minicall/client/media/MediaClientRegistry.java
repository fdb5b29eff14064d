package com.minicall.client.media;

import com.minicall.client.api.CredentialProvider;
import com.minicall.client.media.relay.RelayClientFactory;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 每个通话一个 {@link MediaClientOrchestrator}，用完即弃。
 *
 * <p>同一个 callId 再次打开时，先把旧实例彻底销毁（轨道释放、离开中继、回调移除），再创建新实例。</p>
 */
@Slf4j
public class MediaClientRegistry implements AutoCloseable {

    private static final Duration DESTROY_WAIT = Duration.ofSeconds(5);

    private final RelayClientFactory relayFactory;
    private final CredentialProvider credentials;
    private final MediaClientOptions options;
    private final Map<Long, MediaClientOrchestrator> instances = new ConcurrentHashMap<>();

    public MediaClientRegistry(RelayClientFactory relayFactory, CredentialProvider credentials, MediaClientOptions options) {
        this.relayFactory = Objects.requireNonNull(relayFactory, "relayFactory");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.options = options == null ? MediaClientOptions.defaults() : options;
    }

    public synchronized MediaClientOrchestrator open(CallSessionDto call) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(call.getId(), "call.id");
        return open(call.getId(), call.getChannelName(), call.getCallType() == CallType.VIDEO);
    }

    public synchronized MediaClientOrchestrator open(long callId, String channel, boolean videoCall) {
        MediaClientOrchestrator previous = instances.remove(callId);
        if (previous != null) {
            log.info("media client replaced, destroying previous: callId={}, channel={}", callId, previous.getChannel());
            awaitDestroy(callId, previous.destroy());
        }
        MediaClientOrchestrator created = new MediaClientOrchestrator(channel, videoCall, relayFactory.create(), credentials, options);
        instances.put(callId, created);
        return created;
    }

    public MediaClientOrchestrator get(long callId) {
        return instances.get(callId);
    }

    public CompletableFuture<Void> close(long callId) {
        MediaClientOrchestrator o = instances.remove(callId);
        if (o == null) {
            return CompletableFuture.completedFuture(null);
        }
        return o.destroy();
    }

    @Override
    public synchronized void close() {
        List<Long> ids = new ArrayList<>(instances.keySet());
        for (Long id : ids) {
            MediaClientOrchestrator o = instances.remove(id);
            if (o != null) {
                awaitDestroy(id, o.destroy());
            }
        }
    }

    public int size() {
        return instances.size();
    }

    private static void awaitDestroy(long callId, CompletableFuture<Void> destroyed) {
        try {
            destroyed.get(DESTROY_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while destroying media client: callId={}", callId);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("media client destroy did not finish cleanly: callId={}, err={}", callId, e.toString());
        }
    }
}
