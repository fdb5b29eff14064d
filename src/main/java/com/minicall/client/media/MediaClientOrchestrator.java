package com.minicall.client.media;

import com.minicall.client.api.CallAuthException;
import com.minicall.client.api.CallRejectedException;
import com.minicall.client.api.CredentialProvider;
import com.minicall.client.media.relay.LocalTrack;
import com.minicall.client.media.relay.MediaKind;
import com.minicall.client.media.relay.RelayClient;
import com.minicall.client.media.relay.RelayConnectionState;
import com.minicall.client.media.relay.RelayErrorCode;
import com.minicall.client.media.relay.RelayEventHandler;
import com.minicall.client.media.relay.RelayException;
import com.minicall.client.media.relay.RemoteUser;
import com.minicall.rtc.dto.RtcCredentialDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 单次通话的媒体客户端编排：取凭证、入会、采集、发布、订阅远端、离开。
 *
 * <p>线程模型：每个实例一个单线程事件循环，所有可变状态只在循环线程上读写；
 * 中继 SDK 和凭证接口的回调都切回循环线程再处理。</p>
 *
 * <p>每次异步操作返回后先检查 {@link #generation} 与 {@link #alive}：
 * leave / destroy 会同步推进 generation，之前发起的入会流程在恢复时发现自己过期，直接丢弃结果。</p>
 */
@Slf4j
public class MediaClientOrchestrator implements AutoCloseable {

    private enum Attempt {
        JOINED,
        RETRY
    }

    /** 入会流程被 leave / destroy 打断 */
    static final class StaleJoinException extends RuntimeException {
        StaleJoinException() {
            super("join superseded", null, false, false);
        }
    }

    private final String channel;
    private final boolean videoCall;
    private final RelayClient relay;
    private final CredentialProvider credentials;
    private final MediaClientOptions options;

    private final ScheduledExecutorService loop;
    /** 切回循环线程；销毁后提交的回调直接丢弃，不向 SDK 线程抛异常 */
    private final Executor onLoop;
    private final AtomicLong generation = new AtomicLong();
    private volatile boolean alive = true;
    private volatile MediaCallState snapshot;
    private final List<Consumer<MediaCallState>> stateListeners = new CopyOnWriteArrayList<>();

    // 以下字段只在循环线程上访问
    private MediaClientState state = MediaClientState.UNINITIALIZED;
    private boolean joinInProgress;
    private boolean hasJoined;
    private int publishRetries;
    private LocalTrack audioTrack;
    private LocalTrack videoTrack;
    private boolean muted;
    private boolean videoOff;
    private String error;
    private final Map<Long, RemoteParticipant> remotes = new LinkedHashMap<>();
    private final Map<CompletableFuture<Void>, ScheduledFuture<?>> timers = new HashMap<>();
    private CompletableFuture<MediaCallState> pendingJoin;
    private CompletableFuture<Void> leaveInFlight;
    private CompletableFuture<Void> destroyed;

    public MediaClientOrchestrator(String channel, boolean videoCall, RelayClient relay,
                                   CredentialProvider credentials, MediaClientOptions options) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("missing_channel");
        }
        this.channel = channel;
        this.videoCall = videoCall;
        this.relay = Objects.requireNonNull(relay, "relay");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.options = options == null ? MediaClientOptions.defaults() : options;
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "media-client-" + channel);
            t.setDaemon(true);
            return t;
        });
        this.onLoop = this::runOnLoop;
        this.snapshot = buildSnapshot();
        runOnLoop(() -> {
            state = MediaClientState.READY;
            publishState();
            log.info("media client ready: channel={}, video={}", channel, videoCall);
        });
    }

    public String getChannel() {
        return channel;
    }

    public boolean isVideoCall() {
        return videoCall;
    }

    public boolean isAlive() {
        return alive;
    }

    /** 最近一次状态快照，任意线程可读 */
    public MediaCallState getState() {
        return snapshot;
    }

    public void addStateListener(Consumer<MediaCallState> listener) {
        if (listener != null) {
            stateListeners.add(listener);
        }
    }

    public void removeStateListener(Consumer<MediaCallState> listener) {
        stateListeners.remove(listener);
    }

    // ---------------------------------------------------------------- join

    /**
     * 入会。已经在入会或已入会时直接返回当前快照。
     *
     * <p>失败时 future 异常结束，实例回到 ready 并带上 error，可以再次调用重试。</p>
     */
    public CompletableFuture<MediaCallState> joinChannel() {
        CompletableFuture<MediaCallState> result = new CompletableFuture<>();
        if (!alive) {
            result.completeExceptionally(new IllegalStateException("media_client_destroyed"));
            return result;
        }
        boolean queued = runOnLoop(() -> {
            CompletableFuture<Void> leaving = leaveInFlight;
            if (leaving != null && !leaving.isDone()) {
                leaving.whenCompleteAsync((v, e) -> beginJoin(result), onLoop);
                return;
            }
            beginJoin(result);
        });
        if (!queued) {
            result.completeExceptionally(new IllegalStateException("media_client_destroyed"));
        }
        return result;
    }

    private void beginJoin(CompletableFuture<MediaCallState> result) {
        if (!alive) {
            result.completeExceptionally(new IllegalStateException("media_client_destroyed"));
            return;
        }
        if (joinInProgress) {
            log.warn("join already in progress, skipping: channel={}", channel);
            result.complete(snapshot);
            return;
        }
        if (hasJoined) {
            log.warn("already joined, skipping: channel={}", channel);
            result.complete(snapshot);
            return;
        }
        publishRetries = 0;
        pendingJoin = result;
        startAttempt(result);
    }

    private void startAttempt(CompletableFuture<MediaCallState> result) {
        final long gen = generation.get();
        joinInProgress = true;
        state = MediaClientState.JOINING;
        error = null;
        publishState();
        log.info("join started: channel={}, video={}, publishRetries={}", channel, videoCall, publishRetries);

        CompletableFuture<Void> ready;
        RelayConnectionState cs = relay.connectionState();
        if (cs == RelayConnectionState.CONNECTED || cs == RelayConnectionState.CONNECTING) {
            log.warn("relay still {}, cleaning up before join: channel={}", cs, channel);
            ready = staleTeardown();
        } else {
            ready = CompletableFuture.completedFuture(null);
        }

        ready.thenComposeAsync(v -> {
                    guard(gen);
                    // 先挂回调再入会，入会后立即到达的 published 事件不会丢
                    relay.removeAllListeners();
                    relay.setEventHandler(new Handler(gen));
                    return fetchCredential(gen);
                }, onLoop)
                .thenComposeAsync(cred -> {
                    guard(gen);
                    log.info("joining relay: channel={}, uid={}, token={}", cred.channel(), cred.uid(), RtcCredentialDto.mask(cred.token()));
                    return relay.join(cred.appId(), cred.channel(), cred.token(), cred.uid());
                }, onLoop)
                .thenComposeAsync(v -> {
                    guard(gen);
                    hasJoined = true;
                    log.info("relay joined: channel={}, state={}", channel, relay.connectionState());
                    return relay.createMicrophoneAudioTrack();
                }, onLoop)
                .thenComposeAsync(track -> {
                    adoptTrack(gen, track, MediaKind.AUDIO);
                    return videoCall ? relay.createCameraVideoTrack() : CompletableFuture.<LocalTrack>completedFuture(null);
                }, onLoop)
                .thenComposeAsync(track -> {
                    if (track != null) {
                        adoptTrack(gen, track, MediaKind.VIDEO);
                    } else {
                        guard(gen);
                    }
                    return publishTracks();
                }, onLoop)
                .whenCompleteAsync((attempt, err) -> finishAttempt(gen, result, attempt, err), onLoop);
    }

    private void adoptTrack(long gen, LocalTrack track, MediaKind kind) {
        if (!isCurrent(gen)) {
            releaseTrack(track);
            throw new StaleJoinException();
        }
        if (kind == MediaKind.AUDIO) {
            audioTrack = track;
        } else {
            videoTrack = track;
        }
    }

    private CompletableFuture<Attempt> publishTracks() {
        List<LocalTrack> tracks = new ArrayList<>(2);
        if (audioTrack != null) {
            tracks.add(audioTrack);
        }
        if (videoTrack != null) {
            tracks.add(videoTrack);
        }
        log.info("publishing tracks: channel={}, count={}", channel, tracks.size());
        CompletableFuture<Void> published;
        try {
            published = relay.publish(tracks);
        } catch (RuntimeException e) {
            published = CompletableFuture.failedFuture(e);
        }
        return published.handle((v, err) -> {
            if (err == null) {
                return Attempt.JOINED;
            }
            Throwable cause = unwrap(err);
            if (cause instanceof RelayException re
                    && re.getCode() == RelayErrorCode.INVALID_OPERATION
                    && publishRetries < options.publishRetryLimit()) {
                return Attempt.RETRY;
            }
            throw new CompletionException(cause);
        });
    }

    private void finishAttempt(long gen, CompletableFuture<MediaCallState> result, Attempt attempt, Throwable err) {
        if (!isCurrent(gen)) {
            log.debug("join result discarded (superseded): channel={}", channel);
            result.completeExceptionally(new CancellationException("join_abandoned"));
            return;
        }
        if (err != null) {
            Throwable cause = unwrap(err);
            if (cause instanceof StaleJoinException) {
                result.completeExceptionally(new CancellationException("join_abandoned"));
                return;
            }
            log.warn("join failed: channel={}, err={}", channel, cause.toString());
            releaseLocalTracks();
            CompletableFuture<Void> left = hasJoined ? safeLeave() : CompletableFuture.completedFuture(null);
            hasJoined = false;
            left.whenCompleteAsync((v, e) -> {
                if (!isCurrent(gen)) {
                    result.completeExceptionally(new CancellationException("join_abandoned"));
                    return;
                }
                joinInProgress = false;
                pendingJoin = null;
                state = MediaClientState.READY;
                error = describe(cause);
                publishState();
                result.completeExceptionally(cause);
            }, onLoop);
            return;
        }

        if (attempt == Attempt.RETRY) {
            publishRetries++;
            log.warn("publish rejected (INVALID_OPERATION), restarting join: channel={}, retry={}/{}",
                    channel, publishRetries, options.publishRetryLimit());
            releaseLocalTracks();
            safeLeave().whenCompleteAsync((v, e) -> {
                hasJoined = false;
                // joinInProgress 保持为 true：等待重来期间不接受新的 joinChannel
                if (!isCurrent(gen)) {
                    result.completeExceptionally(new CancellationException("join_abandoned"));
                    return;
                }
                delay(options.restartDelay()).whenCompleteAsync((v2, e2) -> {
                    if (e2 != null || !isCurrent(gen)) {
                        result.completeExceptionally(new CancellationException("join_abandoned"));
                        return;
                    }
                    startAttempt(result);
                }, onLoop);
            }, onLoop);
            return;
        }

        joinInProgress = false;
        hasJoined = true;
        publishRetries = 0;
        pendingJoin = null;
        muted = false;
        videoOff = false;
        error = null;
        state = MediaClientState.JOINED;
        publishState();
        log.info("join completed: channel={}, audio={}, video={}", channel, audioTrack != null, videoTrack != null);
        result.complete(snapshot);
    }

    // ---------------------------------------------------------------- credential

    private CompletableFuture<RtcCredentialDto> fetchCredential(long gen) {
        CompletableFuture<RtcCredentialDto> out = new CompletableFuture<>();
        fetchCredentialAttempt(gen, 0, out);
        return out;
    }

    private void fetchCredentialAttempt(long gen, int attempt, CompletableFuture<RtcCredentialDto> out) {
        if (!isCurrent(gen)) {
            out.completeExceptionally(new StaleJoinException());
            return;
        }
        log.info("fetching credential: channel={}, attempt={}/{}", channel, attempt + 1, options.credentialAttempts());
        CompletableFuture<RtcCredentialDto> f;
        try {
            f = credentials.fetchCredential(channel);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        f.whenCompleteAsync((cred, err) -> {
            if (err == null && cred != null) {
                out.complete(cred);
                return;
            }
            Throwable cause = err == null ? new IllegalStateException("empty_credential") : unwrap(err);
            if (cause instanceof CallAuthException || cause instanceof CallRejectedException) {
                log.warn("credential fetch rejected, not retrying: channel={}, err={}", channel, cause.toString());
                out.completeExceptionally(cause);
                return;
            }
            if (attempt + 1 >= options.credentialAttempts()) {
                log.warn("credential fetch failed, attempts exhausted: channel={}, err={}", channel, cause.toString());
                out.completeExceptionally(cause);
                return;
            }
            Duration backoff = options.credentialBackoff(attempt);
            log.warn("credential fetch failed, retry in {}ms: channel={}, attempt={}, err={}",
                    backoff.toMillis(), channel, attempt + 1, cause.toString());
            delay(backoff).whenCompleteAsync((v, e) -> {
                if (e != null) {
                    out.completeExceptionally(new StaleJoinException());
                    return;
                }
                fetchCredentialAttempt(gen, attempt + 1, out);
            }, onLoop);
        }, onLoop);
    }

    // ---------------------------------------------------------------- leave / destroy

    /**
     * 离开频道，回到 ready。幂等；没有入会过也可以调用。
     */
    public CompletableFuture<MediaCallState> leaveChannel() {
        generation.incrementAndGet();
        CompletableFuture<MediaCallState> result = new CompletableFuture<>();
        boolean queued = runOnLoop(() -> doLeave(MediaClientState.READY)
                .whenComplete((v, e) -> result.complete(snapshot)));
        if (!queued) {
            result.complete(snapshot);
        }
        return result;
    }

    /**
     * 彻底销毁：离开频道、移除回调、关闭事件循环。之后所有操作都会失败。
     */
    public synchronized CompletableFuture<Void> destroy() {
        if (destroyed != null) {
            return destroyed;
        }
        alive = false;
        generation.incrementAndGet();
        CompletableFuture<Void> done = new CompletableFuture<>();
        destroyed = done;
        boolean queued = runOnLoop(() -> doLeave(MediaClientState.TERMINATED).whenComplete((v, e) -> {
            stateListeners.clear();
            loop.shutdown();
            log.info("media client destroyed: channel={}", channel);
            done.complete(null);
        }));
        if (!queued) {
            done.complete(null);
        }
        return done;
    }

    @Override
    public void close() {
        destroy();
    }

    private CompletableFuture<Void> doLeave(MediaClientState finalState) {
        CompletableFuture<Void> running = leaveInFlight;
        if (running != null && !running.isDone()) {
            return running.thenComposeAsync(v -> doLeave(finalState), onLoop);
        }

        joinInProgress = false;
        hasJoined = false;
        publishRetries = 0;
        cancelTimers();
        CompletableFuture<MediaCallState> join = pendingJoin;
        pendingJoin = null;
        if (join != null && !join.isDone()) {
            join.completeExceptionally(new CancellationException("join_abandoned"));
        }

        state = MediaClientState.LEAVING;
        publishState();
        releaseLocalTracks();

        CompletableFuture<Void> left;
        if (relay.connectionState() != RelayConnectionState.DISCONNECTED) {
            log.info("leaving relay: channel={}, state={}", channel, relay.connectionState());
            left = safeLeave();
        } else {
            left = CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> finished = left.handleAsync((v, e) -> {
            relay.removeAllListeners();
            remotes.clear();
            muted = false;
            videoOff = false;
            error = null;
            state = finalState;
            publishState();
            log.info("leave completed: channel={}, state={}", channel, finalState);
            return (Void) null;
        }, onLoop);
        leaveInFlight = finished;
        return finished;
    }

    /**
     * 上一次连接残留：释放轨道、离开、清回调，再等一小段时间让中继收尾。
     */
    private CompletableFuture<Void> staleTeardown() {
        releaseLocalTracks();
        return safeLeave().thenComposeAsync(v -> {
            hasJoined = false;
            relay.removeAllListeners();
            return delay(options.staleSettleDelay());
        }, onLoop);
    }

    // ---------------------------------------------------------------- mute / video

    public CompletableFuture<MediaCallState> toggleMute() {
        return toggle(MediaKind.AUDIO);
    }

    public CompletableFuture<MediaCallState> toggleVideo() {
        return toggle(MediaKind.VIDEO);
    }

    private CompletableFuture<MediaCallState> toggle(MediaKind kind) {
        CompletableFuture<MediaCallState> result = new CompletableFuture<>();
        boolean queued = runOnLoop(() -> {
            LocalTrack track = kind == MediaKind.AUDIO ? audioTrack : videoTrack;
            if (track == null) {
                result.complete(snapshot);
                return;
            }
            boolean off = !(kind == MediaKind.AUDIO ? muted : videoOff);
            track.setEnabled(!off).whenCompleteAsync((v, e) -> {
                if (e != null) {
                    log.warn("toggle {} failed: channel={}, err={}", kind, channel, unwrap(e).toString());
                    result.completeExceptionally(unwrap(e));
                    return;
                }
                LocalTrack current = kind == MediaKind.AUDIO ? audioTrack : videoTrack;
                if (current == track) {
                    if (kind == MediaKind.AUDIO) {
                        muted = off;
                    } else {
                        videoOff = off;
                    }
                    publishState();
                    log.info("toggle {}: channel={}, off={}", kind, channel, off);
                }
                result.complete(snapshot);
            }, onLoop);
        });
        if (!queued) {
            result.complete(snapshot);
        }
        return result;
    }

    // ---------------------------------------------------------------- relay events

    private final class Handler implements RelayEventHandler {

        private final long gen;

        private Handler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onUserPublished(RemoteUser user, MediaKind kind) {
            runOnLoop(() -> {
                if (!isCurrent(gen)) {
                    return;
                }
                log.info("remote published: channel={}, uid={}, kind={}", channel, user.uid(), kind);
                CompletableFuture<Void> sub;
                try {
                    sub = relay.subscribe(user, kind);
                } catch (RuntimeException e) {
                    sub = CompletableFuture.failedFuture(e);
                }
                sub.whenCompleteAsync((v, e) -> {
                    if (!isCurrent(gen)) {
                        return;
                    }
                    if (e != null) {
                        log.warn("subscribe failed: channel={}, uid={}, kind={}, err={}", channel, user.uid(), kind, unwrap(e).toString());
                        return;
                    }
                    mergeRemote(user, kind);
                    if (kind == MediaKind.AUDIO && user.audioTrack() != null) {
                        user.audioTrack().play();
                    }
                }, onLoop);
            });
        }

        @Override
        public void onUserUnpublished(RemoteUser user, MediaKind kind) {
            runOnLoop(() -> {
                if (!isCurrent(gen)) {
                    return;
                }
                log.info("remote unpublished: channel={}, uid={}, kind={}", channel, user.uid(), kind);
                if (remotes.containsKey(user.uid())) {
                    remotes.put(user.uid(), RemoteParticipant.of(user));
                    publishState();
                }
            });
        }

        @Override
        public void onUserJoined(RemoteUser user) {
            log.info("remote joined: channel={}, uid={}", channel, user.uid());
        }

        @Override
        public void onUserLeft(RemoteUser user, String reason) {
            runOnLoop(() -> {
                if (!isCurrent(gen)) {
                    return;
                }
                log.info("remote left: channel={}, uid={}, reason={}", channel, user.uid(), reason);
                if (remotes.remove(user.uid()) != null) {
                    publishState();
                }
            });
        }

        @Override
        public void onConnectionStateChange(RelayConnectionState current, RelayConnectionState previous, String reason) {
            log.info("relay connection state: channel={}, {} -> {}, reason={}", channel, previous, current, reason);
        }

        @Override
        public void onTokenPrivilegeWillExpire() {
            // 没有续期流程，长通话会在 token 过期时掉线
            log.warn("relay token will expire soon, renewal not supported: channel={}", channel);
        }

        @Override
        public void onTokenPrivilegeDidExpire() {
            log.error("relay token expired, call will disconnect: channel={}", channel);
        }

        @Override
        public void onException(int code, String message, long uid) {
            log.warn("relay exception: channel={}, code={}, msg={}, uid={}", channel, code, message, uid);
        }
    }

    /**
     * 只有带来新轨道时才更新远端列表，重复的 published 事件不会触发状态变化。
     */
    private void mergeRemote(RemoteUser user, MediaKind kind) {
        RemoteParticipant existing = remotes.get(user.uid());
        if (existing != null) {
            boolean newVideo = kind == MediaKind.VIDEO && existing.videoTrack() == null && user.videoTrack() != null;
            boolean newAudio = kind == MediaKind.AUDIO && existing.audioTrack() == null && user.audioTrack() != null;
            if (!newVideo && !newAudio) {
                log.debug("remote unchanged, skip update: channel={}, uid={}", channel, user.uid());
                return;
            }
        }
        remotes.put(user.uid(), RemoteParticipant.of(user));
        publishState();
    }

    // ---------------------------------------------------------------- helpers

    private boolean isCurrent(long gen) {
        return alive && generation.get() == gen;
    }

    private void guard(long gen) {
        if (!isCurrent(gen)) {
            throw new StaleJoinException();
        }
    }

    private void releaseLocalTracks() {
        LocalTrack a = audioTrack;
        LocalTrack v = videoTrack;
        audioTrack = null;
        videoTrack = null;
        releaseTrack(a);
        releaseTrack(v);
    }

    private void releaseTrack(LocalTrack track) {
        if (track == null) {
            return;
        }
        try {
            track.stop();
            track.close();
        } catch (RuntimeException e) {
            log.debug("release track failed (ignored): channel={}, kind={}, err={}", channel, track.kind(), e.toString());
        }
    }

    /**
     * relay.leave()，失败只记日志。返回的 future 不会异常结束。
     */
    private CompletableFuture<Void> safeLeave() {
        CompletableFuture<Void> f;
        try {
            f = relay.leave();
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.handle((v, e) -> {
            if (e != null) {
                log.debug("relay leave failed (ignored): channel={}, err={}", channel, unwrap(e).toString());
            }
            return null;
        });
    }

    /**
     * 在循环线程上延迟完成；leave / destroy 时统一取消。
     */
    private CompletableFuture<Void> delay(Duration d) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        long ms = d == null ? 0 : Math.max(0, d.toMillis());
        try {
            ScheduledFuture<?> sf = loop.schedule(() -> {
                timers.remove(f);
                f.complete(null);
            }, ms, TimeUnit.MILLISECONDS);
            timers.put(f, sf);
        } catch (RejectedExecutionException e) {
            f.completeExceptionally(new CancellationException("loop_stopped"));
        }
        return f;
    }

    private void cancelTimers() {
        if (timers.isEmpty()) {
            return;
        }
        List<Map.Entry<CompletableFuture<Void>, ScheduledFuture<?>>> pending = new ArrayList<>(timers.entrySet());
        timers.clear();
        for (Map.Entry<CompletableFuture<Void>, ScheduledFuture<?>> e : pending) {
            e.getValue().cancel(false);
            e.getKey().completeExceptionally(new CancellationException("timer_cancelled"));
        }
    }

    private boolean runOnLoop(Runnable task) {
        try {
            loop.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("media client task failed: channel={}, err={}", channel, e.toString());
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("media client loop stopped, task dropped: channel={}", channel);
            return false;
        }
    }

    private void publishState() {
        MediaCallState s = buildSnapshot();
        snapshot = s;
        for (Consumer<MediaCallState> l : stateListeners) {
            try {
                l.accept(s);
            } catch (RuntimeException e) {
                log.warn("media state listener failed: channel={}, err={}", channel, e.toString());
            }
        }
    }

    private MediaCallState buildSnapshot() {
        return new MediaCallState(state, audioTrack, videoTrack, new ArrayList<>(remotes.values()), muted, videoOff, error);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof CallAuthException) {
            return "must_sign_in";
        }
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
