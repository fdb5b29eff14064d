package com.minicall.client.signal;

import com.minicall.client.api.CallApi;
import com.minicall.domain.call.CallStateMachine;
import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 通话信令对账（轮询版）。
 *
 * <p>没有推送通道，参与方每隔 pollInterval 拉一次：</p>
 * <ul>
 *   <li>有进行中的通话：拉取该通话，与本地 lastObserved 比较，变化时触发一次副作用；</li>
 *   <li>没有进行中的通话：拉取最近通话记录，找第一条 ringing、主叫不是自己（且在指定会话内）的记录作为来电。</li>
 * </ul>
 *
 * <p>lastObserved 是触发副作用的唯一依据，同一 (callId, status) 最多触发一次；
 * 通话记录消息另外按 (callId, status) 去重。轮询失败只打 debug 日志，下一次 tick 再试。</p>
 */
@Slf4j
public class CallSignalingReconciler implements AutoCloseable {

    private final CallApi api;
    private final long selfUserId;
    private final Long conversationScope;
    private final CallSignalListener listener;
    private final CallSignalingOptions options;
    private final CallMessageDedup messageDedup;

    private final Object lock = new Object();
    private final Cache<Long, CallStatus> lastObserved;
    private CallSessionDto activeCall;
    private CallSessionDto incomingCall;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopped;
    private volatile ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;

    /**
     * @param conversationScope 只关心某个会话的来电时传会话 id；null 表示所有会话
     */
    public CallSignalingReconciler(CallApi api, long selfUserId, Long conversationScope,
                                   CallSignalListener listener, CallSignalingOptions options) {
        this.api = Objects.requireNonNull(api, "api");
        this.selfUserId = selfUserId;
        this.conversationScope = conversationScope;
        this.listener = listener == null ? new CallSignalListener() { } : listener;
        this.options = options == null ? CallSignalingOptions.defaults() : options;
        this.messageDedup = new CallMessageDedup(this.options.messageDedupTtl(), this.options.messageDedupMaxSize());
        // 与通话记录去重同一个窗口：窗口外的旧通话不会再被轮询到
        Duration ttl = this.options.messageDedupTtl();
        this.lastObserved = Caffeine.newBuilder()
                .maximumSize(Math.max(1, this.options.messageDedupMaxSize()))
                .expireAfterWrite(ttl == null || ttl.isZero() || ttl.isNegative() ? Duration.ofHours(1) : ttl)
                .build();
    }

    public void start() {
        if (stopped || !started.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "call-signal-poll-" + selfUserId);
            t.setDaemon(true);
            return t;
        });
        scheduler = s;
        long intervalMs = Math.max(1, options.pollInterval().toMillis());
        pollTask = s.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("call signaling started: userId={}, conversationScope={}, intervalMs={}", selfUserId, conversationScope, intervalMs);
    }

    /**
     * 停止轮询；之后到达的响应全部丢弃。
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
        }
        ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdownNow();
        }
        log.info("call signaling stopped: userId={}", selfUserId);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * 执行一次对账。上一次还没结束时直接返回（不并发执行）。
     */
    public CompletableFuture<Void> tick() {
        if (stopped || !inFlight.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> work;
        try {
            CallSessionDto active = getActiveCall();
            work = active != null ? pollActive(active) : discoverIncoming();
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }
        return work.handle((v, err) -> {
            if (err != null) {
                log.debug("call signaling poll failed (suppressed): userId={}, err={}", selfUserId, err.toString());
            }
            inFlight.set(false);
            return null;
        });
    }

    // ---------------------------------------------------------------- 参与方动作

    public CompletableFuture<CallSessionDto> startCall(long conversationId, CallType callType) {
        return api.startCall(conversationId, callType).thenApply(this::observeAndReturn);
    }

    public CompletableFuture<CallSessionDto> accept(long callId) {
        return api.accept(callId).thenApply(this::observeAndReturn);
    }

    public CompletableFuture<CallSessionDto> reject(long callId) {
        return api.reject(callId).thenApply(this::observeAndReturn);
    }

    /**
     * 结束当前通话；没有进行中的通话时返回 null。
     */
    public CompletableFuture<CallSessionDto> end() {
        CallSessionDto active = getActiveCall();
        if (active == null) {
            return CompletableFuture.completedFuture(null);
        }
        return api.end(active.getId()).thenApply(this::observeAndReturn);
    }

    public CallSessionDto getActiveCall() {
        synchronized (lock) {
            return activeCall;
        }
    }

    public CallSessionDto getIncomingCall() {
        synchronized (lock) {
            return incomingCall;
        }
    }

    /**
     * 对一次观察到的会话状态做对账；状态没有变化时什么都不做。
     *
     * @return true 表示触发了一次迁移副作用
     */
    public boolean observe(CallSessionDto next) {
        if (next == null || next.getId() == null || next.getStatus() == null || stopped) {
            return false;
        }
        long id = next.getId();
        CallStatus status = next.getStatus();

        CallStatus prev;
        boolean incomingCleared = false;
        CallSessionDto clearedIncoming = null;
        synchronized (lock) {
            prev = lastObserved.getIfPresent(id);
            if (prev == null) {
                prev = knownStatus(id);
            }
            lastObserved.put(id, status);
            if (status == prev) {
                if (isActive(id)) {
                    activeCall = next;
                }
                return false;
            }

            switch (status) {
                case RINGING -> {
                    if (Objects.equals(next.getCallerUserId(), selfUserId)) {
                        activeCall = next;
                    }
                }
                case ACCEPTED -> activeCall = next;
                default -> {
                    if (isActive(id)) {
                        activeCall = null;
                    }
                }
            }
            if (status != CallStatus.RINGING && incomingCall != null && incomingCall.getId() == id) {
                clearedIncoming = incomingCall;
                incomingCall = null;
                incomingCleared = true;
            }
        }

        log.info("call observed: userId={}, callId={}, from={}, to={}",
                selfUserId, id, prev == null ? "-" : prev.getDesc(), status.getDesc());
        if (incomingCleared) {
            listener.onIncomingCleared(clearedIncoming);
        }
        switch (status) {
            case ACCEPTED -> listener.onAccepted(next);
            case REJECTED -> {
                listener.onRejected(next);
                appendTranscript(next, CallStatus.REJECTED, null);
            }
            case ENDED -> {
                int duration = durationOf(next);
                listener.onEnded(next, duration);
                appendTranscript(next, CallStatus.ENDED, duration);
            }
            case MISSED -> {
                listener.onMissed(next);
                appendTranscript(next, CallStatus.MISSED, null);
            }
            default -> {
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- 轮询

    private CompletableFuture<Void> pollActive(CallSessionDto active) {
        return api.getCall(active.getId()).thenAccept(next -> {
            if (stopped || next == null) {
                return;
            }
            observe(next);
        });
    }

    private CompletableFuture<Void> discoverIncoming() {
        return api.getHistory(conversationScope, options.historyLimit(), 0).thenCompose(resp -> {
            if (stopped) {
                return CompletableFuture.completedFuture(null);
            }
            CallSessionDto ringing = firstIncomingRinging(resp);
            if (ringing != null) {
                return surfaceIncoming(ringing);
            }

            CallSessionDto vanished;
            synchronized (lock) {
                vanished = incomingCall;
                incomingCall = null;
            }
            if (vanished == null) {
                return CompletableFuture.completedFuture(null);
            }
            listener.onIncomingCleared(vanished);
            return resolveVanished(vanished);
        });
    }

    /**
     * 来电从界面上撤下后取一次最新状态，主叫挂断时由这里通知被叫 missed。
     */
    private CompletableFuture<Void> resolveVanished(CallSessionDto vanished) {
        return api.getCall(vanished.getId()).thenAccept(next -> {
            if (stopped || next == null || next.getStatus() == null) {
                return;
            }
            if (next.getStatus().isTerminal()) {
                observe(next);
            } else {
                synchronized (lock) {
                    lastObserved.put(next.getId(), next.getStatus());
                }
            }
        });
    }

    private CallSessionDto firstIncomingRinging(CallHistoryResponse resp) {
        List<CallSessionDto> calls = resp == null ? null : resp.calls();
        if (calls == null) {
            return null;
        }
        for (CallSessionDto c : calls) {
            if (c == null || c.getId() == null || c.getStatus() != CallStatus.RINGING) {
                continue;
            }
            if (Objects.equals(c.getCallerUserId(), selfUserId)) {
                continue;
            }
            if (conversationScope != null && !conversationScope.equals(c.getConversationId())) {
                continue;
            }
            return c;
        }
        return null;
    }

    private CompletableFuture<Void> surfaceIncoming(CallSessionDto ringing) {
        CallSessionDto replaced;
        synchronized (lock) {
            if (incomingCall != null && Objects.equals(incomingCall.getId(), ringing.getId())) {
                return CompletableFuture.completedFuture(null);
            }
            replaced = incomingCall;
            incomingCall = ringing;
            lastObserved.asMap().putIfAbsent(ringing.getId(), CallStatus.RINGING);
        }
        if (replaced != null) {
            // 主叫挂断后在一个轮询周期内重拨：旧来电同样要撤下并对账
            listener.onIncomingCleared(replaced);
        }
        log.info("incoming call: userId={}, callId={}, callerUserId={}, callType={}",
                selfUserId, ringing.getId(), ringing.getCallerUserId(),
                ringing.getCallType() == null ? "-" : ringing.getCallType().getDesc());
        listener.onIncomingCall(ringing);
        return replaced == null ? CompletableFuture.completedFuture(null) : resolveVanished(replaced);
    }

    private void appendTranscript(CallSessionDto call, CallStatus status, Integer durationSeconds) {
        if (!messageDedup.markIfAbsent(call.getId(), status)) {
            return;
        }
        api.sendCallMessage(call.getId(), status, durationSeconds).whenComplete((r, err) -> {
            if (err != null) {
                log.warn("call message send failed: callId={}, status={}, err={}", call.getId(), status.getDesc(), err.toString());
            }
        });
    }

    long observedCallCount() {
        lastObserved.cleanUp();
        return lastObserved.estimatedSize();
    }

    private CallSessionDto observeAndReturn(CallSessionDto session) {
        observe(session);
        return session;
    }

    private CallStatus knownStatus(long id) {
        if (activeCall != null && activeCall.getId() == id) {
            return activeCall.getStatus();
        }
        if (incomingCall != null && incomingCall.getId() == id) {
            return incomingCall.getStatus();
        }
        return null;
    }

    private boolean isActive(long id) {
        return activeCall != null && activeCall.getId() != null && activeCall.getId() == id;
    }

    private static int durationOf(CallSessionDto call) {
        if (call.getDurationSeconds() != null && call.getDurationSeconds() > 0) {
            return call.getDurationSeconds();
        }
        return CallStateMachine.durationSeconds(call.getStartedAt(), call.getEndedAt());
    }
}
