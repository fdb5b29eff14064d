package com.minicall.client.signal;

import com.minicall.client.api.CallApi;
import com.minicall.client.api.CallTransportException;
import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CallSignalingReconcilerTest {

    private static final long C1 = 501L;
    private static final long U1 = 1L;
    private static final long U2 = 2L;

    @Test
    void acceptedThenEnded_ShouldNotifyBothSidesAndWriteOneTranscriptEntry() {
        InMemoryCallServer server = new InMemoryCallServer();
        RecordingListener l1 = new RecordingListener();
        RecordingListener l2 = new RecordingListener();
        CallSignalingReconciler r1 = new CallSignalingReconciler(server.as(U1), U1, C1, l1, CallSignalingOptions.defaults());
        CallSignalingReconciler r2 = new CallSignalingReconciler(server.as(U2), U2, C1, l2, CallSignalingOptions.defaults());

        CallSessionDto call = r1.startCall(C1, CallType.VIDEO).join();
        assertEquals(call.getId(), r1.getActiveCall().getId());

        r2.tick().join();
        assertEquals(List.of("incoming:" + call.getId()), l2.events);
        assertEquals(call.getId(), r2.getIncomingCall().getId());

        r2.accept(call.getId()).join();
        assertEquals(CallStatus.ACCEPTED, r2.getActiveCall().getStatus());
        assertNull(r2.getIncomingCall());

        r1.tick().join();
        assertEquals(List.of("accepted"), l1.events);

        server.advanceSeconds(42);
        r1.end().join();
        r2.tick().join();
        r2.tick().join();
        r1.tick().join();

        assertEquals(List.of("accepted", "ended:42"), l1.events);
        assertEquals(List.of("incoming:" + call.getId(), "cleared", "accepted", "ended:42"), l2.events);
        assertEquals(List.of("ended, duration=42"), server.transcript());
        assertNull(r1.getActiveCall());
        assertNull(r2.getActiveCall());
    }

    @Test
    void callerAbandoning_ShouldSurfaceMissedToBothSidesOnce() {
        InMemoryCallServer server = new InMemoryCallServer();
        RecordingListener l1 = new RecordingListener();
        RecordingListener l2 = new RecordingListener();
        CallSignalingReconciler r1 = new CallSignalingReconciler(server.as(U1), U1, null, l1, CallSignalingOptions.defaults());
        CallSignalingReconciler r2 = new CallSignalingReconciler(server.as(U2), U2, null, l2, CallSignalingOptions.defaults());

        CallSessionDto call = r1.startCall(C1, CallType.VOICE).join();
        r2.tick().join();

        r1.end().join();
        r2.tick().join();
        r2.tick().join();

        assertEquals(List.of("missed"), l1.events);
        assertEquals(List.of("incoming:" + call.getId(), "cleared", "missed"), l2.events);
        assertEquals(List.of("missed"), server.transcript());
        assertNull(r2.getIncomingCall());
    }

    @Test
    void calleeRejecting_ShouldNotifyCaller() {
        InMemoryCallServer server = new InMemoryCallServer();
        RecordingListener l1 = new RecordingListener();
        CallSignalingReconciler r1 = new CallSignalingReconciler(server.as(U1), U1, C1, l1, null);
        CallSignalingReconciler r2 = new CallSignalingReconciler(server.as(U2), U2, C1, null, null);

        CallSessionDto call = r1.startCall(C1, CallType.VOICE).join();
        r2.tick().join();
        r2.reject(call.getId()).join();
        r1.tick().join();

        assertEquals(List.of("rejected"), l1.events);
        assertEquals(List.of("rejected"), server.transcript());
    }

    @Test
    void observeTwice_ShouldFireSideEffectsOnce() {
        CallApi api = mock(CallApi.class);
        when(api.sendCallMessage(anyLong(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        RecordingListener l = new RecordingListener();
        CallSignalingReconciler r = new CallSignalingReconciler(api, U1, null, l, null);

        CallSessionDto missed = dto(11L, U1, CallStatus.MISSED);
        assertTrue(r.observe(missed));
        assertFalse(r.observe(missed));

        assertEquals(List.of("missed"), l.events);
        verify(api).sendCallMessage(11L, CallStatus.MISSED, null);
    }

    @Test
    void discovery_ShouldIgnoreOwnCallsAndOtherConversations() {
        CallApi api = mock(CallApi.class);
        CallSessionDto own = dto(21L, U2, CallStatus.RINGING);
        CallSessionDto elsewhere = dto(22L, U1, CallStatus.RINGING);
        elsewhere.setConversationId(999L);
        CallSessionDto ended = dto(23L, U1, CallStatus.ENDED);
        CallSessionDto target = dto(24L, U1, CallStatus.RINGING);
        when(api.getHistory(C1, 10, 0)).thenReturn(CompletableFuture.completedFuture(
                new CallHistoryResponse(List.of(own, elsewhere, ended, target), 4)));
        RecordingListener l = new RecordingListener();
        CallSignalingReconciler r = new CallSignalingReconciler(api, U2, C1, l, null);

        r.tick().join();
        r.tick().join();

        assertEquals(List.of("incoming:24"), l.events);
        assertEquals(24L, r.getIncomingCall().getId());
    }

    @Test
    void pollFailure_ShouldBeSwallowedAndRetriedNextTick() {
        CallApi api = mock(CallApi.class);
        when(api.getHistory(any(), anyInt(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new CallTransportException("connection refused", 0)))
                .thenReturn(CompletableFuture.completedFuture(
                        new CallHistoryResponse(List.of(dto(31L, U1, CallStatus.RINGING)), 1)));
        RecordingListener l = new RecordingListener();
        CallSignalingReconciler r = new CallSignalingReconciler(api, U2, C1, l, null);

        r.tick().join();
        assertTrue(l.events.isEmpty());

        r.tick().join();
        assertEquals(List.of("incoming:31"), l.events);
    }

    @Test
    void stop_ShouldDiscardLateResponses() {
        CallApi api = mock(CallApi.class);
        CompletableFuture<CallHistoryResponse> pending = new CompletableFuture<>();
        when(api.getHistory(any(), anyInt(), anyInt())).thenReturn(pending);
        RecordingListener l = new RecordingListener();
        CallSignalingReconciler r = new CallSignalingReconciler(api, U2, C1, l, null);

        CompletableFuture<Void> tick = r.tick();
        r.stop();
        pending.complete(new CallHistoryResponse(List.of(dto(41L, U1, CallStatus.RINGING)), 1));
        tick.join();

        assertTrue(r.isStopped());
        assertTrue(l.events.isEmpty());
        assertNull(r.getIncomingCall());
        assertFalse(r.observe(dto(41L, U1, CallStatus.MISSED)));
        verify(api, never()).sendCallMessage(anyLong(), any(), any());
    }

    @Test
    void redialWithinOnePoll_ShouldClearAndReconcileReplacedIncomingCall() {
        CallApi api = mock(CallApi.class);
        CallSessionDto first = dto(51L, U1, CallStatus.RINGING);
        CallSessionDto redial = dto(52L, U1, CallStatus.RINGING);
        CallSessionDto firstMissed = dto(51L, U1, CallStatus.MISSED);
        when(api.getHistory(C1, 10, 0))
                .thenReturn(CompletableFuture.completedFuture(new CallHistoryResponse(List.of(first), 1)))
                .thenReturn(CompletableFuture.completedFuture(new CallHistoryResponse(List.of(redial, firstMissed), 2)));
        when(api.getCall(51L)).thenReturn(CompletableFuture.completedFuture(firstMissed));
        when(api.sendCallMessage(anyLong(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        RecordingListener l = new RecordingListener();
        CallSignalingReconciler r = new CallSignalingReconciler(api, U2, C1, l, null);

        r.tick().join();
        r.tick().join();

        assertEquals(List.of("incoming:51", "cleared", "incoming:52", "missed"), l.events);
        assertEquals(52L, r.getIncomingCall().getId());
        verify(api, times(1)).sendCallMessage(51L, CallStatus.MISSED, null);
    }

    @Test
    void tick_ShouldNotOverlapWhilePreviousPollIsPending() {
        CallApi api = mock(CallApi.class);
        CompletableFuture<CallHistoryResponse> pending = new CompletableFuture<>();
        when(api.getHistory(C1, 10, 0))
                .thenReturn(pending)
                .thenReturn(CompletableFuture.completedFuture(new CallHistoryResponse(List.of(), 0)));
        CallSignalingReconciler r = new CallSignalingReconciler(api, U2, C1, null, null);

        CompletableFuture<Void> first = r.tick();
        assertTrue(r.tick().isDone());
        verify(api, times(1)).getHistory(C1, 10, 0);

        pending.complete(new CallHistoryResponse(List.of(), 0));
        first.join();
        r.tick().join();
        verify(api, times(2)).getHistory(C1, 10, 0);
    }

    @Test
    void observedCalls_ShouldStayWithinConfiguredBound() {
        CallApi api = mock(CallApi.class);
        when(api.sendCallMessage(anyLong(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        CallSignalingOptions options = new CallSignalingOptions(Duration.ofSeconds(2), 10, Duration.ofHours(1), 2);
        CallSignalingReconciler r = new CallSignalingReconciler(api, U1, null, null, options);

        for (long id = 61L; id <= 65L; id++) {
            assertTrue(r.observe(dto(id, U1, CallStatus.MISSED)));
        }

        assertTrue(r.observedCallCount() <= 2);
    }

    @Test
    void endWithoutActiveCall_ShouldReturnNull() {
        CallSignalingReconciler r = new CallSignalingReconciler(mock(CallApi.class), U1, null, null, null);
        assertNull(r.end().join());
    }

    private static CallSessionDto dto(long id, long caller, CallStatus status) {
        CallSessionDto d = new CallSessionDto();
        d.setId(id);
        d.setConversationId(C1);
        d.setCallerUserId(caller);
        d.setCallType(CallType.VOICE);
        d.setStatus(status);
        d.setChannelName("call_" + id);
        d.setDurationSeconds(0);
        return d;
    }

    static final class RecordingListener implements CallSignalListener {

        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void onIncomingCall(CallSessionDto call) {
            events.add("incoming:" + call.getId());
        }

        @Override
        public void onIncomingCleared(CallSessionDto call) {
            events.add("cleared");
        }

        @Override
        public void onAccepted(CallSessionDto call) {
            events.add("accepted");
        }

        @Override
        public void onRejected(CallSessionDto call) {
            events.add("rejected");
        }

        @Override
        public void onEnded(CallSessionDto call, int durationSeconds) {
            events.add("ended:" + durationSeconds);
        }

        @Override
        public void onMissed(CallSessionDto call) {
            events.add("missed");
        }
    }
}
