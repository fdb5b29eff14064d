package com.minicall.client.media;

import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.rtc.dto.RtcCredentialDto;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MediaClientRegistryTest {

    private static final MediaClientOptions FAST = new MediaClientOptions(1, List.of(Duration.ZERO), 0, Duration.ZERO, Duration.ZERO);

    private final List<ScriptedRelayClient> relays = new CopyOnWriteArrayList<>();
    private final MediaClientRegistry registry = new MediaClientRegistry(
            () -> {
                ScriptedRelayClient r = new ScriptedRelayClient();
                relays.add(r);
                return r;
            },
            channel -> CompletableFuture.completedFuture(new RtcCredentialDto("app-id", "tok", channel, 42L, 3600, 0L)),
            FAST);

    @Test
    void open_ShouldUseCallChannelAndType() {
        MediaClientOrchestrator o = registry.open(call(9001L, CallType.VIDEO));

        assertEquals("call_9001", o.getChannel());
        assertTrue(o.isVideoCall());
        assertSame(o, registry.get(9001L));
        registry.close();
    }

    @Test
    void reopenSameCall_ShouldDestroyPreviousInstanceFirst() throws Exception {
        MediaClientOrchestrator first = registry.open(call(9001L, CallType.VOICE));
        first.joinChannel().get(5, TimeUnit.SECONDS);

        MediaClientOrchestrator second = registry.open(call(9001L, CallType.VOICE));

        assertNotSame(first, second);
        assertFalse(first.isAlive());
        assertEquals(MediaClientState.TERMINATED, first.getState().state());
        assertEquals(1, relays.get(0).leaves.get());
        assertEquals(2, relays.size());
        assertEquals(1, registry.size());
        registry.close();
    }

    @Test
    void close_ShouldDestroyEverything() throws Exception {
        MediaClientOrchestrator a = registry.open(call(1L, CallType.VOICE));
        MediaClientOrchestrator b = registry.open(call(2L, CallType.VIDEO));

        registry.close(1L).get(5, TimeUnit.SECONDS);
        assertFalse(a.isAlive());
        assertNull(registry.get(1L));

        registry.close();
        assertFalse(b.isAlive());
        assertEquals(0, registry.size());
        assertNull(registry.close(3L).get(5, TimeUnit.SECONDS));
    }

    private static CallSessionDto call(long id, CallType type) {
        CallSessionDto d = new CallSessionDto();
        d.setId(id);
        d.setConversationId(77L);
        d.setCallerUserId(1L);
        d.setCallType(type);
        d.setStatus(CallStatus.ACCEPTED);
        d.setChannelName("call_" + id);
        return d;
    }
}
