package com.minicall.client.media;

import com.minicall.client.media.relay.LocalTrack;

import java.util.List;

/**
 * 对外暴露的只读快照，每次变化生成新对象。
 *
 * @param error 最近一次入会失败的原因；成功入会或离开后清空
 */
public record MediaCallState(
        MediaClientState state,
        LocalTrack localAudioTrack,
        LocalTrack localVideoTrack,
        List<RemoteParticipant> remoteParticipants,
        boolean muted,
        boolean videoOff,
        String error
) {

    public MediaCallState {
        remoteParticipants = remoteParticipants == null ? List.of() : List.copyOf(remoteParticipants);
    }

    public boolean joined() {
        return state == MediaClientState.JOINED;
    }

    public boolean connecting() {
        return state == MediaClientState.JOINING;
    }
}
