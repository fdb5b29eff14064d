package com.minicall.client.media;

import com.minicall.client.media.relay.RemoteTrack;
import com.minicall.client.media.relay.RemoteUser;

public record RemoteParticipant(
        long uid,
        RemoteTrack audioTrack,
        RemoteTrack videoTrack
) {

    static RemoteParticipant of(RemoteUser user) {
        return new RemoteParticipant(user.uid(), user.audioTrack(), user.videoTrack());
    }

    public boolean hasAudio() {
        return audioTrack != null;
    }

    public boolean hasVideo() {
        return videoTrack != null;
    }
}
