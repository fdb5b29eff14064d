package com.minicall.client.media.relay;

public interface RemoteTrack {

    MediaKind kind();

    void play();

    void stop();
}
