package com.minicall.client.media.relay;

public enum MediaKind {
    AUDIO,
    VIDEO
}
