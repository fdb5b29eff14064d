package com.minicall.client.media;

/**
 * uninitialized -> ready -> joining -> joined -> leaving -> ready ... -> terminated
 */
public enum MediaClientState {
    UNINITIALIZED,
    READY,
    JOINING,
    JOINED,
    LEAVING,
    TERMINATED
}
