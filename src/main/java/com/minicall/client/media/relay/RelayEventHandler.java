package com.minicall.client.media.relay;

/**
 * 中继事件回调。可能在中继 SDK 的任意线程上触发。
 */
public interface RelayEventHandler {

    default void onUserPublished(RemoteUser user, MediaKind kind) {
    }

    default void onUserUnpublished(RemoteUser user, MediaKind kind) {
    }

    default void onUserJoined(RemoteUser user) {
    }

    default void onUserLeft(RemoteUser user, String reason) {
    }

    default void onConnectionStateChange(RelayConnectionState current, RelayConnectionState previous, String reason) {
    }

    /** token 即将过期（默认提前 30 秒） */
    default void onTokenPrivilegeWillExpire() {
    }

    default void onTokenPrivilegeDidExpire() {
    }

    default void onException(int code, String message, long uid) {
    }
}
