package com.minicall.client.media.relay;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 第三方媒体中继 SDK 的边界。
 *
 * <p>一个实例对应一次通话；通话结束后丢弃，不复用。</p>
 */
public interface RelayClient {

    RelayConnectionState connectionState();

    /**
     * 替换事件回调；传 null 等价于 {@link #removeAllListeners()}。
     */
    void setEventHandler(RelayEventHandler handler);

    void removeAllListeners();

    CompletableFuture<Void> join(String appId, String channel, String token, long uid);

    CompletableFuture<Void> leave();

    CompletableFuture<LocalTrack> createMicrophoneAudioTrack();

    CompletableFuture<LocalTrack> createCameraVideoTrack();

    /**
     * 一次性发布多个本地轨道；状态不对时以 {@link RelayErrorCode#INVALID_OPERATION} 失败。
     */
    CompletableFuture<Void> publish(List<LocalTrack> tracks);

    CompletableFuture<Void> subscribe(RemoteUser user, MediaKind kind);
}
