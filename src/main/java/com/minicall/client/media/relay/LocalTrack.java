package com.minicall.client.media.relay;

import java.util.concurrent.CompletableFuture;

/**
 * 本地采集的音频/视频轨道。
 */
public interface LocalTrack {

    MediaKind kind();

    /**
     * 开关采集（静音/关摄像头），不会触发重新发布。
     */
    CompletableFuture<Void> setEnabled(boolean enabled);

    boolean isEnabled();

    /** 停止播放/预览 */
    void stop();

    /** 释放设备，之后不能再使用 */
    void close();
}
