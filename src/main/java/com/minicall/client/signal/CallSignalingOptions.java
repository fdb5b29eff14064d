package com.minicall.client.signal;

import java.time.Duration;

/**
 * 轮询参数。
 *
 * @param pollInterval          两次 tick 之间的间隔（上一次结束后开始计时）
 * @param historyLimit          没有进行中的通话时，拉取最近多少条记录来发现来电
 * @param messageDedupTtl       通话记录消息的本地去重保留时间
 * @param messageDedupMaxSize   本地去重最多保留多少个 key
 */
public record CallSignalingOptions(
        Duration pollInterval,
        int historyLimit,
        Duration messageDedupTtl,
        long messageDedupMaxSize
) {

    public static CallSignalingOptions defaults() {
        return new CallSignalingOptions(Duration.ofSeconds(2), 10, Duration.ofHours(1), 1_000);
    }

    public CallSignalingOptions withPollInterval(Duration interval) {
        return new CallSignalingOptions(interval, historyLimit, messageDedupTtl, messageDedupMaxSize);
    }
}
