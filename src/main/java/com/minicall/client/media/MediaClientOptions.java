package com.minicall.client.media;

import java.time.Duration;
import java.util.List;

/**
 * 入会流程的重试/等待参数。
 *
 * @param credentialAttempts  取凭证最多尝试次数（含第一次）
 * @param credentialBackoffs  第 n 次失败后等待 credentialBackoffs[n]，越界取最后一个
 * @param publishRetryLimit   publish 遇到 INVALID_OPERATION 时整套入会流程最多重来几次
 * @param restartDelay        重来之前等待多久
 * @param staleSettleDelay    发现上一次连接残留时，清理后等待多久再入会
 */
public record MediaClientOptions(
        int credentialAttempts,
        List<Duration> credentialBackoffs,
        int publishRetryLimit,
        Duration restartDelay,
        Duration staleSettleDelay
) {

    public MediaClientOptions {
        credentialBackoffs = credentialBackoffs == null || credentialBackoffs.isEmpty()
                ? List.of(Duration.ZERO)
                : List.copyOf(credentialBackoffs);
        restartDelay = restartDelay == null ? Duration.ZERO : restartDelay;
        staleSettleDelay = staleSettleDelay == null ? Duration.ZERO : staleSettleDelay;
    }

    public static MediaClientOptions defaults() {
        return new MediaClientOptions(
                3,
                List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3)),
                2,
                Duration.ofSeconds(1),
                Duration.ofMillis(500));
    }

    public Duration credentialBackoff(int failedAttemptIndex) {
        int i = Math.min(Math.max(failedAttemptIndex, 0), credentialBackoffs.size() - 1);
        return credentialBackoffs.get(i);
    }
}
