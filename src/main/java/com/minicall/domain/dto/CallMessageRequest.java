package com.minicall.domain.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 追加通话记录消息。
 *
 * @param status          终态：rejected / ended / missed
 * @param durationSeconds 可选；为空时由服务端按 started_at / ended_at 计算
 */
public record CallMessageRequest(
        @NotBlank(message = "missing_status") String status,
        Integer durationSeconds
) {
}
