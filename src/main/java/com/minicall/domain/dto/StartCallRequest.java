package com.minicall.domain.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param callType "voice" / "video"，为空时按 voice
 */
public record StartCallRequest(
        @NotNull(message = "missing_conversation_id") Long conversationId,
        String callType
) {
}
