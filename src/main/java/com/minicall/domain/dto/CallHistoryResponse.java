package com.minicall.domain.dto;

import java.util.List;

public record CallHistoryResponse(
        List<CallSessionDto> calls,
        long total
) {
}
