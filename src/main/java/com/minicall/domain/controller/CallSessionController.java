package com.minicall.domain.controller;

import com.minicall.auth.web.AuthContext;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallMessageRequest;
import com.minicall.domain.dto.CallMessageResult;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.dto.StartCallRequest;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.service.CallSessionAppService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/call/session")
public class CallSessionController {

    private final CallSessionAppService callSessionAppService;

    @PostMapping
    public Result<CallSessionDto> start(@Valid @RequestBody StartCallRequest request) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        CallType callType = parseCallType(request.callType());
        return Result.ok(callSessionAppService.start(userId, request.conversationId(), callType));
    }

    @GetMapping("/{callId}")
    public Result<CallSessionDto> get(@PathVariable("callId") long callId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(callSessionAppService.get(userId, callId));
    }

    @PostMapping("/{callId}/accept")
    public Result<CallSessionDto> accept(@PathVariable("callId") long callId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(callSessionAppService.accept(userId, callId));
    }

    @PostMapping("/{callId}/reject")
    public Result<CallSessionDto> reject(@PathVariable("callId") long callId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(callSessionAppService.reject(userId, callId));
    }

    @PostMapping("/{callId}/end")
    public Result<CallSessionDto> end(@PathVariable("callId") long callId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(callSessionAppService.end(userId, callId));
    }

    @GetMapping("/history")
    public Result<CallHistoryResponse> history(@RequestParam(required = false) Integer limit,
                                               @RequestParam(required = false) Integer offset,
                                               @RequestParam(required = false) Long conversationId,
                                               @RequestParam(required = false) String callType,
                                               @RequestParam(required = false) String status) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        CallType type = callType == null || callType.isBlank() ? null : parseCallType(callType);
        CallStatus st = null;
        if (status != null && !status.isBlank()) {
            st = CallStatus.fromString(status);
            if (st == null) {
                throw new IllegalArgumentException("invalid_status");
            }
        }
        return Result.ok(callSessionAppService.history(userId, conversationId, type, st, limit, offset));
    }

    @GetMapping("/stats")
    public Result<CallStatsDto> stats() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(callSessionAppService.stats(userId));
    }

    @PostMapping("/{callId}/message")
    public Result<CallMessageResult> appendMessage(@PathVariable("callId") long callId,
                                                   @Valid @RequestBody CallMessageRequest request) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        CallStatus status = CallStatus.fromString(request.status());
        if (status == null) {
            throw new IllegalArgumentException("invalid_status");
        }
        return Result.ok(callSessionAppService.appendCallMessage(userId, callId, status, request.durationSeconds()));
    }

    private static CallType parseCallType(String value) {
        if (value == null || value.isBlank()) {
            return CallType.VOICE;
        }
        CallType t = CallType.fromString(value);
        if (t == null) {
            throw new IllegalArgumentException("invalid_call_type");
        }
        return t;
    }
}
