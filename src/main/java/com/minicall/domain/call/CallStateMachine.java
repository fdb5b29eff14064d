package com.minicall.domain.call;

import com.minicall.domain.enums.CallAction;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.exception.CallStateConflictException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 通话会话状态机（纯函数，不访问存储）。
 *
 * <pre>
 * current   | ACCEPT   | REJECT   | END(caller) | END(callee)
 * ringing   | accepted | rejected | missed      | rejected
 * accepted  | no-op    | conflict | ended       | ended
 * terminal  | conflict | no-op    | no-op       | no-op
 * </pre>
 *
 * <p>谁可以发起动作（只有被叫可以 accept/reject）由调用方在进入状态机之前校验。</p>
 */
public final class CallStateMachine {

    private CallStateMachine() {
    }

    public static CallTransition apply(CallStatus current, CallAction action, boolean actorIsCaller, LocalDateTime now) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(now, "now");

        CallStatus target = resolveTarget(current, action, actorIsCaller);
        if (target == current) {
            return CallTransition.unchanged(current);
        }
        if (!isAllowed(current, target)) {
            throw new CallStateConflictException("call_state_conflict: " + current.getDesc() + " -> " + target.getDesc(), current);
        }
        LocalDateTime startedAt = target == CallStatus.ACCEPTED ? now : null;
        LocalDateTime endedAt = target.isTerminal() ? now : null;
        return new CallTransition(current, target, true, startedAt, endedAt);
    }

    /**
     * 合法迁移：ringing -> accepted/rejected/missed，accepted -> ended。
     */
    public static boolean isAllowed(CallStatus from, CallStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case RINGING -> to == CallStatus.ACCEPTED || to == CallStatus.REJECTED || to == CallStatus.MISSED;
            case ACCEPTED -> to == CallStatus.ENDED;
            default -> false;
        };
    }

    /**
     * 通话时长（秒），未接通为 0，时钟回拨时不会为负。
     */
    public static int durationSeconds(LocalDateTime startedAt, LocalDateTime endedAt) {
        if (startedAt == null || endedAt == null) {
            return 0;
        }
        long seconds = Duration.between(startedAt, endedAt).getSeconds();
        return (int) Math.max(0, Math.min(seconds, Integer.MAX_VALUE));
    }

    private static CallStatus resolveTarget(CallStatus current, CallAction action, boolean actorIsCaller) {
        if (current.isTerminal()) {
            // 终态上再 reject/end 视为重复请求；再 accept 是真正的冲突
            return action == CallAction.ACCEPT ? CallStatus.ACCEPTED : current;
        }
        return switch (action) {
            case ACCEPT -> CallStatus.ACCEPTED;
            case REJECT -> CallStatus.REJECTED;
            case END -> {
                if (current == CallStatus.ACCEPTED) {
                    yield CallStatus.ENDED;
                }
                yield actorIsCaller ? CallStatus.MISSED : CallStatus.REJECTED;
            }
        };
    }
}
