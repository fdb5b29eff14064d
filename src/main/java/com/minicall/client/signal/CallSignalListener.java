package com.minicall.client.signal;

import com.minicall.domain.dto.CallSessionDto;

/**
 * 通话状态变化的回调。每个 (callId, status) 只回调一次。
 *
 * <p>回调在轮询线程或 HTTP 回调线程上执行，不要在里面做阻塞操作。</p>
 */
public interface CallSignalListener {

    /** 发现一个打给自己的 ringing 通话 */
    default void onIncomingCall(CallSessionDto call) {
    }

    /** 之前提示的来电不再 ringing（被接听、拒绝或主叫挂断） */
    default void onIncomingCleared(CallSessionDto call) {
    }

    default void onAccepted(CallSessionDto call) {
    }

    default void onRejected(CallSessionDto call) {
    }

    default void onEnded(CallSessionDto call, int durationSeconds) {
    }

    default void onMissed(CallSessionDto call) {
    }
}
