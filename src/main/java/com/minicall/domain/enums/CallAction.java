package com.minicall.domain.enums;

/**
 * 参与方对会话发起的动作。
 */
public enum CallAction {
    ACCEPT,
    REJECT,
    END
}
