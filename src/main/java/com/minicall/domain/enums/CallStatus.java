package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 通话会话状态（对应表字段：t_call_session.status）。
 *
 * <p>ringing -> accepted / rejected / missed；accepted -> ended。其余均为终态。</p>
 */
@Getter
@RequiredArgsConstructor
public enum CallStatus {

    RINGING(1, "ringing"),

    ACCEPTED(2, "accepted"),

    REJECTED(3, "rejected"),

    ENDED(4, "ended"),

    MISSED(5, "missed");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    public boolean isTerminal() {
        return this == REJECTED || this == ENDED || this == MISSED;
    }

    /**
     * 兼容 "RINGING" / "ringing"；无法识别时返回 null。
     */
    @JsonCreator
    public static CallStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (CallStatus s : values()) {
            if (s.name().equalsIgnoreCase(v) || s.desc.equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
