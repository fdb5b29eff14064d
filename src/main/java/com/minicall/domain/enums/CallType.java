package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 通话类型（对应表字段：t_call_session.call_type / t_message.call_type）。
 */
@Getter
@RequiredArgsConstructor
public enum CallType {

    /** 1 = 语音 */
    VOICE(1, "voice"),

    /** 2 = 视频 */
    VIDEO(2, "video");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    @JsonCreator
    public static CallType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (CallType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
