package com.minicall.rtc.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RtcRole {

    /** 可加入并发布音视频/数据流 */
    PUBLISHER(1, "publisher"),

    /** 只能加入频道订阅 */
    SUBSCRIBER(2, "subscriber");

    private final int code;

    private final String desc;

    /**
     * 兼容 "publisher" / "subscriber" / "1" / "2"；为空时默认 publisher，无法识别时返回 null。
     */
    public static RtcRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return PUBLISHER;
        }
        String v = value.trim();
        for (RtcRole r : values()) {
            if (r.name().equalsIgnoreCase(v) || r.desc.equalsIgnoreCase(v) || String.valueOf(r.code).equals(v)) {
                return r;
            }
        }
        return null;
    }
}
