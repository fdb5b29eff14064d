package com.minicall.rtc.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * token 内的权限 id（uint16），与中继侧约定一致。
 */
@Getter
@RequiredArgsConstructor
public enum RtcPrivilege {

    JOIN_CHANNEL(1),

    PUBLISH_AUDIO_STREAM(2),

    PUBLISH_VIDEO_STREAM(3),

    PUBLISH_DATA_STREAM(4);

    private final int id;
}
