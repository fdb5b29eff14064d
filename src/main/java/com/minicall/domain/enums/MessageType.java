package com.minicall.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息内容类型（对应表字段：t_message.msg_type）。
 *
 * <ul>
 *   <li>1 = 文本（TEXT），本服务只读不写</li>
 *   <li>2 = 通话记录（CALL），由通话终态追加</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text"),

    CALL(2, "call");

    @EnumValue
    private final Integer code;

    private final String desc;
}
