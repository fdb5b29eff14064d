package com.minicall.rtc.token;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 小端序打包：uint16 / uint32 / uint16 长度前缀字符串。
 */
final class RtcByteWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream(256);

    RtcByteWriter putUint16(int value) {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
        return this;
    }

    RtcByteWriter putUint32(long value) {
        out.write((int) (value & 0xFF));
        out.write((int) ((value >>> 8) & 0xFF));
        out.write((int) ((value >>> 16) & 0xFF));
        out.write((int) ((value >>> 24) & 0xFF));
        return this;
    }

    RtcByteWriter putString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        putUint16(bytes.length);
        return putBytes(bytes);
    }

    RtcByteWriter putBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }
}
