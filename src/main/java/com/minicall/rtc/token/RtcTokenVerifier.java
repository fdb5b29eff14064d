package com.minicall.rtc.token;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 中继侧的 token 校验：解析 {@link RtcTokenBuilder} 的输出并用同一 appCertificate 重算签名。
 */
public final class RtcTokenVerifier {

    private RtcTokenVerifier() {
    }

    /**
     * @throws IllegalArgumentException 版本不对、base64 非法、字段截断或存在多余字节
     */
    public static RtcTokenContent parse(String token) {
        if (token == null || !token.startsWith(RtcTokenBuilder.VERSION)) {
            throw new IllegalArgumentException("unsupported_token_version");
        }
        byte[] raw = Base64.getDecoder().decode(token.substring(RtcTokenBuilder.VERSION.length()));
        ByteBuffer buf = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        try {
            String appId = readString(buf);
            long issuedAt = readUint32(buf);
            long ttl = readUint32(buf);
            long salt = readUint32(buf);
            int serviceCount = readUint16(buf);
            int serviceType = readUint16(buf);
            if (serviceCount != RtcTokenBuilder.SERVICE_COUNT || serviceType != RtcTokenBuilder.SERVICE_TYPE_RTC) {
                throw new IllegalArgumentException("unsupported_service");
            }
            String channel = readString(buf);
            long uid = readUint32(buf);
            int privilegeCount = readUint16(buf);
            Map<Integer, Long> privileges = new LinkedHashMap<>();
            for (int i = 0; i < privilegeCount; i++) {
                privileges.put(readUint16(buf), readUint32(buf));
            }
            int signatureLength = readUint16(buf);
            byte[] signature = new byte[signatureLength];
            buf.get(signature);
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("trailing_bytes");
            }
            return new RtcTokenContent(appId, issuedAt, ttl, salt, serviceType, channel, uid, privileges, signature);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated_token", e);
        }
    }

    /**
     * 签名是否由 appCertificate 签出；任何解析失败都视为无效。
     */
    public static boolean verify(String token, String appCertificate) {
        RtcTokenContent content;
        try {
            content = parse(token);
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] message = RtcTokenBuilder.signedMessage(content.salt(), content.issuedAt(), content.ttlSeconds(), content.privileges());
        byte[] expected = RtcTokenBuilder.sign(appCertificate, content.appId(), content.channel(), content.uid(), message);
        return MessageDigest.isEqual(expected, content.signature());
    }

    private static int readUint16(ByteBuffer buf) {
        return buf.getShort() & 0xFFFF;
    }

    private static long readUint32(ByteBuffer buf) {
        return buf.getInt() & 0xFFFFFFFFL;
    }

    private static String readString(ByteBuffer buf) {
        byte[] bytes = new byte[readUint16(buf)];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
