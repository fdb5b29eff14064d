package com.minicall.rtc.token;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 中继 access token 的二进制编码与 HMAC-SHA256 签名（纯函数，无共享可变状态）。
 *
 * <p>布局（全部小端序，字符串为 uint16 长度前缀）：</p>
 * <pre>
 * "007" + base64(
 *   appId | issuedAt:u32 | ttl:u32 | salt:u32 | serviceCount:u16(=1) | serviceType:u16(=1)
 *   | channel | uid:u32 | privilegeCount:u16 | (privilegeId:u16, expiresAt:u32)*
 *   | signatureLength:u16 | signature)
 * </pre>
 * <p>签名：HMAC-SHA256(key = appCertificate, appId | channel | uid:u32 | signedMessage)，
 * 其中 signedMessage = salt | issuedAt | ttl | serviceCount | serviceType | privileges。</p>
 */
public final class RtcTokenBuilder {

    public static final String VERSION = "007";

    public static final int SERVICE_TYPE_RTC = 1;

    static final int SERVICE_COUNT = 1;

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private RtcTokenBuilder() {
    }

    public static String build(String appId,
                               String appCertificate,
                               String channel,
                               long uid,
                               RtcRole role,
                               long issuedAt,
                               long ttlSeconds,
                               long salt) {
        Map<Integer, Long> privileges = privilegesFor(role, issuedAt + ttlSeconds);
        byte[] signature = sign(appCertificate, appId, channel, uid,
                signedMessage(salt, issuedAt, ttlSeconds, privileges));

        RtcByteWriter w = new RtcByteWriter()
                .putString(appId)
                .putUint32(issuedAt)
                .putUint32(ttlSeconds)
                .putUint32(salt)
                .putUint16(SERVICE_COUNT)
                .putUint16(SERVICE_TYPE_RTC)
                .putString(channel)
                .putUint32(uid);
        writePrivileges(w, privileges);
        w.putUint16(signature.length).putBytes(signature);

        return VERSION + Base64.getEncoder().encodeToString(w.toByteArray());
    }

    /**
     * join 权限总是授予；publisher 额外授予音频/视频/数据发布权限，全部在 expiresAt 失效。
     */
    static Map<Integer, Long> privilegesFor(RtcRole role, long expiresAt) {
        Map<Integer, Long> privileges = new LinkedHashMap<>();
        privileges.put(RtcPrivilege.JOIN_CHANNEL.getId(), expiresAt);
        if (role == RtcRole.PUBLISHER) {
            privileges.put(RtcPrivilege.PUBLISH_AUDIO_STREAM.getId(), expiresAt);
            privileges.put(RtcPrivilege.PUBLISH_VIDEO_STREAM.getId(), expiresAt);
            privileges.put(RtcPrivilege.PUBLISH_DATA_STREAM.getId(), expiresAt);
        }
        return privileges;
    }

    static byte[] signedMessage(long salt, long issuedAt, long ttlSeconds, Map<Integer, Long> privileges) {
        RtcByteWriter w = new RtcByteWriter()
                .putUint32(salt)
                .putUint32(issuedAt)
                .putUint32(ttlSeconds)
                .putUint16(SERVICE_COUNT)
                .putUint16(SERVICE_TYPE_RTC);
        writePrivileges(w, privileges);
        return w.toByteArray();
    }

    static byte[] sign(String appCertificate, String appId, String channel, long uid, byte[] message) {
        byte[] toSign = new RtcByteWriter()
                .putBytes(appId.getBytes(StandardCharsets.UTF_8))
                .putBytes(channel.getBytes(StandardCharsets.UTF_8))
                .putUint32(uid)
                .putBytes(message)
                .toByteArray();
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(appCertificate.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(toSign);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void writePrivileges(RtcByteWriter w, Map<Integer, Long> privileges) {
        w.putUint16(privileges.size());
        for (Map.Entry<Integer, Long> e : privileges.entrySet()) {
            w.putUint16(e.getKey()).putUint32(e.getValue());
        }
    }
}
