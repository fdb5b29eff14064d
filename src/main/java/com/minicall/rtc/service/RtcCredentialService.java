package com.minicall.rtc.service;

import com.minicall.rtc.config.RtcProperties;
import com.minicall.rtc.dto.RtcCredentialDto;
import com.minicall.rtc.token.RtcRole;
import com.minicall.rtc.token.RtcTokenBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * 中继凭证签发（无状态，可任意并发调用）。
 *
 * <p>除了读取不可变配置和取随机 salt，没有任何共享可变状态。</p>
 */
@Slf4j
@Service
public class RtcCredentialService {

    /** 中继允许的频道名字符集，最长 64 字节。 */
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("^[A-Za-z0-9 !#$%&()+\\-:;<=.>?@\\[\\]^_{|}~,]+$");
    private static final int MAX_CHANNEL_BYTES = 64;
    private static final long MAX_UID = 0xFFFFFFFFL;

    private final RtcProperties props;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RtcCredentialService(RtcProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param ttlSeconds null 或 0 取默认有效期
     * @throws IllegalArgumentException channel / uid / ttl 不合法
     * @throws RtcConfigException       未配置 appId / appCertificate
     */
    public RtcCredentialDto issueCredential(String channel, long subjectUid, RtcRole role, Long ttlSeconds) {
        validateChannel(channel);
        if (subjectUid < 0 || subjectUid > MAX_UID) {
            throw new IllegalArgumentException("invalid_uid");
        }
        if (role == null) {
            throw new IllegalArgumentException("invalid_role");
        }
        long ttl = resolveTtl(ttlSeconds);

        String appId = props == null ? null : props.appId();
        String appCertificate = props == null ? null : props.appCertificate();
        if (appId == null || appId.isBlank() || appCertificate == null || appCertificate.isBlank()) {
            throw new RtcConfigException("missing call.rtc.app-id / call.rtc.app-certificate");
        }

        long issuedAt = clock.instant().getEpochSecond();
        long salt = random.nextInt() & 0xFFFFFFFFL;
        String token = RtcTokenBuilder.build(appId, appCertificate, channel, subjectUid, role, issuedAt, ttl, salt);

        RtcCredentialDto credential = new RtcCredentialDto(appId, token, channel, subjectUid, ttl, issuedAt + ttl);
        log.info("rtc token issued: channel={}, uid={}, role={}, ttl={}, token={}",
                channel, subjectUid, role.getDesc(), ttl, RtcCredentialDto.mask(token));
        return credential;
    }

    private long resolveTtl(Long ttlSeconds) {
        if (ttlSeconds == null || ttlSeconds == 0) {
            return props == null ? 3600 : props.defaultTtlSecondsEffective();
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("invalid_expire_time");
        }
        long max = props == null ? 86_400 : props.maxTtlSecondsEffective();
        if (ttlSeconds > max) {
            throw new IllegalArgumentException("expire_time_too_long");
        }
        return ttlSeconds;
    }

    private static void validateChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("missing_channel");
        }
        if (channel.getBytes(StandardCharsets.UTF_8).length > MAX_CHANNEL_BYTES) {
            throw new IllegalArgumentException("channel_too_long");
        }
        if (!CHANNEL_PATTERN.matcher(channel).matches()) {
            throw new IllegalArgumentException("invalid_channel");
        }
    }
}
