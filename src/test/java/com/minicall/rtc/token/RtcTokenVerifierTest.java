package com.minicall.rtc.token;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RtcTokenVerifierTest {

    private static final String APP_ID = "970CA35de60c44645bbae8a215061b33";
    private static final String CERT = "5CFd2fd1755d40ecb72977518be15d3b";

    @Test
    void verify_ShouldAcceptTokenSignedWithSameCertificate() {
        String token = RtcTokenBuilder.build(APP_ID, CERT, "call_77", 987654321L, RtcRole.PUBLISHER, 1_700_000_000L, 3600, 0xFFFFFFFFL);

        assertTrue(RtcTokenVerifier.verify(token, CERT));
    }

    @Test
    void verify_ShouldRejectOtherCertificate() {
        String token = RtcTokenBuilder.build(APP_ID, CERT, "call_77", 1L, RtcRole.PUBLISHER, 1_700_000_000L, 3600, 1L);

        assertFalse(RtcTokenVerifier.verify(token, "another-certificate"));
    }

    @Test
    void verify_ShouldRejectAnySingleByteMutation() {
        String token = RtcTokenBuilder.build(APP_ID, CERT, "call_77", 4242L, RtcRole.PUBLISHER, 1_700_000_000L, 3600, 99L);
        byte[] raw = Base64.getDecoder().decode(token.substring(RtcTokenBuilder.VERSION.length()));

        for (int i = 0; i < raw.length; i++) {
            byte[] mutated = raw.clone();
            mutated[i] ^= 0x01;
            String tampered = RtcTokenBuilder.VERSION + Base64.getEncoder().encodeToString(mutated);
            assertFalse(RtcTokenVerifier.verify(tampered, CERT), "byte " + i + " mutation should invalidate token");
        }
    }

    @Test
    void verify_ShouldRejectTrailingBytes() {
        String token = RtcTokenBuilder.build(APP_ID, CERT, "call_77", 1L, RtcRole.PUBLISHER, 1_700_000_000L, 3600, 1L);
        byte[] raw = Base64.getDecoder().decode(token.substring(3));
        byte[] longer = java.util.Arrays.copyOf(raw, raw.length + 1);

        assertFalse(RtcTokenVerifier.verify("007" + Base64.getEncoder().encodeToString(longer), CERT));
    }

    @Test
    void verify_ShouldRejectGarbage() {
        assertFalse(RtcTokenVerifier.verify(null, CERT));
        assertFalse(RtcTokenVerifier.verify("", CERT));
        assertFalse(RtcTokenVerifier.verify("007", CERT));
        assertFalse(RtcTokenVerifier.verify("007!!!not-base64", CERT));
    }
}
