package com.minicall.common.web;

import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.exception.CallForbiddenException;
import com.minicall.domain.exception.CallNotFoundException;
import com.minicall.domain.exception.CallStateConflictException;
import com.minicall.rtc.service.RtcConfigException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "call/sessions"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleBadRequest_ShouldKeepValidationMessage() {
        ResponseEntity<Result<Void>> resp = handler.handleBadRequest(new IllegalArgumentException("channel_too_long"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.BAD_REQUEST);
        assertThat(resp.getBody().message()).isEqualTo("channel_too_long");
    }

    @Test
    void callExceptions_ShouldMapToTheirStatusCodes() {
        assertThat(handler.handleForbidden(new CallForbiddenException("not_conversation_member")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handleNotFound(new CallNotFoundException("call_not_found")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);

        ResponseEntity<Result<Void>> conflict = handler.handleConflict(
                new CallStateConflictException("call_state_conflict: ended -> accepted", CallStatus.ENDED));
        assertThat(conflict.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(conflict.getBody().code()).isEqualTo(ApiCodes.CONFLICT);
    }

    @Test
    void handleRtcConfig_ShouldHideConfigurationDetails() {
        ResponseEntity<Result<Void>> resp = handler.handleRtcConfig(new RtcConfigException("missing appCertificate"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.SERVER_CONFIG_ERROR);
        assertThat(resp.getBody().message()).doesNotContain("appCertificate");
    }
}
