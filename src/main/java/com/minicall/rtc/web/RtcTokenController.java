package com.minicall.rtc.web;

import com.minicall.auth.web.AuthContext;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.rtc.dto.RtcCredentialDto;
import com.minicall.rtc.dto.RtcTokenRequest;
import com.minicall.rtc.service.RtcCredentialService;
import com.minicall.rtc.service.SubjectUids;
import com.minicall.rtc.token.RtcRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/call/token")
public class RtcTokenController {

    private final RtcCredentialService rtcCredentialService;

    @PostMapping
    public Result<RtcCredentialDto> issue(@Valid @RequestBody RtcTokenRequest request) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        RtcRole role = RtcRole.fromString(request.role());
        if (role == null) {
            throw new IllegalArgumentException("invalid_role");
        }
        long uid = SubjectUids.fromUserId(userId);
        return Result.ok(rtcCredentialService.issueCredential(request.channel(), uid, role, request.expireTime()));
    }
}
