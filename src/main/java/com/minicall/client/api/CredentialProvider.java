package com.minicall.client.api;

import com.minicall.rtc.dto.RtcCredentialDto;

import java.util.concurrent.CompletableFuture;

/**
 * 中继凭证来源。uid 由服务端根据登录身份计算，客户端不传。
 */
@FunctionalInterface
public interface CredentialProvider {

    CompletableFuture<RtcCredentialDto> fetchCredential(String channel);
}
