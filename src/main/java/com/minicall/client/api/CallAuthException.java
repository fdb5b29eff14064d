package com.minicall.client.api;

/**
 * 没有有效登录身份（无 accessToken 或服务端 401）。不重试，提示用户重新登录。
 */
public class CallAuthException extends CallClientException {

    public CallAuthException(String message) {
        super(message);
    }
}
