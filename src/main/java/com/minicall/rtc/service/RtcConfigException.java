package com.minicall.rtc.service;

/**
 * 缺少中继签名配置。属于部署问题：直接失败，永不重试。
 */
public class RtcConfigException extends RuntimeException {

    public RtcConfigException(String message) {
        super(message);
    }
}
