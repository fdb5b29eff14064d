package com.minicall.client.media.relay;

@FunctionalInterface
public interface RelayClientFactory {

    RelayClient create();
}
