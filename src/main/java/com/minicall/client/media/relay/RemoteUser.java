package com.minicall.client.media.relay;

/**
 * 频道里的远端参与者。轨道在订阅成功之前为 null。
 */
public interface RemoteUser {

    long uid();

    RemoteTrack audioTrack();

    RemoteTrack videoTrack();
}
