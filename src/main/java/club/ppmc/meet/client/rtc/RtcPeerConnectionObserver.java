package club.ppmc.meet.client.rtc;

import club.ppmc.meet.client.media.MediaTrack;

/**
 * 原生对等连接的事件回调。回调可能在任意线程上触发。
 */
public interface RtcPeerConnectionObserver {

    void onIceCandidate(IceCandidate candidate);

    void onRemoteTrack(MediaTrack track);

    void onConnectionStateChange(NativeConnectionState state);
}
