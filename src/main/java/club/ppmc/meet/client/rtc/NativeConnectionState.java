package club.ppmc.meet.client.rtc;

/**
 * 原生对等连接上报的连接状态，与浏览器 `RTCPeerConnection.connectionState` 一一对应。
 */
public enum NativeConnectionState {
    NEW,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED
}
