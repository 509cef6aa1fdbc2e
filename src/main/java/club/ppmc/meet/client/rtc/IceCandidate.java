package club.ppmc.meet.client.rtc;

/**
 * Trickle ICE候选，作为ice-candidate消息的负载在信令通道上传输。
 */
public record IceCandidate(String candidate, String sdpMid, Integer sdpMLineIndex) {}
