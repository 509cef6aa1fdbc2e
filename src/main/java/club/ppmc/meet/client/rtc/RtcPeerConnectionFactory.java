package club.ppmc.meet.client.rtc;

/**
 * 原生对等连接的创建入口。
 */
@FunctionalInterface
public interface RtcPeerConnectionFactory {

    RtcPeerConnection create(RtcConfiguration configuration, RtcPeerConnectionObserver observer);
}
