package club.ppmc.meet.client.rtc;

import java.util.List;

/**
 * 创建原生对等连接时使用的配置。
 */
public record RtcConfiguration(List<IceServer> iceServers) {

    private static final List<String> DEFAULT_STUN_SERVERS = List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302");

    public RtcConfiguration {
        iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
    }

    public static RtcConfiguration defaults() {
        return new RtcConfiguration(DEFAULT_STUN_SERVERS.stream().map(IceServer::stun).toList());
    }
}
