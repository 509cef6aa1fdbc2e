package club.ppmc.meet.client;

import club.ppmc.meet.client.media.MediaConstraints;
import club.ppmc.meet.client.rtc.RtcConfiguration;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 会议客户端配置。
 *
 * @param signalingUri      信令端点，例如 `ws://localhost:8080/ws`。
 * @param rtc               原生对等连接的ICE配置。
 * @param mediaConstraints  `startLocalMedia` 请求的设备。
 * @param avatarThrottle    头像位置广播的节流窗口。
 * @param heartbeatInterval 心跳间隔，为零时不发送心跳。
 */
public record MeetingClientConfig(
        URI signalingUri,
        RtcConfiguration rtc,
        MediaConstraints mediaConstraints,
        Duration avatarThrottle,
        Duration heartbeatInterval) {

    public static final Duration DEFAULT_AVATAR_THROTTLE = Duration.ofMillis(50);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(25);

    public MeetingClientConfig {
        Objects.requireNonNull(signalingUri, "signalingUri");
        rtc = rtc == null ? RtcConfiguration.defaults() : rtc;
        mediaConstraints = mediaConstraints == null ? MediaConstraints.audioAndVideo() : mediaConstraints;
        avatarThrottle = avatarThrottle == null ? DEFAULT_AVATAR_THROTTLE : avatarThrottle;
        heartbeatInterval = heartbeatInterval == null ? DEFAULT_HEARTBEAT_INTERVAL : heartbeatInterval;
    }

    public static MeetingClientConfig defaults(URI signalingUri) {
        return new MeetingClientConfig(signalingUri, null, null, null, null);
    }

    /**
     * @return 加入指定房间的连接地址，房间ID作为 `room` 查询参数。
     */
    public URI roomUri(String roomId) {
        return UriComponentsBuilder.fromUri(signalingUri)
                .replaceQueryParam("room", roomId)
                .encode()
                .build()
                .toUri();
    }
}
