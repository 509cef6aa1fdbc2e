package club.ppmc.meet.client.media;

/**
 * 提供当前出站轨道的一方。新建对等会话时据此初始化发送端。
 */
@FunctionalInterface
public interface OutgoingTrackSource {

    MediaTrack outgoingTrack(TrackKind kind);
}
