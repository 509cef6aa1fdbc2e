package club.ppmc.meet.client.media;

import java.util.concurrent.CompletableFuture;

/**
 * 接收出站轨道变化的一方，即所有对等会话的发送端。
 */
@FunctionalInterface
public interface OutgoingTrackSink {

    /**
     * 在所有对等会话上替换指定类型的出站轨道。
     *
     * @return 所有会话都替换完成后完成的future。
     */
    CompletableFuture<Void> replaceOutgoingTrack(TrackKind kind, MediaTrack track);
}
