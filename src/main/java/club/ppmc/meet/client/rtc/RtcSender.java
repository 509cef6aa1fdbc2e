package club.ppmc.meet.client.rtc;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import java.util.concurrent.CompletableFuture;

/**
 * 对等连接上某一类媒体的发送端。发送端在连接创建时一次性建立，此后只替换轨道，从不移除，
 * 因此媒体变化不会触发重新协商。
 */
public interface RtcSender {

    TrackKind kind();

    MediaTrack track();

    CompletableFuture<Void> replaceTrack(MediaTrack track);
}
