package club.ppmc.meet.client.media;

import java.util.List;
import java.util.Optional;

/**
 * 一次设备获取得到的轨道集合。
 */
public record MediaStream(List<MediaTrack> tracks) {

    public MediaStream {
        tracks = List.copyOf(tracks);
    }

    public Optional<MediaTrack> track(TrackKind kind) {
        return tracks.stream().filter(track -> track.kind() == kind).findFirst();
    }

    public void stopAll() {
        tracks.forEach(MediaTrack::stop);
    }
}
