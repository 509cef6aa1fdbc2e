package club.ppmc.meet.client.support;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import club.ppmc.meet.client.rtc.RtcSender;
import java.util.concurrent.CompletableFuture;

public class FakeSender implements RtcSender {

    private final TrackKind kind;
    private MediaTrack track;
    private int replacements;

    public FakeSender(TrackKind kind, MediaTrack track) {
        this.kind = kind;
        this.track = track;
    }

    @Override
    public TrackKind kind() {
        return kind;
    }

    @Override
    public MediaTrack track() {
        return track;
    }

    @Override
    public CompletableFuture<Void> replaceTrack(MediaTrack track) {
        this.track = track;
        replacements++;
        return CompletableFuture.completedFuture(null);
    }

    public int replacements() {
        return replacements;
    }
}
