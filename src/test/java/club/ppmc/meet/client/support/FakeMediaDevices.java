package club.ppmc.meet.client.support;

import club.ppmc.meet.client.media.MediaAccessException;
import club.ppmc.meet.client.media.MediaConstraints;
import club.ppmc.meet.client.media.MediaDevices;
import club.ppmc.meet.client.media.MediaStream;
import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 内存中的媒体设备。默认立即授予访问；可以改为挂起请求或拒绝下一次请求。
 */
public class FakeMediaDevices implements MediaDevices {

    public final List<CompletableFuture<MediaStream>> heldUserMedia = new ArrayList<>();
    public final List<CompletableFuture<MediaTrack>> heldDisplayMedia = new ArrayList<>();
    public final List<FakeMediaTrack> createdTracks = new ArrayList<>();

    private boolean holdRequests;
    private boolean holdDisplayRequests;
    private MediaAccessException nextUserMediaError;
    private MediaAccessException nextDisplayError;
    private int userMediaRequests;
    private int counter;

    public void holdRequests() {
        holdRequests = true;
    }

    public void holdDisplayRequests() {
        holdDisplayRequests = true;
    }

    public void denyNextUserMedia(MediaAccessException.Reason reason) {
        nextUserMediaError = new MediaAccessException(reason, "denied: " + reason);
    }

    public void denyNextDisplayMedia(MediaAccessException.Reason reason) {
        nextDisplayError = new MediaAccessException(reason, "denied: " + reason);
    }

    public int userMediaRequests() {
        return userMediaRequests;
    }

    public MediaStream grantedStream() {
        return new MediaStream(List.of(track("camera", TrackKind.VIDEO), track("microphone", TrackKind.AUDIO)));
    }

    @Override
    public CompletableFuture<MediaStream> getUserMedia(MediaConstraints constraints) {
        userMediaRequests++;
        if (nextUserMediaError != null) {
            var error = nextUserMediaError;
            nextUserMediaError = null;
            return CompletableFuture.failedFuture(error);
        }
        if (holdRequests) {
            var pending = new CompletableFuture<MediaStream>();
            heldUserMedia.add(pending);
            return pending;
        }
        return CompletableFuture.completedFuture(grantedStream());
    }

    @Override
    public CompletableFuture<MediaTrack> getDisplayMedia() {
        if (nextDisplayError != null) {
            var error = nextDisplayError;
            nextDisplayError = null;
            return CompletableFuture.failedFuture(error);
        }
        if (holdDisplayRequests) {
            var pending = new CompletableFuture<MediaTrack>();
            heldDisplayMedia.add(pending);
            return pending;
        }
        return CompletableFuture.completedFuture(track("screen", TrackKind.VIDEO));
    }

    @Override
    public MediaTrack createPlaceholderTrack(TrackKind kind) {
        return track("placeholder-" + kind.name().toLowerCase(), kind);
    }

    public FakeMediaTrack lastTrack(String prefix) {
        for (int i = createdTracks.size() - 1; i >= 0; i--) {
            if (createdTracks.get(i).id().startsWith(prefix)) {
                return createdTracks.get(i);
            }
        }
        throw new IllegalStateException("no track " + prefix);
    }

    private FakeMediaTrack track(String prefix, TrackKind kind) {
        var track = new FakeMediaTrack(prefix + "-" + (++counter), kind);
        createdTracks.add(track);
        return track;
    }
}
