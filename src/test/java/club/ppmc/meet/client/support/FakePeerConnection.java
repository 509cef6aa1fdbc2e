package club.ppmc.meet.client.support;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import club.ppmc.meet.client.rtc.IceCandidate;
import club.ppmc.meet.client.rtc.NativeConnectionState;
import club.ppmc.meet.client.rtc.RtcPeerConnection;
import club.ppmc.meet.client.rtc.RtcPeerConnectionObserver;
import club.ppmc.meet.client.rtc.RtcSender;
import club.ppmc.meet.client.rtc.SessionDescription;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 内存中的原生对等连接。所有操作立即成功，除非调用了`holdRemoteDescription`。
 */
public class FakePeerConnection implements RtcPeerConnection {

    public final int index;
    public final RtcPeerConnectionObserver observer;
    public final Map<TrackKind, FakeSender> senders = new EnumMap<>(TrackKind.class);
    public final List<IceCandidate> appliedCandidates = new ArrayList<>();

    public SessionDescription localDescription;
    public SessionDescription remoteDescription;
    public int offersCreated;
    public boolean closed;

    private CompletableFuture<Void> heldRemoteDescription;
    private boolean holdRemoteDescription;
    private NativeConnectionState state = NativeConnectionState.NEW;

    FakePeerConnection(int index, RtcPeerConnectionObserver observer) {
        this.index = index;
        this.observer = observer;
    }

    public void holdRemoteDescription() {
        holdRemoteDescription = true;
    }

    public void releaseRemoteDescription() {
        holdRemoteDescription = false;
        heldRemoteDescription.complete(null);
    }

    @Override
    public RtcSender addTransceiver(TrackKind kind, MediaTrack initialTrack) {
        var sender = new FakeSender(kind, initialTrack);
        senders.put(kind, sender);
        return sender;
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer(boolean iceRestart) {
        offersCreated++;
        return CompletableFuture.completedFuture(SessionDescription.offer("v=0 offer " + index));
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        return CompletableFuture.completedFuture(SessionDescription.answer("v=0 answer " + index));
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
        localDescription = description;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        remoteDescription = description;
        if (holdRemoteDescription) {
            heldRemoteDescription = new CompletableFuture<>();
            return heldRemoteDescription;
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> addIceCandidate(IceCandidate candidate) {
        appliedCandidates.add(candidate);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public NativeConnectionState connectionState() {
        return state;
    }

    @Override
    public void close() {
        closed = true;
        state = NativeConnectionState.CLOSED;
    }

    public void changeState(NativeConnectionState next) {
        state = next;
        observer.onConnectionStateChange(next);
    }

    public MediaTrack outgoing(TrackKind kind) {
        return senders.get(kind).track();
    }
}
