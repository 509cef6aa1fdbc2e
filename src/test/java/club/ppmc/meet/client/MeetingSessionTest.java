package club.ppmc.meet.client;

import club.ppmc.meet.client.media.TrackKind;
import club.ppmc.meet.client.peer.PeerState;
import club.ppmc.meet.client.support.FakeMediaDevices;
import club.ppmc.meet.client.support.FakeRtcPeerConnectionFactory;
import club.ppmc.meet.client.support.FakeTransport;
import club.ppmc.meet.client.support.RecordingPeerView;
import club.ppmc.meet.dto.AvatarPositionMessage;
import club.ppmc.meet.dto.CanvasDrawMessage;
import club.ppmc.meet.dto.HeartbeatMessage;
import club.ppmc.meet.dto.MessageType;
import club.ppmc.meet.dto.Point;
import club.ppmc.meet.dto.PresenceMessage;
import club.ppmc.meet.dto.PresenterMessage;
import club.ppmc.meet.dto.RoomMembersMessage;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MeetingSessionTest {

    private static final URI SIGNALING_URI = URI.create("ws://localhost:8080/ws");

    private final FakeTransport transport = new FakeTransport();
    private final FakeRtcPeerConnectionFactory rtcFactory = new FakeRtcPeerConnectionFactory();
    private final FakeMediaDevices devices = new FakeMediaDevices();
    private final RecordingPeerView peerView = new RecordingPeerView();
    private final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
    private MeetingSession session;

    @BeforeEach
    void setUp() {
        doReturn(mock(ScheduledFuture.class)).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        session = newSession(Duration.ZERO);
    }

    @Test
    void initializeConnectsToRoom() {
        session.initialize("team a").join();

        assertEquals(URI.create("ws://localhost:8080/ws?room=team%20a"), transport.connectedUri);
        assertEquals("team a", session.roomId());
    }

    @Test
    void initializeTwiceFails() {
        session.initialize("R1").join();

        var error = assertThrows(CompletionException.class, () -> session.initialize("R2").join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void heartbeatPingsAtConfiguredInterval() {
        var withHeartbeat = newSession(Duration.ofSeconds(25));
        withHeartbeat.initialize("R1").join();

        var ping = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(
                ping.capture(), eq(25_000L), eq(25_000L), eq(TimeUnit.MILLISECONDS));
        ping.getValue().run();

        assertEquals(List.of(HeartbeatMessage.ping()), transport.sentOfType(MessageType.PING));
    }

    @Test
    void inboundMessagesReachPeersAndBoards() {
        session.initialize("R1").join();

        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));
        transport.deliver(new AvatarPositionMessage(MessageType.AVATAR_POSITION, "b", 3.0, 4.0, "Bo", null, 1L));
        transport.deliver(new CanvasDrawMessage(
                MessageType.CANVAS_DRAW, "b", "pen", "#000", 2.0, Point.of(0, 0), Point.of(1, 1), 1L));

        assertEquals("a", session.localConnectionId());
        assertEquals(1, session.peerCount());
        assertEquals(1, transport.sentOfType(MessageType.OFFER).size());
        assertEquals("b", session.avatars().get(0).userId());
        assertEquals(1, session.strokes().size());

        transport.deliver(PresenceMessage.left("b"));

        assertEquals(0, session.peerCount());
        assertTrue(session.avatars().isEmpty());
        assertEquals(1, session.strokes().size());
    }

    @Test
    void togglingVideoReplacesTrackWithoutRenegotiation() {
        session.initialize("R1").join();
        session.startLocalMedia().join();
        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));
        var connection = rtcFactory.last();
        var camera = devices.lastTrack("camera");
        assertSame(camera, connection.outgoing(TrackKind.VIDEO));

        session.toggleVideo().join();

        assertTrue(connection.outgoing(TrackKind.VIDEO).id().startsWith("placeholder-video"));
        assertEquals(1, connection.offersCreated);
        assertEquals(1, transport.sentOfType(MessageType.OFFER).size());

        session.toggleVideo().join();
        assertSame(camera, connection.outgoing(TrackKind.VIDEO));
    }

    @Test
    void screenShareSwapsVideoOnEveryPeer() {
        session.initialize("R1").join();
        session.startLocalMedia().join();
        transport.deliver(RoomMembersMessage.of(List.of("b", "c"), "a"));

        session.startScreenShare().join();

        var screen = devices.lastTrack("screen");
        rtcFactory.created.forEach(connection -> assertSame(screen, connection.outgoing(TrackKind.VIDEO)));

        session.stopScreenShare().join();

        var camera = devices.lastTrack("camera");
        rtcFactory.created.forEach(connection -> assertSame(camera, connection.outgoing(TrackKind.VIDEO)));
    }

    @Test
    void presenterIsAppliedLocallyAndBroadcast() {
        session.initialize("R1").join();
        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));

        session.setPresenter("a");

        assertEquals("a", session.presenterId());
        List<PresenterMessage> sent = transport.sentOfType(MessageType.SET_PRESENTER);
        assertEquals("a", sent.get(0).presenterId());

        transport.deliver(new PresenterMessage(MessageType.SET_PRESENTER, "b", "b", 2L));
        assertEquals("b", session.presenterId());

        transport.deliver(PresenceMessage.left("b"));
        assertNull(session.presenterId());
        assertTrue(peerView.events.containsAll(List.of("presenter:a", "presenter:b", "presenter:null")));
    }

    @Test
    void leaveReleasesEverythingExactlyOnce() {
        session.initialize("R1").join();
        session.startLocalMedia().join();
        transport.deliver(RoomMembersMessage.of(List.of("b", "c"), "a"));
        session.drawSegment(Point.of(0, 0), Point.of(1, 1));

        session.leave();
        session.leave();

        assertTrue(session.isLeft());
        assertEquals(1, transport.closeCalls);
        assertEquals(0, session.peerCount());
        assertEquals(0, rtcFactory.openCount());
        assertTrue(session.strokes().isEmpty());
        devices.createdTracks.forEach(track -> assertFalse(track.isLive(), track.id()));
    }

    @Test
    void transportCloseTriggersLeave() {
        session.initialize("R1").join();
        session.startLocalMedia().join();
        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));

        transport.simulateClose();

        assertTrue(session.isLeft());
        assertEquals(0, session.peerCount());
        assertFalse(session.mediaState().started());
    }

    @Test
    void messagesAfterLeaveAreIgnored() {
        session.initialize("R1").join();
        session.leave();

        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));

        assertEquals(0, session.peerCount());
        assertEquals(Optional.empty(), session.peerState("b"));
        assertTrue(rtcFactory.created.isEmpty());
    }

    @Test
    void peerStateIsExposed() {
        session.initialize("R1").join();
        transport.deliver(RoomMembersMessage.of(List.of("b"), "a"));

        assertEquals(Optional.of(PeerState.NEGOTIATING), session.peerState("b"));
    }

    private MeetingSession newSession(Duration heartbeat) {
        var config = new MeetingClientConfig(SIGNALING_URI, null, null, Duration.ofMillis(50), heartbeat);
        return new MeetingSession(
                config,
                transport,
                rtcFactory,
                devices,
                new MeetingViews(peerView, null, null, null),
                Runnable::run,
                scheduler);
    }
}
