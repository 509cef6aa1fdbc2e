package club.ppmc.meet;

import club.ppmc.meet.client.transport.WebSocketSignalingTransport;
import club.ppmc.meet.codec.SignalingCodec;
import club.ppmc.meet.dto.AvatarPositionMessage;
import club.ppmc.meet.dto.MessageType;
import club.ppmc.meet.dto.PresenceMessage;
import club.ppmc.meet.dto.RelayMessage;
import club.ppmc.meet.dto.RoomMembersMessage;
import club.ppmc.meet.dto.SignalingMessage;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SignalingEndToEndTest {

    private final SignalingCodec codec = new SignalingCodec();
    private final List<WebSocketSignalingTransport> opened = new ArrayList<>();

    @LocalServerPort
    private int port;

    @AfterEach
    void tearDown() {
        opened.forEach(WebSocketSignalingTransport::close);
    }

    @Test
    void twoParticipantsExchangeSignalsThroughTheGateway() throws Exception {
        var aliceInbox = new LinkedBlockingQueue<SignalingMessage>();
        var alice = connect("/ws?room=e2e-1", aliceInbox);
        var aliceId = next(aliceInbox, RoomMembersMessage.class).connectionId();

        var bobInbox = new LinkedBlockingQueue<SignalingMessage>();
        var bob = connect("/ws/e2e-1", bobInbox);
        var bobMembers = next(bobInbox, RoomMembersMessage.class);
        assertEquals(List.of(aliceId), bobMembers.members());
        var bobId = bobMembers.connectionId();

        var joined = next(aliceInbox, PresenceMessage.class);
        assertEquals(MessageType.USER_JOINED, joined.type());
        assertEquals(bobId, joined.userId());

        var payload = JsonNodeFactory.instance.objectNode().put("type", "offer").put("sdp", "v=0");
        alice.send(RelayMessage.offer(bobId, payload));
        var offer = next(bobInbox, RelayMessage.class);
        assertEquals(aliceId, offer.from());
        assertEquals("v=0", offer.payload().get("sdp").asText());

        bob.send(AvatarPositionMessage.of(3, 4, "Bob", "#0000ff"));
        var avatar = next(aliceInbox, AvatarPositionMessage.class);
        assertEquals(bobId, avatar.userId());

        bob.close();
        var left = next(aliceInbox, PresenceMessage.class);
        assertEquals(MessageType.USER_LEFT, left.type());
        assertEquals(bobId, left.userId());
    }

    @Test
    void roomsDoNotLeakIntoEachOther() throws Exception {
        var firstInbox = new LinkedBlockingQueue<SignalingMessage>();
        connect("/ws?room=e2e-a", firstInbox);
        next(firstInbox, RoomMembersMessage.class);

        var secondInbox = new LinkedBlockingQueue<SignalingMessage>();
        connect("/ws?room=e2e-b", secondInbox);
        assertEquals(List.of(), next(secondInbox, RoomMembersMessage.class).members());

        assertNull(firstInbox.poll(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void invalidRoomIdIsRefusedAtHandshake() {
        var transport = new WebSocketSignalingTransport(codec);
        opened.add(transport);

        assertThrows(ExecutionException.class,
                () -> transport.connect(uri("/ws/" + "r".repeat(65))).get(5, TimeUnit.SECONDS));
    }

    private WebSocketSignalingTransport connect(String path, BlockingQueue<SignalingMessage> inbox) throws Exception {
        var transport = new WebSocketSignalingTransport(codec);
        transport.onMessage(inbox::add);
        opened.add(transport);
        transport.connect(uri(path)).get(5, TimeUnit.SECONDS);
        return transport;
    }

    private URI uri(String path) {
        return URI.create("ws://localhost:" + port + path);
    }

    private static <T extends SignalingMessage> T next(BlockingQueue<SignalingMessage> inbox, Class<T> type)
            throws InterruptedException {
        var message = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "等待 " + type.getSimpleName() + " 超时");
        return type.cast(message);
    }
}
