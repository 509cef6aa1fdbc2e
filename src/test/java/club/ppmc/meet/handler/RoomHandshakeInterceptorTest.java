package club.ppmc.meet.handler;

import club.ppmc.meet.auth.AnonymousSessionResolver;
import club.ppmc.meet.config.SignalingProperties;
import java.net.URI;
import java.util.HashMap;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class RoomHandshakeInterceptorTest {

    private final RoomHandshakeInterceptor interceptor =
            new RoomHandshakeInterceptor(new AnonymousSessionResolver(), SignalingProperties.defaults());

    @Test
    void roomIdComesFromQueryThenPathThenDefault() {
        assertEquals("R1", interceptor.resolveRoomId(URI.create("ws://host/ws?room=R1")));
        assertEquals("R2", interceptor.resolveRoomId(URI.create("ws://host/ws/R2")));
        assertEquals("R1", interceptor.resolveRoomId(URI.create("ws://host/ws/R2?room=R1")));
        assertEquals("default", interceptor.resolveRoomId(URI.create("ws://host/ws")));
        assertEquals("default", interceptor.resolveRoomId(URI.create("ws://host/ws?room=")));
    }

    @Test
    void percentEncodedRoomIdIsDecoded() {
        assertEquals("team a", interceptor.resolveRoomId(URI.create("ws://host/ws?room=team%20a")));
    }

    @Test
    void validRoomIsStoredInAttributes() {
        var request = new MockHttpServletRequest("GET", "/ws");
        request.setQueryString("room=standup-1");
        var attributes = new HashMap<String, Object>();

        var accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()),
                mock(WebSocketHandler.class),
                attributes);

        assertTrue(accepted);
        assertEquals("standup-1", attributes.get(RoomHandshakeInterceptor.ROOM_ID_ATTR));
        assertFalse(attributes.containsKey(RoomHandshakeInterceptor.USER_ID_ATTR));
    }

    @Test
    void invalidRoomIsRejectedWithBadRequest() {
        var request = new MockHttpServletRequest("GET", "/ws");
        request.setQueryString("room=team%20a");
        var servletResponse = new MockHttpServletResponse();
        var attributes = new HashMap<String, Object>();

        var accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse),
                mock(WebSocketHandler.class),
                attributes);

        assertFalse(accepted);
        assertEquals(HttpStatus.BAD_REQUEST.value(), servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
    }

    @Test
    void overlongRoomIsRejected() {
        var request = new MockHttpServletRequest("GET", "/ws/" + "r".repeat(65));
        var servletResponse = new MockHttpServletResponse();

        var accepted = interceptor.beforeHandshake(
                new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse),
                mock(WebSocketHandler.class),
                new HashMap<>());

        assertFalse(accepted);
        assertEquals(HttpStatus.BAD_REQUEST.value(), servletResponse.getStatus());
    }

    @Test
    void resolvedUserIdIsStored() {
        var authenticating = new RoomHandshakeInterceptor(request -> Optional.of("user-7"), SignalingProperties.defaults());
        var attributes = new HashMap<String, Object>();

        authenticating.beforeHandshake(
                new ServletServerHttpRequest(new MockHttpServletRequest("GET", "/ws/R1")),
                new ServletServerHttpResponse(new MockHttpServletResponse()),
                mock(WebSocketHandler.class),
                attributes);

        assertEquals("R1", attributes.get(RoomHandshakeInterceptor.ROOM_ID_ATTR));
        assertEquals("user-7", attributes.get(RoomHandshakeInterceptor.USER_ID_ATTR));
    }
}
