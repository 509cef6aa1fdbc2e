/**
 * 此文件定义了WebSocket升级握手前的拦截器。
 *
 * 主要职责:
 * - 从请求的查询参数 (`/ws?room=R1`) 或路径 (`/ws/R1`) 中解析房间ID，未携带时使用默认房间。
 * - 拒绝格式非法的房间ID，返回`400 Bad Request`，连接不会升级。
 * - 调用一次外部认证子系统 (`SessionResolver`) 解析可选的用户ID，并与房间ID一起写入会话属性。
 *
 * 关联:
 * - `WebSocketConfig`: 在此类中被注册到信令路径。
 * - `RoomWebSocketHandler`: 从会话属性中读取房间ID与用户ID。
 * - `SignalingProperties`: 提供默认房间ID与长度上限。
 */
package club.ppmc.meet.handler;

import club.ppmc.meet.auth.AnonymousSessionResolver;
import club.ppmc.meet.auth.SessionResolver;
import club.ppmc.meet.config.SignalingProperties;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

@Component
public class RoomHandshakeInterceptor implements HandshakeInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(RoomHandshakeInterceptor.class);

    public static final String SIGNALING_PATH = "/ws";
    public static final String ROOM_ID_ATTR = "signaling.roomId";
    public static final String USER_ID_ATTR = "signaling.userId";

    private static final String ROOM_QUERY_PARAM = "room";
    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("[A-Za-z0-9_.:-]+");

    private final SessionResolver sessionResolver;
    private final SignalingProperties properties;

    @Autowired
    public RoomHandshakeInterceptor(ObjectProvider<SessionResolver> sessionResolver, SignalingProperties properties) {
        this(sessionResolver.getIfAvailable(AnonymousSessionResolver::new), properties);
    }

    RoomHandshakeInterceptor(SessionResolver sessionResolver, SignalingProperties properties) {
        this.sessionResolver = sessionResolver;
        this.properties = properties;
        logger.info("握手拦截器初始化。认证解析器: {}", sessionResolver.getClass().getSimpleName());
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        var roomId = resolveRoomId(request.getURI());

        if (!isValidRoomId(roomId)) {
            logger.warn("拒绝WebSocket升级：房间ID无效 '{}' | 来源: {}", roomId, request.getRemoteAddress());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        attributes.put(ROOM_ID_ATTR, roomId);
        sessionResolver.resolveUserId(request).ifPresent(userId -> attributes.put(USER_ID_ATTR, userId));

        logger.debug("WebSocket升级请求已接受 | 房间: {} | 已认证: {}", roomId, attributes.containsKey(USER_ID_ATTR));
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception) {
        if (exception != null) {
            logger.warn("WebSocket握手失败 | URI {}: {}", request.getURI(), exception.getMessage());
        }
    }

    /**
     * 查询参数优先，其次是信令路径后的第一段路径，都没有时返回默认房间。
     */
    String resolveRoomId(URI uri) {
        var queryRoom = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(ROOM_QUERY_PARAM);
        if (queryRoom != null && !queryRoom.isBlank()) {
            return UriUtils.decode(queryRoom, StandardCharsets.UTF_8);
        }

        var path = uri.getRawPath();
        var prefix = SIGNALING_PATH + "/";
        if (path != null && path.startsWith(prefix) && path.length() > prefix.length()) {
            return UriUtils.decode(path.substring(prefix.length()), StandardCharsets.UTF_8);
        }

        return properties.defaultRoomId();
    }

    private boolean isValidRoomId(String roomId) {
        return roomId != null
                && roomId.length() <= properties.maxRoomIdLength()
                && ROOM_ID_PATTERN.matcher(roomId).matches();
    }
}
