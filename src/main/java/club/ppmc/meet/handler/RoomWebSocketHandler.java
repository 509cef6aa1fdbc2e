/**
 * 此文件是信令端点的WebSocket处理器。
 *
 * 主要职责:
 * - 管理WebSocket连接的生命周期 (`afterConnectionEstablished`, `afterConnectionClosed`)。
 * - 用`ConcurrentWebSocketSessionDecorator`包装会话，保证同一会话上的并发发送被串行化。
 * - 将文本消息交给`SignalingGateway`；其他帧类型被忽略。
 * - 传输错误只记录日志，容器随后会回调`afterConnectionClosed`，按参与者离开处理。
 *
 * 关联:
 * - `SignalingGateway`: 连接与消息处理的实际逻辑。
 * - `RoomHandshakeInterceptor`: 在握手阶段写入房间ID与用户ID。
 * - `WebSocketConfig`: 在此类中被注册到信令路径。
 */
package club.ppmc.meet.handler;

import club.ppmc.meet.config.SignalingProperties;
import club.ppmc.meet.service.SignalingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Component
public class RoomWebSocketHandler implements WebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(RoomWebSocketHandler.class);

    private static final int KB_TO_BYTES = 1024;

    private final SignalingGateway signalingGateway;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeBytes;

    public RoomWebSocketHandler(SignalingGateway signalingGateway, SignalingProperties properties) {
        this.signalingGateway = signalingGateway;
        this.sendTimeLimitMs = properties.sendTimeLimitMs();
        this.sendBufferSizeBytes = properties.sendBufferSizeKb() * KB_TO_BYTES;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var roomId = (String) session.getAttributes().get(RoomHandshakeInterceptor.ROOM_ID_ATTR);
        var userId = (String) session.getAttributes().get(RoomHandshakeInterceptor.USER_ID_ATTR);
        logger.debug("新的WebSocket连接已建立: 会话ID {} | 房间 {}", session.getId(), roomId);

        var concurrentSession = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeBytes);
        signalingGateway.open(concurrentSession, roomId, userId);
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        if (message instanceof TextMessage) {
            signalingGateway.receive(session, ((TextMessage) message).getPayload());
        } else {
            logger.debug("忽略非文本消息 {} | 会话ID {}", message.getClass().getSimpleName(), session.getId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket传输错误 | 会话ID {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        logger.debug("WebSocket连接已关闭: 会话ID {} | 状态: {}", session.getId(), closeStatus);
        signalingGateway.close(session, closeStatus);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false; // 信令消息通常较小，不支持分片消息
    }
}
