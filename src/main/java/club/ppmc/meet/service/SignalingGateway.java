/**
 * 此服务类是信令网关的核心，负责连接生命周期与消息投递，与具体的WebSocket处理器解耦以便测试。
 *
 * 主要职责:
 * - 连接建立: 分配连接ID，加入房间，向新连接发送 `room-members`，再向其他成员广播 `user-joined`。
 * - 消息处理: 解码入站消息，交给`MessageRouter`计算目标，再按路由结果投递；格式错误的消息只记录并丢弃，
 *   不会断开发送方。
 * - 连接关闭 (主动离开、超时或网络故障): 移出房间并向剩余成员广播恰好一次 `user-left`。
 * - 清理陈旧会话，并为其补发离开通知。
 *
 * 关联:
 * - `RoomWebSocketHandler`: 将WebSocket回调委托给本类。
 * - `RoomRegistry`: 成员关系的唯一事实来源。
 * - `MessageRouter`: 扇出策略。
 * - `SignalingCodec`: 消息编解码。
 * - `SignalingMetrics`: 计数。
 */
package club.ppmc.meet.service;

import club.ppmc.meet.codec.MalformedMessageException;
import club.ppmc.meet.codec.SignalingCodec;
import club.ppmc.meet.dto.PresenceMessage;
import club.ppmc.meet.dto.RoomMembersMessage;
import club.ppmc.meet.dto.SignalingMessage;
import club.ppmc.meet.metrics.SignalingMetrics;
import club.ppmc.meet.model.Connection;
import club.ppmc.meet.registry.RoomRegistry;
import club.ppmc.meet.registry.RoomRegistry.Member;
import club.ppmc.meet.router.MessageRouter;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Service
public class SignalingGateway {
    private static final Logger logger = LoggerFactory.getLogger(SignalingGateway.class);

    public static final String CONNECTION_ID_ATTR = "signaling.connectionId";

    private final RoomRegistry roomRegistry;
    private final MessageRouter messageRouter;
    private final SignalingCodec codec;
    private final SignalingMetrics metrics;

    public SignalingGateway(
            RoomRegistry roomRegistry,
            MessageRouter messageRouter,
            SignalingCodec codec,
            SignalingMetrics metrics) {
        this.roomRegistry = roomRegistry;
        this.messageRouter = messageRouter;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * 处理一个新建立的连接。
     *
     * @param session 已建立的WebSocket会话。
     * @param roomId  握手阶段解析出的房间ID。
     * @param userId  认证子系统识别出的用户ID，匿名时为`null`。
     * @return 分配给该连接的身份。
     */
    public Connection open(WebSocketSession session, String roomId, String userId) {
        var connection = new Connection(UUID.randomUUID().toString(), roomId, userId, Instant.now());
        session.getAttributes().put(CONNECTION_ID_ATTR, connection.id());

        var join = roomRegistry.join(connection, session);
        metrics.connectionOpened();

        // 先告知新连接现有成员，再通知其他成员，新连接自身不会收到自己的加入事件
        send(join.member(), RoomMembersMessage.of(join.otherIds(), connection.id()));
        broadcast(join.others(), PresenceMessage.joined(connection.id(), userId));

        logger.info("连接 '{}' {} 已加入房间 '{}' | 会话ID {}",
                connection.id(), userId != null ? "(用户: " + userId + ")" : "(匿名)", roomId, session.getId());
        return connection;
    }

    /**
     * 处理一条入站文本消息。任何错误都只影响这一条消息。
     */
    public void receive(WebSocketSession session, String payload) {
        var connectionId = connectionId(session);
        var sender = roomRegistry.member(connectionId).orElse(null);
        if (sender == null) {
            logger.warn("收到未注册会话 {} 的消息，已忽略。", session.getId());
            return;
        }

        SignalingMessage message;
        try {
            message = codec.decode(payload);
        } catch (MalformedMessageException e) {
            metrics.messageMalformed();
            logger.warn("丢弃格式错误的消息 | 连接 '{}': {}", connectionId, e.getMessage());
            return;
        }

        metrics.messageReceived(message.type());
        logReceivedMessage(sender.connection(), message);

        var roomMembers = roomRegistry.roomMembers(sender.connection().roomId());
        var memberIds = roomMembers.stream().map(Member::id).toList();
        var route = messageRouter.route(sender.connection(), message, memberIds);

        if (route.isDropped()) {
            if (route.malformed()) {
                metrics.messageMalformed();
                logger.warn("丢弃无效消息 | 连接 '{}': {}", connectionId, route.dropReason());
            } else {
                metrics.messageDropped();
                logger.debug("消息已丢弃 | 连接 '{}': {}", connectionId, route.dropReason());
            }
            return;
        }

        var byId = roomMembers.stream().collect(Collectors.toMap(Member::id, Function.identity()));
        var recipients = route.recipients().stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .toList();
        broadcast(recipients, route.outbound());
    }

    /**
     * 处理连接关闭。无论关闭原因如何，均按参与者离开处理。
     */
    public void close(WebSocketSession session, CloseStatus closeStatus) {
        var connectionId = connectionId(session);
        roomRegistry.leave(connectionId).ifPresent(result -> {
            metrics.connectionClosed();
            broadcast(result.remaining(), PresenceMessage.left(connectionId));
            logger.info("连接 '{}' 已关闭 | 状态: {}", connectionId, closeStatus);
        });
    }

    /**
     * 清理会话已关闭但未收到关闭回调的连接，并为每个连接补发一次离开通知。
     *
     * @return 被清理的连接数。
     */
    public int sweepClosedConnections() {
        var purged = roomRegistry.purgeClosedSessions();
        for (var result : purged) {
            metrics.connectionClosed();
            broadcast(result.remaining(), PresenceMessage.left(result.departed().id()));
        }
        return purged.size();
    }

    private void broadcast(List<Member> recipients, SignalingMessage message) {
        if (recipients.isEmpty()) return;
        var textMessage = new TextMessage(codec.encode(message));
        for (var recipient : recipients) {
            sendText(recipient, textMessage, message);
        }
    }

    private void send(Member recipient, SignalingMessage message) {
        sendText(recipient, new TextMessage(codec.encode(message)), message);
    }

    private void sendText(Member recipient, TextMessage textMessage, SignalingMessage message) {
        var session = recipient.session();
        try {
            if (session.isOpen()) {
                session.sendMessage(textMessage);
            } else {
                logger.warn("尝试向已关闭的连接 '{}' 发送消息失败: {}", recipient.id(), message.type());
            }
        } catch (Exception e) {
            logger.error("通过WebSocket发送消息失败 | 连接 '{}': {}", recipient.id(), e.getMessage(), e);
        }
    }

    private static String connectionId(WebSocketSession session) {
        Map<String, Object> attributes = session.getAttributes();
        var value = attributes.get(CONNECTION_ID_ATTR);
        return value instanceof String ? (String) value : null;
    }

    private void logReceivedMessage(Connection sender, SignalingMessage message) {
        switch (message.type().category()) {
            case RELAY, BROADCAST ->
                    logger.debug("收到消息: {} | 连接: {} | 房间: {}", message, sender.id(), sender.roomId());
            case HEARTBEAT ->
                    logger.debug("收到消息: {} | 连接: {}", message.type(), sender.id());
            default ->
                    logger.info("收到消息: {} | 连接: {}", message, sender.id());
        }
    }
}
