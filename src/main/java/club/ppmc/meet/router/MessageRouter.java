/**
 * 此文件定义了信令消息的扇出策略，是一个不接触套接字的纯函数。
 *
 * 主要职责:
 * - 点对点转发 (offer / answer / ice-candidate): 必须携带 `target`；目标仍在发送者房间内时，
 *   原样转发并填入 `from`；目标已离开则静默丢弃 (良性竞态，不是错误)。负载内容从不检查。
 * - 房间广播 (avatar-position / canvas-draw / canvas-clear / set-presenter): 经结构校验后
 *   发送给除发送者外的所有成员，`userId` 改写为发送者的连接ID。
 * - 心跳: `ping` 只回复发送者一条 `pong`。
 * - 服务器专属的成员事件 (user-joined 等) 不接受客户端发送。
 *
 * 关联:
 * - `SignalingGateway`: 对每条入站消息调用`route`，再按结果投递。
 * - `BroadcastValidator`: 广播消息的结构校验。
 */
package club.ppmc.meet.router;

import club.ppmc.meet.codec.MalformedMessageException;
import club.ppmc.meet.dto.BroadcastMessage;
import club.ppmc.meet.dto.HeartbeatMessage;
import club.ppmc.meet.dto.RelayMessage;
import club.ppmc.meet.dto.SignalingMessage;
import club.ppmc.meet.model.Connection;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class MessageRouter {

    private final BroadcastValidator broadcastValidator;

    public MessageRouter(BroadcastValidator broadcastValidator) {
        this.broadcastValidator = broadcastValidator;
    }

    /**
     * 计算一条入站消息的投递目标。
     *
     * @param sender      发送者连接。
     * @param message     已解码的入站消息。
     * @param roomMembers 发送者所在房间当前的成员ID (含发送者)，按加入顺序排列。
     * @return 路由决策。
     */
    public Route route(Connection sender, SignalingMessage message, List<String> roomMembers) {
        return switch (message.type().category()) {
            case RELAY -> routeRelay(sender, (RelayMessage) message, roomMembers);
            case BROADCAST -> routeBroadcast(sender, (BroadcastMessage) message, roomMembers);
            case HEARTBEAT -> routeHeartbeat(sender, message);
            case PRESENCE -> Route.reject("客户端不能发送服务器事件: " + message.type().wireName());
        };
    }

    private Route routeRelay(Connection sender, RelayMessage message, List<String> roomMembers) {
        var target = message.target();
        if (target == null || target.isBlank()) {
            return Route.reject(message.type().wireName() + " 缺少target");
        }
        if (target.equals(sender.id()) || !roomMembers.contains(target)) {
            return Route.drop("目标连接 '" + target + "' 不在房间内");
        }
        return Route.deliver(List.of(target), message.withSender(sender.id()));
    }

    private Route routeBroadcast(Connection sender, BroadcastMessage message, List<String> roomMembers) {
        try {
            broadcastValidator.validate(message);
        } catch (MalformedMessageException e) {
            return Route.reject(message.type().wireName() + " 校验失败: " + e.getMessage());
        }

        var recipients = roomMembers.stream()
                .filter(memberId -> !memberId.equals(sender.id()))
                .toList();
        if (recipients.isEmpty()) {
            return Route.drop("房间内没有其他成员");
        }
        return Route.deliver(recipients, message.withUserId(sender.id()));
    }

    private Route routeHeartbeat(Connection sender, SignalingMessage message) {
        return switch (message.type()) {
            case PING -> Route.deliver(List.of(sender.id()), HeartbeatMessage.pong());
            default -> Route.drop("忽略客户端发送的 " + message.type().wireName());
        };
    }
}
