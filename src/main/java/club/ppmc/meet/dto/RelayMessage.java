/**
 * 此文件定义了点对点转发的WebRTC信令消息 (offer / answer / ice-candidate)。
 *
 * `payload` 是不透明的信令数据 (SDP描述或ICE候选)，服务器只负责原样转发，从不解析其内容。
 * `from` 由服务器在转发时填入，标识原始发送者的连接ID。
 *
 * 关联:
 * - `MessageRouter`: 根据 `target` 查找目标连接。
 * - `PeerConnectionManager`: 在客户端创建和消费此类消息。
 */
package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayMessage(
        MessageType type,
        String target,
        String from,
        JsonNode payload) implements SignalingMessage {

    public static RelayMessage offer(String target, JsonNode payload) {
        return new RelayMessage(MessageType.OFFER, target, null, payload);
    }

    public static RelayMessage answer(String target, JsonNode payload) {
        return new RelayMessage(MessageType.ANSWER, target, null, payload);
    }

    public static RelayMessage iceCandidate(String target, JsonNode payload) {
        return new RelayMessage(MessageType.ICE_CANDIDATE, target, null, payload);
    }

    /**
     * 返回一个携带发送者ID的副本，其余字段原样保留。
     */
    public RelayMessage withSender(String senderId) {
        return new RelayMessage(type, target, senderId, payload);
    }

    /**
     * 重写toString以避免在日志中输出完整的SDP负载。
     */
    @Override
    public String toString() {
        var builder = new StringBuilder("RelayMessage{");
        builder.append("type=").append(type);
        if (target != null) builder.append(", target='").append(target).append('\'');
        if (from != null) builder.append(", from='").append(from).append('\'');
        if (payload != null) builder.append(", payload='<signal_data>'");
        builder.append('}');
        return builder.toString();
    }
}
