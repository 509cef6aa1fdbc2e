package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 成员加入/离开通知。`userId` 是连接ID；`authenticatedUserId` 仅在认证子系统识别出用户时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceMessage(
        MessageType type,
        String userId,
        String authenticatedUserId) implements SignalingMessage {

    public static PresenceMessage joined(String connectionId, String authenticatedUserId) {
        return new PresenceMessage(MessageType.USER_JOINED, connectionId, authenticatedUserId);
    }

    public static PresenceMessage left(String connectionId) {
        return new PresenceMessage(MessageType.USER_LEFT, connectionId, null);
    }
}
