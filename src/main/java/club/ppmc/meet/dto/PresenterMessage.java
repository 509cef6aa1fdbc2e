package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 指定当前主讲人。`presenterId` 为空表示取消主讲人。
 * 与其他广播一样不回送给发送者，发送方在本地直接生效。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenterMessage(
        MessageType type,
        String userId,
        String presenterId,
        Long timestamp) implements BroadcastMessage {

    public static PresenterMessage of(String presenterId) {
        return new PresenterMessage(MessageType.SET_PRESENTER, null, presenterId, System.currentTimeMillis());
    }

    @Override
    public PresenterMessage withUserId(String userId) {
        return new PresenterMessage(type, userId, presenterId, timestamp);
    }
}
