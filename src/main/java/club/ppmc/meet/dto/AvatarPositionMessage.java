/**
 * 此文件定义了头像位置广播消息。
 *
 * 接收方按 `userId` 以"最后写入为准"的方式覆盖该用户的头像位置，不保留历史。
 * `label` 与 `color` 是可选的显示元数据。
 */
package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvatarPositionMessage(
        MessageType type,
        String userId,
        Double x,
        Double y,
        String label,
        String color,
        Long timestamp) implements BroadcastMessage {

    public static AvatarPositionMessage of(double x, double y, String label, String color) {
        return new AvatarPositionMessage(
                MessageType.AVATAR_POSITION, null, x, y, label, color, System.currentTimeMillis());
    }

    @Override
    public AvatarPositionMessage withUserId(String userId) {
        return new AvatarPositionMessage(type, userId, x, y, label, color, timestamp);
    }
}
