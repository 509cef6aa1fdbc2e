package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * 发送给新加入连接的房间成员快照。
 *
 * @param members      加入前已在房间中的连接ID，按加入顺序排列，不含自身。
 * @param connectionId 服务器为新连接分配的ID，客户端据此决定由哪一方发起协商。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomMembersMessage(
        MessageType type,
        List<String> members,
        String connectionId) implements SignalingMessage {

    public RoomMembersMessage {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static RoomMembersMessage of(List<String> members, String connectionId) {
        return new RoomMembersMessage(MessageType.ROOM_MEMBERS, members, connectionId);
    }
}
