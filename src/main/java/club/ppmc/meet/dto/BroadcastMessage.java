package club.ppmc.meet.dto;

/**
 * 房间广播类消息。`userId` 始终由服务器改写为发送者的连接ID，客户端提供的值不被信任。
 */
public interface BroadcastMessage extends SignalingMessage {

    String userId();

    BroadcastMessage withUserId(String userId);
}
