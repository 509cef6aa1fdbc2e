/**
 * 此文件定义了房间信令通道上使用的所有消息类型。
 *
 * 每个枚举值同时携带:
 * - 线上的类型名 (`wireName`)，即JSON中 `type` 字段的取值。
 * - 路由类别 (`Category`)，决定服务器采用点对点转发还是房间广播。
 * - 对应的消息记录类，供`SignalingCodec`反序列化使用。
 *
 * 关联:
 * - `SignalingCodec`: 根据 `type` 字段查找枚举值并解析为具体记录。
 * - `MessageRouter`: 根据 `Category` 选择扇出策略。
 */
package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum MessageType {
    // WebRTC 信令 (点对点转发，负载对服务器不透明)
    OFFER("offer", Category.RELAY, RelayMessage.class),
    ANSWER("answer", Category.RELAY, RelayMessage.class),
    ICE_CANDIDATE("ice-candidate", Category.RELAY, RelayMessage.class),

    // 服务器产生的成员事件
    USER_JOINED("user-joined", Category.PRESENCE, PresenceMessage.class),
    USER_LEFT("user-left", Category.PRESENCE, PresenceMessage.class),
    ROOM_MEMBERS("room-members", Category.PRESENCE, RoomMembersMessage.class),

    // 协作状态 (房间广播，不回送发送者)
    AVATAR_POSITION("avatar-position", Category.BROADCAST, AvatarPositionMessage.class),
    CANVAS_DRAW("canvas-draw", Category.BROADCAST, CanvasDrawMessage.class),
    CANVAS_CLEAR("canvas-clear", Category.BROADCAST, CanvasClearMessage.class),
    SET_PRESENTER("set-presenter", Category.BROADCAST, PresenterMessage.class),

    // 心跳
    PING("ping", Category.HEARTBEAT, HeartbeatMessage.class),
    PONG("pong", Category.HEARTBEAT, HeartbeatMessage.class);

    public enum Category {
        RELAY,
        BROADCAST,
        PRESENCE,
        HEARTBEAT
    }

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

    private final String wireName;
    private final Category category;
    private final Class<? extends SignalingMessage> messageClass;

    MessageType(String wireName, Category category, Class<? extends SignalingMessage> messageClass) {
        this.wireName = wireName;
        this.category = category;
        this.messageClass = messageClass;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Category category() {
        return category;
    }

    public Class<? extends SignalingMessage> messageClass() {
        return messageClass;
    }

    public boolean isRelay() {
        return category == Category.RELAY;
    }

    public boolean isBroadcast() {
        return category == Category.BROADCAST;
    }

    /**
     * 根据线上类型名查找消息类型。
     * @param wireName JSON中的 `type` 字段值。
     * @return 匹配的类型；未知类型返回空。
     */
    public static Optional<MessageType> lookup(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }

    @JsonCreator
    public static MessageType fromWireName(String wireName) {
        return lookup(wireName).orElse(null);
    }
}
