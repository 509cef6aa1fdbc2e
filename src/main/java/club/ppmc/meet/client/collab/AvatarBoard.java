/**
 * 此文件定义了房间内的头像看板，维护每个用户头像的位置并广播本端头像的移动。
 *
 * 主要职责:
 * - 本地渲染操作: 添加、更新、移除头像。
 * - `moveOwnAvatar`: 立即更新本地头像，并经`TrailingThrottle`节流后广播，最终位置一定会被发送。
 * - 远端更新按发送者键入，按到达顺序后写者胜出，不比较发送方时钟。
 * - 参与者离开时移除其头像。状态不持久化，也不向后加入者回放。
 *
 * 关联:
 * - `MeetingSession`: 分发avatar-position与user-left消息，并在离开时调用`reset`。
 */
package club.ppmc.meet.client.collab;

import club.ppmc.meet.dto.AvatarPositionMessage;
import club.ppmc.meet.dto.SignalingMessage;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AvatarBoard {
    private static final Logger logger = LoggerFactory.getLogger(AvatarBoard.class);

    // 服务器分配连接ID之前，本端头像使用的键
    static final String UNASSIGNED_LOCAL_ID = "local";

    private final AvatarView view;
    private final LongSupplier clockMillis;
    private final TrailingThrottle<AvatarPositionMessage> throttle;
    private final Map<String, AvatarState> avatars = new LinkedHashMap<>();

    private String localId = UNASSIGNED_LOCAL_ID;
    private String ownLabel;
    private String ownColor;

    public AvatarBoard(
            AvatarView view,
            Consumer<SignalingMessage> sender,
            Duration throttleInterval,
            ScheduledExecutorService scheduler,
            LongSupplier clockMillis) {
        this.view = view;
        this.clockMillis = clockMillis;
        this.throttle = new TrailingThrottle<>(throttleInterval, scheduler, clockMillis, sender::accept);
    }

    public synchronized void setLocalConnectionId(String connectionId) {
        if (connectionId == null || connectionId.equals(localId)) {
            return;
        }
        var own = avatars.remove(localId);
        localId = connectionId;
        if (own != null) {
            avatars.put(localId, own.withUserId(localId));
        }
    }

    public synchronized String localConnectionId() {
        return localId;
    }

    /**
     * 设置本端头像随位置一起广播的标签与颜色。
     */
    public synchronized void setOwnAppearance(String label, String color) {
        this.ownLabel = label;
        this.ownColor = color;
    }

    public synchronized void addAvatar(String userId, double x, double y, String label, String color) {
        var avatar = new AvatarState(userId, x, y, label, color, clockMillis.getAsLong());
        avatars.put(userId, avatar);
        view.onAvatarUpdated(avatar);
    }

    public synchronized void updateAvatar(String userId, double x, double y) {
        var current = avatars.get(userId);
        if (current == null) {
            addAvatar(userId, x, y, null, null);
            return;
        }
        var moved = current.moveTo(x, y, clockMillis.getAsLong());
        avatars.put(userId, moved);
        view.onAvatarUpdated(moved);
    }

    public synchronized void removeAvatar(String userId) {
        if (avatars.remove(userId) != null) {
            view.onAvatarRemoved(userId);
        }
    }

    /**
     * 移动本端头像: 本地立即生效，广播经过节流。
     */
    public void moveOwnAvatar(double x, double y) {
        AvatarPositionMessage message;
        synchronized (this) {
            var current = avatars.get(localId);
            if (current == null) {
                addAvatar(localId, x, y, ownLabel, ownColor);
            } else {
                updateAvatar(localId, x, y);
            }
            message = AvatarPositionMessage.of(x, y, ownLabel, ownColor);
        }
        throttle.submit(message);
    }

    public synchronized void onRemotePosition(AvatarPositionMessage message) {
        var userId = message.userId();
        if (userId == null || userId.equals(localId) || message.x() == null || message.y() == null) {
            return;
        }

        // 服务器按发送顺序转发同一用户的消息，到达顺序即写入顺序
        var current = avatars.get(userId);
        var at = clockMillis.getAsLong();

        var label = message.label() != null ? message.label() : current == null ? null : current.label();
        var color = message.color() != null ? message.color() : current == null ? null : current.color();
        var avatar = new AvatarState(userId, message.x(), message.y(), label, color, at);
        avatars.put(userId, avatar);
        view.onAvatarUpdated(avatar);
    }

    public void onUserLeft(String userId) {
        removeAvatar(userId);
    }

    public synchronized List<AvatarState> avatars() {
        return List.copyOf(avatars.values());
    }

    public synchronized Optional<AvatarState> avatar(String userId) {
        return Optional.ofNullable(avatars.get(userId));
    }

    /**
     * 丢弃未发送的位置并清空所有头像。用于离开会议。
     */
    public void reset() {
        throttle.cancel();
        List<String> removed;
        synchronized (this) {
            removed = List.copyOf(avatars.keySet());
            avatars.clear();
            localId = UNASSIGNED_LOCAL_ID;
        }
        removed.forEach(view::onAvatarRemoved);
    }
}
