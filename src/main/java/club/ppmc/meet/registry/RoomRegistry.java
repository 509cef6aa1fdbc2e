/**
 * 此服务类是房间成员关系的唯一事实来源。
 *
 * 主要职责:
 * - 维护房间ID到成员连接集合的映射，以及连接ID到(连接身份, WebSocket会话)的映射。
 * - 原子地完成"快照现有成员 + 加入"与"移除 + 快照剩余成员"，保证每个在场成员对每次加入/离开事件
 *   恰好收到一次通知。
 * - 房间在首个连接加入时隐式创建，在最后一个连接离开时丢弃。
 * - 清理已关闭但未收到关闭回调的陈旧会话，保证成员集合中不含已关闭的连接。
 * - 生命周期绑定到Spring容器: 容器关闭时以`GOING_AWAY`关闭所有会话。
 *
 * 关联:
 * - `SignalingGateway`: 唯一的写入方 (加入/离开)，同时读取成员快照用于扇出。
 * - `RoomMaintenanceTask`: 定期调用`purgeClosedSessions`。
 */
package club.ppmc.meet.registry;

import club.ppmc.meet.model.Connection;
import club.ppmc.meet.model.Room;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

@Component
public class RoomRegistry implements DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    // 以下两个映射都由 this 的监视器锁保护
    private final Map<String, Room> rooms = new HashMap<>();
    private final Map<String, Member> members = new HashMap<>();

    /**
     * 房间中的一个成员: 连接身份及其WebSocket会话。
     */
    public record Member(Connection connection, WebSocketSession session) {

        public String id() {
            return connection.id();
        }

        public boolean isOpen() {
            return session.isOpen();
        }
    }

    /**
     * 加入结果。
     * @param member 新加入的成员。
     * @param others 加入前已在房间中的成员，按加入顺序排列。
     */
    public record JoinResult(Member member, List<Member> others) {

        public List<String> otherIds() {
            return others.stream().map(Member::id).toList();
        }
    }

    /**
     * 离开结果。
     * @param departed  离开的成员。
     * @param remaining 离开后仍在房间中的成员。
     */
    public record LeaveResult(Member departed, List<Member> remaining) {}

    /**
     * 将连接加入其房间，房间不存在时创建。
     *
     * @param connection 新连接的身份。
     * @param session    连接的WebSocket会话。
     * @return 包含加入前成员快照的结果。
     * @throws IllegalStateException 连接ID已被注册。
     */
    public synchronized JoinResult join(Connection connection, WebSocketSession session) {
        if (members.containsKey(connection.id())) {
            throw new IllegalStateException("连接ID已注册: " + connection.id());
        }

        var room = rooms.computeIfAbsent(connection.roomId(), id -> {
            logger.info("创建房间 '{}'。", id);
            return new Room(id);
        });

        var others = snapshot(room);
        var member = new Member(connection, session);
        room.add(connection.id());
        members.put(connection.id(), member);

        logger.info("连接 '{}' 已加入房间 '{}'，当前成员数 {}。", connection.id(), room.getId(), room.size());
        return new JoinResult(member, others);
    }

    /**
     * 将连接从其房间移除，房间变空时丢弃。
     *
     * @param connectionId 要移除的连接ID。
     * @return 离开结果；连接未注册 (例如已被移除) 时为空，因此同一连接只会产生一次离开事件。
     */
    public synchronized Optional<LeaveResult> leave(String connectionId) {
        if (connectionId == null) return Optional.empty();

        var member = members.remove(connectionId);
        if (member == null) {
            logger.debug("尝试移除一个未注册的连接: {}", connectionId);
            return Optional.empty();
        }

        var roomId = member.connection().roomId();
        var room = rooms.get(roomId);
        List<Member> remaining = List.of();
        if (room != null) {
            room.remove(connectionId);
            if (room.isEmpty()) {
                rooms.remove(roomId);
                logger.info("房间 '{}' 已无成员，已丢弃。", roomId);
            } else {
                remaining = snapshot(room);
            }
        }

        logger.info("连接 '{}' 已离开房间 '{}'，剩余成员数 {}。", connectionId, roomId, remaining.size());
        return Optional.of(new LeaveResult(member, remaining));
    }

    /**
     * 移除所有会话已关闭、但尚未经过正常关闭流程的连接。
     *
     * @return 每个被清理连接的离开结果。
     */
    public synchronized List<LeaveResult> purgeClosedSessions() {
        var staleIds = members.values().stream()
                .filter(member -> !member.isOpen())
                .map(Member::id)
                .toList();

        var results = new ArrayList<LeaveResult>();
        for (var staleId : staleIds) {
            logger.warn("发现已关闭的陈旧会话 '{}'，正在清理...", staleId);
            leave(staleId).ifPresent(results::add);
        }
        return results;
    }

    public synchronized Optional<Member> member(String connectionId) {
        return Optional.ofNullable(connectionId).map(members::get);
    }

    /**
     * @return 房间当前成员的快照；房间不存在时为空列表。
     */
    public synchronized List<Member> roomMembers(String roomId) {
        var room = rooms.get(roomId);
        return room == null ? List.of() : snapshot(room);
    }

    public synchronized int getRoomCount() {
        return rooms.size();
    }

    public synchronized int getConnectionCount() {
        return members.size();
    }

    /**
     * 容器关闭时断开所有连接并清空注册表。
     */
    @Override
    public void destroy() {
        List<Member> all;
        synchronized (this) {
            all = new ArrayList<>(members.values());
            members.clear();
            rooms.clear();
        }

        logger.info("正在关闭 {} 个信令连接...", all.size());
        for (var member : all) {
            try {
                if (member.isOpen()) {
                    member.session().close(CloseStatus.GOING_AWAY);
                }
            } catch (IOException e) {
                logger.warn("关闭会话 '{}' 失败: {}", member.id(), e.getMessage());
            }
        }
    }

    private List<Member> snapshot(Room room) {
        var result = new ArrayList<Member>(room.size());
        for (var id : room.memberIds()) {
            var member = members.get(id);
            if (member != null) {
                result.add(member);
            }
        }
        return result;
    }
}
