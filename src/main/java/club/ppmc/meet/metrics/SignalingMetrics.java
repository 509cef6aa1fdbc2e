/**
 * 此文件定义了信令服务的内存计数器。
 *
 * 主要职责:
 * - 统计连接建立/关闭次数、各类型入站消息数、被丢弃的消息数 (结构错误与良性丢弃分开计数)。
 * - 提供不可变快照，供定时任务输出摘要日志。
 *
 * 关联:
 * - `SignalingGateway`: 在连接与消息处理路径上更新计数。
 * - `RoomMaintenanceTask`: 定期读取快照并记录日志。
 */
package club.ppmc.meet.metrics;

import club.ppmc.meet.dto.MessageType;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.stereotype.Component;

@Component
public class SignalingMetrics {

    private final LongAdder connectionsOpened = new LongAdder();
    private final LongAdder connectionsClosed = new LongAdder();
    private final LongAdder malformedMessages = new LongAdder();
    private final LongAdder droppedMessages = new LongAdder();
    private final Map<MessageType, LongAdder> inboundByType = new ConcurrentHashMap<>();

    public record Snapshot(
            long connectionsOpened,
            long connectionsClosed,
            long malformedMessages,
            long droppedMessages,
            Map<MessageType, Long> inboundByType) {

        public long activeConnections() {
            return connectionsOpened - connectionsClosed;
        }
    }

    public void connectionOpened() {
        connectionsOpened.increment();
    }

    public void connectionClosed() {
        connectionsClosed.increment();
    }

    public void messageReceived(MessageType type) {
        inboundByType.computeIfAbsent(type, key -> new LongAdder()).increment();
    }

    public void messageMalformed() {
        malformedMessages.increment();
    }

    public void messageDropped() {
        droppedMessages.increment();
    }

    public Snapshot snapshot() {
        var byType = new EnumMap<MessageType, Long>(MessageType.class);
        inboundByType.forEach((type, count) -> byType.put(type, count.sum()));
        return new Snapshot(
                connectionsOpened.sum(),
                connectionsClosed.sum(),
                malformedMessages.sum(),
                droppedMessages.sum(),
                Map.copyOf(byType));
    }
}
