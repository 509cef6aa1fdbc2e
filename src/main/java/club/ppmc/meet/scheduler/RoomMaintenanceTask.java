/**
 * 此文件定义了信令服务的定时维护任务。
 *
 * 主要职责:
 * - 定期清理已关闭但未触发关闭回调的陈旧连接，保证房间成员中不含已关闭的连接。
 * - 定期输出信令统计摘要 (连接数、房间数、各类型消息数、丢弃数)。
 *
 * 关联:
 * - `SignalingGateway`: 调用其`sweepClosedConnections`方法，并由其补发离开通知。
 * - `SignalingMetrics`, `RoomRegistry`: 读取统计数据。
 * - `BootApplication`: 需要有`@EnableScheduling`注解来启用此定时任务。
 */
package club.ppmc.meet.scheduler;

import club.ppmc.meet.metrics.SignalingMetrics;
import club.ppmc.meet.registry.RoomRegistry;
import club.ppmc.meet.service.SignalingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RoomMaintenanceTask {

    private static final Logger logger = LoggerFactory.getLogger(RoomMaintenanceTask.class);

    private final SignalingGateway signalingGateway;
    private final RoomRegistry roomRegistry;
    private final SignalingMetrics metrics;

    public RoomMaintenanceTask(SignalingGateway signalingGateway, RoomRegistry roomRegistry, SignalingMetrics metrics) {
        this.signalingGateway = signalingGateway;
        this.roomRegistry = roomRegistry;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${signaling.sweep-interval-ms:30000}")
    public void sweepClosedConnections() {
        try {
            var purged = signalingGateway.sweepClosedConnections();
            if (purged > 0) {
                logger.info("定时清理任务完成：移除了 {} 个陈旧连接。", purged);
            }
        } catch (Exception e) {
            logger.error("执行陈旧连接清理任务时发生错误。", e);
        }
    }

    @Scheduled(
            initialDelayString = "${signaling.metrics-log-interval-ms:300000}",
            fixedRateString = "${signaling.metrics-log-interval-ms:300000}")
    public void logSignalingSummary() {
        var snapshot = metrics.snapshot();
        logger.info("信令统计: 房间[{}] 连接[{}] 累计建立[{}] 累计关闭[{}] 格式错误[{}] 丢弃[{}] 消息分布{}",
                roomRegistry.getRoomCount(),
                roomRegistry.getConnectionCount(),
                snapshot.connectionsOpened(),
                snapshot.connectionsClosed(),
                snapshot.malformedMessages(),
                snapshot.droppedMessages(),
                snapshot.inboundByType());
    }
}
