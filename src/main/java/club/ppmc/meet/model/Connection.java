/**
 * 此文件定义了服务器端每个WebSocket连接的身份信息。
 *
 * 使用JDK 17的`record`类型，连接身份在创建后不可变。
 * 连接由`SignalingGateway`独占管理，套接字关闭时随之销毁。
 */
package club.ppmc.meet.model;

import java.time.Instant;

/**
 * @param id        网关分配的连接ID。
 * @param roomId    连接所属的房间，一个连接只属于一个房间。
 * @param userId    认证子系统识别出的用户ID，匿名连接为`null`。
 * @param createdAt 连接建立时间。
 */
public record Connection(String id, String roomId, String userId, Instant createdAt) {

    public boolean isAuthenticated() {
        return userId != null;
    }
}
