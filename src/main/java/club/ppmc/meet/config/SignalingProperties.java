/**
 * 此文件定义了信令服务自身的类型安全配置。
 *
 * 主要职责:
 * - 使用 `@ConfigurationProperties` 将 `application.yml` 中以 "signaling" 为前缀的配置项绑定到此记录。
 * - 通过 `@Validated` 在启动时校验取值范围，配置错误时应用直接启动失败。
 *
 * 关联:
 * - `BroadcastValidator`: 使用坐标、线宽与字符串长度上限。
 * - `RoomHandshakeInterceptor`: 使用房间ID长度上限与默认房间ID。
 * - `WebSocketConfig`: 使用每个会话的发送超时与缓冲上限。
 * - `application.yml`: 例如:
 *   ```yaml
 *   signaling:
 *     default-room-id: default
 *     max-room-id-length: 64
 *     max-coordinate: 100000
 *     max-stroke-width: 200
 *     max-string-length: 64
 *     send-time-limit-ms: 5000
 *     send-buffer-size-kb: 512
 *   ```
 */
package club.ppmc.meet.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param defaultRoomId    握手请求未携带房间ID时使用的房间。
 * @param maxRoomIdLength  房间ID的最大长度。
 * @param maxCoordinate    广播消息中坐标绝对值的上限。
 * @param maxStrokeWidth   画笔线宽上限。
 * @param maxStringLength  广播消息中字符串字段 (工具、颜色、标签) 的最大长度。
 * @param sendTimeLimitMs  单个会话发送一条消息的最长耗时。
 * @param sendBufferSizeKb 单个会话待发送缓冲的上限。
 */
@ConfigurationProperties(prefix = "signaling")
@Validated
public record SignalingProperties(
        @NotBlank String defaultRoomId,
        @Positive int maxRoomIdLength,
        @Positive double maxCoordinate,
        @Positive double maxStrokeWidth,
        @Positive int maxStringLength,
        @Positive int sendTimeLimitMs,
        @Positive int sendBufferSizeKb) {

    public static SignalingProperties defaults() {
        return new SignalingProperties("default", 64, 100_000, 200, 64, 5_000, 512);
    }
}
