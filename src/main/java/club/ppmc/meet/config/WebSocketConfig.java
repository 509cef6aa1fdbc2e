/**
 * 此文件定义了信令端点的Spring WebSocket配置。
 *
 * 主要职责:
 * - 启用WebSocket支持 (`@EnableWebSocket`)。
 * - 在 `/ws` 与 `/ws/*` 上注册`RoomWebSocketHandler`，并挂载`RoomHandshakeInterceptor`。
 * - 配置信令容器的帧大小上限、空闲超时与异步发送超时。
 *
 * 关联:
 * - `RoomWebSocketHandler`, `RoomHandshakeInterceptor`: 在此被注册到WebSocket路由。
 * - `AppProperties`: 提供允许的源列表。
 * - `SignalingProperties`: 信令服务自身的配置。
 */
package club.ppmc.meet.config;

import club.ppmc.meet.handler.RoomHandshakeInterceptor;
import club.ppmc.meet.handler.RoomWebSocketHandler;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@EnableConfigurationProperties({AppProperties.class, SignalingProperties.class})
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConfig.class);
    private static final String ROOM_PATH_PATTERN = RoomHandshakeInterceptor.SIGNALING_PATH + "/*";
    private static final int KB_TO_BYTES = 1024;

    private final RoomWebSocketHandler roomWebSocketHandler;
    private final RoomHandshakeInterceptor roomHandshakeInterceptor;
    private final String[] allowedOrigins;
    private final int textFrameLimitKb;
    private final int binaryFrameLimitKb;
    private final Duration idleTimeout;
    private final long asyncSendTimeoutMs;

    public WebSocketConfig(
            RoomWebSocketHandler roomWebSocketHandler,
            RoomHandshakeInterceptor roomHandshakeInterceptor,
            AppProperties appProperties,
            SignalingProperties signalingProperties,
            @Value("${websocket.max.text-buffer-size-kb}") int textFrameLimitKb,
            @Value("${websocket.max.binary-buffer-size-kb}") int binaryFrameLimitKb,
            @Value("${websocket.max.session-timeout-min}") long idleTimeoutMin) {

        this.roomWebSocketHandler = roomWebSocketHandler;
        this.roomHandshakeInterceptor = roomHandshakeInterceptor;
        this.allowedOrigins = appProperties.origins().toArray(new String[0]);
        this.textFrameLimitKb = textFrameLimitKb;
        this.binaryFrameLimitKb = binaryFrameLimitKb;
        this.idleTimeout = Duration.ofMinutes(idleTimeoutMin);
        this.asyncSendTimeoutMs = signalingProperties.sendTimeLimitMs();

        logger.info("WebSocketConfig初始化。信令路径: {}, 允许的源: {}",
                RoomHandshakeInterceptor.SIGNALING_PATH, appProperties.origins());
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(roomWebSocketHandler, RoomHandshakeInterceptor.SIGNALING_PATH, ROOM_PATH_PATTERN)
                .addInterceptors(roomHandshakeInterceptor)
                .setAllowedOrigins(this.allowedOrigins);
        logger.info("已为路径'{}'和'{}'注册RoomWebSocketHandler。",
                RoomHandshakeInterceptor.SIGNALING_PATH, ROOM_PATH_PATTERN);
    }

    /**
     * 空闲超时关闭的连接与正常关闭一样，按参与者离开处理。
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(textFrameLimitKb * KB_TO_BYTES);
        container.setMaxBinaryMessageBufferSize(binaryFrameLimitKb * KB_TO_BYTES);
        container.setMaxSessionIdleTimeout(idleTimeout.toMillis());
        container.setAsyncSendTimeout(asyncSendTimeoutMs);
        logger.info("信令容器限制 | 文本帧 {} KB | 二进制帧 {} KB | 空闲超时 {} | 发送超时 {} ms",
                textFrameLimitKb, binaryFrameLimitKb, idleTimeout, asyncSendTimeoutMs);
        return container;
    }
}
