/**
 * 此文件是基于Spring `StandardWebSocketClient` 的信令通道实现。
 *
 * 主要职责:
 * - 建立到 `/ws?room=...` 的WebSocket连接，并用`ConcurrentWebSocketSessionDecorator`串行化发送。
 * - 用`SignalingCodec`编解码消息；格式错误的入站消息被记录并丢弃，不影响连接。
 * - 连接关闭 (任何原因) 时通知关闭监听器一次。
 *
 * 关联:
 * - `MeetingSession`: 通过`SignalingTransport`接口使用此类。
 * - `RoomWebSocketHandler`: 服务器端的对应处理器。
 */
package club.ppmc.meet.client.transport;

import club.ppmc.meet.codec.MalformedMessageException;
import club.ppmc.meet.codec.SignalingCodec;
import club.ppmc.meet.dto.SignalingMessage;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

public class WebSocketSignalingTransport implements SignalingTransport {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketSignalingTransport.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketClient client;
    private final SignalingCodec codec;
    private final List<Consumer<SignalingMessage>> messageListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closeNotified = new AtomicBoolean();

    private volatile WebSocketSession session;

    public WebSocketSignalingTransport(SignalingCodec codec) {
        this(new StandardWebSocketClient(), codec);
    }

    public WebSocketSignalingTransport(WebSocketClient client, SignalingCodec codec) {
        this.client = client;
        this.codec = codec;
    }

    @Override
    public CompletableFuture<Void> connect(URI uri) {
        logger.info("正在连接信令服务器: {}", uri);
        return client.execute(new TransportHandler(), new WebSocketHttpHeaders(), uri)
                .thenAccept(established -> logger.info("信令连接已建立 | 会话ID {}", established.getId()));
    }

    @Override
    public void send(SignalingMessage message) {
        var current = session;
        if (current == null || !current.isOpen()) {
            logger.warn("信令连接未打开，丢弃出站消息: {}", message.type());
            return;
        }
        try {
            current.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException e) {
            logger.warn("发送信令消息失败 ({}): {}", message.type(), e.getMessage());
        }
    }

    @Override
    public void onMessage(Consumer<SignalingMessage> listener) {
        messageListeners.add(listener);
    }

    @Override
    public void onClose(Runnable listener) {
        closeListeners.add(listener);
    }

    @Override
    public boolean isOpen() {
        var current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void close() {
        var current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.warn("关闭信令连接失败: {}", e.getMessage());
            }
        }
        notifyClosed();
    }

    private void notifyClosed() {
        if (closeNotified.compareAndSet(false, true)) {
            closeListeners.forEach(Runnable::run);
        }
    }

    private final class TransportHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession established) {
            session = new ConcurrentWebSocketSessionDecorator(established, SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT);
        }

        @Override
        protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
            SignalingMessage decoded;
            try {
                decoded = codec.decode(message.getPayload());
            } catch (MalformedMessageException e) {
                logger.warn("丢弃服务器发来的无效消息: {}", e.getMessage());
                return;
            }
            messageListeners.forEach(listener -> listener.accept(decoded));
        }

        @Override
        public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
            logger.warn("信令连接传输错误: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
            logger.info("信令连接已关闭 | 状态: {}", status);
            notifyClosed();
        }
    }
}
