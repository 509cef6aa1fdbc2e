/**
 * 此文件定义了客户端信令通道的抽象。
 *
 * 一个实例对应一次连接: 关闭后不可重新连接。监听器在传输层的线程上被调用，
 * 调用方负责把处理切换到自己的执行线程上。
 *
 * 关联:
 * - `WebSocketSignalingTransport`: 基于Spring WebSocket客户端的实现。
 * - `MeetingSession`: 唯一的使用方。
 */
package club.ppmc.meet.client.transport;

import club.ppmc.meet.dto.SignalingMessage;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface SignalingTransport {

    /**
     * 连接到信令服务器。
     *
     * @return 连接建立后完成；失败时以异常完成。
     */
    CompletableFuture<Void> connect(URI uri);

    /**
     * 发送一条消息。连接未打开时消息被丢弃。
     */
    void send(SignalingMessage message);

    void onMessage(Consumer<SignalingMessage> listener);

    /**
     * 注册连接关闭回调。无论关闭由哪一方发起，回调最多触发一次。
     */
    void onClose(Runnable listener);

    boolean isOpen();

    void close();
}
