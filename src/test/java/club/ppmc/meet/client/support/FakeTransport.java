package club.ppmc.meet.client.support;

import club.ppmc.meet.client.transport.SignalingTransport;
import club.ppmc.meet.dto.MessageType;
import club.ppmc.meet.dto.SignalingMessage;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public class FakeTransport implements SignalingTransport {

    public final List<SignalingMessage> sent = new ArrayList<>();
    public URI connectedUri;
    public int closeCalls;

    private final List<Consumer<SignalingMessage>> messageListeners = new ArrayList<>();
    private final List<Runnable> closeListeners = new ArrayList<>();
    private boolean open;
    private boolean closeNotified;

    @Override
    public CompletableFuture<Void> connect(URI uri) {
        connectedUri = uri;
        open = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void send(SignalingMessage message) {
        if (open) {
            sent.add(message);
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
        return open;
    }

    @Override
    public void close() {
        closeCalls++;
        simulateClose();
    }

    public void deliver(SignalingMessage message) {
        List.copyOf(messageListeners).forEach(listener -> listener.accept(message));
    }

    /**
     * 模拟服务器或网络关闭连接。
     */
    public void simulateClose() {
        open = false;
        if (!closeNotified) {
            closeNotified = true;
            List.copyOf(closeListeners).forEach(Runnable::run);
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends SignalingMessage> List<T> sentOfType(MessageType type) {
        return sent.stream().filter(message -> message.type() == type).map(message -> (T) message).toList();
    }
}
