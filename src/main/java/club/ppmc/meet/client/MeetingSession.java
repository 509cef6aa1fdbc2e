/**
 * 此文件定义了客户端会议会话，把信令通道、对等连接、本地媒体与协作看板组装在一起。
 *
 * 主要职责:
 * - `initialize(roomId)`: 连接信令服务器并加入房间，之后定期发送心跳。
 * - 把每条入站消息切换到事件线程上，再分发给`PeerConnectionManager`、`AvatarBoard`、`CanvasBoard`。
 * - 对外提供会议操作: 本地媒体、屏幕共享、头像、画布、主讲人。
 * - `leave()`: 幂等；由显式离开、信令连接关闭或JVM关闭钩子触发。同步地停止本地媒体、
 *   关闭所有对等会话、清空看板，最后关闭信令连接。
 *
 * 关联:
 * - `SignalingTransport`: 信令通道。
 * - `MeetingViews`: UI层回调。
 */
package club.ppmc.meet.client;

import club.ppmc.meet.client.collab.AvatarBoard;
import club.ppmc.meet.client.collab.AvatarState;
import club.ppmc.meet.client.collab.CanvasBoard;
import club.ppmc.meet.client.collab.CanvasStroke;
import club.ppmc.meet.client.collab.DrawingTool;
import club.ppmc.meet.client.media.LocalMediaState;
import club.ppmc.meet.client.media.MediaController;
import club.ppmc.meet.client.media.MediaDevices;
import club.ppmc.meet.client.peer.PeerConnectionManager;
import club.ppmc.meet.client.peer.PeerState;
import club.ppmc.meet.client.peer.PeerView;
import club.ppmc.meet.client.rtc.RtcPeerConnectionFactory;
import club.ppmc.meet.client.transport.SignalingTransport;
import club.ppmc.meet.client.transport.WebSocketSignalingTransport;
import club.ppmc.meet.codec.SignalingCodec;
import club.ppmc.meet.dto.AvatarPositionMessage;
import club.ppmc.meet.dto.CanvasClearMessage;
import club.ppmc.meet.dto.CanvasDrawMessage;
import club.ppmc.meet.dto.HeartbeatMessage;
import club.ppmc.meet.dto.Point;
import club.ppmc.meet.dto.PresenceMessage;
import club.ppmc.meet.dto.PresenterMessage;
import club.ppmc.meet.dto.RoomMembersMessage;
import club.ppmc.meet.dto.SignalingMessage;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MeetingSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MeetingSession.class);

    private final MeetingClientConfig config;
    private final SignalingTransport transport;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final PeerView peerView;
    private final MediaController media;
    private final PeerConnectionManager peers;
    private final AvatarBoard avatars;
    private final CanvasBoard canvas;
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean left = new AtomicBoolean();

    private volatile String roomId;
    private volatile String presenterId;
    private volatile ScheduledFuture<?> heartbeat;
    private List<ExecutorService> ownedExecutors = List.of();
    private Thread shutdownHook;

    /**
     * @param executor  事件线程: 所有入站消息与原生回调都在其上处理。
     * @param scheduler 定时任务 (头像节流的尾部刷新、心跳)。
     */
    public MeetingSession(
            MeetingClientConfig config,
            SignalingTransport transport,
            RtcPeerConnectionFactory rtcFactory,
            MediaDevices mediaDevices,
            MeetingViews views,
            Executor executor,
            ScheduledExecutorService scheduler) {
        this.config = config;
        this.transport = transport;
        this.executor = executor;
        this.scheduler = scheduler;
        this.peerView = views.peers();

        var codec = new SignalingCodec();
        this.media = new MediaController(mediaDevices, config.mediaConstraints(), views.media());
        this.peers = new PeerConnectionManager(
                rtcFactory, config.rtc(), codec, transport::send, media, views.peers(), executor);
        this.media.bindOutgoingSink(peers);
        this.avatars = new AvatarBoard(
                views.avatars(), transport::send, config.avatarThrottle(), scheduler, System::currentTimeMillis);
        this.canvas = new CanvasBoard(views.canvas(), transport::send);
    }

    /**
     * 使用WebSocket信令通道和独立的事件线程创建会话。离开会议时这些线程随之关闭。
     */
    public static MeetingSession create(
            MeetingClientConfig config,
            RtcPeerConnectionFactory rtcFactory,
            MediaDevices mediaDevices,
            MeetingViews views) {
        var executor = Executors.newSingleThreadExecutor(daemonThreads("meeting-events"));
        var scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("meeting-timers"));
        var transport = new WebSocketSignalingTransport(new SignalingCodec());
        var session = new MeetingSession(config, transport, rtcFactory, mediaDevices, views, executor, scheduler);
        session.ownedExecutors = List.of(executor, scheduler);
        return session;
    }

    /**
     * 连接信令服务器并加入房间。每个会话只能初始化一次。
     *
     * @return 信令连接建立后完成。
     */
    public CompletableFuture<Void> initialize(String roomId) {
        if (!initialized.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException("会话已经初始化"));
        }
        this.roomId = roomId;
        transport.onMessage(message -> executor.execute(() -> dispatch(message)));
        transport.onClose(this::leave);

        return transport.connect(config.roomUri(roomId))
                .thenRun(this::startHeartbeat)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.error("加入房间 '{}' 失败: {}", roomId, error.getMessage());
                        leave();
                    } else {
                        logger.info("已连接到房间 '{}'", roomId);
                    }
                });
    }

    private void dispatch(SignalingMessage message) {
        if (left.get()) {
            return;
        }
        try {
            switch (message.type()) {
                case ROOM_MEMBERS -> {
                    var connectionId = ((RoomMembersMessage) message).connectionId();
                    avatars.setLocalConnectionId(connectionId);
                    canvas.setLocalConnectionId(connectionId);
                    peers.handle(message);
                }
                case USER_LEFT -> {
                    var userId = ((PresenceMessage) message).userId();
                    peers.handle(message);
                    avatars.onUserLeft(userId);
                    if (userId != null && userId.equals(presenterId)) {
                        applyPresenter(null);
                    }
                }
                case USER_JOINED, OFFER, ANSWER, ICE_CANDIDATE -> peers.handle(message);
                case AVATAR_POSITION -> avatars.onRemotePosition((AvatarPositionMessage) message);
                case CANVAS_DRAW -> canvas.onRemoteDraw((CanvasDrawMessage) message);
                case CANVAS_CLEAR -> canvas.onRemoteClear((CanvasClearMessage) message);
                case SET_PRESENTER -> applyPresenter(((PresenterMessage) message).presenterId());
                case PING, PONG -> logger.trace("收到心跳: {}", message.type());
            }
        } catch (RuntimeException e) {
            logger.error("处理信令消息 {} 时发生错误", message.type(), e);
        }
    }

    public CompletableFuture<LocalMediaState> startLocalMedia() {
        return media.startLocalMedia();
    }

    public CompletableFuture<Void> stopLocalMedia() {
        return media.stopLocalMedia();
    }

    public CompletableFuture<Void> toggleVideo() {
        return media.toggleVideo();
    }

    public CompletableFuture<Void> toggleAudio() {
        return media.toggleAudio();
    }

    public CompletableFuture<Void> setVideoEnabled(boolean enabled) {
        return media.setVideoEnabled(enabled);
    }

    public CompletableFuture<Void> setAudioEnabled(boolean enabled) {
        return media.setAudioEnabled(enabled);
    }

    public CompletableFuture<Void> startScreenShare() {
        return media.startScreenShare();
    }

    public CompletableFuture<Void> stopScreenShare() {
        return media.stopScreenShare();
    }

    public void addAvatar(String userId, double x, double y, String label, String color) {
        avatars.addAvatar(userId, x, y, label, color);
    }

    public void updateAvatar(String userId, double x, double y) {
        avatars.updateAvatar(userId, x, y);
    }

    public void removeAvatar(String userId) {
        avatars.removeAvatar(userId);
    }

    public void setOwnAvatarAppearance(String label, String color) {
        avatars.setOwnAppearance(label, color);
    }

    public void moveOwnAvatar(double x, double y) {
        avatars.moveOwnAvatar(x, y);
    }

    public void setDrawingTool(DrawingTool tool) {
        canvas.setTool(tool);
    }

    public void setDrawingColor(String color) {
        canvas.setColor(color);
    }

    public void setDrawingWidth(double width) {
        canvas.setWidth(width);
    }

    public CanvasStroke drawSegment(Point from, Point to) {
        return canvas.drawSegment(from, to);
    }

    public void clearCanvas() {
        canvas.clear();
    }

    /**
     * 指定主讲人并通知房间内其他成员。本端立即生效，服务器不会回送。
     *
     * @param presenterId 主讲人的连接ID，`null` 表示取消。
     */
    public void setPresenter(String presenterId) {
        applyPresenter(presenterId);
        transport.send(PresenterMessage.of(presenterId));
    }

    private void applyPresenter(String presenterId) {
        this.presenterId = presenterId;
        logger.info("主讲人已变更为: {}", presenterId);
        peerView.onPresenterChanged(presenterId);
    }

    /**
     * 离开会议并释放所有资源。可以重复调用，只有第一次生效。
     */
    public void leave() {
        if (!left.compareAndSet(false, true)) {
            return;
        }
        logger.info("正在离开房间 '{}'...", roomId);

        var currentHeartbeat = heartbeat;
        if (currentHeartbeat != null) {
            currentHeartbeat.cancel(false);
        }
        media.stopAll();
        peers.closeAll();
        avatars.reset();
        canvas.reset();
        presenterId = null;
        transport.close();

        removeShutdownHook();
        ownedExecutors.forEach(ExecutorService::shutdown);
        logger.info("已离开房间 '{}'。", roomId);
    }

    @Override
    public void close() {
        leave();
    }

    /**
     * 注册JVM关闭钩子，进程退出时自动离开会议。
     */
    public synchronized void registerShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::leave, "meeting-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private synchronized void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            logger.debug("JVM正在关闭，无需移除关闭钩子。");
        }
        shutdownHook = null;
    }

    private void startHeartbeat() {
        var interval = config.heartbeatInterval();
        if (interval.isZero() || interval.isNegative() || left.get()) {
            return;
        }
        heartbeat = scheduler.scheduleAtFixedRate(
                () -> transport.send(HeartbeatMessage.ping()),
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    public boolean isLeft() {
        return left.get();
    }

    public String roomId() {
        return roomId;
    }

    public String localConnectionId() {
        return peers.localConnectionId();
    }

    public String presenterId() {
        return presenterId;
    }

    public int peerCount() {
        return peers.peerCount();
    }

    public Optional<PeerState> peerState(String peerId) {
        return peers.peerState(peerId);
    }

    public LocalMediaState mediaState() {
        return media.state();
    }

    public List<AvatarState> avatars() {
        return avatars.avatars();
    }

    public List<CanvasStroke> strokes() {
        return canvas.strokes();
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            var thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
