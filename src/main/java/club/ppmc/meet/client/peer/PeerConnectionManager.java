/**
 * 此文件定义了客户端的对等连接管理器，为房间中每个远端参与者维护一个`PeerSession`。
 *
 * 主要职责:
 * - 根据成员事件 (room-members / user-joined / user-left) 创建和销毁会话。
 * - 决定由哪一方发起协商: 连接ID按字典序较小的一方发送offer，另一方等待并应答。
 *   服务器未下发本端连接ID时退化为"新加入者向已有成员发起"。
 * - 驱动offer/answer交换与Trickle ICE；远端描述设置之前到达的候选按到达顺序缓冲。
 * - room-members到达之前收到的成员与中继消息先暂存，待本端连接ID确定后按原顺序处理，
 *   保证双方使用同一个连接ID比较结果决定发起方。
 * - 原生连接失败时重试一次: 先关闭旧连接，再创建新连接并由发起方重新发送offer。
 *   再次失败则该参与者持续处于断开状态，并通知视图。重连成功后重新获得一次重试机会。
 * - 实现`OutgoingTrackSink`，在所有会话上替换出站轨道。
 *
 * 线程模型: 公开方法与内部状态由 this 的监视器锁保护；原生回调与异步步骤的后续处理
 * 统一提交到构造时传入的`Executor`上执行。
 *
 * 关联:
 * - `MeetingSession`: 分发信令消息，并在离开时调用`closeAll`。
 * - `RtcPeerConnectionFactory`: 创建原生连接。
 * - `OutgoingTrackSource` (即`MediaController`): 新会话的初始出站轨道。
 */
package club.ppmc.meet.client.peer;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.OutgoingTrackSink;
import club.ppmc.meet.client.media.OutgoingTrackSource;
import club.ppmc.meet.client.media.TrackKind;
import club.ppmc.meet.client.rtc.IceCandidate;
import club.ppmc.meet.client.rtc.NativeConnectionState;
import club.ppmc.meet.client.rtc.RtcConfiguration;
import club.ppmc.meet.client.rtc.RtcPeerConnectionFactory;
import club.ppmc.meet.client.rtc.RtcPeerConnectionObserver;
import club.ppmc.meet.client.rtc.RtcSender;
import club.ppmc.meet.client.rtc.SessionDescription;
import club.ppmc.meet.codec.MalformedMessageException;
import club.ppmc.meet.codec.SignalingCodec;
import club.ppmc.meet.dto.PresenceMessage;
import club.ppmc.meet.dto.RelayMessage;
import club.ppmc.meet.dto.RoomMembersMessage;
import club.ppmc.meet.dto.SignalingMessage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PeerConnectionManager implements OutgoingTrackSink {
    private static final Logger logger = LoggerFactory.getLogger(PeerConnectionManager.class);

    private final RtcPeerConnectionFactory factory;
    private final RtcConfiguration configuration;
    private final SignalingCodec codec;
    private final Consumer<SignalingMessage> signalSender;
    private final OutgoingTrackSource trackSource;
    private final PeerView view;
    private final Executor executor;

    // 按会话创建顺序排列
    private final Map<String, PeerSession> sessions = new LinkedHashMap<>();
    private String localConnectionId;
    private boolean joined;
    // room-members之前到达的消息，按到达顺序
    private final List<SignalingMessage> deferred = new ArrayList<>();

    public PeerConnectionManager(
            RtcPeerConnectionFactory factory,
            RtcConfiguration configuration,
            SignalingCodec codec,
            Consumer<SignalingMessage> signalSender,
            OutgoingTrackSource trackSource,
            PeerView view,
            Executor executor) {
        this.factory = factory;
        this.configuration = configuration;
        this.codec = codec;
        this.signalSender = signalSender;
        this.trackSource = trackSource;
        this.view = view;
        this.executor = executor;
    }

    /**
     * 处理一条与对等连接相关的信令消息，其他类型被忽略。
     */
    public synchronized void handle(SignalingMessage message) {
        if (!joined && isPeerScoped(message)) {
            deferred.add(message);
            logger.debug("尚未收到room-members，暂存 {} 消息。", message.type());
            return;
        }
        dispatch(message);
    }

    private static boolean isPeerScoped(SignalingMessage message) {
        return switch (message.type()) {
            case USER_JOINED, USER_LEFT, OFFER, ANSWER, ICE_CANDIDATE -> true;
            default -> false;
        };
    }

    private void dispatch(SignalingMessage message) {
        switch (message.type()) {
            case ROOM_MEMBERS -> onRoomMembers((RoomMembersMessage) message);
            case USER_JOINED -> onUserJoined(((PresenceMessage) message).userId());
            case USER_LEFT -> onUserLeft(((PresenceMessage) message).userId());
            case OFFER -> onOffer((RelayMessage) message);
            case ANSWER -> onAnswer((RelayMessage) message);
            case ICE_CANDIDATE -> onRemoteCandidate((RelayMessage) message);
            default -> logger.trace("忽略与对等连接无关的消息: {}", message.type());
        }
    }

    private void onRoomMembers(RoomMembersMessage message) {
        if (message.connectionId() != null) {
            localConnectionId = message.connectionId();
        }
        logger.info("已加入房间，本端连接ID: {}，现有成员: {}", localConnectionId, message.members());

        for (var memberId : message.members()) {
            if (memberId.equals(localConnectionId) || sessions.containsKey(memberId)) {
                continue;
            }
            var session = createSession(memberId, isInitiatorFor(memberId, true));
            if (session.isInitiator()) {
                startNegotiation(session);
            }
        }

        if (!joined) {
            joined = true;
            var held = new ArrayList<>(deferred);
            deferred.clear();
            if (!held.isEmpty()) {
                logger.debug("本端连接ID已确定，处理 {} 条暂存消息。", held.size());
            }
            held.forEach(this::dispatch);
        }
    }

    private void onUserJoined(String peerId) {
        if (peerId == null || peerId.equals(localConnectionId)) {
            return;
        }
        if (sessions.containsKey(peerId)) {
            logger.debug("参与者 '{}' 的会话已存在，忽略重复的加入通知。", peerId);
            return;
        }
        var session = createSession(peerId, isInitiatorFor(peerId, false));
        if (session.isInitiator()) {
            startNegotiation(session);
        }
    }

    private void onUserLeft(String peerId) {
        var session = sessions.remove(peerId);
        if (session == null) {
            return;
        }
        teardown(session);
        logger.info("参与者 '{}' 已离开，会话已关闭。", peerId);
        view.onPeerRemoved(peerId);
    }

    private void onOffer(RelayMessage message) {
        var peerId = message.from();
        if (peerId == null) {
            logger.warn("收到缺少from的offer，已忽略。");
            return;
        }

        SessionDescription offer;
        try {
            offer = codec.fromPayload(message.payload(), SessionDescription.class);
        } catch (MalformedMessageException e) {
            logger.warn("丢弃来自 '{}' 的无效offer: {}", peerId, e.getMessage());
            return;
        }

        var session = sessions.get(peerId);
        if (session == null) {
            session = createSession(peerId, false);
        } else if (session.connection() == null || session.isRemoteDescriptionSet()) {
            // 远端在重连: 丢弃旧连接，用新连接应答
            logger.info("收到来自 '{}' 的重新协商offer，正在重建连接。", peerId);
            attachNewConnection(session);
            transition(session, PeerState.RECONNECTING);
        }

        if (session.state() == PeerState.NEW) {
            transition(session, PeerState.NEGOTIATING);
        }
        answerOffer(session, offer);
    }

    private void onAnswer(RelayMessage message) {
        var session = message.from() == null ? null : sessions.get(message.from());
        if (session == null || session.connection() == null) {
            logger.debug("收到未知会话 '{}' 的answer，已忽略。", message.from());
            return;
        }

        SessionDescription answer;
        try {
            answer = codec.fromPayload(message.payload(), SessionDescription.class);
        } catch (MalformedMessageException e) {
            logger.warn("丢弃来自 '{}' 的无效answer: {}", message.from(), e.getMessage());
            return;
        }

        var generation = session.generation();
        session.connection().setRemoteDescription(answer)
                .thenRunAsync(() -> remoteDescriptionApplied(session, generation), executor)
                .whenCompleteAsync((ignored, error) -> onStepCompleted(session, generation, error), executor);
    }

    private void onRemoteCandidate(RelayMessage message) {
        var session = message.from() == null ? null : sessions.get(message.from());
        if (session == null || session.connection() == null) {
            logger.debug("收到未知会话 '{}' 的ICE候选，已忽略。", message.from());
            return;
        }

        IceCandidate candidate;
        try {
            candidate = codec.fromPayload(message.payload(), IceCandidate.class);
        } catch (MalformedMessageException e) {
            logger.warn("丢弃来自 '{}' 的无效ICE候选: {}", message.from(), e.getMessage());
            return;
        }

        if (session.isRemoteDescriptionSet()) {
            applyCandidate(session, candidate);
        } else {
            session.bufferCandidate(candidate);
            logger.trace("远端描述尚未设置，缓冲来自 '{}' 的ICE候选。", session.remoteId());
        }
    }

    @Override
    public synchronized CompletableFuture<Void> replaceOutgoingTrack(TrackKind kind, MediaTrack track) {
        var replacements = new ArrayList<CompletableFuture<Void>>();
        for (var session : sessions.values()) {
            RtcSender sender = session.sender(kind);
            if (sender != null) {
                replacements.add(sender.replaceTrack(track));
            }
        }
        return CompletableFuture.allOf(replacements.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * 同步关闭所有会话。用于离开会议。
     */
    public synchronized void closeAll() {
        var closing = new ArrayList<>(sessions.values());
        sessions.clear();
        for (var session : closing) {
            teardown(session);
            view.onPeerRemoved(session.remoteId());
        }
        if (!closing.isEmpty()) {
            logger.info("已关闭 {} 个对等会话。", closing.size());
        }
        localConnectionId = null;
        joined = false;
        deferred.clear();
    }

    public synchronized int peerCount() {
        return sessions.size();
    }

    public synchronized List<String> peerIds() {
        return List.copyOf(sessions.keySet());
    }

    public synchronized Optional<PeerState> peerState(String peerId) {
        return Optional.ofNullable(sessions.get(peerId)).map(PeerSession::state);
    }

    public synchronized Optional<PeerSession> session(String peerId) {
        return Optional.ofNullable(sessions.get(peerId));
    }

    public synchronized String localConnectionId() {
        return localConnectionId;
    }

    private boolean isInitiatorFor(String peerId, boolean discoveredViaMembers) {
        if (localConnectionId != null) {
            return localConnectionId.compareTo(peerId) < 0;
        }
        return discoveredViaMembers;
    }

    private PeerSession createSession(String peerId, boolean initiator) {
        var session = new PeerSession(peerId, initiator);
        sessions.put(peerId, session);
        attachNewConnection(session);
        logger.info("为参与者 '{}' 创建会话 | 本端发起: {}", peerId, initiator);
        view.onPeerAdded(peerId);
        return session;
    }

    /**
     * 关闭会话当前的原生连接 (如有)，再创建新的连接并建立音频与视频发送端。
     */
    private void attachNewConnection(PeerSession session) {
        var generation = session.invalidate();
        session.stopRemoteTracks();

        var connection = factory.create(configuration, new SessionObserver(session, generation));
        var senders = new EnumMap<TrackKind, RtcSender>(TrackKind.class);
        for (var kind : TrackKind.values()) {
            senders.put(kind, connection.addTransceiver(kind, trackSource.outgoingTrack(kind)));
        }
        session.attach(connection, senders);
    }

    private void startNegotiation(PeerSession session) {
        if (session.state() == PeerState.NEW) {
            transition(session, PeerState.NEGOTIATING);
        }
        var generation = session.generation();
        var connection = session.connection();
        connection.createOffer(false)
                .thenCompose(offer -> connection.setLocalDescription(offer).thenApply(ignored -> offer))
                .thenAcceptAsync(offer -> sendDescription(session, generation, offer), executor)
                .whenCompleteAsync((ignored, error) -> onStepCompleted(session, generation, error), executor);
    }

    private void answerOffer(PeerSession session, SessionDescription offer) {
        var generation = session.generation();
        var connection = session.connection();
        connection.setRemoteDescription(offer)
                .thenRunAsync(() -> remoteDescriptionApplied(session, generation), executor)
                .thenCompose(ignored -> connection.createAnswer())
                .thenCompose(answer -> connection.setLocalDescription(answer).thenApply(ignored -> answer))
                .thenAcceptAsync(answer -> sendDescription(session, generation, answer), executor)
                .whenCompleteAsync((ignored, error) -> onStepCompleted(session, generation, error), executor);
    }

    private synchronized void remoteDescriptionApplied(PeerSession session, long generation) {
        ensureCurrent(session, generation);
        var flushed = session.markRemoteDescriptionSet();
        if (!flushed.isEmpty()) {
            logger.debug("远端描述已设置，应用 {} 个缓冲的ICE候选 | 参与者 '{}'", flushed.size(), session.remoteId());
        }
        flushed.forEach(candidate -> applyCandidate(session, candidate));
    }

    private void applyCandidate(PeerSession session, IceCandidate candidate) {
        session.connection().addIceCandidate(candidate).whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("添加ICE候选失败 | 参与者 '{}': {}", session.remoteId(), error.getMessage());
            }
        });
    }

    private synchronized void sendDescription(PeerSession session, long generation, SessionDescription description) {
        ensureCurrent(session, generation);
        var payload = codec.toPayload(description);
        var message = SessionDescription.OFFER.equals(description.type())
                ? RelayMessage.offer(session.remoteId(), payload)
                : RelayMessage.answer(session.remoteId(), payload);
        logger.debug("发送 {} 给 '{}'", description.type(), session.remoteId());
        signalSender.accept(message);
    }

    private synchronized void onStepCompleted(PeerSession session, long generation, Throwable error) {
        if (error == null) {
            return;
        }
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof StaleSessionException || !isCurrent(session, generation)) {
            logger.debug("会话 '{}' 已被替换或关闭，放弃未完成的协商步骤。", session.remoteId());
            return;
        }
        logger.warn("与 '{}' 的协商失败: {}", session.remoteId(), cause.getMessage());
        connectionFailed(session);
    }

    private synchronized void onNativeStateChange(PeerSession session, long generation, NativeConnectionState state) {
        if (!isCurrent(session, generation)) {
            return;
        }
        logger.debug("参与者 '{}' 的原生连接状态: {}", session.remoteId(), state);
        switch (state) {
            case CONNECTED -> {
                session.markConnected();
                transition(session, PeerState.CONNECTED);
            }
            case DISCONNECTED -> {
                if (session.state().canTransitionTo(PeerState.DISCONNECTED)) {
                    transition(session, PeerState.DISCONNECTED);
                }
            }
            case FAILED -> connectionFailed(session);
            default -> {
                // NEW / CONNECTING / CLOSED 不改变会话状态
            }
        }
    }

    private void connectionFailed(PeerSession session) {
        if (session.state() == PeerState.NEW) {
            logger.debug("会话 '{}' 尚未开始协商，忽略失败事件。", session.remoteId());
            return;
        }
        if (!session.isRetryUsed()) {
            session.markRetryUsed();
            logger.warn("与 '{}' 的连接失败，正在重试一次。", session.remoteId());
            attachNewConnection(session);
            transition(session, PeerState.RECONNECTING);
            if (session.isInitiator()) {
                startNegotiation(session);
            }
            return;
        }

        logger.warn("与 '{}' 的连接在重试后仍然失败，标记为不可达。", session.remoteId());
        session.invalidate();
        session.stopRemoteTracks();
        session.markUnreachable();
        if (session.state() != PeerState.DISCONNECTED) {
            transition(session, PeerState.DISCONNECTED);
        }
        view.onPeerUnreachable(session.remoteId());
    }

    private synchronized void onLocalCandidate(PeerSession session, long generation, IceCandidate candidate) {
        if (!isCurrent(session, generation)) {
            return;
        }
        signalSender.accept(RelayMessage.iceCandidate(session.remoteId(), codec.toPayload(candidate)));
    }

    private synchronized void onRemoteTrack(PeerSession session, long generation, MediaTrack track) {
        if (!isCurrent(session, generation)) {
            return;
        }
        session.addRemoteTrack(track);
        logger.debug("收到参与者 '{}' 的远端{}轨道。", session.remoteId(), track.kind());
        view.onRemoteTrack(session.remoteId(), track);
    }

    private void teardown(PeerSession session) {
        session.invalidate();
        session.stopRemoteTracks();
        transition(session, PeerState.CLOSED);
    }

    private void transition(PeerSession session, PeerState next) {
        if (session.transitionTo(next)) {
            view.onPeerStateChanged(session.remoteId(), next);
        }
    }

    private boolean isCurrent(PeerSession session, long generation) {
        return sessions.get(session.remoteId()) == session
                && session.generation() == generation
                && !session.state().isTerminal();
    }

    private void ensureCurrent(PeerSession session, long generation) {
        if (!isCurrent(session, generation)) {
            throw new StaleSessionException();
        }
    }

    /**
     * 原生连接回调，绑定到创建时的会话代数。
     */
    private final class SessionObserver implements RtcPeerConnectionObserver {
        private final PeerSession session;
        private final long generation;

        private SessionObserver(PeerSession session, long generation) {
            this.session = session;
            this.generation = generation;
        }

        @Override
        public void onIceCandidate(IceCandidate candidate) {
            executor.execute(() -> onLocalCandidate(session, generation, candidate));
        }

        @Override
        public void onRemoteTrack(MediaTrack track) {
            executor.execute(() -> PeerConnectionManager.this.onRemoteTrack(session, generation, track));
        }

        @Override
        public void onConnectionStateChange(NativeConnectionState state) {
            executor.execute(() -> onNativeStateChange(session, generation, state));
        }
    }

    /**
     * 异步步骤完成时会话已被替换或关闭。
     */
    private static final class StaleSessionException extends RuntimeException {
        private StaleSessionException() {
            super(null, null, false, false);
        }
    }
}
