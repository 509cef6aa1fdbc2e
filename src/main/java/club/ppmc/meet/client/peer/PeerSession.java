package club.ppmc.meet.client.peer;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import club.ppmc.meet.client.rtc.IceCandidate;
import club.ppmc.meet.client.rtc.RtcPeerConnection;
import club.ppmc.meet.client.rtc.RtcSender;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 与一个远端参与者之间的会话。
 *
 * 会话在整个参与期间保持不变，其中的原生连接可能因失败重试而被替换。每次替换都会递增
 * `generation`，旧连接的回调与未完成的异步步骤据此被识别并丢弃。
 * 非线程安全，只在`PeerConnectionManager`的锁内访问。
 */
public class PeerSession {

    private final String remoteId;
    private final boolean initiator;
    private final Map<TrackKind, RtcSender> senders = new EnumMap<>(TrackKind.class);
    private final List<IceCandidate> pendingCandidates = new ArrayList<>();
    private final List<MediaTrack> remoteTracks = new ArrayList<>();

    private RtcPeerConnection connection;
    private long generation;
    private PeerState state = PeerState.NEW;
    private boolean remoteDescriptionSet;
    private boolean retryUsed;
    private boolean unreachable;

    PeerSession(String remoteId, boolean initiator) {
        this.remoteId = remoteId;
        this.initiator = initiator;
    }

    public String remoteId() {
        return remoteId;
    }

    /**
     * @return 是否由本端发送offer。
     */
    public boolean isInitiator() {
        return initiator;
    }

    public PeerState state() {
        return state;
    }

    public boolean isUnreachable() {
        return unreachable;
    }

    public List<MediaTrack> remoteTracks() {
        return List.copyOf(remoteTracks);
    }

    long generation() {
        return generation;
    }

    RtcPeerConnection connection() {
        return connection;
    }

    RtcSender sender(TrackKind kind) {
        return senders.get(kind);
    }

    /**
     * 执行一次状态转换。
     *
     * @return 状态是否发生了变化；目标状态与当前状态相同时返回false。
     * @throws IllegalPeerTransitionException 状态机不允许该转换。
     */
    boolean transitionTo(PeerState next) {
        if (state == next) {
            return false;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalPeerTransitionException(remoteId, state, next);
        }
        state = next;
        return true;
    }

    /**
     * 使当前原生连接失效并关闭它。此后旧连接的所有回调都会被忽略。
     *
     * @return 新的代数，供下一个原生连接的回调使用。
     */
    long invalidate() {
        generation++;
        if (connection != null) {
            connection.close();
            connection = null;
        }
        senders.clear();
        pendingCandidates.clear();
        remoteDescriptionSet = false;
        return generation;
    }

    void attach(RtcPeerConnection connection, Map<TrackKind, RtcSender> senders) {
        this.connection = connection;
        this.senders.putAll(senders);
    }

    boolean isRemoteDescriptionSet() {
        return remoteDescriptionSet;
    }

    /**
     * 标记远端描述已设置，并取出此前缓冲的候选 (按到达顺序)。
     */
    List<IceCandidate> markRemoteDescriptionSet() {
        remoteDescriptionSet = true;
        var flushed = List.copyOf(pendingCandidates);
        pendingCandidates.clear();
        return flushed;
    }

    void bufferCandidate(IceCandidate candidate) {
        pendingCandidates.add(candidate);
    }

    int pendingCandidateCount() {
        return pendingCandidates.size();
    }

    boolean isRetryUsed() {
        return retryUsed;
    }

    void markRetryUsed() {
        retryUsed = true;
    }

    void markConnected() {
        retryUsed = false;
        unreachable = false;
    }

    void markUnreachable() {
        unreachable = true;
    }

    void addRemoteTrack(MediaTrack track) {
        remoteTracks.add(track);
    }

    /**
     * 停止并清空远端轨道。
     */
    void stopRemoteTracks() {
        remoteTracks.forEach(MediaTrack::stop);
        remoteTracks.clear();
    }
}
