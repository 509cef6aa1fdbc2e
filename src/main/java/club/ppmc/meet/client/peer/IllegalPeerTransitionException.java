package club.ppmc.meet.client.peer;

/**
 * 试图执行状态机不允许的转换。
 */
public class IllegalPeerTransitionException extends IllegalStateException {

    private final PeerState from;
    private final PeerState to;

    public IllegalPeerTransitionException(String peerId, PeerState from, PeerState to) {
        super("对等会话 '" + peerId + "' 不能从 " + from + " 转换到 " + to);
        this.from = from;
        this.to = to;
    }

    public PeerState getFrom() {
        return from;
    }

    public PeerState getTo() {
        return to;
    }
}
