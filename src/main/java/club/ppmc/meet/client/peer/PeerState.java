package club.ppmc.meet.client.peer;

import java.util.EnumSet;
import java.util.Set;

/**
 * 一个对等会话的生命周期状态。
 *
 * <pre>
 * NEW -> NEGOTIATING -> CONNECTED -> (DISCONNECTED <-> RECONNECTING) -> CLOSED
 * </pre>
 * 任何状态都可以进入终态 CLOSED；CLOSED 之后不再有任何转换。
 */
public enum PeerState {
    NEW,
    NEGOTIATING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    CLOSED;

    private Set<PeerState> successors;

    static {
        NEW.successors = EnumSet.of(NEGOTIATING, CLOSED);
        NEGOTIATING.successors = EnumSet.of(CONNECTED, DISCONNECTED, RECONNECTING, CLOSED);
        CONNECTED.successors = EnumSet.of(DISCONNECTED, RECONNECTING, CLOSED);
        DISCONNECTED.successors = EnumSet.of(CONNECTED, RECONNECTING, CLOSED);
        RECONNECTING.successors = EnumSet.of(CONNECTED, DISCONNECTED, CLOSED);
        CLOSED.successors = EnumSet.noneOf(PeerState.class);
    }

    public boolean canTransitionTo(PeerState next) {
        return successors.contains(next);
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
