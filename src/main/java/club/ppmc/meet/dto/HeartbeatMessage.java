package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HeartbeatMessage(@JsonProperty("type") MessageType type) implements SignalingMessage {

    public static HeartbeatMessage ping() {
        return new HeartbeatMessage(MessageType.PING);
    }

    public static HeartbeatMessage pong() {
        return new HeartbeatMessage(MessageType.PONG);
    }
}
