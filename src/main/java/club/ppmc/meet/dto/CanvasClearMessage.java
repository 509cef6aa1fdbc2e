package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanvasClearMessage(
        MessageType type,
        String userId,
        Long timestamp) implements BroadcastMessage {

    public static CanvasClearMessage now() {
        return new CanvasClearMessage(MessageType.CANVAS_CLEAR, null, System.currentTimeMillis());
    }

    @Override
    public CanvasClearMessage withUserId(String userId) {
        return new CanvasClearMessage(type, userId, timestamp);
    }
}
