/**
 * 此文件定义了画布绘制广播消息。
 *
 * 每条消息都是一个自描述的线段操作 (工具、颜色、线宽、起止点)，相互独立、可交换顺序。
 * 接收方按到达顺序追加并渲染，不做去重。
 */
package club.ppmc.meet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanvasDrawMessage(
        MessageType type,
        String userId,
        String tool,
        String color,
        Double width,
        Point from,
        Point to,
        Long timestamp) implements BroadcastMessage {

    public static CanvasDrawMessage of(String tool, String color, double width, Point from, Point to) {
        return new CanvasDrawMessage(
                MessageType.CANVAS_DRAW, null, tool, color, width, from, to, System.currentTimeMillis());
    }

    @Override
    public CanvasDrawMessage withUserId(String userId) {
        return new CanvasDrawMessage(type, userId, tool, color, width, from, to, timestamp);
    }
}
