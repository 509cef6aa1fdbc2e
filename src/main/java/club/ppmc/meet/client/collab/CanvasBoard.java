/**
 * 此文件定义了共享画布，记录本房间内所有笔迹并广播本端的绘制。
 *
 * 主要职责:
 * - 保存当前工具、颜色与线宽设置。
 * - `drawSegment`: 本地追加笔迹并广播。橡皮擦以白色、双倍线宽绘制。
 * - 远端笔迹按到达顺序追加并渲染，不做去重。
 * - `clear`: 本地清空并广播；收到远端清空时同样清空。
 * - 发送者为本端的消息被忽略 (服务器不会回送，此处只作保护)。
 *
 * 关联:
 * - `MeetingSession`: 分发canvas-draw/canvas-clear消息，并在离开时调用`reset`。
 */
package club.ppmc.meet.client.collab;

import club.ppmc.meet.dto.CanvasClearMessage;
import club.ppmc.meet.dto.CanvasDrawMessage;
import club.ppmc.meet.dto.Point;
import club.ppmc.meet.dto.SignalingMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CanvasBoard {
    private static final Logger logger = LoggerFactory.getLogger(CanvasBoard.class);

    public static final String ERASER_COLOR = "#ffffff";
    public static final String DEFAULT_COLOR = "#000000";
    public static final double DEFAULT_WIDTH = 2.0;

    private final CanvasView view;
    private final Consumer<SignalingMessage> sender;
    private final List<CanvasStroke> strokes = new ArrayList<>();

    private DrawingTool tool = DrawingTool.PEN;
    private String color = DEFAULT_COLOR;
    private double width = DEFAULT_WIDTH;
    private String localId;

    public CanvasBoard(CanvasView view, Consumer<SignalingMessage> sender) {
        this.view = view;
        this.sender = sender;
    }

    public synchronized void setLocalConnectionId(String connectionId) {
        this.localId = connectionId;
    }

    public synchronized void setTool(DrawingTool tool) {
        this.tool = tool;
    }

    public synchronized void setColor(String color) {
        if (color == null || color.isBlank()) {
            throw new IllegalArgumentException("颜色不能为空");
        }
        this.color = color;
    }

    public synchronized void setWidth(double width) {
        if (!Double.isFinite(width) || width <= 0) {
            throw new IllegalArgumentException("线宽必须为正数: " + width);
        }
        this.width = width;
    }

    public synchronized DrawingTool tool() {
        return tool;
    }

    public synchronized String color() {
        return color;
    }

    public synchronized double width() {
        return width;
    }

    /**
     * 用当前设置绘制一段笔迹，本地立即渲染并广播给房间内其他成员。
     */
    public CanvasStroke drawSegment(Point from, Point to) {
        CanvasStroke stroke;
        synchronized (this) {
            var eraser = tool == DrawingTool.ERASER;
            stroke = new CanvasStroke(
                    localId,
                    tool.wireName(),
                    eraser ? ERASER_COLOR : color,
                    eraser ? width * 2 : width,
                    from,
                    to);
            strokes.add(stroke);
        }
        view.onStroke(stroke);
        sender.accept(CanvasDrawMessage.of(stroke.tool(), stroke.color(), stroke.width(), from, to));
        return stroke;
    }

    public void onRemoteDraw(CanvasDrawMessage message) {
        CanvasStroke stroke;
        synchronized (this) {
            if (isOwn(message.userId()) || message.from() == null || message.to() == null) {
                return;
            }
            var strokeWidth = message.width() != null ? message.width() : DEFAULT_WIDTH;
            stroke = new CanvasStroke(
                    message.userId(), message.tool(), message.color(), strokeWidth, message.from(), message.to());
            strokes.add(stroke);
        }
        view.onStroke(stroke);
    }

    /**
     * 清空本地画布并通知房间内其他成员。
     */
    public void clear() {
        String clearedBy;
        synchronized (this) {
            strokes.clear();
            clearedBy = localId;
        }
        view.onCleared(clearedBy);
        sender.accept(CanvasClearMessage.now());
    }

    public void onRemoteClear(CanvasClearMessage message) {
        synchronized (this) {
            if (isOwn(message.userId())) {
                return;
            }
            strokes.clear();
        }
        logger.debug("画布已被 '{}' 清空。", message.userId());
        view.onCleared(message.userId());
    }

    public synchronized List<CanvasStroke> strokes() {
        return List.copyOf(strokes);
    }

    /**
     * 清空笔迹并恢复默认设置，不广播。用于离开会议。
     */
    public synchronized void reset() {
        strokes.clear();
        tool = DrawingTool.PEN;
        color = DEFAULT_COLOR;
        width = DEFAULT_WIDTH;
        localId = null;
    }

    private boolean isOwn(String userId) {
        return userId != null && userId.equals(localId);
    }
}
