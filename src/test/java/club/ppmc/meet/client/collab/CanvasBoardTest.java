package club.ppmc.meet.client.collab;

import club.ppmc.meet.dto.CanvasClearMessage;
import club.ppmc.meet.dto.CanvasDrawMessage;
import club.ppmc.meet.dto.MessageType;
import club.ppmc.meet.dto.Point;
import club.ppmc.meet.dto.SignalingMessage;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanvasBoardTest {

    private final List<SignalingMessage> sent = new ArrayList<>();
    private final List<CanvasStroke> rendered = new ArrayList<>();
    private final List<String> clears = new ArrayList<>();
    private CanvasBoard board;

    @BeforeEach
    void setUp() {
        var view = new CanvasView() {
            @Override
            public void onStroke(CanvasStroke stroke) {
                rendered.add(stroke);
            }

            @Override
            public void onCleared(String clearedBy) {
                clears.add(clearedBy);
            }
        };
        board = new CanvasBoard(view, sent::add);
        board.setLocalConnectionId("me");
    }

    @Test
    void drawSegmentRendersLocallyAndBroadcasts() {
        board.setColor("#00ff00");
        board.setWidth(4);

        board.drawSegment(Point.of(0, 0), Point.of(10, 10));

        assertEquals(1, board.strokes().size());
        assertEquals(1, rendered.size());
        var message = (CanvasDrawMessage) sent.get(0);
        assertEquals("pen", message.tool());
        assertEquals("#00ff00", message.color());
        assertEquals(4.0, message.width());
        assertEquals(Point.of(10, 10), message.to());
    }

    @Test
    void eraserDrawsWhiteAtDoubleWidth() {
        board.setTool(DrawingTool.ERASER);
        board.setColor("#123456");
        board.setWidth(5);

        var stroke = board.drawSegment(Point.of(1, 1), Point.of(2, 2));

        assertEquals(CanvasBoard.ERASER_COLOR, stroke.color());
        assertEquals(10.0, stroke.width());
        var message = (CanvasDrawMessage) sent.get(0);
        assertEquals("eraser", message.tool());
        assertEquals(CanvasBoard.ERASER_COLOR, message.color());
    }

    @Test
    void remoteStrokesAppendInArrivalOrderWithoutDedup() {
        var stroke = remoteDraw("u1", "#000");
        board.onRemoteDraw(stroke);
        board.onRemoteDraw(stroke);
        board.onRemoteDraw(remoteDraw("u2", "#fff"));

        assertEquals(3, board.strokes().size());
        assertEquals(List.of("u1", "u1", "u2"), board.strokes().stream().map(CanvasStroke::userId).toList());
    }

    @Test
    void remoteStrokeWithoutWidthUsesDefault() {
        board.onRemoteDraw(new CanvasDrawMessage(
                MessageType.CANVAS_DRAW, "u1", "pen", "#ff0000", null, Point.of(10, 10), Point.of(50, 50), null));

        assertEquals(CanvasBoard.DEFAULT_WIDTH, rendered.get(0).width());
        assertEquals(Point.of(50, 50), board.strokes().get(0).to());
    }

    @Test
    void ownEchoIsIgnored() {
        board.onRemoteDraw(remoteDraw("me", "#000"));
        board.onRemoteClear(new CanvasClearMessage(MessageType.CANVAS_CLEAR, "me", 1L));

        assertTrue(board.strokes().isEmpty());
        assertTrue(rendered.isEmpty());
        assertTrue(clears.isEmpty());
    }

    @Test
    void clearResetsLocallyAndBroadcasts() {
        board.drawSegment(Point.of(0, 0), Point.of(1, 1));

        board.clear();

        assertTrue(board.strokes().isEmpty());
        assertEquals(MessageType.CANVAS_CLEAR, sent.get(1).type());
        assertEquals(List.of("me"), clears);
    }

    @Test
    void remoteClearResetsSurface() {
        board.onRemoteDraw(remoteDraw("u1", "#000"));

        board.onRemoteClear(new CanvasClearMessage(MessageType.CANVAS_CLEAR, "u1", 1L));

        assertTrue(board.strokes().isEmpty());
        assertEquals(List.of("u1"), clears);
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> board.setWidth(0));
        assertThrows(IllegalArgumentException.class, () -> board.setWidth(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> board.setColor(" "));
    }

    @Test
    void toolsMapToWireNames() {
        assertEquals(DrawingTool.RECTANGLE, DrawingTool.fromWireName("rectangle").orElseThrow());
        assertTrue(DrawingTool.fromWireName("spray").isEmpty());
    }

    private static CanvasDrawMessage remoteDraw(String userId, String color) {
        return new CanvasDrawMessage(
                MessageType.CANVAS_DRAW, userId, "pen", color, 2.0, Point.of(0, 0), Point.of(5, 5), 1L);
    }
}
