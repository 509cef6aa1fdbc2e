package club.ppmc.meet.client.collab;

import java.util.Arrays;
import java.util.Optional;

public enum DrawingTool {
    PEN("pen"),
    ERASER("eraser"),
    LINE("line"),
    ARROW("arrow"),
    RECTANGLE("rectangle"),
    CIRCLE("circle");

    private final String wireName;

    DrawingTool(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<DrawingTool> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(tool -> tool.wireName.equals(wireName)).findFirst();
    }
}
