package club.ppmc.meet.client.collab;

import club.ppmc.meet.dto.Point;

/**
 * 画布上的一段笔迹。`tool` 保留线上的原始取值，未知工具按普通画笔渲染。
 */
public record CanvasStroke(String userId, String tool, String color, double width, Point from, Point to) {}
