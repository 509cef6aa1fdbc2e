package club.ppmc.meet.client.collab;

public interface CanvasView {

    default void onStroke(CanvasStroke stroke) {}

    /**
     * @param clearedBy 清空画布的用户连接ID；本地清空时为本端ID (可能尚未分配)。
     */
    default void onCleared(String clearedBy) {}
}
