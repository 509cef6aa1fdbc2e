package club.ppmc.meet.client.media;

/**
 * 一条本地或远端媒体轨道。
 *
 * `setEnabled(false)` 让轨道输出静音/黑帧但保持存活；`stop()` 释放底层设备，轨道随后不可再用。
 */
public interface MediaTrack {

    String id();

    TrackKind kind();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    boolean isLive();

    void stop();

    /**
     * 注册轨道结束回调，例如用户通过浏览器的"停止共享"按钮结束屏幕共享。
     * 调用`stop()`本身不会触发此回调。
     */
    void onEnded(Runnable listener);
}
