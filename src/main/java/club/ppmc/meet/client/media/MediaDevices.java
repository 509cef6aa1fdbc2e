/**
 * 此文件定义了本地媒体设备的抽象，对应浏览器的 `navigator.mediaDevices`。
 *
 * 获取失败时返回的future以`MediaAccessException`异常完成 (权限被拒、设备不存在等)。
 *
 * 关联:
 * - `MediaController`: 唯一的调用方。
 */
package club.ppmc.meet.client.media;

import java.util.concurrent.CompletableFuture;

public interface MediaDevices {

    CompletableFuture<MediaStream> getUserMedia(MediaConstraints constraints);

    CompletableFuture<MediaTrack> getDisplayMedia();

    /**
     * 创建一条不占用设备的禁用轨道 (静音/黑帧)，在摄像头或麦克风关闭时代替真实轨道发送。
     */
    MediaTrack createPlaceholderTrack(TrackKind kind);
}
