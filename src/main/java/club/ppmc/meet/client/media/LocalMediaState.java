package club.ppmc.meet.client.media;

/**
 * 本地媒体状态的快照。
 *
 * @param started       是否已持有摄像头/麦克风轨道。
 * @param videoEnabled  摄像头是否开启。
 * @param audioEnabled  麦克风是否开启。
 * @param screenSharing 是否正在共享屏幕 (与摄像头互斥地占用视频发送端)。
 * @param lastError     最近一次获取失败的原因，成功获取后清空。
 */
public record LocalMediaState(
        boolean started,
        boolean videoEnabled,
        boolean audioEnabled,
        boolean screenSharing,
        MediaAccessException lastError) {}
