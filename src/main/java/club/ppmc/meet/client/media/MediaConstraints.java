package club.ppmc.meet.client.media;

/**
 * 获取本地媒体时请求的设备类型。
 */
public record MediaConstraints(boolean audio, boolean video) {

    public static MediaConstraints audioAndVideo() {
        return new MediaConstraints(true, true);
    }

    public static MediaConstraints audioOnly() {
        return new MediaConstraints(true, false);
    }
}
