package club.ppmc.meet.client.media;

/**
 * 获取本地媒体失败。属于可恢复错误: 只影响本地参与者，用户可以重试。
 */
public class MediaAccessException extends Exception {

    public enum Reason {
        PERMISSION_DENIED,
        DEVICE_NOT_FOUND,
        UNAVAILABLE
    }

    private final Reason reason;

    public MediaAccessException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MediaAccessException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
