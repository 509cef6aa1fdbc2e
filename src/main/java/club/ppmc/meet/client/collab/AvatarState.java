package club.ppmc.meet.client.collab;

/**
 * 一个用户头像的当前状态。
 *
 * @param updatedAt 本地应用最近一次更新的时间 (毫秒)。
 */
public record AvatarState(String userId, double x, double y, String label, String color, long updatedAt) {

    public AvatarState moveTo(double x, double y, long at) {
        return new AvatarState(userId, x, y, label, color, at);
    }

    AvatarState withUserId(String userId) {
        return new AvatarState(userId, x, y, label, color, updatedAt);
    }
}
