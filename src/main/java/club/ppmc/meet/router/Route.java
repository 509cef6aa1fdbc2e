package club.ppmc.meet.router;

import club.ppmc.meet.dto.SignalingMessage;
import java.util.List;

/**
 * 路由决策: 要发送的消息及其目标连接集合，或者一次带原因的丢弃。
 *
 * @param recipients 目标连接ID，按房间加入顺序排列；丢弃时为空。
 * @param outbound   要发送的消息；丢弃时为`null`。
 * @param dropReason 丢弃原因；正常投递时为`null`。
 * @param malformed  丢弃是否由消息结构错误导致 (需要记录警告)，否则属于良性丢弃。
 */
public record Route(List<String> recipients, SignalingMessage outbound, String dropReason, boolean malformed) {

    public static Route deliver(List<String> recipients, SignalingMessage outbound) {
        return new Route(List.copyOf(recipients), outbound, null, false);
    }

    public static Route drop(String reason) {
        return new Route(List.of(), null, reason, false);
    }

    public static Route reject(String reason) {
        return new Route(List.of(), null, reason, true);
    }

    public boolean isDropped() {
        return outbound == null;
    }
}
