package club.ppmc.meet.auth;

import java.util.Optional;
import org.springframework.http.server.ServerHttpRequest;

/**
 * 未接入认证子系统时使用: 所有连接都视为匿名。
 */
public class AnonymousSessionResolver implements SessionResolver {

    @Override
    public Optional<String> resolveUserId(ServerHttpRequest request) {
        return Optional.empty();
    }
}
