/**
 * 此文件定义了外部认证子系统的接入点。
 *
 * 会话凭证 (Cookie) 的签发与校验不在本服务范围内。握手前网关调用一次本接口，
 * 信任其返回的用户ID，自身不做任何凭证检查。
 *
 * 关联:
 * - `RoomHandshakeInterceptor`: 在升级握手前调用。
 * - `AnonymousSessionResolver`: 容器中没有其他实现时的默认实现。
 */
package club.ppmc.meet.auth;

import java.util.Optional;
import org.springframework.http.server.ServerHttpRequest;

@FunctionalInterface
public interface SessionResolver {

    /**
     * 根据升级请求解析已认证的用户ID。
     *
     * @param request WebSocket升级请求。
     * @return 已认证用户的ID；匿名请求返回空。
     */
    Optional<String> resolveUserId(ServerHttpRequest request);
}
