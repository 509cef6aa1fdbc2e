package club.ppmc.meet.client.rtc;

import java.util.List;

/**
 * STUN/TURN服务器。STUN服务器不需要凭据。
 */
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        urls = List.copyOf(urls);
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }

    public static IceServer turn(String url, String username, String credential) {
        return new IceServer(List.of(url), username, credential);
    }
}
