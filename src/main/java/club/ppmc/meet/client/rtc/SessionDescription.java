package club.ppmc.meet.client.rtc;

/**
 * SDP会话描述，作为offer/answer消息的负载在信令通道上传输。
 *
 * @param type "offer" 或 "answer"。
 * @param sdp  SDP文本。
 */
public record SessionDescription(String type, String sdp) {

    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";

    public static SessionDescription offer(String sdp) {
        return new SessionDescription(OFFER, sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription(ANSWER, sdp);
    }

    @Override
    public String toString() {
        return "SessionDescription{type='" + type + "', sdp=<" + (sdp == null ? 0 : sdp.length()) + " chars>}";
    }
}
