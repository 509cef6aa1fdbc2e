package club.ppmc.meet.codec;

/**
 * 表示一条入站信令消息无法解析或未通过结构校验。调用方应记录并丢弃该消息，而不是断开连接。
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
