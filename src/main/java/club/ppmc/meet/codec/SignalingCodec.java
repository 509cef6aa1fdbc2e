/**
 * 此文件定义了信令消息的JSON编解码器，服务器和客户端共用。
 *
 * 主要职责:
 * - 先将文本解析为JSON树，读取 `type` 字段，再按`MessageType`映射反序列化为具体的消息记录。
 * - 任何解析失败 (非JSON、缺少类型、未知类型、字段类型错误) 都统一抛出`MalformedMessageException`。
 * - 在不透明负载 (`JsonNode`) 与客户端的强类型对象 (SDP描述、ICE候选) 之间转换。
 *
 * 关联:
 * - `SignalingGateway`: 解码入站消息，编码出站消息。
 * - `WebSocketSignalingTransport`, `PeerConnectionManager`: 客户端侧的编解码。
 */
package club.ppmc.meet.codec;

import club.ppmc.meet.dto.MessageType;
import club.ppmc.meet.dto.SignalingMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class SignalingCodec {

    private static final String TYPE_FIELD = "type";

    private final ObjectMapper objectMapper;

    public SignalingCodec() {
        this(new ObjectMapper());
    }

    public SignalingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * 将一条文本帧解码为具体的信令消息。
     *
     * @param text 入站的JSON文本。
     * @return 与 `type` 字段对应的消息记录。
     * @throws MalformedMessageException 文本不是合法的信令消息。
     */
    public SignalingMessage decode(String text) throws MalformedMessageException {
        if (text == null || text.isBlank()) {
            throw new MalformedMessageException("消息内容为空");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("无法解析JSON: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("消息必须是JSON对象");
        }

        var typeNode = node.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedMessageException("消息缺少字符串类型的type字段");
        }

        var type = MessageType.lookup(typeNode.asText())
                .orElseThrow(() -> new MalformedMessageException("未知的消息类型: " + typeNode.asText()));

        try {
            return objectMapper.treeToValue(node, type.messageClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("消息字段格式错误 (" + type.wireName() + "): " + e.getMessage(), e);
        }
    }

    /**
     * 将信令消息编码为JSON文本。消息记录均由本项目定义，序列化失败意味着程序错误。
     */
    public String encode(SignalingMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化信令消息失败: " + message.type(), e);
        }
    }

    /**
     * 将强类型对象转换为不透明负载，用于offer/answer/ice-candidate的 `payload` 字段。
     */
    public JsonNode toPayload(Object value) {
        return objectMapper.valueToTree(value);
    }

    /**
     * 将不透明负载还原为强类型对象。
     *
     * @throws MalformedMessageException 负载缺失或结构不匹配。
     */
    public <T> T fromPayload(JsonNode payload, Class<T> type) throws MalformedMessageException {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new MalformedMessageException("信令负载为空");
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("信令负载无法解析为 " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
