/**
 * 此文件定义了房间广播消息的轻量结构校验。
 *
 * 主要职责:
 * - 坐标必须存在、有限，且绝对值不超过配置上限；线宽可省略，出现时必须在允许范围内。
 * - 字符串字段长度受限；颜色只接受十六进制颜色或纯字母的CSS颜色关键字。
 * - 校验只约束结构以限制内存与带宽，并降低接收方渲染时的注入风险，不解释业务含义。
 *
 * 关联:
 * - `MessageRouter`: 广播前调用本类，校验失败的消息被丢弃。
 * - `SignalingProperties`: 提供各项上限。
 */
package club.ppmc.meet.router;

import club.ppmc.meet.codec.MalformedMessageException;
import club.ppmc.meet.config.SignalingProperties;
import club.ppmc.meet.dto.AvatarPositionMessage;
import club.ppmc.meet.dto.BroadcastMessage;
import club.ppmc.meet.dto.CanvasDrawMessage;
import club.ppmc.meet.dto.Point;
import club.ppmc.meet.dto.PresenterMessage;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class BroadcastValidator {

    private static final Pattern HEX_COLOR = Pattern.compile("#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    private static final Pattern NAMED_COLOR = Pattern.compile("[a-zA-Z]{3,20}");

    private final SignalingProperties properties;

    public BroadcastValidator(SignalingProperties properties) {
        this.properties = properties;
    }

    /**
     * 校验一条广播消息的结构。
     *
     * @throws MalformedMessageException 任一字段不满足约束。
     */
    public void validate(BroadcastMessage message) throws MalformedMessageException {
        switch (message.type()) {
            case AVATAR_POSITION -> validateAvatar((AvatarPositionMessage) message);
            case CANVAS_DRAW -> validateDraw((CanvasDrawMessage) message);
            case SET_PRESENTER -> optionalString("presenterId", ((PresenterMessage) message).presenterId());
            case CANVAS_CLEAR -> {
                // 除userId外无其他字段
            }
            default -> throw new MalformedMessageException("不支持的广播消息: " + message.type());
        }
    }

    private void validateAvatar(AvatarPositionMessage avatar) throws MalformedMessageException {
        coordinate("x", avatar.x());
        coordinate("y", avatar.y());
        optionalString("label", avatar.label());
        if (avatar.color() != null) {
            color(avatar.color());
        }
    }

    private void validateDraw(CanvasDrawMessage draw) throws MalformedMessageException {
        requiredString("tool", draw.tool());
        color(draw.color());
        point("from", draw.from());
        point("to", draw.to());

        // width可省略，接收方使用默认线宽
        var width = draw.width();
        if (width != null && (!Double.isFinite(width) || width <= 0 || width > properties.maxStrokeWidth())) {
            throw new MalformedMessageException("线宽无效: " + width);
        }
    }

    private void point(String name, Point point) throws MalformedMessageException {
        if (point == null) {
            throw new MalformedMessageException("缺少坐标点: " + name);
        }
        coordinate(name + ".x", point.x());
        coordinate(name + ".y", point.y());
    }

    private void coordinate(String name, Double value) throws MalformedMessageException {
        if (value == null || !Double.isFinite(value) || Math.abs(value) > properties.maxCoordinate()) {
            throw new MalformedMessageException("坐标无效: " + name + "=" + value);
        }
    }

    private void color(String value) throws MalformedMessageException {
        requiredString("color", value);
        if (!HEX_COLOR.matcher(value).matches() && !NAMED_COLOR.matcher(value).matches()) {
            throw new MalformedMessageException("颜色格式无效");
        }
    }

    private void requiredString(String name, String value) throws MalformedMessageException {
        if (value == null || value.isBlank()) {
            throw new MalformedMessageException("缺少字段: " + name);
        }
        optionalString(name, value);
    }

    private void optionalString(String name, String value) throws MalformedMessageException {
        if (value != null && value.length() > properties.maxStringLength()) {
            throw new MalformedMessageException("字段过长: " + name + " (" + value.length() + ")");
        }
    }
}
