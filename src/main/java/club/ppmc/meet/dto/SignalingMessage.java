/**
 * 此文件定义了所有信令消息的公共契约。
 *
 * 信令消息是一个以 `type` 字段区分的标签联合体，每个变体都是一个JDK 17的`record`。
 * 具体变体见`MessageType`中的映射。
 */
package club.ppmc.meet.dto;

public interface SignalingMessage {

    MessageType type();
}
