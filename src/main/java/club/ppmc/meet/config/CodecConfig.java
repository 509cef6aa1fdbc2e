/**
 * 此文件定义了信令编解码器的Spring配置。
 *
 * 主要职责:
 * - 基于Spring Boot自动配置的`ObjectMapper`创建`SignalingCodec`，服务器各组件共用同一个实例。
 *
 * 关联:
 * - `SignalingGateway`: 注入此编解码器处理入站与出站消息。
 */
package club.ppmc.meet.config;

import club.ppmc.meet.codec.SignalingCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CodecConfig {

    @Bean
    public SignalingCodec signalingCodec(ObjectMapper objectMapper) {
        return new SignalingCodec(objectMapper);
    }
}
