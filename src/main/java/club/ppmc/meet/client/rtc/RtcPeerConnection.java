/**
 * 此文件定义了原生WebRTC对等连接的最小抽象。
 *
 * 生产环境中由原生绑定 (例如基于libwebrtc的Java绑定) 实现，测试中由内存实现替代。
 * 所有异步操作都以`CompletableFuture`返回，失败时以异常完成。
 *
 * 关联:
 * - `RtcPeerConnectionFactory`: 创建实例。
 * - `PeerConnectionManager`: 驱动offer/answer与ICE交换。
 */
package club.ppmc.meet.client.rtc;

import club.ppmc.meet.client.media.MediaTrack;
import club.ppmc.meet.client.media.TrackKind;
import java.util.concurrent.CompletableFuture;

public interface RtcPeerConnection {

    /**
     * 添加一个收发器，并以给定轨道作为初始发送轨道。
     */
    RtcSender addTransceiver(TrackKind kind, MediaTrack initialTrack);

    CompletableFuture<SessionDescription> createOffer(boolean iceRestart);

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

    NativeConnectionState connectionState();

    /**
     * 关闭连接并释放原生资源。重复调用无副作用。
     */
    void close();
}
