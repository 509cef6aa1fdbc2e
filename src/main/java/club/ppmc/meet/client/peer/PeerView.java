package club.ppmc.meet.client.peer;

import club.ppmc.meet.client.media.MediaTrack;

/**
 * UI层对远端参与者变化的回调。所有方法都有空的默认实现，视图只需覆盖关心的事件。
 */
public interface PeerView {

    default void onPeerAdded(String peerId) {}

    default void onRemoteTrack(String peerId, MediaTrack track) {}

    default void onPeerStateChanged(String peerId, PeerState state) {}

    /**
     * 一次重试后仍然失败: 该参与者持续处于断开状态，其他参与者不受影响。
     */
    default void onPeerUnreachable(String peerId) {}

    default void onPeerRemoved(String peerId) {}

    default void onPresenterChanged(String presenterId) {}
}
