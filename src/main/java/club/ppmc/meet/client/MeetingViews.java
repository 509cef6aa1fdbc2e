package club.ppmc.meet.client;

import club.ppmc.meet.client.collab.AvatarView;
import club.ppmc.meet.client.collab.CanvasView;
import club.ppmc.meet.client.media.MediaView;
import club.ppmc.meet.client.peer.PeerView;

/**
 * UI层提供的全部视图回调。
 */
public record MeetingViews(PeerView peers, MediaView media, AvatarView avatars, CanvasView canvas) {

    public MeetingViews {
        peers = peers == null ? new PeerView() {} : peers;
        media = media == null ? new MediaView() {} : media;
        avatars = avatars == null ? new AvatarView() {} : avatars;
        canvas = canvas == null ? new CanvasView() {} : canvas;
    }

    /**
     * 不渲染任何内容的视图，用于无界面的客户端。
     */
    public static MeetingViews none() {
        return new MeetingViews(null, null, null, null);
    }
}
