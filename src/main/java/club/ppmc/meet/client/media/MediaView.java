package club.ppmc.meet.client.media;

/**
 * UI层对本地媒体变化的回调。
 */
public interface MediaView {

    default void onLocalMediaChanged(LocalMediaState state) {}

    default void onMediaError(MediaAccessException error) {}
}
