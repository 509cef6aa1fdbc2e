package club.ppmc.meet.client.collab;

public interface AvatarView {

    default void onAvatarUpdated(AvatarState avatar) {}

    default void onAvatarRemoved(String userId) {}
}
