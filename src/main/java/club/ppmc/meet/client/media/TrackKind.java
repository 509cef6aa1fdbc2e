package club.ppmc.meet.client.media;

public enum TrackKind {
    AUDIO,
    VIDEO
}
