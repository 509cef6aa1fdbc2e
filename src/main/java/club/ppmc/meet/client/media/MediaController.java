/**
 * 此文件定义了本地媒体控制器，管理摄像头、麦克风与屏幕共享轨道。
 *
 * 主要职责:
 * - `startLocalMedia`: 幂等地获取摄像头与麦克风；并发调用共享同一次进行中的获取。
 * - 开关摄像头/麦克风: 出站轨道在真实轨道与禁用的占位轨道之间切换，发送端从不移除，因此不会重新协商。
 * - 屏幕共享: 与摄像头互斥地占用视频发送端；用户在系统界面结束共享时自动恢复摄像头。
 * - 获取失败以`MediaAccessException`报告给视图，只影响本地参与者，允许重试。
 * - `stopAll`: 停止所有本地轨道，是离开会议时必须执行的清理步骤。
 *
 * 线程模型: 所有状态由 this 的监视器锁保护；对视图与出站发送端的回调在锁外执行。
 *
 * 关联:
 * - `MediaDevices`: 设备获取。
 * - `OutgoingTrackSink`: 出站轨道变化的接收方 (所有对等会话的发送端)。
 * - `PeerConnectionManager`: 通过`OutgoingTrackSource`读取当前出站轨道来初始化新会话。
 */
package club.ppmc.meet.client.media;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MediaController implements OutgoingTrackSource {
    private static final Logger logger = LoggerFactory.getLogger(MediaController.class);

    private static final OutgoingTrackSink NO_SINK = (kind, track) -> CompletableFuture.completedFuture(null);

    private final MediaDevices devices;
    private final MediaConstraints constraints;
    private final MediaView view;
    private final Map<TrackKind, MediaTrack> placeholders = new EnumMap<>(TrackKind.class);

    private OutgoingTrackSink sink = NO_SINK;
    private MediaTrack camera;
    private MediaTrack microphone;
    private MediaTrack screen;
    private boolean videoEnabled = true;
    private boolean audioEnabled = true;
    private MediaAccessException lastError;
    private CompletableFuture<LocalMediaState> acquisition;
    private CompletableFuture<Void> screenRequest;
    // 每次停止本地媒体时递增，用于丢弃停止之前发起的获取结果
    private long generation;

    public MediaController(MediaDevices devices, MediaConstraints constraints, MediaView view) {
        this.devices = devices;
        this.constraints = constraints;
        this.view = view;
    }

    public synchronized void bindOutgoingSink(OutgoingTrackSink sink) {
        this.sink = sink == null ? NO_SINK : sink;
    }

    /**
     * 获取摄像头与麦克风。已持有轨道时立即完成；获取进行中时返回同一个future。
     *
     * @return 获取完成且所有会话的发送端都已更新后完成；失败时以`MediaAccessException`异常完成。
     */
    public CompletableFuture<LocalMediaState> startLocalMedia() {
        CompletableFuture<LocalMediaState> pending;
        long requestGeneration;
        synchronized (this) {
            if (camera != null || microphone != null) {
                return CompletableFuture.completedFuture(snapshot());
            }
            if (acquisition != null) {
                return acquisition;
            }
            pending = new CompletableFuture<>();
            acquisition = pending;
            requestGeneration = generation;
        }

        logger.info("正在获取本地媒体: {}", constraints);
        devices.getUserMedia(constraints).whenComplete((stream, error) -> {
            if (error != null) {
                onAcquisitionFailed(pending, requestGeneration, error);
            } else {
                onAcquired(pending, requestGeneration, stream);
            }
        });
        return pending;
    }

    private void onAcquired(CompletableFuture<LocalMediaState> pending, long requestGeneration, MediaStream stream) {
        synchronized (this) {
            if (requestGeneration != generation) {
                logger.info("本地媒体在获取完成前已被停止，丢弃获取到的轨道。");
                stream.stopAll();
                pending.complete(snapshot());
                return;
            }
            camera = stream.track(TrackKind.VIDEO).orElse(null);
            microphone = stream.track(TrackKind.AUDIO).orElse(null);
            if (camera != null) camera.setEnabled(videoEnabled);
            if (microphone != null) microphone.setEnabled(audioEnabled);
            lastError = null;
            acquisition = null;
        }

        logger.info("本地媒体已就绪 | 视频: {} | 音频: {}", camera != null, microphone != null);
        pushOutgoing(TrackKind.AUDIO)
                .thenCombine(pushOutgoing(TrackKind.VIDEO), (audio, video) -> snapshot())
                .whenComplete((state, error) -> {
                    view.onLocalMediaChanged(state);
                    pending.complete(state);
                });
    }

    private void onAcquisitionFailed(
            CompletableFuture<LocalMediaState> pending, long requestGeneration, Throwable error) {
        var accessError = toAccessException(error);
        synchronized (this) {
            if (requestGeneration == generation) {
                lastError = accessError;
                acquisition = null;
            }
        }
        logger.warn("获取本地媒体失败 ({}): {}", accessError.getReason(), accessError.getMessage());
        view.onMediaError(accessError);
        pending.completeExceptionally(accessError);
    }

    public CompletableFuture<Void> setVideoEnabled(boolean enabled) {
        synchronized (this) {
            videoEnabled = enabled;
            if (camera != null) camera.setEnabled(enabled);
        }
        logger.debug("摄像头已{}", enabled ? "开启" : "关闭");
        return pushOutgoing(TrackKind.VIDEO).thenRun(this::notifyChanged);
    }

    public CompletableFuture<Void> setAudioEnabled(boolean enabled) {
        synchronized (this) {
            audioEnabled = enabled;
            if (microphone != null) microphone.setEnabled(enabled);
        }
        logger.debug("麦克风已{}", enabled ? "开启" : "关闭");
        return pushOutgoing(TrackKind.AUDIO).thenRun(this::notifyChanged);
    }

    public CompletableFuture<Void> toggleVideo() {
        boolean next;
        synchronized (this) {
            next = !videoEnabled;
        }
        return setVideoEnabled(next);
    }

    public CompletableFuture<Void> toggleAudio() {
        boolean next;
        synchronized (this) {
            next = !audioEnabled;
        }
        return setAudioEnabled(next);
    }

    /**
     * 开始屏幕共享，在所有会话上一起把视频发送端切换为屏幕轨道。
     *
     * @return 所有会话切换完成后完成；用户拒绝时以`MediaAccessException`异常完成。
     */
    public CompletableFuture<Void> startScreenShare() {
        CompletableFuture<Void> pending;
        long requestGeneration;
        synchronized (this) {
            if (screen != null) {
                return CompletableFuture.completedFuture(null);
            }
            if (screenRequest != null) {
                return screenRequest;
            }
            pending = new CompletableFuture<>();
            screenRequest = pending;
            requestGeneration = generation;
        }

        devices.getDisplayMedia().whenComplete((track, error) -> {
            if (error != null) {
                var accessError = toAccessException(error);
                boolean stale;
                synchronized (this) {
                    screenRequest = null;
                    stale = requestGeneration != generation;
                    if (!stale) {
                        lastError = accessError;
                    }
                }
                if (stale) {
                    logger.debug("屏幕共享请求在停止后失败，已忽略: {}", accessError.getMessage());
                } else {
                    logger.warn("开始屏幕共享失败 ({}): {}", accessError.getReason(), accessError.getMessage());
                    view.onMediaError(accessError);
                }
                pending.completeExceptionally(accessError);
                return;
            }

            synchronized (this) {
                screenRequest = null;
                if (requestGeneration != generation) {
                    track.stop();
                    pending.complete(null);
                    return;
                }
                screen = track;
            }
            track.onEnded(() -> {
                logger.info("屏幕共享已由系统界面结束。");
                stopScreenShare();
            });
            logger.info("屏幕共享已开始。");
            pushOutgoing(TrackKind.VIDEO).whenComplete((ignored, e) -> {
                notifyChanged();
                pending.complete(null);
            });
        });
        return pending;
    }

    /**
     * 结束屏幕共享，视频发送端恢复为摄像头 (或摄像头关闭时的占位轨道)。
     */
    public CompletableFuture<Void> stopScreenShare() {
        MediaTrack ended;
        synchronized (this) {
            if (screen == null) {
                return CompletableFuture.completedFuture(null);
            }
            ended = screen;
            screen = null;
        }
        ended.stop();
        logger.info("屏幕共享已结束。");
        return pushOutgoing(TrackKind.VIDEO).thenRun(this::notifyChanged);
    }

    /**
     * 停止摄像头与麦克风，发送端切换为占位轨道。屏幕共享不受影响。
     */
    public CompletableFuture<Void> stopLocalMedia() {
        List<MediaTrack> stopped;
        synchronized (this) {
            generation++;
            acquisition = null;
            stopped = takeDeviceTracks();
        }
        stopped.forEach(MediaTrack::stop);
        logger.info("本地摄像头与麦克风已停止。");
        return pushOutgoing(TrackKind.AUDIO)
                .thenCombine(pushOutgoing(TrackKind.VIDEO), (audio, video) -> (Void) null)
                .thenRun(this::notifyChanged);
    }

    /**
     * 停止所有本地轨道 (含屏幕共享与占位轨道) 并重置状态。不会再更新发送端，调用方随后会关闭所有会话。
     */
    public void stopAll() {
        List<MediaTrack> stopped;
        synchronized (this) {
            generation++;
            acquisition = null;
            screenRequest = null;
            stopped = takeDeviceTracks();
            if (screen != null) {
                stopped.add(screen);
                screen = null;
            }
            stopped.addAll(placeholders.values());
            placeholders.clear();
            videoEnabled = true;
            audioEnabled = true;
            lastError = null;
        }
        stopped.forEach(MediaTrack::stop);
        logger.info("已停止 {} 条本地轨道。", stopped.size());
        notifyChanged();
    }

    @Override
    public synchronized MediaTrack outgoingTrack(TrackKind kind) {
        return switch (kind) {
            case VIDEO -> {
                if (screen != null) yield screen;
                yield camera != null && videoEnabled ? camera : placeholder(TrackKind.VIDEO);
            }
            case AUDIO -> microphone != null && audioEnabled ? microphone : placeholder(TrackKind.AUDIO);
        };
    }

    public LocalMediaState state() {
        return snapshot();
    }

    private synchronized LocalMediaState snapshot() {
        return new LocalMediaState(
                camera != null || microphone != null,
                videoEnabled,
                audioEnabled,
                screen != null,
                lastError);
    }

    private List<MediaTrack> takeDeviceTracks() {
        var tracks = new ArrayList<MediaTrack>();
        if (camera != null) tracks.add(camera);
        if (microphone != null) tracks.add(microphone);
        camera = null;
        microphone = null;
        return tracks;
    }

    private MediaTrack placeholder(TrackKind kind) {
        return placeholders.computeIfAbsent(kind, key -> {
            var track = devices.createPlaceholderTrack(key);
            track.setEnabled(false);
            return track;
        });
    }

    private CompletableFuture<Void> pushOutgoing(TrackKind kind) {
        MediaTrack track;
        OutgoingTrackSink target;
        synchronized (this) {
            track = outgoingTrack(kind);
            target = sink;
        }
        return target.replaceOutgoingTrack(kind, track).exceptionally(error -> {
            logger.warn("替换出站{}轨道失败: {}", kind, error.getMessage());
            return null;
        });
    }

    private void notifyChanged() {
        view.onLocalMediaChanged(snapshot());
    }

    private static MediaAccessException toAccessException(Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof MediaAccessException) {
            return (MediaAccessException) cause;
        }
        return new MediaAccessException(MediaAccessException.Reason.UNAVAILABLE, String.valueOf(cause.getMessage()), cause);
    }
}
