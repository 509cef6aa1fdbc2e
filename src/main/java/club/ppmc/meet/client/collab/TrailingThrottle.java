/**
 * 此文件定义了一个带尾部刷新的节流器。
 *
 * 每个时间窗口内最多向下游发出一个值: 窗口空闲时立即发出，否则只保留最新的值，
 * 并在窗口结束时发出，因此最后一个值总会被发送。
 *
 * 关联:
 * - `AvatarBoard`: 节流本地头像位置的广播。
 */
package club.ppmc.meet.client.collab;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

public class TrailingThrottle<T> {

    private final long intervalMillis;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clockMillis;
    private final Consumer<T> sink;

    private boolean emitted;
    private long lastEmitAt;
    private T pending;
    private ScheduledFuture<?> flushTask;

    public TrailingThrottle(
            Duration interval, ScheduledExecutorService scheduler, LongSupplier clockMillis, Consumer<T> sink) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("节流间隔不能为负: " + interval);
        }
        this.intervalMillis = interval.toMillis();
        this.scheduler = scheduler;
        this.clockMillis = clockMillis;
        this.sink = sink;
    }

    public void submit(T value) {
        T emitNow = null;
        synchronized (this) {
            var now = clockMillis.getAsLong();
            var elapsed = now - lastEmitAt;
            if (flushTask == null && (!emitted || elapsed >= intervalMillis)) {
                emitted = true;
                lastEmitAt = now;
                emitNow = value;
            } else {
                pending = value;
                if (flushTask == null) {
                    flushTask = scheduler.schedule(this::flush, intervalMillis - elapsed, TimeUnit.MILLISECONDS);
                }
            }
        }
        if (emitNow != null) {
            sink.accept(emitNow);
        }
    }

    void flush() {
        T value;
        synchronized (this) {
            flushTask = null;
            value = pending;
            pending = null;
            if (value != null) {
                lastEmitAt = clockMillis.getAsLong();
            }
        }
        if (value != null) {
            sink.accept(value);
        }
    }

    /**
     * 丢弃尚未发出的值并取消尾部刷新。
     */
    public void cancel() {
        synchronized (this) {
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
            pending = null;
        }
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }
}
