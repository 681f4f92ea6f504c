package com.framedenoiser.core.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Флаг отмены, общий для всех воркеров прогона. Проверяется в начале каждой единицы работы
 * (кадр или строка). Может иметь дедлайн: по его истечении токен считается отменённым.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private volatile String reason = "cancelled";

    public CancellationToken() {
        this.deadline = null;
    }

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    /** Токен, который никто не отменяет. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return new CancellationToken();
        }
        return new CancellationToken(Instant.now().plus(timeout));
    }

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String why) {
        if (cancelled.compareAndSet(false, true)) {
            reason = why;
        }
    }

    public boolean isCancelled() {
        if (cancelled.get()) return true;
        if (deadline != null && Instant.now().isAfter(deadline)) {
            cancel("timed out");
            return true;
        }
        return false;
    }

    /** Бросает CancellationException, если прогон отменён. */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason);
        }
    }
}
