package com.framedenoiser.core.queue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

public final class QueueTask {
    public enum Status { PENDING, RUNNING, DONE, FAILED, CANCELED }

    private static final AtomicInteger SEQ = new AtomicInteger(1);

    public final int id = SEQ.getAndIncrement();
    public final Path video;
    public final Path output;       // null - путь по умолчанию рядом с исходником
    public volatile Status status = Status.PENDING;
    public volatile int progress = 0;
    public volatile String message = "";
    public volatile Instant startedAt;
    public volatile Instant finishedAt;

    public QueueTask(Path video, Path output) {
        this.video = video;
        this.output = output;
    }

    /** Задача больше не изменит статус. */
    public boolean isFinished() {
        return status == Status.DONE || status == Status.FAILED || status == Status.CANCELED;
    }

    @Override
    public String toString() {
        return "#" + id + " " + video.getFileName() + " " + status + " " + progress + "%";
    }
}
