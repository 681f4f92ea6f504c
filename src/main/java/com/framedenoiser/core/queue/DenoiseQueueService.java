package com.framedenoiser.core.queue;

import com.framedenoiser.core.pipeline.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Очередь видео на обработку: один фоновый воркер берёт задачи по порядку.
 */
public final class DenoiseQueueService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DenoiseQueueService.class);

    /** Обрабатывает одно видео и репортит прогресс. Должна бросать исключение при ошибке. */
    @FunctionalInterface
    public interface Processor {
        void process(QueueTask task, Consumer<Integer> onProgress, CancellationToken token) throws Exception;
    }

    /** Слушатель событий задач. */
    @FunctionalInterface
    public interface Listener {
        void onUpdate(QueueTask task);
    }

    private final BlockingQueue<QueueTask> queue = new LinkedBlockingQueue<>();
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
       Thread t = new Thread(r, "vd-queue-worker");
       t.setDaemon(true);
       return t;
    });

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Future<?> workerFuture;
    private volatile CancellationToken currentToken;
    private final Duration jobTimeout;

    public DenoiseQueueService() {
        this(Duration.ZERO);
    }

    /** @param jobTimeout ограничение на одну задачу; ноль - без ограничения */
    public DenoiseQueueService(Duration jobTimeout) {
        this.jobTimeout = jobTimeout == null ? Duration.ZERO : jobTimeout;
    }

    public void addListener(Listener l) {
        if (l != null) listeners.add(l);
    }
    public void removeListener(Listener l) {
        listeners.remove(l);
    }

    public List<QueueTask> snapshot() {
        return List.copyOf(queue);
    }

    public QueueTask enqueue(Path video) {
        return enqueue(video, null);
    }

    public QueueTask enqueue(Path video, Path output) {
        Objects.requireNonNull(video, "video");
        QueueTask t = new QueueTask(video, output);
        queue.add(t);
        notifyListeners(t);
        return t;
    }

    /** Запустить обработчик очереди. Повторный вызов, если уже запущен, игнорируется. */
    public synchronized void start(Processor processor) {
        Objects.requireNonNull(processor, "processor");
        if (running.get()) return;
        running.set(true);
        workerFuture = exec.submit(() -> workerLoop(processor));
    }

    /** Остановить после текущей задачи. */
    public synchronized void stop() {
        running.set(false);
        if (workerFuture != null) workerFuture.cancel(false);
    }

    /** Отменить задачу: ожидающую - убрать из очереди, текущую - прервать через токен. */
    public boolean cancel(QueueTask t) {
        boolean removed = queue.remove(t);
        if (removed) {
            t.status = QueueTask.Status.CANCELED;
            t.finishedAt = Instant.now();
            notifyListeners(t);
            return true;
        }
        CancellationToken tk = currentToken;
        if (t.status == QueueTask.Status.RUNNING && tk != null) {
            tk.cancel("canceled by user");
            return true;
        }
        return false;
    }

    private void workerLoop(Processor processor) {
        while (running.get()) {
            try {
                QueueTask t = queue.poll(250, TimeUnit.MILLISECONDS);
                if (t == null) continue;

                // токен публикуется до RUNNING: cancel() из слушателя уже видит его
                CancellationToken token = CancellationToken.withTimeout(jobTimeout);
                currentToken = token;
                t.status = QueueTask.Status.RUNNING;
                t.startedAt = Instant.now();
                t.message = "running";
                t.progress = 0;
                notifyListeners(t);

                try {
                    token.throwIfCancelled();
                    processor.process(t, p -> {
                        t.progress = clamp(p, 0, 100);
                        notifyListeners(t);
                    }, token);
                    t.progress = 100;
                    t.status = QueueTask.Status.DONE;
                    t.message = "done";
                } catch (CancellationException ce) {
                    t.status = QueueTask.Status.CANCELED;
                    t.message = String.valueOf(ce.getMessage());
                    log.info("Task {} canceled: {}", t.id, ce.getMessage());
                } catch (Exception | Error ex) {
                    t.status = QueueTask.Status.FAILED;
                    t.message = String.valueOf(ex.getMessage());
                    log.error("Task {} failed: {}", t.id, t.video, ex);
                } finally {
                    currentToken = null;
                    t.finishedAt = Instant.now();
                    notifyListeners(t);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable th) {
                // очередь продолжает работу
                log.error("Queue worker error", th);
            }
        }
    }

    private int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private void notifyListeners(QueueTask t) {
        for (Listener l : listeners) {
            try {
                l.onUpdate(t);
            } catch (Throwable th) {
                log.warn("Listener failed on task {}: {}", t.id, th.toString());
            }
        }
    }

    @Override
    public void close() {
        stop();
        CancellationToken tk = currentToken;
        if (tk != null) tk.cancel("queue closed");
        exec.shutdownNow();
    }
}
