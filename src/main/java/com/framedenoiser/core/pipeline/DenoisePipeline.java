package com.framedenoiser.core.pipeline;

import com.framedenoiser.core.filter.SpatialFilter;
import com.framedenoiser.core.filter.TemporalFilter;
import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.frame.PatchCommitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Двухфазный конвейер шумоподавления.
 * <p>
 * Пространственная фаза: кадры независимы, раздаются пулу воркеров; барьер ждёт все кадры.
 * Временная фаза: кадры строго по возрастанию индекса (результат кадра t - история для t+1),
 * строки одного кадра раздаются пулу; барьер после каждого кадра.
 * Каждый воркер пишет только в свой кадр или свою строку кадра назначения.
 */
public final class DenoisePipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DenoisePipeline.class);

    private final SpatialFilter spatialFilter;
    private final TemporalFilter temporalFilter;
    private final int threads;
    private final ExecutorService exec;

    public DenoisePipeline(SpatialFilter spatialFilter, TemporalFilter temporalFilter, int maxThreads) {
        this.spatialFilter = Objects.requireNonNull(spatialFilter, "spatialFilter");
        this.temporalFilter = Objects.requireNonNull(temporalFilter, "temporalFilter");
        this.threads = poolSize(maxThreads);
        AtomicInteger seq = new AtomicInteger(1);
        this.exec = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "vd-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /** Размер пула: не больше maxThreads и не больше числа доступных процессоров. */
    public static int poolSize(int maxThreads) {
        int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(maxThreads <= 0 ? cpus : maxThreads, cpus));
    }

    public int threads() {
        return threads;
    }

    /**
     * Полный прогон: пространственная фаза, затем временная.
     * onProgress получает проценты 0..100 (может быть null).
     */
    public List<Frame> process(List<Frame> frames, CancellationToken token, Consumer<Integer> onProgress) {
        checkSequence(frames);
        CancellationToken tk = token == null ? CancellationToken.none() : token;
        if (frames.isEmpty()) {
            report(onProgress, 100);
            return List.of();
        }
        int total = frames.size() * 2;
        AtomicInteger done = new AtomicInteger();
        IntConsumer tick = idx -> report(onProgress, done.incrementAndGet() * 100 / total);

        report(onProgress, 0);
        List<Frame> spatial = spatialPass(frames, tk, tick);
        return temporalPass(spatial, tk, tick);
    }

    /** Каждый кадр - отдельная единица работы; исходные кадры не изменяются. */
    public List<Frame> spatialPass(List<Frame> frames, CancellationToken token, IntConsumer onFrameDone) {
        checkSequence(frames);
        CancellationToken tk = token == null ? CancellationToken.none() : token;
        long t0 = System.currentTimeMillis();
        log.info("Spatial pass: frames={}, radius={}, threads={}", frames.size(), spatialFilter.radius(), threads);

        Frame[] out = new Frame[frames.size()];
        List<Unit> units = new ArrayList<>(frames.size());
        for (int i = 0; i < frames.size(); i++) {
            final int idx = i;
            units.add(new Unit(DenoiseException.Phase.SPATIAL, idx, -1, () -> {
                out[idx] = spatialFilter.apply(frames.get(idx));
                log.debug("Spatial frame {} done", idx);
                if (onFrameDone != null) onFrameDone.accept(idx);
            }));
        }
        runAll(units, tk);
        log.info("Spatial pass finished in {} ms", System.currentTimeMillis() - t0);
        return List.of(out);
    }

    /**
     * Кадры по порядку; внутри кадра строки параллельно. Возвращает новую последовательность,
     * кадры 0..2 и кадры без полного окна истории переходят в неё без изменений.
     */
    public List<Frame> temporalPass(List<Frame> frames, CancellationToken token, IntConsumer onFrameDone) {
        checkSequence(frames);
        CancellationToken tk = token == null ? CancellationToken.none() : token;
        long t0 = System.currentTimeMillis();
        log.info("Temporal pass: frames={}, previousFrames={}, threads={}",
                frames.size(), temporalFilter.previousFrames(), threads);

        List<Frame> result = new ArrayList<>(frames);
        int processed = 0;
        for (int t = 0; t < result.size(); t++) {
            tk.throwIfCancelled();
            if (temporalFilter.canProcess(t)) {
                result.set(t, temporalFrame(result, t, tk));
                processed++;
            }
            log.debug("Temporal frame {} done", t);
            if (onFrameDone != null) onFrameDone.accept(t);
        }
        log.info("Temporal pass finished in {} ms, processed {} of {} frames",
                System.currentTimeMillis() - t0, processed, result.size());
        return Collections.unmodifiableList(result);
    }

    /**
     * Временная обработка одного кадра. Если для кадра недостаточно истории, возвращается
     * тот же экземпляр без изменений; иначе - новый кадр.
     */
    public Frame temporalFrame(List<Frame> frames, int frameIndex, CancellationToken token) {
        checkSequence(frames);
        if (frameIndex < 0 || frameIndex >= frames.size()) {
            throw new IllegalArgumentException("Frame index " + frameIndex + " outside sequence of " + frames.size());
        }
        Frame current = frames.get(frameIndex);
        if (!temporalFilter.canProcess(frameIndex)) {
            return current;
        }
        CancellationToken tk = token == null ? CancellationToken.none() : token;
        Frame out = new Frame(current.rows(), current.cols());
        List<Unit> units = new ArrayList<>(current.rows());
        for (int line = 0; line < current.rows(); line++) {
            final int ln = line;
            units.add(new Unit(DenoiseException.Phase.TEMPORAL, frameIndex, ln,
                    () -> PatchCommitter.commit(out, temporalFilter.linePatches(frames, frameIndex, ln))));
        }
        runAll(units, tk);
        return out;
    }

    // раздаёт единицы работы пулу и ждёт все (барьер); первая ошибка отменяет остальные
    private void runAll(List<Unit> units, CancellationToken token) {
        List<Future<?>> futures = new ArrayList<>(units.size());
        for (Unit u : units) {
            futures.add(exec.submit(() -> {
                token.throwIfCancelled();
                u.work().run();
            }));
        }
        for (int i = 0; i < futures.size(); i++) {
            Unit u = units.get(i);
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                if (cause instanceof CancellationException ce) {
                    log.warn("{} pass cancelled at frame {}: {}", u.phase(), u.frame(), ce.getMessage());
                    throw new CancellationException(ce.getMessage());
                }
                DenoiseException de = new DenoiseException(u.phase(), u.frame(), u.line(), cause);
                log.error(de.getMessage(), cause);
                throw de;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                token.cancel("interrupted");
                throw new CancellationException("interrupted");
            }
        }
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> f : futures) f.cancel(false);
    }

    private static void checkSequence(List<Frame> frames) {
        if (frames == null) {
            throw new IllegalArgumentException("Invalid dimensions: sequence is null");
        }
        Frame first = null;
        for (int i = 0; i < frames.size(); i++) {
            Frame f = frames.get(i);
            if (f == null) {
                throw new IllegalArgumentException("Invalid dimensions: frame " + i + " is null");
            }
            if (first == null) {
                first = f;
            } else if (!first.sameSize(f)) {
                throw new IllegalArgumentException("Frame " + i + " " + f + " differs from " + first);
            }
        }
    }

    private static void report(Consumer<Integer> onProgress, int percent) {
        if (onProgress != null) onProgress.accept(Math.max(0, Math.min(100, percent)));
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }

    private record Unit(DenoiseException.Phase phase, int frame, int line, Runnable work) {}
}
