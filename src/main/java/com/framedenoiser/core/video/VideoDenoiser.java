package com.framedenoiser.core.video;

import com.framedenoiser.app.Config;
import com.framedenoiser.core.filter.SpatialFilter;
import com.framedenoiser.core.filter.TemporalFilter;
import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.pipeline.CancellationToken;
import com.framedenoiser.core.pipeline.DenoisePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Обработка файла целиком: чтение, выбор диапазона кадров, конвейер, запись.
 */
public final class VideoDenoiser implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VideoDenoiser.class);

    private final DenoisePipeline pipeline;
    private final Config.VideoConf video;
    private final long timeoutMs;

    public VideoDenoiser(DenoisePipeline pipeline, Config.VideoConf video, long timeoutMs) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.video = Objects.requireNonNull(video, "video");
        this.timeoutMs = Math.max(0L, timeoutMs);
    }

    /** Параметры из application.yaml; -Dvd.radius, -Dvd.previousFrames, -Dvd.threads приоритетнее YAML. */
    public VideoDenoiser(Config cfg) {
        this(pipelineFrom(cfg), cfg.video(), Long.getLong("vd.timeoutMs", cfg.threads().timeoutMs()));
    }

    static DenoisePipeline pipelineFrom(Config cfg) {
        var d = cfg.denoise();
        int radius = Integer.getInteger("vd.radius", d.spatialRadius());
        int previousFrames = Integer.getInteger("vd.previousFrames", d.previousFrames());
        int threads = Integer.getInteger("vd.threads", cfg.threads().max());
        log.info("Denoise params: radius={}, previousFrames={}, maxThreads={}, thresholds={}",
                radius, previousFrames, threads, d.thresholds());
        return new DenoisePipeline(
                new SpatialFilter(radius, d.thresholds()),
                new TemporalFilter(previousFrames, d.thresholds()),
                threads);
    }

    /** Путь результата по умолчанию: рядом с исходником, с суффиксом из конфигурации. */
    public Path defaultOutput(Path input) {
        return withSuffix(input, video.outputSuffix());
    }

    static Path withSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : ".mp4";
        return file.resolveSibling(base + suffix + ext);
    }

    public DenoiseResult denoise(Path input, Path output, Consumer<Integer> onProgress) {
        return denoise(input, output, onProgress, CancellationToken.withTimeout(Duration.ofMillis(timeoutMs)));
    }

    public DenoiseResult denoise(Path input, Path output, Consumer<Integer> onProgress, CancellationToken token) {
        Objects.requireNonNull(input, "input");
        Path out = output != null ? output : defaultOutput(input);
        long t0 = System.currentTimeMillis();

        VideoCodec.Decoded decoded = VideoCodec.decode(input);
        List<Frame> frames = VideoCodec.clip(decoded.frames(), video.fromFrame(), video.toFrame());
        double fps = video.fps() > 1e-3 ? video.fps() : decoded.fps();
        log.info("Denoising {}: frames {}..{} ({} total)", input.getFileName(),
                video.fromFrame(), video.toFrame(), frames.size());

        if (video.writeOriginal()) {
            Path orig = withSuffix(out, "_original");
            VideoCodec.encode(frames, orig, fps, video.fourcc());
        }

        List<Frame> result = pipeline.process(frames, token, onProgress);
        VideoCodec.encode(result, out, fps, video.fourcc());

        long elapsed = System.currentTimeMillis() - t0;
        log.info("Done {} → {} in {} ms", input.getFileName(), out, elapsed);
        return new DenoiseResult(input, out, result.size(), fps, elapsed);
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
