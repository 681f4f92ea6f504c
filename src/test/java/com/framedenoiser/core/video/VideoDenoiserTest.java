package com.framedenoiser.core.video;

import com.framedenoiser.app.Config;
import com.framedenoiser.core.filter.FilterThresholds;
import com.framedenoiser.core.filter.SpatialFilter;
import com.framedenoiser.core.filter.TemporalFilter;
import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.pipeline.DenoisePipeline;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.global.opencv_videoio;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class VideoDenoiserTest {

    private static VideoDenoiser denoiser(String suffix) {
        return denoiser(new Config.VideoConf("avc1", 0.0, 0, -1, false, suffix));
    }

    private static VideoDenoiser denoiser(Config.VideoConf video) {
        FilterThresholds t = FilterThresholds.defaults();
        return new VideoDenoiser(
                new DenoisePipeline(new SpatialFilter(1, t), new TemporalFilter(3, t), 2),
                video, 0L);
    }

    @Test
    void defaultOutputSitsNextToInput() {
        try (VideoDenoiser d = denoiser("_denoised")) {
            assertEquals(Path.of("videos", "video_denoised.mp4"), d.defaultOutput(Path.of("videos", "video.mp4")));
            assertEquals(Path.of("clip.v2_denoised.avi"), d.defaultOutput(Path.of("clip.v2.avi")));
            assertEquals(Path.of("raw_denoised.mp4"), d.defaultOutput(Path.of("raw")));
        }
    }

    @Test
    void suffixIsInsertedBeforeExtension() {
        assertEquals(Path.of("out", "a_original.mp4"), VideoDenoiser.withSuffix(Path.of("out", "a.mp4"), "_original"));
    }

    @Test
    void missingInputFails() {
        try (VideoDenoiser d = denoiser("_x")) {
            assertThrows(IllegalStateException.class,
                    () -> d.denoise(Path.of("does-not-exist.mp4"), null, null));
        }
    }

    @Test
    @Timeout(60)
    void clippedRangeIsDenoisedAndOriginalIsWritten(@TempDir Path dir) throws Exception {
        System.setProperty("org.bytedeco.javacpp.cachedir",
                System.getProperty("user.home") + "/.javacpp-cache");
        Loader.load(opencv_core.class);
        Loader.load(opencv_imgproc.class);
        Loader.load(opencv_videoio.class);

        List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            int[][] v = new int[32][40];
            for (int r = 0; r < 32; r++) {
                for (int c = 0; c < 40; c++) v[r][c] = 80 + r + c + i;
            }
            frames.add(Frame.of(v));
        }
        Path input = dir.resolve("clip.avi");
        try {
            VideoCodec.encode(frames, input, 10.0, "MJPG");
        } catch (IllegalStateException e) {
            Assumptions.abort("skip: no MJPG writer in this OpenCV build: " + e.getMessage());
        }
        Assumptions.assumeTrue(Files.size(input) > 0, "skip: writer produced empty file");
        Assumptions.assumeTrue(VideoCodec.decode(input).frames().size() == 12, "skip: reader drops frames");

        Path output = dir.resolve("clip_out.avi");
        List<Integer> progress = new CopyOnWriteArrayList<>();
        DenoiseResult result;
        try (VideoDenoiser d = denoiser(new Config.VideoConf("MJPG", 0.0, 2, 9, true, "_denoised"))) {
            result = d.denoise(input, output, progress::add);
        }

        assertEquals(7, result.frames());
        assertEquals(output, result.output());
        assertEquals(10.0, result.fps(), 0.5);
        assertTrue(Files.size(output) > 0);
        Path original = dir.resolve("clip_out_original.avi");
        assertTrue(Files.exists(original));
        assertEquals(7, VideoCodec.decode(original).frames().size());
        assertEquals(7, VideoCodec.decode(output).frames().size());
        assertEquals(Integer.valueOf(100), progress.get(progress.size() - 1));
    }
}
