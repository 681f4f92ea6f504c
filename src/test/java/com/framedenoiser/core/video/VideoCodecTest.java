package com.framedenoiser.core.video;

import com.framedenoiser.core.frame.Frame;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.global.opencv_videoio;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VideoCodecTest {

    @BeforeAll
    static void loadNatives() {
        // фиксированный кэш, чтобы JavaCPP не распаковывал заново каждый запуск
        System.setProperty("org.bytedeco.javacpp.cachedir",
                System.getProperty("user.home") + "/.javacpp-cache");
        Loader.load(opencv_core.class);
        Loader.load(opencv_imgproc.class);
        Loader.load(opencv_videoio.class);
    }

    private static List<Frame> gradientSequence(int count, int rows, int cols) {
        List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int[][] v = new int[rows][cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) v[r][c] = (r * 4 + c * 2 + i) % 256;
            }
            frames.add(Frame.of(v));
        }
        return frames;
    }

    @Test
    void matConversionKeepsPixels() {
        Frame f = gradientSequence(1, 6, 9).get(0);
        Mat m = VideoCodec.toMat(f);
        try {
            assertEquals(6, m.rows());
            assertEquals(9, m.cols());
            assertEquals(f, VideoCodec.toFrame(m));
        } finally {
            m.release();
        }
    }

    @Test
    void clipSelectsHalfOpenRange() {
        List<Frame> frames = gradientSequence(10, 2, 2);
        assertEquals(frames.subList(4, 8), VideoCodec.clip(frames, 4, 8));
        assertEquals(frames.subList(7, 10), VideoCodec.clip(frames, 7, -1));
        assertEquals(frames, VideoCodec.clip(frames, -3, 100));
        assertTrue(VideoCodec.clip(frames, 8, 8).isEmpty());
    }

    @Test
    void missingFileIsRejected(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> VideoCodec.decode(dir.resolve("none.mp4")));
    }

    @Test
    @Timeout(30)
    void encodeThenDecodeKeepsGeometry(@TempDir Path dir) throws Exception {
        List<Frame> frames = gradientSequence(8, 48, 64);
        Path out = dir.resolve("gray.avi");
        try {
            VideoCodec.encode(frames, out, 10.0, "MJPG");
        } catch (IllegalStateException e) {
            Assumptions.abort("skip: no MJPG writer in this OpenCV build: " + e.getMessage());
        }
        Assumptions.assumeTrue(Files.size(out) > 0, "skip: writer produced empty file");

        VideoCodec.Decoded decoded = VideoCodec.decode(out);
        assertEquals(8, decoded.frames().size());
        assertEquals(48, decoded.frames().get(0).rows());
        assertEquals(64, decoded.frames().get(0).cols());
        assertEquals(10.0, decoded.fps(), 0.5);
    }
}
