package com.framedenoiser.core.video;

import com.framedenoiser.core.frame.Frame;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.global.opencv_videoio;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;
import org.bytedeco.opencv.opencv_videoio.VideoWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Чтение видео в последовательность серых кадров и запись обратно через OpenCV.
 */
public final class VideoCodec {
    private static final Logger log = LoggerFactory.getLogger(VideoCodec.class);

    /** Кадры и частота кадров исходного контейнера. */
    public record Decoded(List<Frame> frames, double fps) {}

    private VideoCodec() {
    }

    public static Decoded decode(Path video) {
        try {
            if (!Files.isRegularFile(video) || Files.size(video) == 0L) {
                throw new IllegalStateException("Video file invalid: " + video);
            }
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Video file check failed: " + video, e);
        }
        try (VideoCapture cap = new VideoCapture(video.toString())) {
            if (!cap.isOpened()) {
                throw new IllegalStateException("VideoCapture cannot open: " + video);
            }
            double fps = cap.get(opencv_videoio.CAP_PROP_FPS);
            if (!(fps > 1e-3)) fps = 25.0;

            List<Frame> frames = new ArrayList<>();
            Mat bgr = new Mat();
            Mat gray = new Mat();
            try {
                while (cap.read(bgr) && !bgr.empty()) {
                    if (bgr.channels() == 1) {
                        bgr.copyTo(gray);
                    } else {
                        opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
                    }
                    frames.add(toFrame(gray));
                }
            } finally {
                bgr.release();
                gray.release();
            }
            if (!frames.isEmpty()) {
                log.info("Decoded {}: {}x{}, {} frames, fps={}", video.getFileName(),
                        frames.get(0).cols(), frames.get(0).rows(), frames.size(), fps);
            } else {
                log.warn("Decoded {}: no frames", video.getFileName());
            }
            return new Decoded(frames, fps);
        }
    }

    /**
     * Пишет последовательность в контейнер; серый канал дублируется в BGR.
     * @param fourcc четыре символа кодека, например "avc1" или "MJPG"
     */
    public static void encode(List<Frame> frames, Path output, double fps, String fourcc) {
        if (frames == null || frames.isEmpty()) {
            log.warn("No frames to write: {}", output);
            return;
        }
        if (fourcc == null || fourcc.length() != 4) {
            throw new IllegalArgumentException("FourCC must have 4 characters: " + fourcc);
        }
        Frame first = frames.get(0);
        int code = VideoWriter.fourcc((byte) fourcc.charAt(0), (byte) fourcc.charAt(1),
                (byte) fourcc.charAt(2), (byte) fourcc.charAt(3));
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Cannot create output directory for " + output, e);
        }
        try (VideoWriter writer = new VideoWriter(output.toString(), code, fps,
                new Size(first.cols(), first.rows()), true)) {
            if (!writer.isOpened()) {
                throw new IllegalStateException("VideoWriter cannot open: " + output + " (fourcc=" + fourcc + ")");
            }
            Mat bgr = new Mat();
            try {
                for (Frame f : frames) {
                    if (!first.sameSize(f)) {
                        throw new IllegalArgumentException("Frame " + f + " differs from " + first);
                    }
                    Mat gray = toMat(f);
                    try {
                        opencv_imgproc.cvtColor(gray, bgr, opencv_imgproc.COLOR_GRAY2BGR);
                        writer.write(bgr);
                    } finally {
                        gray.release();
                    }
                }
            } finally {
                bgr.release();
                writer.release();
            }
            log.info("Encoded {} frames → {} (fps={}, fourcc={})", frames.size(), output, fps, fourcc);
        }
    }

    /** Поддиапазон [from, to) последовательности; to < 0 - до конца. */
    public static List<Frame> clip(List<Frame> frames, int from, int to) {
        int start = Math.max(0, from);
        int end = to < 0 ? frames.size() : Math.min(to, frames.size());
        if (start >= end) return List.of();
        return new ArrayList<>(frames.subList(start, end));
    }

    static Frame toFrame(Mat gray) {
        Mat src = gray.isContinuous() ? gray : gray.clone();
        try {
            int rows = src.rows();
            int cols = src.cols();
            byte[] buf = new byte[rows * cols];
            src.data().get(buf);
            Frame f = new Frame(rows, cols);
            int[] line = new int[cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    line[c] = buf[r * cols + c] & 0xFF;
                }
                f.setRow(r, line);
            }
            return f;
        } finally {
            if (src != gray) src.release();
        }
    }

    static Mat toMat(Frame f) {
        byte[] buf = new byte[f.rows() * f.cols()];
        for (int r = 0; r < f.rows(); r++) {
            int[] line = f.row(r);
            for (int c = 0; c < line.length; c++) {
                buf[r * f.cols() + c] = (byte) line[c];
            }
        }
        Mat m = new Mat(f.rows(), f.cols(), opencv_core.CV_8UC1);
        m.data().put(buf);
        return m;
    }
}
