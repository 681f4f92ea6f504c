package com.framedenoiser.app;

import com.framedenoiser.core.filter.FilterThresholds;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Map;


public record Config(DenoiseConf denoise, ThreadsConf threads, VideoConf video) {
    public record DenoiseConf(int spatialRadius, int previousFrames, FilterThresholds thresholds) {}
    public record ThreadsConf(int max, long timeoutMs) {}
    public record VideoConf(String fourcc, double fps, int fromFrame, int toFrame,
                            boolean writeOriginal, String outputSuffix) {}

    public static Config load() {
        return load("/application.yaml");
    }

    @SuppressWarnings("unchecked")
    public static Config load(String resource) {
        try (InputStream in = Config.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            if (root == null) root = Map.of();

            Map<String, Object> den = (Map<String, Object>) root.getOrDefault("denoise", Map.of());
            Map<String, Object> thr = (Map<String, Object>) den.getOrDefault("thresholds", Map.of());
            Map<String, Object> thd = (Map<String, Object>) root.getOrDefault("threads", Map.of());
            Map<String, Object> vid = (Map<String, Object>) root.getOrDefault("video", Map.of());

            int spatialRadius   = intOr(den, "spatialRadius", 2);
            int previousFrames  = intOr(den, "previousFrames", 5);
            FilterThresholds thresholds = new FilterThresholds(
                    doubleOr(thr, "spatialEdge", FilterThresholds.DEFAULT_SPATIAL_EDGE),
                    intOr(thr, "similarityDelta", FilterThresholds.DEFAULT_SIMILARITY_DELTA),
                    doubleOr(thr, "similarityRatio", FilterThresholds.DEFAULT_SIMILARITY_RATIO),
                    doubleOr(thr, "lowVariance", FilterThresholds.DEFAULT_LOW_VARIANCE),
                    doubleOr(thr, "midVariance", FilterThresholds.DEFAULT_MID_VARIANCE),
                    doubleOr(thr, "temporalEdge", FilterThresholds.DEFAULT_TEMPORAL_EDGE),
                    intOr(thr, "stabilityDelta", FilterThresholds.DEFAULT_STABILITY_DELTA),
                    doubleOr(thr, "stabilityRatio", FilterThresholds.DEFAULT_STABILITY_RATIO),
                    intOr(thr, "temporalNoise", FilterThresholds.DEFAULT_TEMPORAL_NOISE),
                    intOr(thr, "blurDelta", FilterThresholds.DEFAULT_BLUR_DELTA),
                    intOr(thr, "blurCeiling", FilterThresholds.DEFAULT_BLUR_CEILING),
                    intOr(thr, "flareDelta", FilterThresholds.DEFAULT_FLARE_DELTA),
                    intOr(thr, "flareFloor", FilterThresholds.DEFAULT_FLARE_FLOOR),
                    doubleOr(thr, "stableVariance", FilterThresholds.DEFAULT_STABLE_VARIANCE),
                    doubleOr(thr, "movementVariance", FilterThresholds.DEFAULT_MOVEMENT_VARIANCE));

            int maxThreads      = intOr(thd, "max", 22);
            long timeoutMs      = thd.get("timeoutMs") != null ? ((Number) thd.get("timeoutMs")).longValue() : 0L;

            String fourcc       = vid.get("fourcc") != null ? String.valueOf(vid.get("fourcc")) : "avc1";
            double fps          = doubleOr(vid, "fps", 0.0);
            int fromFrame       = intOr(vid, "fromFrame", 0);
            int toFrame         = intOr(vid, "toFrame", -1);
            boolean writeOrig   = vid.get("writeOriginal") != null && (Boolean) vid.get("writeOriginal");
            String suffix       = vid.get("outputSuffix") != null ? String.valueOf(vid.get("outputSuffix")) : "_denoised";

            if (fourcc.length() != 4) {
                throw new IllegalArgumentException("video.fourcc must have 4 characters: " + fourcc);
            }
            return new Config(
                    new DenoiseConf(spatialRadius, previousFrames, thresholds),
                    new ThreadsConf(maxThreads, timeoutMs),
                    new VideoConf(fourcc, fps, fromFrame, toFrame, writeOrig, suffix)
            );
        } catch (Exception e) {
            throw new RuntimeException("Failed to load " + resource, e);
        }
    }

    private static int intOr(Map<String, Object> m, String key, int def) {
        return m.get(key) != null ? ((Number) m.get(key)).intValue() : def;
    }

    private static double doubleOr(Map<String, Object> m, String key, double def) {
        return m.get(key) != null ? ((Number) m.get(key)).doubleValue() : def;
    }
}
