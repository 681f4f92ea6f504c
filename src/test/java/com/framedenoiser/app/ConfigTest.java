package com.framedenoiser.app;

import com.framedenoiser.core.filter.FilterThresholds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void loadsDefaultApplicationYaml() {
        Config cfg = Config.load();

        assertEquals(2, cfg.denoise().spatialRadius());
        assertEquals(5, cfg.denoise().previousFrames());
        assertEquals(FilterThresholds.defaults(), cfg.denoise().thresholds());
        assertEquals(22, cfg.threads().max());
        assertEquals(0L, cfg.threads().timeoutMs());
        assertEquals("avc1", cfg.video().fourcc());
        assertEquals(-1, cfg.video().toFrame());
        assertFalse(cfg.video().writeOriginal());
        assertEquals("_denoised", cfg.video().outputSuffix());
    }

    @Test
    void partialYamlFallsBackToDefaults() {
        Config cfg = Config.load("/config/partial.yaml");

        assertEquals(1, cfg.denoise().spatialRadius());
        assertEquals(23, cfg.denoise().previousFrames());
        assertEquals(12, cfg.denoise().thresholds().temporalNoise());
        assertEquals(15.0, cfg.denoise().thresholds().spatialEdge());
        assertEquals(FilterThresholds.DEFAULT_FLARE_FLOOR, cfg.denoise().thresholds().flareFloor());
        assertEquals(22, cfg.threads().max());
        assertEquals(400, cfg.video().fromFrame());
        assertEquals(640, cfg.video().toFrame());
        assertEquals(24.0, cfg.video().fps());
        assertTrue(cfg.video().writeOriginal());
        assertEquals("MJPG", cfg.video().fourcc());
    }

    @Test
    void missingResourceFails() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> Config.load("/config/nope.yaml"));
        assertTrue(e.getMessage().contains("/config/nope.yaml"));
    }

    @Test
    void invalidThresholdsFail() {
        assertThrows(RuntimeException.class, () -> Config.load("/config/invalid.yaml"));
    }
}
