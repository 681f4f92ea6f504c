package com.framedenoiser.core.video;

import java.nio.file.Path;

/**
 * Итог обработки одного видео.
 */
public record DenoiseResult(
        Path input,
        Path output,
        int frames,         // кадров после выбора диапазона
        double fps,
        long elapsedMs
) {
}
