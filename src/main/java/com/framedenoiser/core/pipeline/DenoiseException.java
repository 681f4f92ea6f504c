package com.framedenoiser.core.pipeline;

/**
 * Фатальная ошибка единицы работы (кадр или строка) в одной из фаз конвейера.
 */
public class DenoiseException extends RuntimeException {

    public enum Phase { SPATIAL, TEMPORAL }

    private final Phase phase;
    private final int frame;
    private final int line;   // -1, если единица работы - кадр целиком

    public DenoiseException(Phase phase, int frame, int line, Throwable cause) {
        super(describe(phase, frame, line) + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.phase = phase;
        this.frame = frame;
        this.line = line;
    }

    public Phase phase() {
        return phase;
    }

    public int frame() {
        return frame;
    }

    public int line() {
        return line;
    }

    private static String describe(Phase phase, int frame, int line) {
        return line < 0
                ? phase + " pass failed at frame " + frame
                : phase + " pass failed at frame " + frame + ", line " + line;
    }
}
