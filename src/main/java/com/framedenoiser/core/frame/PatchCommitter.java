package com.framedenoiser.core.frame;

import java.util.Collection;
import java.util.Objects;

/**
 * Применяет пачку вычисленных значений к кадру на месте.
 * Порядок внутри пачки не гарантируется: при повторе позиции побеждает последняя запись.
 */
public final class PatchCommitter {

    private PatchCommitter() {
    }

    /** @return число применённых записей */
    public static int commit(Frame target, Collection<Patch> patches) {
        Objects.requireNonNull(target, "target");
        if (patches == null || patches.isEmpty()) return 0;
        int n = 0;
        for (Patch p : patches) {
            if (!target.contains(p.row(), p.col())) {
                throw new IllegalArgumentException("Patch (" + p.row() + ", " + p.col() + ") outside frame "
                        + target.rows() + "x" + target.cols());
            }
            target.set(p.row(), p.col(), Math.max(Frame.MIN_VALUE, Math.min(Frame.MAX_VALUE, p.value())));
            n++;
        }
        return n;
    }
}
