package com.simscript.params.value;

import lombok.Value;

/**
 * Python-style {@code start:stop:step} slice; any bound may be null.
 */
@Value
public class Slice {
    Integer start;
    Integer stop;
    Integer step;

    public static Slice all() {
        return new Slice(null, null, null);
    }

    /**
     * Resolves the slice against a dimension of the given length.
     *
     * @return the selected positions, in selection order
     */
    public int[] indices(int length) {
        int st = step == null ? 1 : step;
        if (st == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
        int lo;
        int hi;
        if (st > 0) {
            lo = start == null ? 0 : clamp(start, length, 0, length);
            hi = stop == null ? length : clamp(stop, length, 0, length);
        } else {
            lo = start == null ? length - 1 : clamp(start, length, -1, length - 1);
            hi = stop == null ? -1 : clamp(stop, length, -1, length - 1);
        }
        int count = st > 0
                ? Math.max(0, (hi - lo + st - 1) / st)
                : Math.max(0, (lo - hi - st - 1) / -st);
        int[] out = new int[count];
        for (int i = 0; i < count; i++) {
            out[i] = lo + i * st;
        }
        return out;
    }

    private static int clamp(int index, int length, int min, int max) {
        int resolved = index < 0 ? index + length : index;
        return Math.max(min, Math.min(max, resolved));
    }
}
