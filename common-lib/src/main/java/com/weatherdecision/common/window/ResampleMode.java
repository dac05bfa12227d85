package com.weatherdecision.common.window;

/** How several grid samples are collapsed into one bucket of a coarser window. */
public enum ResampleMode {
    /** Keep the first sample of each bucket. Samples before the bucket start are never considered. */
    PICK_FIRST,
    /** Per-field mean over the bucket; wind direction uses the circular mean. */
    AVERAGE
}
