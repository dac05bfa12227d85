package com.weatherdecision.common.model;

/** Shape of an index's primary output. */
public enum OutputDomain {
    /** Continuous 0–100 score, banded afterwards. */
    CONTINUOUS,
    /** Fixed ordered set of categories chosen directly by the formula. */
    CATEGORICAL
}
