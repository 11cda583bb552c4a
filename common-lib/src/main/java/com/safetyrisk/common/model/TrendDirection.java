package com.safetyrisk.common.model;

/** Direction of the crime count between the last two reporting periods. */
public enum TrendDirection {
    RISING,
    FALLING,
    STABLE
}
