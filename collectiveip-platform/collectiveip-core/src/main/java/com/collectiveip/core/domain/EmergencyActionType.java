package com.collectiveip.core.domain;

/**
 * Action carried out when an emergency proposal executes.
 */
public enum EmergencyActionType {
    /** Suspend a single license of the asset. */
    SUSPEND_LICENSE,
    /** Suspend every currently active license of the asset. */
    SUSPEND_ALL_LICENSES,
    /** Trip the global pause flag. */
    PAUSE
}
