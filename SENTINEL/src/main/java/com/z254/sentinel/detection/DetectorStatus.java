package com.z254.sentinel.detection;

/**
 * Training state of a registered detector. A detector in {@code TRAINING} after a previous
 * success keeps detecting with its last trained model.
 */
public enum DetectorStatus {
    UNCONFIGURED,
    TRAINING,
    READY
}
