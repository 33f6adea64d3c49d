package org.spelunk.runtime.model;

public enum PlatformType {
    FLOATING,
    MOVING
}
