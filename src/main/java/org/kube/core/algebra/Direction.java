package org.kube.core.algebra;

/**
 * Rotation sense of a quarter turn, seen from outside the turned face.
 */
public enum Direction {
    CLOCKWISE,
    COUNTER_CLOCKWISE;

    /**
     * Returns the opposite rotation sense.
     */
    public Direction inverse() {
        return this == CLOCKWISE ? COUNTER_CLOCKWISE : CLOCKWISE;
    }
}
