package org.spelunk.runtime.analysis;

/**
 * Player movement constants in pixel units (y grows downward).
 *
 * @param jumpHeight apex height of a jump in pixels
 * @param gravity downward acceleration in pixels per second squared
 * @param runSpeed maximum horizontal speed in pixels per second
 * @param tileSize edge length of one grid cell in pixels
 */
public record JumpPhysics(double jumpHeight, double gravity, double runSpeed, int tileSize) {

    public JumpPhysics {
        requirePositive("jumpHeight", jumpHeight);
        requirePositive("gravity", gravity);
        requirePositive("runSpeed", runSpeed);
        if (tileSize <= 0) {
            throw new IllegalArgumentException("tileSize must be positive, got " + tileSize);
        }
    }

    public static JumpPhysics defaults() {
        return new JumpPhysics(192, 980, 192, 64);
    }

    /**
     * @return launch speed that reaches exactly {@code jumpHeight}: sqrt(2 * gravity * jumpHeight)
     */
    public double jumpVelocity() {
        return Math.sqrt(2.0 * gravity * jumpHeight);
    }

    /**
     * @return seconds from take-off until the player is back at launch height
     */
    public double airTime() {
        return 2.0 * jumpVelocity() / gravity;
    }

    public int maxRiseTiles() {
        return (int) Math.floor(jumpHeight / tileSize);
    }

    public int maxJumpDistanceTiles() {
        return (int) Math.ceil(runSpeed * airTime() / tileSize);
    }

    private static void requirePositive(String name, double value) {
        if (Double.isNaN(value) || value <= 0.0 || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number, got " + value);
        }
    }
}
