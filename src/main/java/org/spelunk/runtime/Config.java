package org.spelunk.runtime;

/**
 * Fixed constants shared by all generation stages.
 */
public final class Config {

    private Config() {}

    /** Cell value of an open (walkable) cell. */
    public static final byte FLOOR = 0;

    /** Cell value of a solid cell. */
    public static final byte WALL = 1;

    /** Label value of wall cells in a label grid. */
    public static final int WALL_LABEL = 1;

    /** Region labels start here; 0 and 1 are reserved for the raw cell values. */
    public static final int FIRST_REGION_LABEL = 2;

    /** Number of cells in a Moore neighbourhood. */
    public static final int MOORE_NEIGHBOURS = 8;
}
