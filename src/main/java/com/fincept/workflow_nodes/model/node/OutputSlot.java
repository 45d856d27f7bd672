package com.fincept.workflow_nodes.model.node;

/**
 * Where a switch sends one record. Replaces the bare integer target so that
 * "discard" is a named case instead of an out-of-range index.
 */
public enum OutputSlot {
    OUTPUT_1(0),
    OUTPUT_2(1),
    OUTPUT_3(2),
    FALLBACK(3),
    DISCARD(-1);

    public static final int PORT_COUNT = 4;

    private final int port;

    OutputSlot(int port) {
        this.port = port;
    }

    public int port() {
        return port;
    }

    public boolean isDiscard() {
        return this == DISCARD;
    }

    /** -1 and every index outside 0..3 map to DISCARD. */
    public static OutputSlot forIndex(int index) {
        return switch (index) {
            case 0  -> OUTPUT_1;
            case 1  -> OUTPUT_2;
            case 2  -> OUTPUT_3;
            case 3  -> FALLBACK;
            default -> DISCARD;
        };
    }
}
