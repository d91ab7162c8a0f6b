package games.pokercards.table;

/**
 * Dealing stages of a Texas Hold'em hand, in order.
 */
public enum Street {
    /** Hole cards dealt, no community cards yet. */
    PREFLOP,
    /** Three community cards on the board. */
    FLOP,
    /** Fourth community card on the board. */
    TURN,
    /** Fifth and last community card on the board. */
    RIVER,
    /** All cards are out; hands are compared. */
    SHOWDOWN;

    /**
     * Returns the street that follows this one.
     *
     * @return the next street
     * @throws IllegalStateException after {@link #SHOWDOWN}
     */
    public Street next() {
        if (this == SHOWDOWN) {
            throw new IllegalStateException("No street after showdown");
        }
        return values()[ordinal() + 1];
    }
}
