package games.pokercards.game;

/**
 * Where returned cards go in a deck lying face down on the table.
 */
public enum Position {
    /** The top of the deck: the next cards to be dealt. */
    TOP,
    /** The bottom of the deck: the last cards to be dealt. */
    BOTTOM
}
