package games.pokercards.hand;

/**
 * The nine traditional poker hand categories, weakest first.
 * <p>
 * {@link #getRank()} gives the numeric strength, 0 for a high card up to 8 for a straight flush.
 */
public enum HandCategory {
    HIGH_CARD("High Card"),
    ONE_PAIR("One Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush");

    private final String displayName;

    HandCategory(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the numeric strength of this category.
     *
     * @return 0 (high card) to 8 (straight flush)
     */
    public int getRank() {
        return ordinal();
    }

    public String getDisplayName() {
        return displayName;
    }
}
