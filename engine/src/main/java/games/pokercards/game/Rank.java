package games.pokercards.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck.
 * <p>
 * Constants are declared from lowest (Two) to highest (Ace), so the declaration order
 * is also the poker order: Ace is always high. Each rank carries the single-character
 * code used in card codes (e.g., "T" for Ten).
 * <p>
 * Ranks do not wrap: there is no low Ace, so A-2-3-4-5 is not a run of consecutive ranks.
 */
public enum Rank {
    /** Two – the lowest rank. */
    TWO('2'),
    THREE('3'),
    FOUR('4'),
    FIVE('5'),
    SIX('6'),
    SEVEN('7'),
    EIGHT('8'),
    NINE('9'),
    /** Ten – coded "T". */
    TEN('T'),
    JACK('J'),
    QUEEN('Q'),
    KING('K'),
    /** Ace – the highest rank. */
    ACE('A');

    private static final Rank[] BY_CODE = new Rank[128];

    static {
        for (Rank rank : values()) {
            BY_CODE[rank.code] = rank;
        }
    }

    /** Single-character code (e.g., 'A', 'T', '7'). */
    private final char code;

    Rank(char code) {
        this.code = code;
    }

    /**
     * Returns the single-character code of this rank.
     *
     * @return the code (e.g., 'A', 'K', 'T', '2')
     */
    public char getCode() {
        return code;
    }

    /**
     * Returns the rank immediately below this one, or {@code null} for {@link #TWO}.
     *
     * @return the next lower rank, or {@code null} when there is none
     */
    public Rank lower() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    /**
     * Looks up a rank by its code (case-insensitive).
     *
     * @param code the rank character (one of A K Q J T 9 8 7 6 5 4 3 2)
     * @return the matching rank
     * @throws InvalidRankException if the character is not a rank code
     */
    public static Rank fromCode(char code) {
        char upper = Character.toUpperCase(code);
        Rank rank = upper < BY_CODE.length ? BY_CODE[upper] : null;
        if (rank == null) {
            throw new InvalidRankException("Invalid rank: '" + code + "'");
        }
        return rank;
    }

    /**
     * Returns the string form of this rank, its code.
     *
     * @return the rank code as a string
     */
    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
