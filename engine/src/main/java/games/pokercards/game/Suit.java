package games.pokercards.game;

/**
 * Enumeration representing the four suits of a standard playing card deck.
 * <p>
 * Suits have no poker ranking; they only matter for equality and for grouping cards
 * into flushes. The declaration order (Spades, Hearts, Diamonds, Clubs) is the order
 * in which a fresh {@link Deck} lays out its cards.
 */
public enum Suit {
    /** Spades – coded "S". */
    SPADES('S'),
    /** Hearts – coded "H". */
    HEARTS('H'),
    /** Diamonds – coded "D". */
    DIAMONDS('D'),
    /** Clubs – coded "C". */
    CLUBS('C');

    /** Single-character code used in card codes. */
    private final char code;

    Suit(char code) {
        this.code = code;
    }

    /**
     * Returns the single-character code of this suit.
     *
     * @return the code ('S', 'H', 'D' or 'C')
     */
    public char getCode() {
        return code;
    }

    /**
     * Looks up a suit by its code (case-insensitive).
     *
     * @param code the suit character (one of S H D C)
     * @return the matching suit
     * @throws InvalidSuitException if the character is not a suit code
     */
    public static Suit fromCode(char code) {
        char upper = Character.toUpperCase(code);
        for (Suit suit : values()) {
            if (suit.code == upper) {
                return suit;
            }
        }
        throw new InvalidSuitException("Invalid suit: '" + code + "'");
    }

    /**
     * Returns the string form of this suit, its code.
     *
     * @return the suit code as a string
     */
    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
