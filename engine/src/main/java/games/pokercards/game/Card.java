package games.pokercards.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable. Equality and hashing use both rank and suit, while the relational
 * methods ({@link #isHigherThan}, {@link #isLowerThan}, {@link #isAtLeast}, {@link #isAtMost})
 * look at the rank only. Two cards of the same rank but different suits are therefore both
 * "at least" and "at most" each other without being equal. For that reason {@code Card} does
 * not implement {@link Comparable}; use {@link #RANK_ORDER} or {@link #RANK_DESCENDING} where
 * a {@link Comparator} is needed.
 */
public class Card {
    /** Orders cards by rank, lowest first. Suits are ignored. */
    public static final Comparator<Card> RANK_ORDER = Comparator.comparing(Card::getRank);
    /** Orders cards by rank, highest first. Suits are ignored. */
    public static final Comparator<Card> RANK_DESCENDING = RANK_ORDER.reversed();

    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit (Spades, Hearts, Diamonds, Clubs) of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses a card from its two-character code, rank first then suit (e.g., "AS", "TH", "7c").
     *
     * @param code the card code
     * @return the parsed card
     * @throws InvalidRankException if the code is not two characters long or the rank is unknown
     * @throws InvalidSuitException if the suit is unknown
     */
    public static Card of(String code) {
        Objects.requireNonNull(code, "code");
        if (code.length() != 2) {
            throw new InvalidRankException("Card code must be two characters: '" + code + "'");
        }
        Rank rank = Rank.fromCode(code.charAt(0));
        Suit suit = Suit.fromCode(code.charAt(1));
        return new Card(rank, suit);
    }

    /**
     * Parses a list of cards, one per code.
     *
     * @param codes card codes such as "KC", "QH"
     * @return a new mutable list holding one card per code, in the given order
     * @throws InvalidRankException if any code has an unknown rank
     * @throws InvalidSuitException if any code has an unknown suit
     */
    public static List<Card> listOf(String... codes) {
        List<Card> cards = new ArrayList<>(codes.length);
        for (String code : codes) {
            cards.add(of(code));
        }
        return cards;
    }

    /**
     * Returns every card of a standard 52-card deck, suit by suit, each suit from Ace down to Two.
     *
     * @return an unmodifiable list of the 52 standard cards
     */
    public static List<Card> standardDeck() {
        List<Card> cards = new ArrayList<>(52);
        Rank[] ranks = Rank.values();
        for (Suit suit : Suit.values()) {
            for (int i = ranks.length - 1; i >= 0; i--) {
                cards.add(new Card(ranks[i], suit));
            }
        }
        return Collections.unmodifiableList(cards);
    }

    /**
     * Returns the rank of this card.
     *
     * @return the rank (e.g., {@code Rank.ACE}, {@code Rank.KING})
     */
    public Rank getRank() {
        return rank;
    }

    /**
     * Returns the suit of this card.
     *
     * @return the suit (e.g., {@code Suit.SPADES}, {@code Suit.HEARTS})
     */
    public Suit getSuit() {
        return suit;
    }

    /**
     * Compares the ranks of this card and another, ignoring suits.
     *
     * @param other the card to compare with
     * @return negative if this card ranks lower, zero if the ranks are equal, positive if higher
     */
    public int compareRank(Card other) {
        return rank.compareTo(other.rank);
    }

    /** @return {@code true} if this card's rank is strictly higher than {@code other}'s */
    public boolean isHigherThan(Card other) {
        return compareRank(other) > 0;
    }

    /** @return {@code true} if this card's rank is strictly lower than {@code other}'s */
    public boolean isLowerThan(Card other) {
        return compareRank(other) < 0;
    }

    /** @return {@code true} if this card's rank is higher than or equal to {@code other}'s */
    public boolean isAtLeast(Card other) {
        return compareRank(other) >= 0;
    }

    /** @return {@code true} if this card's rank is lower than or equal to {@code other}'s */
    public boolean isAtMost(Card other) {
        return compareRank(other) <= 0;
    }

    /**
     * Returns the canonical two-character code of this card, rank then suit (e.g., "AS", "TH").
     *
     * @return the card code
     */
    @Override
    public String toString() {
        return String.valueOf(rank.getCode()) + suit.getCode();
    }

    /**
     * Checks equality based on rank and suit.
     *
     * @param o the object to compare with
     * @return {@code true} if both cards have identical rank and suit; {@code false} otherwise
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
