package games.pokercards.hand;

/**
 * Thrown when a poker hand is built from fewer than five cards.
 */
public class InsufficientCardsException extends IllegalArgumentException {

    public InsufficientCardsException(int count) {
        super("A poker hand needs at least " + PokerHand.HAND_SIZE + " cards, got " + count);
    }
}
