package games.pokercards.game;

/**
 * Thrown when a card is returned to a {@link Deck} although it is neither among the dealt
 * nor among the burned cards.
 */
public class CardNotRemovedException extends IllegalArgumentException {
    private final Card card;

    public CardNotRemovedException(Card card) {
        super("Card " + card + " is not among the removed cards");
        this.card = card;
    }

    /**
     * Returns the card that could not be returned.
     *
     * @return the offending card
     */
    public Card getCard() {
        return card;
    }
}
