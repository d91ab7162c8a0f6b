package games.pokercards.game;

/**
 * Snapshot of how a deck's cards are split between its three piles.
 *
 * @param active cards still in the deck
 * @param popped cards dealt out
 * @param discarded cards burned
 */
public record DeckStats(int active, int popped, int discarded) {

    /**
     * Returns the number of cards across all three piles; 52 for a consistent deck.
     *
     * @return the total card count
     */
    public int total() {
        return active + popped + discarded;
    }
}
