package games.pokercards.game;

/**
 * Thrown when a card is built from a rank code that is not one of A K Q J T 9 8 7 6 5 4 3 2.
 */
public class InvalidRankException extends IllegalArgumentException {

    public InvalidRankException(String message) {
        super(message);
    }
}
