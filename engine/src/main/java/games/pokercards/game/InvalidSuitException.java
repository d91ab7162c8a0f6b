package games.pokercards.game;

/**
 * Thrown when a card is built from a suit code that is not one of S H D C.
 */
public class InvalidSuitException extends IllegalArgumentException {

    public InvalidSuitException(String message) {
        super(message);
    }
}
