package games.pokercards.game;

/**
 * Thrown when dealing or burning from a deck that has no active cards left.
 */
public class EmptyDeckException extends IllegalStateException {

    public EmptyDeckException(String message) {
        super(message);
    }
}
