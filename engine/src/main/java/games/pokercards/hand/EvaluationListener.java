package games.pokercards.hand;

import games.pokercards.game.Card;
import java.util.List;

/**
 * Receives diagnostic events while a {@link PokerHand} is evaluated.
 * <p>
 * Listeners observe only; nothing they do changes the evaluation result. Every method has
 * an empty default so implementations override just the events they care about. A listener
 * shared between hands evaluated on different threads must be thread-safe.
 */
public interface EvaluationListener {

    /** Listener that ignores every event. */
    EvaluationListener NONE = new EvaluationListener() {};

    /**
     * Called before anything else with the cards to evaluate, highest rank first.
     */
    default void evaluationStarted(List<Card> cards) {}

    /**
     * Called with every five-card straight found, highest first. Not called when there are none.
     */
    default void straightsFound(List<List<Card>> straights) {}

    /**
     * Called with every five-card flush window found. Not called when there are none.
     */
    default void flushesFound(List<List<Card>> flushes) {}

    /**
     * Called with the rank groups found: pairs, three-of-a-kinds and four-of-a-kinds, each list
     * highest rank first. Not called when all three are empty.
     */
    default void rankGroupsFound(List<List<Card>> pairs, List<List<Card>> threes, List<List<Card>> fours) {}

    /**
     * Called once the category and the cards completing it are fixed.
     */
    default void categorySelected(HandCategory category, List<Card> handCards) {}

    /**
     * Called last with the kickers, possibly empty.
     */
    default void kickersSelected(List<Card> kickers) {}
}
