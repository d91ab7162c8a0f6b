package games.pokercards.hand;

import games.pokercards.game.Card;
import games.pokercards.game.CardFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EvaluationListener} that writes each evaluation step to the debug log.
 * <p>
 * Stateless, so one instance can serve any number of hands and threads.
 */
public class LoggingEvaluationListener implements EvaluationListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingEvaluationListener.class);

    @Override
    public void evaluationStarted(List<Card> cards) {
        if (log.isDebugEnabled()) {
            log.debug("--- Evaluating {} ---", CardFormatter.join(cards));
        }
    }

    @Override
    public void straightsFound(List<List<Card>> straights) {
        if (log.isDebugEnabled()) {
            log.debug("straights: {}", CardFormatter.joinGroups(straights));
        }
    }

    @Override
    public void flushesFound(List<List<Card>> flushes) {
        if (log.isDebugEnabled()) {
            log.debug("flushes: {}", CardFormatter.joinGroups(flushes));
        }
    }

    @Override
    public void rankGroupsFound(List<List<Card>> pairs, List<List<Card>> threes, List<List<Card>> fours) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (!pairs.isEmpty()) {
            log.debug("pairs: {}", CardFormatter.joinGroups(pairs));
        }
        if (!threes.isEmpty()) {
            log.debug("threes: {}", CardFormatter.joinGroups(threes));
        }
        if (!fours.isEmpty()) {
            log.debug("fours: {}", CardFormatter.joinGroups(fours));
        }
    }

    @Override
    public void categorySelected(HandCategory category, List<Card> handCards) {
        if (log.isDebugEnabled()) {
            log.debug("* {}: {}", category.getDisplayName(), CardFormatter.join(handCards));
        }
    }

    @Override
    public void kickersSelected(List<Card> kickers) {
        if (log.isDebugEnabled()) {
            log.debug("kickers: {}", CardFormatter.join(kickers));
        }
    }
}
