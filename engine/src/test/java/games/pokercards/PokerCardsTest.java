package games.pokercards;

import static org.junit.jupiter.api.Assertions.*;

import games.pokercards.config.ShowdownProperties;
import games.pokercards.hand.Showdown;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@SpringBootTest(properties = {"showdown.players=6", "showdown.seed=31", "showdown.trace=true"})
@ExtendWith(OutputCaptureExtension.class)
class PokerCardsTest {

    @Autowired
    private PokerCards pokerCards;

    @Autowired
    private ShowdownProperties properties;

    @Test
    void propertiesAreBound() {
        assertEquals(6, properties.getPlayers());
        assertEquals(Long.valueOf(31), properties.getSeed());
        assertTrue(properties.isTrace());
    }

    @Test
    void seededShowdownIsReproducible() {
        Showdown first = pokerCards.play();
        Showdown second = pokerCards.play();

        assertEquals(6, first.getSeats().size());
        assertFalse(first.winners().isEmpty());
        assertEquals(describe(first), describe(second));
    }

    @Test
    void traceWritesEvaluationStepsToTheLog(CapturedOutput output) {
        Showdown showdown = pokerCards.play();

        String log = output.getOut();
        assertTrue(log.contains("Board: "), log);
        assertTrue(log.contains("--- Evaluating "), log);
        assertTrue(log.contains("kickers: "), log);
        String category = showdown.getSeats().get(0).hand().getCategory().getDisplayName();
        assertTrue(log.contains("* " + category + ": "), log);
    }

    private static List<String> describe(Showdown showdown) {
        return showdown.getSeats().stream()
                .map(seat -> seat.name() + " " + seat.hand().describe())
                .collect(Collectors.toList());
    }
}
