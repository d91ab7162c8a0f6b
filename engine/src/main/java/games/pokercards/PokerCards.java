package games.pokercards;

import games.pokercards.config.ShowdownProperties;
import games.pokercards.game.Card;
import games.pokercards.game.CardFormatter;
import games.pokercards.game.Deck;
import games.pokercards.hand.EvaluationListener;
import games.pokercards.hand.LoggingEvaluationListener;
import games.pokercards.hand.Showdown;
import games.pokercards.table.HoldemDeal;
import games.pokercards.table.HoldemDealer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PokerCards implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PokerCards.class);

    private final ShowdownProperties properties;

    public PokerCards(ShowdownProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PokerCards.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Deals one Texas Hold'em hand to the configured seats and compares them at showdown.
     *
     * @return the showdown of every seat
     */
    public Showdown play() {
        Random random = properties.getSeed() == null ? new Random() : new Random(properties.getSeed());
        Deck deck = new Deck(random);
        deck.shuffle();

        List<String> seats = new ArrayList<>();
        for (int i = 1; i <= properties.getPlayers(); i++) {
            seats.add("Seat " + i);
        }
        HoldemDealer dealer = new HoldemDealer(deck, seats);
        dealer.dealRemaining();
        HoldemDeal deal = dealer.snapshot();

        EvaluationListener listener = properties.isTrace()
                ? new LoggingEvaluationListener()
                : EvaluationListener.NONE;
        Showdown showdown = dealer.showdown(listener);

        log.info("Board: {}", CardFormatter.join(deal.board()));
        for (Showdown.Seat seat : showdown.getSeats()) {
            List<Card> hole = deal.holeCards().get(seat.name());
            log.info("{} [{}] -> {}", seat.name(), CardFormatter.join(hole), seat.hand().describe());
        }
        List<Showdown.Seat> winners = showdown.winners();
        String names = winners.stream().map(Showdown.Seat::name).collect(Collectors.joining(", "));
        if (winners.size() > 1) {
            log.info("Split pot between {}", names);
        } else {
            log.info("{} wins with {}", names, winners.get(0).hand().getCategory().getDisplayName());
        }
        log.info("Deck after the hand: {}", deck.stats());
        return showdown;
    }
}
