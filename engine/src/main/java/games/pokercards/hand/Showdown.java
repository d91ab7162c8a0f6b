package games.pokercards.hand;

import games.pokercards.game.Card;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the evaluated hands of several seats to find the winner or winners.
 * <p>
 * Seats keep the order in which they were added; among hands of equal strength that
 * order is kept in {@link #standings()} too.
 */
public class Showdown {
    private static final Logger log = LoggerFactory.getLogger(Showdown.class);

    private final List<Seat> seats = new ArrayList<>();

    /**
     * A named seat and its hand.
     *
     * @param name the seat or player name
     * @param hand the evaluated hand
     */
    public record Seat(String name, PokerHand hand) {
        public Seat {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(hand, "hand");
        }
    }

    /**
     * Builds a showdown for a shared-board game such as Texas Hold'em: each seat's hole cards
     * are combined with the board and evaluated. Seats are evaluated in parallel.
     *
     * @param holeCards hole cards per seat, in seating order
     * @param board the community cards
     * @param listener receiver of evaluation events; must be thread-safe
     * @return the showdown holding one evaluated hand per seat
     * @throws InsufficientCardsException if a seat has fewer than five cards in total
     */
    public static Showdown ofBoard(Map<String, List<Card>> holeCards, List<Card> board,
            EvaluationListener listener) {
        List<Seat> evaluated = holeCards.entrySet().parallelStream()
                .map(entry -> {
                    List<Card> cards = new ArrayList<>(entry.getValue());
                    cards.addAll(board);
                    return new Seat(entry.getKey(), new PokerHand(cards, true, listener));
                })
                .collect(Collectors.toList());
        Showdown showdown = new Showdown();
        evaluated.forEach(seat -> showdown.add(seat.name(), seat.hand()));
        return showdown;
    }

    /**
     * Adds a seat, evaluating its hand first if needed.
     *
     * @param name the seat name
     * @param hand the seat's hand
     * @return this showdown
     */
    public Showdown add(String name, PokerHand hand) {
        if (!hand.isEvaluated()) {
            hand.evaluate();
        }
        seats.add(new Seat(name, hand));
        return this;
    }

    /**
     * Returns the seats in the order they were added.
     *
     * @return an unmodifiable list of seats
     */
    public List<Seat> getSeats() {
        return Collections.unmodifiableList(seats);
    }

    /**
     * Returns the seats strongest hand first.
     *
     * @return a new list of seats sorted by descending hand strength
     */
    public List<Seat> standings() {
        List<Seat> sorted = new ArrayList<>(seats);
        sorted.sort(Comparator.comparing(Seat::hand).reversed());
        return sorted;
    }

    /**
     * Returns every seat whose hand ties with the strongest hand; more than one means a split.
     *
     * @return the winning seats in seating order, empty if there are no seats
     */
    public List<Seat> winners() {
        if (seats.isEmpty()) {
            return List.of();
        }
        PokerHand best = Collections.max(seats, Comparator.comparing(Seat::hand)).hand();
        List<Seat> winners = seats.stream()
                .filter(seat -> seat.hand().compareTo(best) == 0)
                .collect(Collectors.toList());
        if (log.isDebugEnabled()) {
            log.debug("Showdown of {} seats won by {} with {}",
                    seats.size(),
                    winners.stream().map(Seat::name).collect(Collectors.joining(", ")),
                    best.describe());
        }
        return winners;
    }
}
