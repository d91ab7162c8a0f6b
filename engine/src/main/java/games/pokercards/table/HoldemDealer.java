package games.pokercards.table;

import games.pokercards.game.Card;
import games.pokercards.game.Deck;
import games.pokercards.hand.EvaluationListener;
import games.pokercards.hand.Showdown;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deals one Texas Hold'em hand from a {@link Deck}: two hole cards per seat, then the flop,
 * turn and river, each preceded by a burn card.
 * <p>
 * The dealer only moves cards. Betting, turn order and pots belong to the caller. Streets must
 * be dealt in order; a step out of order throws {@link IllegalStateException}.
 */
public class HoldemDealer {
    private static final Logger log = LoggerFactory.getLogger(HoldemDealer.class);

    /** Fewest seats a hand can be dealt to. */
    public static final int MIN_SEATS = 2;
    /** Most seats a hand can be dealt to. */
    public static final int MAX_SEATS = 10;
    private static final int HOLE_CARDS = 2;
    private static final int FLOP_CARDS = 3;

    private final Deck deck;
    private final Map<String, List<Card>> holeCards = new LinkedHashMap<>();
    private final List<Card> board = new ArrayList<>();
    /** Last street dealt; {@code null} before the hole cards. */
    private Street street;

    /**
     * Creates a dealer for the given seats.
     *
     * @param deck the deck to deal from, normally shuffled
     * @param seats distinct seat names in dealing order, {@value #MIN_SEATS} to {@value #MAX_SEATS}
     * @throws IllegalArgumentException if the seat count is out of range or names repeat
     */
    public HoldemDealer(Deck deck, List<String> seats) {
        this.deck = Objects.requireNonNull(deck, "deck");
        Objects.requireNonNull(seats, "seats");
        if (seats.size() < MIN_SEATS || seats.size() > MAX_SEATS) {
            throw new IllegalArgumentException(
                    "Seats must number " + MIN_SEATS + " to " + MAX_SEATS + ", got " + seats.size());
        }
        for (String seat : seats) {
            if (holeCards.put(Objects.requireNonNull(seat, "seat"), new ArrayList<>()) != null) {
                throw new IllegalArgumentException("Duplicate seat: " + seat);
            }
        }
    }

    /**
     * Deals two hole cards to every seat, one card per seat per round.
     */
    public void dealHoleCards() {
        if (street != null) {
            throw new IllegalStateException("Hole cards already dealt");
        }
        for (int round = 0; round < HOLE_CARDS; round++) {
            for (List<Card> hand : holeCards.values()) {
                hand.add(deck.deal());
            }
        }
        street = Street.PREFLOP;
    }

    /** Burns one card and deals the three flop cards. */
    public void dealFlop() {
        advanceTo(Street.FLOP);
        deck.burn();
        for (int i = 0; i < FLOP_CARDS; i++) {
            board.add(deck.deal());
        }
    }

    /** Burns one card and deals the turn card. */
    public void dealTurn() {
        advanceTo(Street.TURN);
        deck.burn();
        board.add(deck.deal());
    }

    /** Burns one card and deals the river card. */
    public void dealRiver() {
        advanceTo(Street.RIVER);
        deck.burn();
        board.add(deck.deal());
    }

    /**
     * Deals whatever streets are still missing, up to and including the river.
     */
    public void dealRemaining() {
        if (street == null) {
            dealHoleCards();
        }
        while (street != Street.RIVER) {
            switch (street) {
                case PREFLOP:
                    dealFlop();
                    break;
                case FLOP:
                    dealTurn();
                    break;
                case TURN:
                    dealRiver();
                    break;
                default:
                    throw new IllegalStateException("Hand already at " + street);
            }
        }
    }

    /**
     * Evaluates every seat's hole cards together with the board.
     *
     * @param listener receiver of evaluation events; must be thread-safe
     * @return the showdown of all seats
     * @throws IllegalStateException if the river has not been dealt
     */
    public Showdown showdown(EvaluationListener listener) {
        advanceTo(Street.SHOWDOWN);
        return Showdown.ofBoard(holeCards, board, listener);
    }

    /**
     * Returns the last street dealt.
     *
     * @return the street, or {@code null} before the hole cards are dealt
     */
    public Street getStreet() {
        return street;
    }

    /**
     * Returns a copy of the cards dealt so far.
     *
     * @return the current deal
     * @throws IllegalStateException before the hole cards are dealt
     */
    public HoldemDeal snapshot() {
        if (street == null) {
            throw new IllegalStateException("Nothing dealt yet");
        }
        Map<String, List<Card>> hole = new LinkedHashMap<>();
        holeCards.forEach((seat, cards) -> hole.put(seat, List.copyOf(cards)));
        return new HoldemDeal(street, Collections.unmodifiableMap(hole), List.copyOf(board));
    }

    private void advanceTo(Street target) {
        if (street == null || street.next() != target) {
            throw new IllegalStateException("Cannot go to " + target + " from " + street);
        }
        street = target;
        if (log.isDebugEnabled()) {
            log.debug("Moving to {} with board {}", target, board);
        }
    }
}
