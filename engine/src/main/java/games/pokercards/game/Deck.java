package games.pokercards.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents a single 52-card deck lying face down on the table.
 * <p>
 * The deck keeps its cards in three piles: {@code active} (still in the deck),
 * {@code popped} (dealt out) and {@code discarded} (burned). Between them the piles always
 * hold each of the 52 standard cards exactly once. All piles are ordered bottom up, so
 * the top of the deck is the last element of the active pile.
 * <p>
 * A new deck is not shuffled; call {@link #shuffle()} before dealing. Instances are not
 * thread-safe.
 */
public class Deck {
    private static final Logger log = LoggerFactory.getLogger(Deck.class);

    /** Cards still in the deck, bottom first. */
    private final List<Card> active = new ArrayList<>();
    /** Cards dealt out, in dealing order. */
    private final List<Card> popped = new ArrayList<>();
    /** Cards burned, in burning order. */
    private final List<Card> discarded = new ArrayList<>();
    /** Source of randomness for {@link #shuffle()}. */
    private final Random random;

    /**
     * Constructs a full, unshuffled deck.
     */
    public Deck() {
        this(new Random());
    }

    /**
     * Constructs a full, unshuffled deck that shuffles with the given random source.
     *
     * @param random the random source used by {@link #shuffle()} (must not be null)
     */
    public Deck(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        active.addAll(Card.standardDeck());
    }

    /**
     * Randomly permutes the active cards. Dealt and burned cards are left alone.
     */
    public void shuffle() {
        Collections.shuffle(active, random);
    }

    /**
     * Deals the top card of the deck.
     *
     * @return the dealt card, now in the popped pile
     * @throws EmptyDeckException if no active cards are left
     */
    public Card deal() {
        Card card = takeTop();
        popped.add(card);
        return card;
    }

    /**
     * Burns the top card of the deck, moving it to the discarded pile unseen.
     *
     * @throws EmptyDeckException if no active cards are left
     */
    public void burn() {
        discarded.add(takeTop());
    }

    /**
     * Returns dealt or burned cards to the bottom of the deck.
     *
     * @param cards the cards to return
     * @throws CardNotRemovedException if a card is neither dealt nor burned
     * @see #returnCards(Collection, Position)
     */
    public void returnCards(Collection<Card> cards) {
        returnCards(cards, Position.BOTTOM);
    }

    /**
     * Returns dealt or burned cards to the deck, one at a time in the given order.
     * <p>
     * With {@link Position#TOP} each card is placed on top, so the last card given ends up
     * as the next card dealt. With {@link Position#BOTTOM} each card is slid under the deck,
     * so the last card given ends up at the very bottom.
     * <p>
     * Cards are moved one by one: if a card in the batch is not dealt or burned, the call
     * fails but the cards before it have already been returned.
     *
     * @param cards the cards to return (may be one of this deck's own piles)
     * @param position where to put the cards
     * @throws CardNotRemovedException if a card is neither dealt nor burned
     */
    public void returnCards(Collection<Card> cards, Position position) {
        Objects.requireNonNull(position, "position");
        for (Card card : new ArrayList<>(cards)) {
            if (!discarded.remove(card) && !popped.remove(card)) {
                throw new CardNotRemovedException(card);
            }
            if (position == Position.BOTTOM) {
                active.add(0, card);
            } else {
                active.add(card);
            }
        }
    }

    /** Returns every burned card to the bottom of the deck. */
    public void returnDiscarded() {
        returnDiscarded(Position.BOTTOM);
    }

    /**
     * Returns every burned card to the deck, in burning order.
     *
     * @param position where to put the cards
     */
    public void returnDiscarded(Position position) {
        returnCards(discarded, position);
    }

    /** Returns every dealt card to the bottom of the deck. */
    public void returnPopped() {
        returnPopped(Position.BOTTOM);
    }

    /**
     * Returns every dealt card to the deck, in dealing order.
     *
     * @param position where to put the cards
     */
    public void returnPopped(Position position) {
        returnCards(popped, position);
    }

    /** Returns every dealt card, then every burned card, to the bottom of the deck. */
    public void returnAll() {
        returnAll(Position.BOTTOM);
    }

    /**
     * Returns every dealt card, then every burned card, to the bottom of the deck.
     * <p>
     * The {@code position} argument is accepted but not applied: both piles always go to
     * the bottom.
     *
     * @param position ignored
     */
    public void returnAll(Position position) {
        if (position != Position.BOTTOM && log.isDebugEnabled()) {
            log.debug("returnAll ignores position {}; returning to bottom", position);
        }
        returnPopped(Position.BOTTOM);
        returnDiscarded(Position.BOTTOM);
    }

    /**
     * Returns the number of cards in each pile.
     *
     * @return active, popped and discarded counts
     */
    public DeckStats stats() {
        return new DeckStats(active.size(), popped.size(), discarded.size());
    }

    /**
     * Returns an unmodifiable view of the active cards, bottom first.
     *
     * @return the cards still in the deck
     */
    public List<Card> getActive() {
        return Collections.unmodifiableList(active);
    }

    /**
     * Returns an unmodifiable view of the dealt cards, in dealing order.
     *
     * @return the popped pile
     */
    public List<Card> getPopped() {
        return Collections.unmodifiableList(popped);
    }

    /**
     * Returns an unmodifiable view of the burned cards, in burning order.
     *
     * @return the discarded pile
     */
    public List<Card> getDiscarded() {
        return Collections.unmodifiableList(discarded);
    }

    /**
     * Returns the active cards bottom to top, e.g. "[AS KS QS ... 2C]".
     *
     * @return the string form of the deck
     */
    @Override
    public String toString() {
        return active.stream().map(Card::toString).collect(Collectors.joining(" ", "[", "]"));
    }

    private Card takeTop() {
        if (active.isEmpty()) {
            throw new EmptyDeckException("No cards left in the deck");
        }
        return active.remove(active.size() - 1);
    }
}
