package games.pokercards.hand;

import games.pokercards.game.Card;
import games.pokercards.game.CardFormatter;
import games.pokercards.game.Rank;
import games.pokercards.game.Suit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The best five-card poker hand that can be made from a set of cards.
 * <p>
 * A hand may hold more than five cards (e.g., two hole cards plus five community cards in
 * Texas Hold'em); evaluation picks the strongest {@link HandCategory}, the cards completing
 * it ({@link #getHandCards()}) and the highest remaining cards that fill the hand up to five
 * ({@link #getKickers()}).
 * <p>
 * Evaluated hands are ordered by strength through {@link #compareTo(PokerHand)}: category
 * first, then the hand cards pair by pair, then the kickers, comparing ranks only. Hands of
 * equal strength compare as {@code 0} even when their suits differ, so the ordering is not
 * consistent with {@link #equals(Object)}, which is identity.
 * <p>
 * Some limits of the evaluation:
 * <ul>
 *   <li>Aces are high only; A-2-3-4-5 is not a straight.</li>
 *   <li>Straights are five consecutive cards of the rank-sorted hand, so a card sharing a rank
 *       with its neighbour inside the run breaks it.</li>
 *   <li>When several suits make a flush, the suit met first in rank order wins, not the
 *       highest flush.</li>
 * </ul>
 * Instances are not thread-safe, but separate instances share no state and can be evaluated
 * concurrently.
 */
public class PokerHand implements Comparable<PokerHand> {
    /** Number of cards that make up a poker hand. */
    public static final int HAND_SIZE = 5;

    private final EvaluationListener listener;
    /** Cards to pick the hand from, highest rank first. */
    private List<Card> cards;
    /** {@code null} until evaluated. */
    private HandCategory category;
    private List<Card> handCards;
    private List<Card> kickers;

    /**
     * Creates and evaluates a hand.
     *
     * @param cards at least five cards
     * @throws InsufficientCardsException if fewer than five cards are given
     */
    public PokerHand(Collection<Card> cards) {
        this(cards, true);
    }

    /**
     * Creates a hand, evaluating it right away if asked to.
     *
     * @param cards at least five cards
     * @param evaluate whether to call {@link #evaluate()} now
     * @throws InsufficientCardsException if fewer than five cards are given
     */
    public PokerHand(Collection<Card> cards, boolean evaluate) {
        this(cards, evaluate, EvaluationListener.NONE);
    }

    /**
     * Creates a hand that reports its evaluation steps to {@code listener}.
     *
     * @param cards at least five cards
     * @param evaluate whether to call {@link #evaluate()} now
     * @param listener receiver of evaluation events (must not be null)
     * @throws InsufficientCardsException if fewer than five cards are given
     */
    public PokerHand(Collection<Card> cards, boolean evaluate, EvaluationListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
        setCards(cards);
        if (evaluate) {
            evaluate();
        }
    }

    /**
     * Creates and evaluates a hand from card codes.
     *
     * @param codes at least five card codes such as "AS", "TH"
     * @return the evaluated hand
     */
    public static PokerHand of(String... codes) {
        return new PokerHand(Card.listOf(codes));
    }

    /**
     * Replaces the cards of this hand and clears any previous evaluation.
     * Call {@link #evaluate()} afterwards to rank the new cards.
     *
     * @param cards at least five cards; the collection is copied
     * @throws InsufficientCardsException if fewer than five cards are given
     */
    public final void setCards(Collection<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        if (cards.size() < HAND_SIZE) {
            throw new InsufficientCardsException(cards.size());
        }
        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(Card.RANK_DESCENDING);
        this.cards = sorted;
        this.category = null;
        this.handCards = null;
        this.kickers = null;
    }

    /**
     * Returns the cards of this hand, highest rank first.
     *
     * @return an unmodifiable view of the cards
     */
    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Works out the hand category, hand cards and kickers from the current cards.
     * Evaluating again without changing the cards gives the same result.
     */
    public final void evaluate() {
        listener.evaluationStarted(getCards());

        List<List<Card>> straights = findStraights();
        if (!straights.isEmpty()) {
            listener.straightsFound(straights);
        }
        List<List<Card>> flushes = findFlushes();
        if (!flushes.isEmpty()) {
            listener.flushesFound(flushes);
        }

        List<List<Card>> pairs = new ArrayList<>();
        List<List<Card>> threes = new ArrayList<>();
        List<List<Card>> fours = new ArrayList<>();
        for (List<Card> group : groupByRank()) {
            int size = group.size();
            if (size >= 4) {
                fours.add(List.copyOf(group.subList(0, 4)));
            } else if (size == 3) {
                threes.add(group);
            } else if (size == 2) {
                pairs.add(group);
            }
        }
        if (!pairs.isEmpty() || !threes.isEmpty() || !fours.isEmpty()) {
            listener.rankGroupsFound(pairs, threes, fours);
        }

        resolveCategory(straights, flushes, pairs, threes, fours);
        listener.categorySelected(category, handCards);
        fillKickers();
        listener.kickersSelected(kickers);
    }

    /**
     * Checks whether this hand has been evaluated since its cards were last set.
     *
     * @return {@code true} once {@link #evaluate()} has run
     */
    public boolean isEvaluated() {
        return category != null;
    }

    /**
     * Returns the category of the best hand.
     *
     * @return the hand category
     * @throws IllegalStateException if the hand has not been evaluated
     */
    public HandCategory getCategory() {
        requireEvaluated();
        return category;
    }

    /**
     * Returns the numeric strength of the best hand, 0 (high card) to 8 (straight flush).
     *
     * @return the hand rank
     * @throws IllegalStateException if the hand has not been evaluated
     */
    public int getHandRank() {
        return getCategory().getRank();
    }

    /**
     * Returns the cards completing the category: one for a high card, two for a pair,
     * four for two pair or four of a kind, three for three of a kind, five otherwise.
     *
     * @return an unmodifiable list of hand cards
     * @throws IllegalStateException if the hand has not been evaluated
     */
    public List<Card> getHandCards() {
        requireEvaluated();
        return handCards;
    }

    /**
     * Returns the highest cards outside the hand cards, enough to make five cards in total.
     *
     * @return an unmodifiable list of kickers, empty when the hand cards already number five
     * @throws IllegalStateException if the hand has not been evaluated
     */
    public List<Card> getKickers() {
        requireEvaluated();
        return kickers;
    }

    /**
     * Compares the strength of two evaluated hands.
     *
     * @param other the hand to compare with
     * @return positive if this hand is stronger, negative if weaker, zero for a tie
     * @throws IllegalStateException if either hand has not been evaluated
     */
    @Override
    public int compareTo(PokerHand other) {
        int result = getCategory().compareTo(other.getCategory());
        if (result != 0) {
            return result;
        }
        result = compareByRank(handCards, other.handCards);
        if (result != 0) {
            return result;
        }
        return compareByRank(kickers, other.kickers);
    }

    /**
     * Describes the evaluated hand, e.g. "Two Pair: KS,KD,5C,5H / AS".
     *
     * @return category name, hand cards and, if any, kickers
     * @throws IllegalStateException if the hand has not been evaluated
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(getCategory().getDisplayName());
        sb.append(": ").append(CardFormatter.join(handCards));
        if (!kickers.isEmpty()) {
            sb.append(CardFormatter.GROUP_SEPARATOR).append(CardFormatter.join(kickers));
        }
        return sb.toString();
    }

    /**
     * Returns all cards of the hand, highest first, e.g. "[AS,KS,KD,7H,5C,5H,2D]".
     */
    @Override
    public String toString() {
        return "[" + CardFormatter.join(cards) + "]";
    }

    /** Every run of five consecutive ranks in the sorted cards, highest first. */
    private List<List<Card>> findStraights() {
        List<List<Card>> straights = new ArrayList<>();
        for (int i = 0; i + HAND_SIZE <= cards.size(); i++) {
            List<Card> window = cards.subList(i, i + HAND_SIZE);
            if (isRun(window)) {
                straights.add(List.copyOf(window));
            }
        }
        return straights;
    }

    private static boolean isRun(List<Card> window) {
        for (int j = 1; j < window.size(); j++) {
            Rank expected = window.get(j - 1).getRank().lower();
            if (window.get(j).getRank() != expected) {
                return false;
            }
        }
        return true;
    }

    /** Every window of five cards within a suit holding five or more cards. */
    private List<List<Card>> findFlushes() {
        List<List<Card>> flushes = new ArrayList<>();
        for (List<Card> suited : groupBySuit().values()) {
            for (int i = 0; i + HAND_SIZE <= suited.size(); i++) {
                flushes.add(List.copyOf(suited.subList(i, i + HAND_SIZE)));
            }
        }
        return flushes;
    }

    /** Cards grouped by rank, highest rank first; ranks without cards are skipped. */
    private List<List<Card>> groupByRank() {
        Rank[] ranks = Rank.values();
        List<List<Card>> buckets = new ArrayList<>(ranks.length);
        for (int i = 0; i < ranks.length; i++) {
            buckets.add(new ArrayList<>());
        }
        for (Card card : cards) {
            buckets.get(card.getRank().ordinal()).add(card);
        }
        List<List<Card>> groups = new ArrayList<>();
        for (int i = ranks.length - 1; i >= 0; i--) {
            List<Card> bucket = buckets.get(i);
            if (!bucket.isEmpty()) {
                groups.add(Collections.unmodifiableList(bucket));
            }
        }
        return groups;
    }

    /** Cards grouped by suit, suits in the order first met in the sorted cards. */
    private Map<Suit, List<Card>> groupBySuit() {
        Map<Suit, List<Card>> bySuit = new LinkedHashMap<>();
        for (Card card : cards) {
            bySuit.computeIfAbsent(card.getSuit(), s -> new ArrayList<>()).add(card);
        }
        return bySuit;
    }

    private void resolveCategory(List<List<Card>> straights, List<List<Card>> flushes,
            List<List<Card>> pairs, List<List<Card>> threes, List<List<Card>> fours) {
        for (List<Card> straight : straights) {
            if (flushes.contains(straight)) {
                select(HandCategory.STRAIGHT_FLUSH, straight);
                return;
            }
        }
        if (!fours.isEmpty()) {
            select(HandCategory.FOUR_OF_A_KIND, fours.get(0));
            return;
        }
        if (threes.size() > 1) {
            select(HandCategory.FULL_HOUSE, concat(threes.get(0), threes.get(1).subList(0, 2)));
            return;
        }
        if (threes.size() == 1 && !pairs.isEmpty()) {
            select(HandCategory.FULL_HOUSE, concat(threes.get(0), pairs.get(0)));
            return;
        }
        if (!flushes.isEmpty()) {
            select(HandCategory.FLUSH, flushes.get(0));
            return;
        }
        if (!straights.isEmpty()) {
            select(HandCategory.STRAIGHT, straights.get(0));
            return;
        }
        if (!threes.isEmpty()) {
            select(HandCategory.THREE_OF_A_KIND, threes.get(0));
            return;
        }
        if (pairs.size() > 1) {
            select(HandCategory.TWO_PAIR, concat(pairs.get(0), pairs.get(1)));
            return;
        }
        if (pairs.size() == 1) {
            select(HandCategory.ONE_PAIR, pairs.get(0));
            return;
        }
        select(HandCategory.HIGH_CARD, cards.subList(0, 1));
    }

    private void select(HandCategory selected, List<Card> selectedCards) {
        this.category = selected;
        this.handCards = List.copyOf(selectedCards);
    }

    private void fillKickers() {
        int kickerCount = HAND_SIZE - handCards.size();
        if (kickerCount <= 0) {
            kickers = List.of();
            return;
        }
        List<Card> remaining = new ArrayList<>(cards);
        for (Card card : handCards) {
            remaining.remove(card);
        }
        kickers = List.copyOf(remaining.subList(0, Math.min(kickerCount, remaining.size())));
    }

    private void requireEvaluated() {
        if (category == null) {
            throw new IllegalStateException("Hand has not been evaluated: " + this);
        }
    }

    private static List<Card> concat(List<Card> first, List<Card> second) {
        List<Card> joined = new ArrayList<>(first.size() + second.size());
        joined.addAll(first);
        joined.addAll(second);
        return joined;
    }

    private static int compareByRank(List<Card> mine, List<Card> theirs) {
        int shared = Math.min(mine.size(), theirs.size());
        for (int i = 0; i < shared; i++) {
            int result = mine.get(i).compareRank(theirs.get(i));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }
}
