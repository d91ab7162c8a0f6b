package games.pokercards.game;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Deck piles: dealing, burning, returning cards and the 52-card partition.
 */
class DeckTest {

    @Test
    void newDeckIsFullAndUnshuffled() {
        Deck deck = new Deck();
        assertEquals(new DeckStats(52, 0, 0), deck.stats());
        assertEquals(Card.of("AS"), deck.getActive().get(0));
        assertEquals(Card.of("2C"), deck.getActive().get(51));
        assertTrue(deck.toString().startsWith("[AS KS QS"));
        assertEquals(Card.of("2C"), deck.deal());
        assertEquals(Card.of("3C"), deck.deal());
    }

    @Test
    void dealtCardsReturnToTopInDealingOrder() {
        Deck deck = new Deck(new Random(11));
        deck.shuffle();
        List<Card> stack = new ArrayList<>();
        stack.add(deck.deal());
        stack.add(deck.deal());
        stack.add(deck.deal());

        assertEquals(3, deck.getPopped().size());
        assertEquals(49, deck.getActive().size());
        assertEquals(stack, deck.getPopped());

        deck.returnPopped(Position.TOP);

        assertEquals(0, deck.getPopped().size());
        assertEquals(52, deck.getActive().size());
        assertEquals(stack, deck.getActive().subList(49, 52));
    }

    @Test
    void burnedCardsReturnToTopInBurningOrder() {
        Deck deck = new Deck(new Random(5));
        deck.shuffle();
        List<Card> stack = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            deck.burn();
            stack.add(deck.getDiscarded().get(deck.getDiscarded().size() - 1));
        }

        assertEquals(new DeckStats(49, 0, 3), deck.stats());
        assertEquals(stack, deck.getDiscarded());

        deck.returnDiscarded(Position.TOP);

        assertEquals(new DeckStats(52, 0, 0), deck.stats());
        assertEquals(stack, deck.getActive().subList(49, 52));
    }

    @Test
    void cardsReturnedToBottomAreSlidUnderOneByOne() {
        Deck deck = new Deck();
        Card first = deck.deal();
        Card second = deck.deal();

        deck.returnPopped();

        assertEquals(second, deck.getActive().get(0));
        assertEquals(first, deck.getActive().get(1));
        assertEquals(Card.of("4C"), deck.getActive().get(51));
    }

    @Test
    void returningCardNotDealtFailsAfterEarlierCardsMoved() {
        Deck deck = new Deck();
        Card dealt = deck.deal();
        Card neverDealt = Card.of("AS");

        CardNotRemovedException e = assertThrows(CardNotRemovedException.class,
                () -> deck.returnCards(List.of(dealt, neverDealt), Position.TOP));

        assertEquals(neverDealt, e.getCard());
        assertEquals(new DeckStats(52, 0, 0), deck.stats());
        assertEquals(dealt, deck.getActive().get(51));
    }

    @Test
    void returningCardTwiceFails() {
        Deck deck = new Deck();
        Card dealt = deck.deal();
        deck.returnCards(List.of(dealt));
        assertThrows(CardNotRemovedException.class, () -> deck.returnCards(List.of(dealt)));
    }

    @Test
    void returnAllAlwaysGoesToBottom() {
        Deck deck = new Deck();
        Card dealt = deck.deal();
        deck.burn();
        Card burned = deck.getDiscarded().get(0);

        deck.returnAll(Position.TOP);

        assertEquals(new DeckStats(52, 0, 0), deck.stats());
        assertEquals(burned, deck.getActive().get(0));
        assertEquals(dealt, deck.getActive().get(1));
        assertEquals(Card.of("4C"), deck.getActive().get(51));
    }

    @Test
    void emptyDeckCannotDealOrBurn() {
        Deck deck = new Deck();
        for (int i = 0; i < 52; i++) {
            deck.deal();
        }
        assertThrows(EmptyDeckException.class, deck::deal);
        assertThrows(EmptyDeckException.class, deck::burn);
        assertEquals(new DeckStats(0, 52, 0), deck.stats());
    }

    @Test
    void pilesAlwaysPartitionTheFullDeck() {
        Random random = new Random(2024);
        Deck deck = new Deck(random);
        for (int step = 0; step < 500; step++) {
            int op = random.nextInt(6);
            if (op == 0) {
                deck.shuffle();
            } else if (op == 1 && !deck.getActive().isEmpty()) {
                deck.deal();
            } else if (op == 2 && !deck.getActive().isEmpty()) {
                deck.burn();
            } else if (op == 3) {
                deck.returnPopped(random.nextBoolean() ? Position.TOP : Position.BOTTOM);
            } else if (op == 4 && random.nextBoolean()) {
                deck.returnDiscarded(Position.TOP);
            } else if (op == 4) {
                deck.returnDiscarded();
            } else if (op == 5 && random.nextInt(4) == 0) {
                deck.returnAll();
            }

            assertEquals(52, deck.stats().total());
            Set<Card> all = new HashSet<>(deck.getActive());
            all.addAll(deck.getPopped());
            all.addAll(deck.getDiscarded());
            assertEquals(new HashSet<>(Card.standardDeck()), all);
        }
    }
}
