package games.pokercards.table;

import static org.junit.jupiter.api.Assertions.*;

import games.pokercards.game.Card;
import games.pokercards.game.Deck;
import games.pokercards.game.DeckStats;
import games.pokercards.game.EmptyDeckException;
import games.pokercards.hand.EvaluationListener;
import games.pokercards.hand.Showdown;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HoldemDealerTest {

    @Test
    void holeCardsGoOnePerSeatPerRound() {
        Deck deck = new Deck();
        HoldemDealer dealer = new HoldemDealer(deck, List.of("a", "b", "c"));

        dealer.dealHoleCards();

        HoldemDeal deal = dealer.snapshot();
        assertEquals(Street.PREFLOP, deal.street());
        assertEquals(Card.listOf("2C", "5C"), deal.holeCards().get("a"));
        assertEquals(Card.listOf("3C", "6C"), deal.holeCards().get("b"));
        assertEquals(Card.listOf("4C", "7C"), deal.holeCards().get("c"));
        assertTrue(deal.board().isEmpty());
    }

    @Test
    void eachStreetBurnsBeforeDealing() {
        Deck deck = new Deck();
        HoldemDealer dealer = new HoldemDealer(deck, List.of("a", "b"));
        dealer.dealHoleCards();

        dealer.dealFlop();
        assertEquals(Card.of("6C"), deck.getDiscarded().get(0));
        assertEquals(Card.listOf("7C", "8C", "9C"), dealer.snapshot().board());

        dealer.dealTurn();
        dealer.dealRiver();

        assertEquals(Street.RIVER, dealer.getStreet());
        assertEquals(Card.listOf("7C", "8C", "9C", "JC", "KC"), dealer.snapshot().board());
        assertEquals(Card.listOf("6C", "TC", "QC"), deck.getDiscarded());
        assertEquals(new DeckStats(52 - 4 - 5 - 3, 9, 3), deck.stats());
    }

    @Test
    void streetsMustBeDealtInOrder() {
        HoldemDealer dealer = new HoldemDealer(new Deck(), List.of("a", "b"));
        assertThrows(IllegalStateException.class, dealer::dealFlop);
        assertThrows(IllegalStateException.class, dealer::snapshot);

        dealer.dealHoleCards();
        assertThrows(IllegalStateException.class, dealer::dealHoleCards);
        assertThrows(IllegalStateException.class, dealer::dealTurn);
        assertThrows(IllegalStateException.class, () -> dealer.showdown(EvaluationListener.NONE));

        dealer.dealRemaining();
        assertEquals(Street.RIVER, dealer.getStreet());
        dealer.showdown(EvaluationListener.NONE);
        assertEquals(Street.SHOWDOWN, dealer.getStreet());
        assertThrows(IllegalStateException.class, dealer::dealRemaining);
    }

    @Test
    void seatCountIsChecked() {
        assertThrows(IllegalArgumentException.class, () -> new HoldemDealer(new Deck(), List.of("solo")));
        assertThrows(IllegalArgumentException.class,
                () -> new HoldemDealer(new Deck(), List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11")));
        assertThrows(IllegalArgumentException.class, () -> new HoldemDealer(new Deck(), List.of("a", "a")));
    }

    @Test
    void showdownEvaluatesEverySeatOnSevenDistinctCards() {
        Deck deck = new Deck(new Random(42));
        deck.shuffle();
        HoldemDealer dealer = new HoldemDealer(deck, List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j"));
        dealer.dealRemaining();

        Showdown showdown = dealer.showdown(EvaluationListener.NONE);

        assertEquals(10, showdown.getSeats().size());
        assertFalse(showdown.winners().isEmpty());
        Set<Card> dealt = new HashSet<>(deck.getPopped());
        assertEquals(25, dealt.size());
        for (Showdown.Seat seat : showdown.getSeats()) {
            assertEquals(7, seat.hand().getCards().size());
            assertTrue(dealt.containsAll(seat.hand().getCards()));
        }
    }

    @Test
    void dealingFromExhaustedDeckFails() {
        Deck deck = new Deck();
        for (int i = 0; i < 50; i++) {
            deck.deal();
        }
        HoldemDealer dealer = new HoldemDealer(deck, List.of("a", "b"));
        assertThrows(EmptyDeckException.class, dealer::dealHoleCards);
    }
}
