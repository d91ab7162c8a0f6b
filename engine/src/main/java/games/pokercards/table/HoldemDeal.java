package games.pokercards.table;

import games.pokercards.game.Card;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the cards dealt in a Texas Hold'em hand.
 *
 * @param street the street reached
 * @param holeCards two hole cards per seat, in seating order
 * @param board the community cards dealt so far
 */
public record HoldemDeal(Street street, Map<String, List<Card>> holeCards, List<Card> board) {
}
