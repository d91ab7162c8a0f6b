package games.pokercards.game;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Formats card collections as short code lists for display and logging.
 */
public final class CardFormatter {
    /** Separator between cards of one group. */
    public static final String CARD_SEPARATOR = ",";
    /** Separator between groups of cards. */
    public static final String GROUP_SEPARATOR = " / ";

    private CardFormatter() {}

    /**
     * Joins card codes with commas, e.g. "AS,KD,7H".
     *
     * @param cards the cards to format
     * @return the comma-joined codes; empty for no cards
     */
    public static String join(Collection<Card> cards) {
        return cards.stream().map(Card::toString).collect(Collectors.joining(CARD_SEPARATOR));
    }

    /**
     * Joins groups of cards, each rendered by {@link #join}, with slashes, e.g. "5C,5H / KS,KD".
     *
     * @param groups the card groups to format
     * @return the slash-joined groups; empty for no groups
     */
    public static String joinGroups(Collection<? extends Collection<Card>> groups) {
        return groups.stream().map(CardFormatter::join).collect(Collectors.joining(GROUP_SEPARATOR));
    }
}
