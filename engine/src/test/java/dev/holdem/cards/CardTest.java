package dev.holdem.cards;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CardTest {

    @Test
    void test_parse_reads_rank_and_suit() {
        Card card = Card.parse("Td");

        assertEquals(Rank.TEN, card.rank());
        assertEquals(Suit.DIAMONDS, card.suit());
        assertEquals("Td", card.code());
    }

    @Test
    void test_cards_order_by_rank_before_suit() {
        assertTrue(Card.parse("Ac").compareTo(Card.parse("Kh")) > 0);
        assertTrue(Card.parse("2h").compareTo(Card.parse("3c")) < 0);
    }

    @Test
    void test_aces_are_high() {
        assertEquals(14, Rank.ACE.getValue());
        assertEquals(Rank.ACE, Rank.fromValue(14));
    }

    @Test
    void test_to_string_uses_display_names() {
        assertEquals("Ace of Spades", Card.parse("As").toString());
    }

    @Test
    void test_parse_rejects_bad_codes() {
        assertThrows(IllegalArgumentException.class, () -> Card.parse("1x"));
        assertThrows(IllegalArgumentException.class, () -> Card.parse("Ace"));
    }
}
