package dev.holdem.cards;

import dev.holdem.Errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Draw pile plus burn pile. Cards leave the draw pile exactly once.
 */
public class Deck {

    private final List<Card> cards;
    private final List<Card> burned = new ArrayList<>();

    private Deck(List<Card> cards) {
        this.cards = cards;
    }

    /**
     * A new unshuffled deck of 52 cards, ordered rank-major.
     */
    public static Deck standard() {
        List<Card> cards = new ArrayList<>(52);
        for (Rank rank : Rank.values()) {
            for (Suit suit : Suit.values()) {
                cards.add(new Card(rank, suit));
            }
        }
        return new Deck(cards);
    }

    public static Deck shuffled(Random rng) {
        Deck deck = standard();
        Collections.shuffle(deck.cards, rng);
        return deck;
    }

    /**
     * A deck whose draw order is exactly the given cards.
     */
    public static Deck ofCards(List<Card> cards) {
        return new Deck(new ArrayList<>(cards));
    }

    /**
     * Take cards from the top of the draw pile.
     *
     * @throws Errors.DeckExhaustedError if fewer than {@code count} cards remain
     */
    public List<Card> take(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        if (cards.size() < count) {
            throw new Errors.DeckExhaustedError(count, cards.size());
        }
        List<Card> top = cards.subList(0, count);
        List<Card> taken = new ArrayList<>(top);
        top.clear();
        return taken;
    }

    /**
     * Move the top card to the burn pile.
     *
     * @throws Errors.DeckExhaustedError if the draw pile is empty
     */
    public Card burn() {
        Card card = take(1).get(0);
        burned.add(card);
        return card;
    }

    public int size() {
        return cards.size();
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public List<Card> getBurned() {
        return Collections.unmodifiableList(burned);
    }
}
