package dev.holdem.table;

import dev.holdem.cards.Card;
import dev.holdem.decision.DecisionProvider;
import dev.holdem.events.EventSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A seated player: chips, cards, round flags, and the source of their decisions.
 */
public class Player {

    private String name;
    private final DecisionProvider provider;
    private final EventSink sink;
    private final List<Card> holeCards = new ArrayList<>();
    private long bankRoll;
    private long stageBet;
    private boolean hasActed;
    private boolean folded;
    private boolean allIn;

    public Player(String name, DecisionProvider provider) {
        this(name, provider, EventSink.none());
    }

    /**
     * @param sink receives every public event plus this player's hole cards
     */
    public Player(String name, DecisionProvider provider, EventSink sink) {
        this.name = name;
        this.provider = provider;
        this.sink = sink == null ? EventSink.none() : sink;
    }

    public String getName() { return name; }
    void setName(String name) { this.name = name; }

    public DecisionProvider getProvider() { return provider; }
    public EventSink getSink() { return sink; }

    public List<Card> getHoleCards() { return Collections.unmodifiableList(holeCards); }
    public void setHoleCards(List<Card> cards) {
        holeCards.clear();
        holeCards.addAll(cards);
    }

    public long getBankRoll() { return bankRoll; }
    public void setBankRoll(long bankRoll) { this.bankRoll = bankRoll; }

    public long getStageBet() { return stageBet; }
    public void setStageBet(long stageBet) { this.stageBet = stageBet; }

    public boolean hasActed() { return hasActed; }
    public void setHasActed(boolean hasActed) { this.hasActed = hasActed; }

    public boolean isFolded() { return folded; }
    public void setFolded(boolean folded) { this.folded = folded; }

    public boolean isAllIn() { return allIn; }
    public void setAllIn(boolean allIn) { this.allIn = allIn; }

    /**
     * Neither folded nor all-in: still asked to bet.
     */
    public boolean isActive() {
        return !folded && !allIn;
    }

    /**
     * Clear the per-round flags and cards.
     */
    public void resetForRound() {
        holeCards.clear();
        stageBet = 0;
        hasActed = false;
        folded = false;
        allIn = false;
    }

    @Override
    public String toString() {
        return name + " (" + bankRoll + ")";
    }
}
