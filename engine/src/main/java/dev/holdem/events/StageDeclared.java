package dev.holdem.events;

import dev.holdem.cards.Card;
import dev.holdem.table.Stage;

import java.util.List;

/**
 * The round entered a new stage.
 */
public record StageDeclared(Stage stage, List<Card> communityCards) implements GameEvent {

    public StageDeclared {
        communityCards = List.copyOf(communityCards);
    }
}
