package dev.holdem.decision.remote;

import dev.holdem.decision.BetRequest;
import dev.holdem.events.PlayerJoined;
import dev.holdem.table.Bet;
import dev.holdem.table.Stage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteDecisionProviderTest {

    private static final BetRequest REQUEST =
        new BetRequest(20, 20, Stage.PRE_FLOP, 0, List.of(), List.of(), 1000);

    private RemoteDecisionProvider provider;

    @AfterEach
    void tearDown() {
        if (provider != null) {
            provider.close();
        }
    }

    @Test
    void reply_from_the_client_should_be_returned_to_the_caller() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.reply(Bet.raise(60));
        provider = new RemoteDecisionProvider("Alice", connection, Duration.ofSeconds(5));

        assertThat(provider.decide(REQUEST)).contains(Bet.raise(60));
        assertThat(connection.getSent()).containsExactly(new OutboundMessage.PlaceBet("Alice", REQUEST));
    }

    @Test
    void updates_should_reach_the_client_before_later_requests() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.reply(Bet.call());
        provider = new RemoteDecisionProvider("Alice", connection, Duration.ofSeconds(5));

        provider.onEvent(new PlayerJoined("Bob", 2000));
        provider.decide(REQUEST);

        assertThat(connection.getSent()).containsExactly(
            new OutboundMessage.Update(new PlayerJoined("Bob", 2000)),
            new OutboundMessage.PlaceBet("Alice", REQUEST));
    }

    @Test
    void timeout_should_yield_no_decision() {
        InMemoryConnection connection = new InMemoryConnection();
        provider = new RemoteDecisionProvider("Alice", connection, Duration.ofMillis(50));

        assertThat(provider.decide(REQUEST)).isEmpty();
    }

    @Test
    void disconnect_should_yield_no_decision_and_close_the_connection() throws InterruptedException {
        InMemoryConnection connection = new InMemoryConnection();
        connection.disconnect();
        provider = new RemoteDecisionProvider("Alice", connection, Duration.ofSeconds(5));

        assertThat(provider.decide(REQUEST)).isEmpty();
        assertThat(connection.closedLatch().await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(provider.isConnected()).isFalse();
        assertThat(provider.decide(REQUEST)).isEmpty();
    }

    @Test
    void failed_send_should_yield_no_decision() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.failSends();
        provider = new RemoteDecisionProvider("Alice", connection, Duration.ofSeconds(5));

        assertThat(provider.decide(REQUEST)).isEmpty();
    }
}
