package dev.holdem.decision.remote;

import dev.holdem.decision.BetRequest;
import dev.holdem.decision.DecisionProvider;
import dev.holdem.events.EventSink;
import dev.holdem.events.GameEvent;
import dev.holdem.table.Bet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Synchronous decision provider and event sink for a player on the other end of a connection.
 *
 * <p>The game thread hands requests to a connection task running on its own thread and blocks on
 * the reply until the timeout. A closed connection or an elapsed timeout yields no decision
 * rather than a hang.
 */
public class RemoteDecisionProvider implements DecisionProvider, EventSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RemoteDecisionProvider.class);

    public static final int QUEUE_CAPACITY = 32;

    private final String player;
    private final Duration timeout;
    private final ConnectionTask task;
    private final ExecutorService executor;

    public RemoteDecisionProvider(String player, PlayerConnection connection, Duration timeout) {
        this.player = player;
        this.timeout = timeout;
        this.task = new ConnectionTask(player, connection, QUEUE_CAPACITY);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "holdem-connection-" + player);
            t.setDaemon(true);
            return t;
        });
        executor.execute(task);
    }

    @Override
    public Optional<Bet> decide(BetRequest request) {
        ConnectionTask.Envelope envelope =
            ConnectionTask.Envelope.request(new OutboundMessage.PlaceBet(player, request));
        if (!task.submit(envelope)) {
            logger.warn("bet_request_not_sent", kv("player", player), kv("open", task.isOpen()));
            return Optional.empty();
        }
        try {
            return envelope.reply().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("bet_request_timed_out", kv("player", player), kv("timeout_ms", timeout.toMillis()));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("bet_request_failed", kv("player", player), e.getCause());
            return Optional.empty();
        }
    }

    @Override
    public void onEvent(GameEvent event) {
        if (!task.submit(ConnectionTask.Envelope.update(new OutboundMessage.Update(event)))) {
            logger.warn("update_dropped", kv("player", player), kv("event", event.getClass().getSimpleName()));
        }
    }

    public boolean isConnected() {
        return task.isOpen();
    }

    @Override
    public void close() {
        task.stop();
        executor.shutdownNow();
    }
}
