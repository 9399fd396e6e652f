package dev.holdem.decision.remote;

import dev.holdem.table.Bet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Owns a {@link PlayerConnection} and serves the messages queued for it, one at a time.
 *
 * <p>Once the connection fails or is stopped, every pending and future bet request completes
 * with no decision.
 */
class ConnectionTask implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionTask.class);

    private final String player;
    private final PlayerConnection connection;
    private final BlockingQueue<Envelope> outbox;
    private boolean closed;

    ConnectionTask(String player, PlayerConnection connection, int capacity) {
        this.player = player;
        this.connection = connection;
        this.outbox = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Queue a message without blocking.
     *
     * @return false if the connection is closed or the queue is full
     */
    synchronized boolean submit(Envelope envelope) {
        if (closed) {
            return false;
        }
        return outbox.offer(envelope);
    }

    synchronized boolean isOpen() {
        return !closed;
    }

    /**
     * Stop serving and fail whatever is still queued.
     */
    void stop() {
        List<Envelope> pending = new ArrayList<>();
        synchronized (this) {
            closed = true;
            outbox.drainTo(pending);
        }
        for (Envelope envelope : pending) {
            envelope.fail();
        }
    }

    @Override
    public void run() {
        try {
            while (isOpen()) {
                serve(outbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stop();
            connection.close();
            logger.info("connection_closed", kv("player", player));
        }
    }

    private void serve(Envelope envelope) {
        try {
            connection.send(envelope.message());
            if (envelope.reply() == null) {
                return;
            }
            Optional<Bet> bet = connection.awaitBet();
            envelope.reply().complete(bet);
            if (bet.isEmpty()) {
                logger.warn("player_disconnected", kv("player", player));
                stop();
            }
        } catch (IOException e) {
            logger.warn("connection_failed", kv("player", player), e);
            envelope.fail();
            stop();
        }
    }

    /**
     * A queued message, with a reply slot when it expects a bet.
     */
    record Envelope(OutboundMessage message, CompletableFuture<Optional<Bet>> reply) {

        static Envelope update(OutboundMessage message) {
            return new Envelope(message, null);
        }

        static Envelope request(OutboundMessage message) {
            return new Envelope(message, new CompletableFuture<>());
        }

        void fail() {
            if (reply != null) {
                reply.complete(Optional.empty());
            }
        }
    }
}
