package dev.holdem.runner;

import dev.holdem.events.EventSink;
import dev.holdem.events.GameEvent;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;

/**
 * Writes every event as a line of text.
 */
public class OutputSink implements EventSink {

    private final TextRenderer renderer = new TextRenderer();
    private final Consumer<String> outputFn;
    private final boolean showTimestamps;
    private final DateTimeFormatter timeFormatter =
        DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    public OutputSink(Consumer<String> outputFn, boolean showTimestamps) {
        this.outputFn = outputFn;
        this.showTimestamps = showTimestamps;
    }

    @Override
    public void onEvent(GameEvent event) {
        String text = renderer.render(event);
        if (showTimestamps) {
            text = "[" + timeFormatter.format(Instant.now()) + "] " + text;
        }
        outputFn.accept(text);
    }
}
