package org.netpreserve.newsagger.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as plain milliseconds ({@code 3000}), short forms ({@code 3s}, {@code 60m},
 * {@code 1h30m}, {@code 250ms}) or full ISO-8601 ({@code PT5M}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofMillis(parser.getLongValue());
        String text = parser.getText().trim();
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            return (Duration) context.handleWeirdStringValue(Duration.class, text, "not a duration");
        }
    }

    public static Duration parse(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P")) return Duration.parse(upper);
        if (upper.endsWith("MS")) return Duration.ofMillis(Long.parseLong(upper.substring(0, upper.length() - 2)));
        return Duration.parse("PT" + upper);
    }
}
