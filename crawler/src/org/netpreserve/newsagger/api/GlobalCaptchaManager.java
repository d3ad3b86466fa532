package org.netpreserve.newsagger.api;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide CAPTCHA cooling-off state. One instance is created per process and handed to every component that
 * issues requests, so a challenge seen by any of them pauses all of them.
 * <p>
 * A CAPTCHA seen while already cooling off moves the end of the window to {@code now + coolingOff} if that is later
 * than the current end. Windows never add up.
 */
public class GlobalCaptchaManager {
    private static final Logger log = LoggerFactory.getLogger(GlobalCaptchaManager.class);
    public static final Duration DEFAULT_COOLING_OFF = Duration.ofMinutes(60);

    private final Clock clock;
    private final Duration coolingOff;
    private @Nullable Instant coolingOffUntil;
    private @Nullable String lastEndpoint;
    private int triggerCount;

    public GlobalCaptchaManager() {
        this(Clock.systemUTC(), DEFAULT_COOLING_OFF);
    }

    public GlobalCaptchaManager(Clock clock, Duration coolingOff) {
        this.clock = clock;
        this.coolingOff = coolingOff;
    }

    public synchronized void recordCaptcha(String endpoint) {
        Instant candidate = clock.instant().plus(coolingOff);
        if (coolingOffUntil == null || candidate.isAfter(coolingOffUntil)) {
            coolingOffUntil = candidate;
        }
        triggerCount++;
        lastEndpoint = endpoint;
        log.atWarn().addKeyValue("endpoint", endpoint)
                .addKeyValue("triggers", triggerCount)
                .addKeyValue("until", coolingOffUntil)
                .log("CAPTCHA detected, cooling off all requests");
    }

    public synchronized Gate canMakeRequests() {
        if (coolingOffUntil == null) return Gate.OPEN;
        Instant now = clock.instant();
        if (!now.isBefore(coolingOffUntil)) return Gate.OPEN;
        Duration remaining = Duration.between(now, coolingOffUntil);
        return new Gate(false, "CAPTCHA cooling-off active for another " + remaining.toSeconds() + "s (triggered by "
                                + lastEndpoint + ", " + triggerCount + " challenges so far)", remaining);
    }

    public synchronized void resetState() {
        coolingOffUntil = null;
        lastEndpoint = null;
        triggerCount = 0;
    }

    public synchronized @Nullable Instant coolingOffUntil() {
        return coolingOffUntil;
    }

    public synchronized int triggerCount() {
        return triggerCount;
    }

    /**
     * Answer to "may I send a request now?".
     *
     * @param allowed   true if no cooling-off window is active
     * @param reason    human readable explanation when not allowed
     * @param remaining time left in the current window, zero when allowed
     */
    public record Gate(boolean allowed, @Nullable String reason, Duration remaining) {
        static final Gate OPEN = new Gate(true, null, Duration.ZERO);
    }
}
