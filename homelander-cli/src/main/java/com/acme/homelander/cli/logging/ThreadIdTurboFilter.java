package com.acme.homelander.cli.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Puts the current thread id into the MDC under {@code key} (default {@code threadId}) so the log
 * pattern can show which thread served a request.
 */
public class ThreadIdTurboFilter extends TurboFilter {
    static final String DEFAULT_KEY = "threadId";

    private String key = DEFAULT_KEY;

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    @Override
    public FilterReply decide(
            Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
        if (!isStarted()) {
            return FilterReply.NEUTRAL;
        }
        MDC.put(key, String.valueOf(Thread.currentThread().getId()));
        return FilterReply.NEUTRAL;
    }
}
