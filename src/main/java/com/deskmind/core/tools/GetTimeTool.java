package com.deskmind.core.tools;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Reports the current local date and time.
 */
@Component
public class GetTimeTool implements Tool {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy HH:mm:ss z", Locale.ENGLISH);

    private final Clock clock;

    public GetTimeTool() {
        this(Clock.systemDefaultZone());
    }

    GetTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "get_time";
    }

    @Override
    public String description() {
        return "Get the current local date and time";
    }

    @Override
    public String invoke(Map<String, Object> args) {
        return "The current time is " + ZonedDateTime.now(clock).format(FORMAT);
    }
}
