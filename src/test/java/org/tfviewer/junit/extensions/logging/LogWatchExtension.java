package org.tfviewer.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when something logs at WARN or above that the test did not announce with
 * {@link AllowLog} or {@link ExpectLog}, and when an {@link ExpectLog} is not met.
 * <p>
 * Events are captured by a Logback turbo filter, so background threads (poll loops, decode
 * workers) are watched as well and logger levels do not hide anything. Announced events are
 * suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(rulesFor(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(CapturingFilter.class, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(CapturingFilter.class, CapturingFilter.class);
        if (filter != null) {
            filter.rules = rulesFor(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(CapturingFilter.class, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (Event event : events) {
                if (event.level().isGreaterOrEqual(toLogback(rules.minLevel())) && !rules.announces(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long found = events.stream()
                .filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern()))
                .count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing log: expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(CapturingFilter.class, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules rulesFor(ExtensionContext context) {
        AnnotatedElement method = context.getElement().orElse(null);
        Class<?> testClass = context.getTestClass().orElse(null);

        FailOnLog fail = method != null ? method.getAnnotation(FailOnLog.class) : null;
        if (fail == null && testClass != null) {
            fail = testClass.getAnnotation(FailOnLog.class);
        }
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        if (testClass != null) {
            allows.addAll(List.of(testClass.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(testClass.getAnnotationsByType(ExpectLog.class)));
        }
        if (method != null && method != testClass) {
            allows.addAll(List.of(method.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(method.getAnnotationsByType(ExpectLog.class)));
        }
        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.logger())
            && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean announces(Event event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(toLogback(current.minLevel()))) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.announces(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
