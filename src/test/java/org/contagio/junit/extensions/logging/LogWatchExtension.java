package org.contagio.junit.extensions.logging;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link AllowLog}
 * or {@link ExpectLog}, and fails it when an {@link ExpectLog} event is missing.
 * <p>
 * Events are captured through a Logback turbo filter installed for the test class, so events
 * from every thread are seen. Declared events are suppressed from the console output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.clear();

        StringBuilder failures = new StringBuilder();
        if (!rules.disabled) {
            for (Event event : events) {
                if (!rules.isDeclared(event)) {
                    failures.append("Unexpected log: ").append(event).append('\n');
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> Rules.matches(e, expect.level(), expect.loggerPattern(),
                    expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                failures.append(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d%n",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (failures.length() > 0) {
            throw new AssertionError(failures.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        // Method contexts see the class-level store through their parent
        return context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
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
            if (format == null || !level.isGreaterOrEqual(toLogback(current.minLevel)) || !logger.isEnabledFor(level)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.isDeclared(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        void clear() {
            events.clear();
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            AnnotatedElement testClass = context.getRequiredTestClass();
            AnnotatedElement element = context.getElement().orElse(testClass);
            FailOnLog fail = element.getAnnotation(FailOnLog.class);
            if (fail == null) {
                fail = testClass.getAnnotation(FailOnLog.class);
            }
            List<AllowLog> allows = new ArrayList<>(Arrays.asList(testClass.getAnnotationsByType(AllowLog.class)));
            List<ExpectLog> expects = new ArrayList<>(Arrays.asList(testClass.getAnnotationsByType(ExpectLog.class)));
            if (element != testClass) {
                allows.addAll(Arrays.asList(element.getAnnotationsByType(AllowLog.class)));
                expects.addAll(Arrays.asList(element.getAnnotationsByType(ExpectLog.class)));
            }
            return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(),
                    allows, expects);
        }

        boolean isDeclared(Event event) {
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

        static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
            return event.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, event.loggerName())
                    && Pattern.matches(messagePattern, event.message());
        }
    }
}
