package org.seanet.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at WARN (or the {@link FailOnLog} level) or above unless the event is covered by {@link AllowLog}
 * or {@link ExpectLog}, and fails it when an {@link ExpectLog} is not met.
 * <p>
 * Events are captured by a Logback turbo filter, so they are seen regardless of the
 * configured logger levels. Allowed and expected events are not printed.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent event : filter.events) {
                if (event.level.isGreaterOrEqual(rules.threshold) && !rules.allows(event) && !rules.expects(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expected : rules.expectations) {
            long count = filter.events.stream().filter(e -> matches(e, expected)).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getRequiredTestMethod().getAnnotation(FailOnLog.class);
        if (fail == null) {
            fail = context.getRequiredTestClass().getAnnotation(FailOnLog.class);
        }
        List<AllowLog> allows = Stream.concat(
                Arrays.stream(context.getRequiredTestClass().getAnnotationsByType(AllowLog.class)),
                Arrays.stream(context.getRequiredTestMethod().getAnnotationsByType(AllowLog.class))).toList();
        List<ExpectLog> expectations = Stream.concat(
                Arrays.stream(context.getRequiredTestClass().getAnnotationsByType(ExpectLog.class)),
                Arrays.stream(context.getRequiredTestMethod().getAnnotationsByType(ExpectLog.class))).toList();
        Level threshold = toLogback(fail != null ? fail.level() : LogLevel.WARN);
        boolean disabled = fail != null && fail.disabled();
        Level captureLevel = threshold;
        for (ExpectLog expected : expectations) {
            Level level = toLogback(expected.level());
            if (!level.isGreaterOrEqual(captureLevel)) {
                captureLevel = level;
            }
        }
        return new Rules(threshold, captureLevel, disabled, allows, expectations);
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static boolean matches(CapturedEvent event, ExpectLog expected) {
        return matches(event, expected.level(), expected.loggerPattern(), expected.messagePattern());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(Level threshold, Level captureLevel, boolean disabled, List<AllowLog> allowances, List<ExpectLog> expectations) {

        boolean allows(CapturedEvent event) {
            return allowances.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean expects(CapturedEvent event) {
            return expectations.stream().anyMatch(e -> matches(event, e));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private final Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Level checks such as isDebugEnabled() arrive without a format.
            if (format == null || !level.isGreaterOrEqual(rules.captureLevel)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.allows(event) || rules.expects(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
