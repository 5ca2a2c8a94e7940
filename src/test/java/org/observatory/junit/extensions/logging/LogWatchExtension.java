package org.observatory.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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
 * Fails a test when it logs at WARN or above unless the event is permitted with {@link AllowLog}
 * or demanded with {@link ExpectLog}. Events are captured by a Logback turbo filter, so logger
 * levels do not hide them. Permitted and expected events are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Captured> events = filter.events();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Captured e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.permits(e)) {
                    unexpected.add(String.format("[%s] %s - %s", e.level, e.loggerName, e.message));
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog exp : rules.expects) {
            long count = events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                    exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            ((LoggerContext) LoggerFactory.getILoggerFactory()).getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static Rules resolveRules(ExtensionContext context) {
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

    private static boolean matches(Captured e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, e.loggerName)
            && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Captured(String loggerName, Level level, String message) {
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean permits(Captured e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()))
                || expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Captured> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            Rules current = rules;
            // A null format is an isXxxEnabled() check, not an event.
            if (format == null || level == null || !level.isGreaterOrEqual(toLogback(current.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Captured event = new Captured(logger.getName(), level, message != null ? message : "");
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Captured> events() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }
}
