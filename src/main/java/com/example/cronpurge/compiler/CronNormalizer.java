package com.example.cronpurge.compiler;

import com.example.cronpurge.models.CronSchedule;
import java.util.ArrayList;
import java.util.List;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * Converts between cron strings and {@link CronSchedule}. Grammar checks are delegated to Spring's
 * {@link CronExpression}, which only understands the six-field form, so five-field input is
 * checked with a leading {@code 0} seconds field.
 */
@Component
public class CronNormalizer {

    private static final String DEFAULT_FIELD = "*";
    private static final String DEFAULT_SECOND = "0";

    /**
     * Splits a five- or six-field cron expression into its tokens. Five-field input keeps the
     * default second of {@code 0}.
     *
     * @throws JobCompilerException with {@code INVALID_CRON_FORMAT} on any other field count or
     *         when the expression is rejected by the cron grammar
     */
    public CronSchedule parse(String expression) {
        String[] parts = split(expression);
        validate(parts.length == 5 ? DEFAULT_SECOND + " " + String.join(" ", parts) : String.join(" ", parts),
                expression);

        if (parts.length == 5) {
            return CronSchedule.builder()
                    .minute(parts[0])
                    .hour(parts[1])
                    .dayOfMonth(parts[2])
                    .month(parts[3])
                    .dayOfWeek(parts[4])
                    .build();
        }
        return CronSchedule.builder()
                .second(parts[0])
                .minute(parts[1])
                .hour(parts[2])
                .dayOfMonth(parts[3])
                .month(parts[4])
                .dayOfWeek(parts[5])
                .build();
    }

    public String format(CronSchedule schedule, boolean includeSeconds) {
        return format(schedule, includeSeconds, true);
    }

    /**
     * Joins the schedule back into a single-space separated cron string. Blank fields become
     * {@code *}; a blank second becomes {@code 0} and is only emitted when {@code includeSeconds}.
     * When {@code validate} is set, a rejected result means the fields do not fit together and
     * the failure names the produced string.
     */
    public String format(CronSchedule schedule, boolean includeSeconds, boolean validate) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule must not be null");
        }

        List<String> parts = new ArrayList<>(6);
        if (includeSeconds) {
            parts.add(orDefault(schedule.getSecond(), DEFAULT_SECOND));
        }
        parts.add(orDefault(schedule.getMinute(), DEFAULT_FIELD));
        parts.add(orDefault(schedule.getHour(), DEFAULT_FIELD));
        parts.add(orDefault(schedule.getDayOfMonth(), DEFAULT_FIELD));
        parts.add(orDefault(schedule.getMonth(), DEFAULT_FIELD));
        parts.add(orDefault(schedule.getDayOfWeek(), DEFAULT_FIELD));

        String cron = String.join(" ", parts);
        if (validate) {
            validate(includeSeconds ? cron : DEFAULT_SECOND + " " + cron, cron);
        }
        return cron;
    }

    /**
     * Parses and re-formats an expression, keeping the seconds field only if the input had one.
     */
    public String normalize(String expression) {
        boolean withSeconds = split(expression).length == 6;
        return format(parse(expression), withSeconds, false);
    }

    private static String[] split(String expression) {
        if (expression == null || expression.isBlank()) {
            throw JobCompilerException.invalidCronFormat(String.valueOf(expression));
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            throw JobCompilerException.invalidCronFormat(expression);
        }
        return parts;
    }

    private static void validate(String sixFieldCron, String reported) {
        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException ex) {
            throw JobCompilerException.invalidCronFormat(reported, ex);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
