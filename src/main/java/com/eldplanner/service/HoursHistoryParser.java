package com.eldplanner.service;

import com.eldplanner.exception.NoValidLogsException;
import com.eldplanner.model.DailyHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads caller-supplied daily hour records.
 *
 * Records look like {@code {"date": "2024-03-01", "hours": 9.5}}; the hours
 * key may also be {@code on_duty_hours} or {@code onDutyHours}, and the date
 * may carry a time part. Bad records are recovered one at a time:
 * <ul>
 *   <li>an unreadable date takes the day after the previous good record;</li>
 *   <li>a record with no usable hours, or a bad date and no previous good
 *       record, is skipped.</li>
 * </ul>
 * If nothing at all can be read from a non-empty history,
 * {@link NoValidLogsException} is thrown.
 */
@Component
public class HoursHistoryParser {

    private static final Logger log = LoggerFactory.getLogger(HoursHistoryParser.class);

    private static final List<String> HOURS_KEYS = List.of("hours", "on_duty_hours", "onDutyHours");

    private static final List<Function<String, LocalDate>> DATE_FORMS = List.of(
        LocalDate::parse,
        text -> LocalDateTime.parse(text).toLocalDate(),
        text -> OffsetDateTime.parse(text).toLocalDate());

    public List<DailyHours> parse(List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<DailyHours> parsed = new ArrayList<>();
        LocalDate previous = null;
        int rejected = 0;

        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            if (record == null) {
                rejected++;
                log.warn("Skipping history record {}: record is null", i);
                continue;
            }

            Double hours = readHours(record);
            if (hours == null || hours < 0 || hours > 24) {
                rejected++;
                log.warn("Skipping history record {}: unusable hours {}", i, record);
                continue;
            }

            LocalDate date = readDate(record.get("date"));
            if (date == null) {
                if (previous == null) {
                    rejected++;
                    log.warn("Skipping history record {}: unreadable date {} and no earlier date to infer from",
                        i, record.get("date"));
                    continue;
                }
                date = previous.plusDays(1);
                log.warn("History record {} has unreadable date {}, assuming {}", i, record.get("date"), date);
            }

            parsed.add(new DailyHours(date, hours));
            previous = date;
        }

        if (parsed.isEmpty()) {
            throw new NoValidLogsException(rejected);
        }
        return parsed;
    }

    private static Double readHours(Map<String, Object> record) {
        for (String key : HOURS_KEYS) {
            Object value = record.get(key);
            if (value instanceof Number number) {
                double hours = number.doubleValue();
                return Double.isNaN(hours) ? null : hours;
            }
            if (value instanceof String text) {
                try {
                    return Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static LocalDate readDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        for (Function<String, LocalDate> form : DATE_FORMS) {
            try {
                return form.apply(trimmed);
            } catch (DateTimeParseException e) {
                log.trace("'{}' is not in this date form: {}", trimmed, e.getMessage());
            }
        }
        return null;
    }
}
