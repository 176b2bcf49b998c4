package com.eldplanner.service;

import com.eldplanner.model.DailyLog;
import com.eldplanner.model.DutyEvent;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a duty timeline into calendar-day log sheets.
 *
 * An event belongs to the day on which it starts. Events running past
 * midnight are not split, so a long rest counts entirely towards its first day.
 */
@Component
public class DailyLogAggregator {

    public List<DailyLog> aggregate(List<DutyEvent> events) {
        List<DailyLog> logs = new ArrayList<>();
        DailyLog current = null;

        for (DutyEvent event : events) {
            LocalDate day = event.getStartTime().toLocalDate();
            if (current == null || !current.getDate().equals(day)) {
                current = new DailyLog(day);
                logs.add(current);
            }
            current.add(event);
        }
        return logs;
    }
}
