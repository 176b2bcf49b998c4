package com.eldplanner.service;

import com.eldplanner.model.DailyHours;
import com.eldplanner.model.RollingHoursSummary;
import com.eldplanner.model.WeeklyMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sums on-duty hours over the trailing 7 or 8 recorded days.
 */
@Component
public class RollingHoursTracker {

    public RollingHoursSummary rollingHours(List<DailyHours> history, WeeklyMode mode) {
        List<DailyHours> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(DailyHours::date));

        int from = Math.max(0, sorted.size() - mode.getDays());
        List<DailyHours> window = new ArrayList<>(sorted.subList(from, sorted.size()));

        double used = window.stream().mapToDouble(DailyHours::onDutyHours).sum();
        double available = Math.max(0.0, mode.getMaxHours() - used);
        return new RollingHoursSummary(used, available, mode, window);
    }
}
