package com.openrangelabs.blacklist.collector.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive date range requested from a source export.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    public DateWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * Window ending on {@code today} and reaching {@code days} back.
     */
    public static DateWindow endingOn(LocalDate today, int days) {
        return new DateWindow(today.minusDays(Math.max(days, 0)), today);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public String startCompact() {
        return start.format(COMPACT);
    }

    public String endCompact() {
        return end.format(COMPACT);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
