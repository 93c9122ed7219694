package com.openrangelabs.donpetre.mobility.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of UTC calendar dates
 */
public record DateWindow(LocalDate from, LocalDate to) {

    public DateWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Date window bounds are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Date window ends before it starts: " + from + " > " + to);
        }
    }

    public static DateWindow of(LocalDate from, LocalDate to) {
        return new DateWindow(from, to);
    }

    public static DateWindow singleDay(LocalDate day) {
        return new DateWindow(day, day);
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(from, to) + 1;
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(days());
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
