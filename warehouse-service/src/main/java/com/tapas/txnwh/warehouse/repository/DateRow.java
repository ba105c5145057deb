package com.tapas.txnwh.warehouse.repository;

import java.time.DayOfWeek;
import java.time.LocalDate;

public record DateRow(
        LocalDate fullDate,
        int calendarYear,
        int calendarMonth,
        int dayOfMonth,
        int dayOfWeek,
        boolean weekend) {

    public static DateRow of(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return new DateRow(
                date,
                date.getYear(),
                date.getMonthValue(),
                date.getDayOfMonth(),
                dow.getValue(),
                dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY);
    }
}
