package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.entity.CalendarDate;
import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.exception.DimensionResolutionException;
import com.premiergroup.ad_warehouse.repository.CalendarDateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.Locale;

@Service
@Log4j2
@RequiredArgsConstructor
public class DateKeyDeriver {

    private final CalendarDateRepository calendarDateRepository;

    /**
     * yyyyMMdd as an integer, e.g. 2024-03-07 -> 20240307.
     */
    public static int toDateKey(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    /**
     * Derives the key for the date and makes sure the dim_date row exists.
     */
    public Integer resolve(LocalDate date) {
        if (date == null) {
            throw new DimensionResolutionException(Dimension.DATE, null, "calendar date is missing");
        }
        int dateKey = toDateKey(date);
        try {
            if (!calendarDateRepository.existsById(dateKey)) {
                calendarDateRepository.saveAndFlush(toCalendarDate(dateKey, date));
                log.debug("Created date row {}", dateKey);
            }
        } catch (DataAccessException e) {
            throw new DimensionResolutionException(Dimension.DATE, date, e);
        }
        return dateKey;
    }

    static CalendarDate toCalendarDate(int dateKey, LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return CalendarDate.builder()
                .dateKey(dateKey)
                .fullDate(date)
                .calendarYear(date.getYear())
                .calendarMonth(date.getMonthValue())
                .calendarDay(date.getDayOfMonth())
                .dayOfWeek(dayOfWeek.getValue())
                .calendarQuarter(date.get(IsoFields.QUARTER_OF_YEAR))
                .weekOfYear(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .monthName(date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .dayName(dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .weekend(dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY)
                .build();
    }
}
