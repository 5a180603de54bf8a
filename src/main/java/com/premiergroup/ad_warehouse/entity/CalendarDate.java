package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Date dimension. The key is assigned, never generated: yyyyMMdd as an integer.
 */
@Entity
@Table(name = "dim_date")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarDate {

    @Id
    @Column(name = "date_key")
    private Integer dateKey;

    @Column(name = "full_date", nullable = false)
    private LocalDate fullDate;

    @Column(name = "calendar_year", nullable = false)
    private Integer calendarYear;

    @Column(name = "calendar_month", nullable = false)
    private Integer calendarMonth;

    @Column(name = "calendar_day", nullable = false)
    private Integer calendarDay;

    // ISO numbering, Monday = 1
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    @Column(name = "calendar_quarter", nullable = false)
    private Integer calendarQuarter;

    @Column(name = "week_of_year", nullable = false)
    private Integer weekOfYear;

    @Column(name = "month_name", nullable = false, length = 20)
    private String monthName;

    @Column(name = "day_name", nullable = false, length = 20)
    private String dayName;

    @Column(name = "is_weekend", nullable = false)
    private Boolean weekend;
}
