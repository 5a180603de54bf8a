package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.CalendarDate;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CalendarDateRepository extends JpaRepository<CalendarDate, Integer> {
}
