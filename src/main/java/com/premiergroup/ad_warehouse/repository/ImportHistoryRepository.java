package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.ImportHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportHistoryRepository extends JpaRepository<ImportHistory, Integer> {

    List<ImportHistory> findAllByOrderByCreatedAtDescIdDesc();
}
