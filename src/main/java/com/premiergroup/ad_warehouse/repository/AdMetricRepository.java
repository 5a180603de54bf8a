package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.AdMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdMetricRepository extends JpaRepository<AdMetric, Long> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AdMetric m " +
            "WHERE m.date.dateKey = :dateKey " +
            "AND m.ad.id = :adId " +
            "AND m.demographic.id = :demographicId " +
            "AND m.placement.id = :placementId")
    int deleteByGrain(@Param("dateKey") Integer dateKey,
                      @Param("adId") Integer adId,
                      @Param("demographicId") Integer demographicId,
                      @Param("placementId") Integer placementId);
}
