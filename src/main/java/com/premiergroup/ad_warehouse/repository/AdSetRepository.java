package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.AdSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AdSetRepository extends JpaRepository<AdSet, Integer> {

    Optional<AdSet> findByAdSetFbid(Long adSetFbid);

    @Modifying
    @Query(value = "INSERT INTO dim_ad_sets (campaign_id, ad_set_fbid, ad_set_name, created_date) " +
            "SELECT CAST(:campaignId AS INTEGER), CAST(:adSetFbid AS BIGINT), " +
            "CAST(:adSetName AS NVARCHAR(4000)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_ad_sets WHERE ad_set_fbid = :adSetFbid)",
            nativeQuery = true)
    int insertIfAbsent(@Param("adSetFbid") Long adSetFbid,
                       @Param("campaignId") Integer campaignId,
                       @Param("adSetName") String adSetName);
}
