package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CampaignRepository extends JpaRepository<Campaign, Integer> {

    Optional<Campaign> findByCampaignFbid(Long campaignFbid);

    @Modifying
    @Query(value = "INSERT INTO dim_campaigns (client_id, campaign_fbid, campaign_name, objective, created_date) " +
            "SELECT CAST(:clientId AS INTEGER), CAST(:campaignFbid AS BIGINT), " +
            "CAST(:campaignName AS NVARCHAR(4000)), CAST(:objective AS NVARCHAR(4000)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_campaigns WHERE campaign_fbid = :campaignFbid)",
            nativeQuery = true)
    int insertIfAbsent(@Param("campaignFbid") Long campaignFbid,
                       @Param("clientId") Integer clientId,
                       @Param("campaignName") String campaignName,
                       @Param("objective") String objective);
}
