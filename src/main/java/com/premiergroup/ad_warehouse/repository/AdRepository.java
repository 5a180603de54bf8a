package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.Ad;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AdRepository extends JpaRepository<Ad, Integer> {

    Optional<Ad> findByAdFbid(Long adFbid);

    @Modifying
    @Query(value = "INSERT INTO dim_ads (ad_set_id, ad_fbid, ad_name, ad_thumbnail_url, permanent_link, created_date) " +
            "SELECT CAST(:adSetId AS INTEGER), CAST(:adFbid AS BIGINT), CAST(:adName AS NVARCHAR(4000)), " +
            "CAST(:adThumbnailUrl AS NVARCHAR(4000)), CAST(:permanentLink AS NVARCHAR(4000)), CURRENT_TIMESTAMP " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_ads WHERE ad_fbid = :adFbid)",
            nativeQuery = true)
    int insertIfAbsent(@Param("adFbid") Long adFbid,
                       @Param("adSetId") Integer adSetId,
                       @Param("adName") String adName,
                       @Param("adThumbnailUrl") String adThumbnailUrl,
                       @Param("permanentLink") String permanentLink);

    // unbounded text, written right after creation through the entity mapping
    @Modifying
    @Query("UPDATE Ad a SET a.adBody = :adBody WHERE a.adFbid = :adFbid")
    int updateAdBody(@Param("adFbid") Long adFbid, @Param("adBody") String adBody);
}
