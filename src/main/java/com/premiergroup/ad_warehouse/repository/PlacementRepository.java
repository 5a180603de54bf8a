package com.premiergroup.ad_warehouse.repository;

import com.premiergroup.ad_warehouse.entity.Placement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PlacementRepository extends JpaRepository<Placement, Integer> {

    Optional<Placement> findByPlatformAndDeviceAndPosition(String platform, String device, String position);

    @Modifying
    @Query(value = "INSERT INTO dim_placements (platform, device, placement_position) " +
            "SELECT CAST(:platform AS NVARCHAR(4000)), CAST(:device AS NVARCHAR(4000)), CAST(:position AS NVARCHAR(4000)) " +
            "WHERE NOT EXISTS (SELECT 1 FROM dim_placements " +
            "WHERE platform = :platform AND device = :device AND placement_position = :position)",
            nativeQuery = true)
    int insertIfAbsent(@Param("platform") String platform,
                       @Param("device") String device,
                       @Param("position") String position);
}
