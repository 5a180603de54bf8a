package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "dim_placements",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_dim_placements_platform_device_position",
                columnNames = {"platform", "device", "placement_position"})
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Placement implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, length = 100)
    private String platform;

    @Column(nullable = false, length = 100)
    private String device;

    @Column(name = "placement_position", nullable = false, length = 100)
    private String position;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }
}
