package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "dim_ad_sets",
        uniqueConstraints = @UniqueConstraint(name = "uq_dim_ad_sets_ad_set_fbid", columnNames = "ad_set_fbid"),
        indexes = @Index(name = "ix_dim_ad_sets_campaign_id", columnList = "campaign_id")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "campaign")
@ToString(exclude = "campaign")
public class AdSet implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "ad_set_fbid", nullable = false)
    private Long adSetFbid;

    @Column(name = "ad_set_name")
    private String adSetName;

    @Column(name = "created_date")
    private LocalDateTime createdDate;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }

    @Override
    public Integer getParentKey() {
        return campaign.getId();
    }
}
