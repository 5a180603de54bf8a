package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Nationalized;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "dim_ads",
        uniqueConstraints = @UniqueConstraint(name = "uq_dim_ads_ad_fbid", columnNames = "ad_fbid"),
        indexes = @Index(name = "ix_dim_ads_ad_set_id", columnList = "ad_set_id")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "adSet")
@ToString(exclude = "adSet")
public class Ad implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ad_set_id", nullable = false)
    private AdSet adSet;

    @Column(name = "ad_fbid", nullable = false)
    private Long adFbid;

    @Column(name = "ad_name", length = 500)
    private String adName;

    @Lob
    @Nationalized
    @Column(name = "ad_body")
    private String adBody;

    @Column(name = "ad_thumbnail_url", length = 1024)
    private String adThumbnailUrl;

    @Column(name = "permanent_link", length = 1024)
    private String permanentLink;

    @Column(name = "created_date")
    private LocalDateTime createdDate;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }

    @Override
    public Integer getParentKey() {
        return adSet.getId();
    }
}
