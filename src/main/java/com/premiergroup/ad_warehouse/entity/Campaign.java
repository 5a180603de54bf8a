package com.premiergroup.ad_warehouse.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "dim_campaigns",
        uniqueConstraints = @UniqueConstraint(name = "uq_dim_campaigns_campaign_fbid", columnNames = "campaign_fbid"),
        indexes = @Index(name = "ix_dim_campaigns_client_id", columnList = "client_id")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "client")
@ToString(exclude = "client")
public class Campaign implements DimensionRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @Column(name = "campaign_fbid", nullable = false)
    private Long campaignFbid;

    @Column(name = "campaign_name")
    private String campaignName;

    @Column(length = 100)
    private String objective;

    @Column(name = "created_date")
    private LocalDateTime createdDate;

    @Override
    public Integer getSurrogateKey() {
        return id;
    }

    @Override
    public Integer getParentKey() {
        return client.getId();
    }
}
