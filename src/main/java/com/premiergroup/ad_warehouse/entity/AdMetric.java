package com.premiergroup.ad_warehouse.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Fact row: daily metrics for one (date, ad, demographic, placement) grain.
 * Client, campaign and ad set are carried alongside for reporting queries.
 */
@Entity
@Table(
        name = "fact_metrics",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_fact_metrics_grain",
                columnNames = {"date_key", "ad_id", "demographic_id", "placement_id"}),
        indexes = {
                @Index(name = "ix_fact_metrics_client_date", columnList = "client_id, date_key"),
                @Index(name = "ix_fact_metrics_campaign_date", columnList = "campaign_id, date_key")
        }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "spend", "impressions", "clicks"})
public class AdMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "date_key", nullable = false)
    private CalendarDate date;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ad_set_id", nullable = false)
    private AdSet adSet;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ad_id", nullable = false)
    private Ad ad;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "demographic_id", nullable = false)
    private Demographic demographic;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "placement_id", nullable = false)
    private Placement placement;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal spend;

    @Column(nullable = false)
    private Integer impressions;

    private Integer reach;
    private Integer clicks;
    private Integer purchases;

    @Column(name = "purchase_value", precision = 18, scale = 4)
    private BigDecimal purchaseValue;

    @Column(name = "video_plays_25_pct")
    private Integer videoPlays25Pct;

    @Column(name = "video_plays_50_pct")
    private Integer videoPlays50Pct;

    @Column(name = "video_plays_75_pct")
    private Integer videoPlays75Pct;

    @Column(name = "video_plays_95_pct")
    private Integer videoPlays95Pct;

    @Column(name = "video_plays_100_pct")
    private Integer videoPlays100Pct;

    private Integer results;

    @Column(name = "cost_per_result", precision = 18, scale = 4)
    private BigDecimal costPerResult;

    @Column(name = "created_date", nullable = false)
    private LocalDateTime createdDate;
}
