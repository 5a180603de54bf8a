package com.premiergroup.ad_warehouse.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MetricMeasures {

    BigDecimal spend;
    Integer impressions;
    Integer reach;
    Integer clicks;
    Integer purchases;
    BigDecimal purchaseValue;
    Integer videoPlays25Pct;
    Integer videoPlays50Pct;
    Integer videoPlays75Pct;
    Integer videoPlays95Pct;
    Integer videoPlays100Pct;
    Integer results;
    BigDecimal costPerResult;
}
