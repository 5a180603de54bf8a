package com.premiergroup.ad_warehouse.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One row of an ad performance report: the natural keys of every dimension,
 * their descriptive attributes and the measures for that day.
 */
@Value
@Builder
public class AdPerformanceRecord {

    LocalDate date;

    Long accountId;
    String accountName;

    Long campaignId;
    String campaignName;
    String objective;

    Long adSetId;
    String adSetName;

    Long adId;
    String adName;
    String adBody;
    String adThumbnailUrl;
    String permanentLink;

    String ageBracket;
    String gender;

    String platform;
    String device;
    String position;

    MetricMeasures measures;
}
