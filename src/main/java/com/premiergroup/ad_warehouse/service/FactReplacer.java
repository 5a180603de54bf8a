package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.DimensionKeySet;
import com.premiergroup.ad_warehouse.dto.MetricMeasures;
import com.premiergroup.ad_warehouse.entity.AdMetric;
import com.premiergroup.ad_warehouse.exception.FactReplacementException;
import com.premiergroup.ad_warehouse.repository.AdMetricRepository;
import com.premiergroup.ad_warehouse.repository.AdRepository;
import com.premiergroup.ad_warehouse.repository.AdSetRepository;
import com.premiergroup.ad_warehouse.repository.CalendarDateRepository;
import com.premiergroup.ad_warehouse.repository.CampaignRepository;
import com.premiergroup.ad_warehouse.repository.ClientRepository;
import com.premiergroup.ad_warehouse.repository.DemographicRepository;
import com.premiergroup.ad_warehouse.repository.PlacementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Last-write-wins replacement of the fact row at a grain. Runs in the caller's
 * transaction so the delete never commits without the insert.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class FactReplacer {

    private final AdMetricRepository adMetricRepository;
    private final CalendarDateRepository calendarDateRepository;
    private final ClientRepository clientRepository;
    private final CampaignRepository campaignRepository;
    private final AdSetRepository adSetRepository;
    private final AdRepository adRepository;
    private final DemographicRepository demographicRepository;
    private final PlacementRepository placementRepository;

    public void replace(DimensionKeySet keys, MetricMeasures measures) {
        if (measures == null) {
            throw new FactReplacementException(keys, "record carries no measures");
        }
        try {
            // every row at the grain, not just the first one found
            int removed = adMetricRepository.deleteByGrain(
                    keys.dateKey(), keys.adKey(), keys.demographicKey(), keys.placementKey());

            AdMetric metric = AdMetric.builder()
                    .date(calendarDateRepository.getReferenceById(keys.dateKey()))
                    .client(clientRepository.getReferenceById(keys.clientKey()))
                    .campaign(campaignRepository.getReferenceById(keys.campaignKey()))
                    .adSet(adSetRepository.getReferenceById(keys.adSetKey()))
                    .ad(adRepository.getReferenceById(keys.adKey()))
                    .demographic(demographicRepository.getReferenceById(keys.demographicKey()))
                    .placement(placementRepository.getReferenceById(keys.placementKey()))
                    .spend(measures.getSpend())
                    .impressions(measures.getImpressions())
                    .reach(measures.getReach())
                    .clicks(measures.getClicks())
                    .purchases(measures.getPurchases())
                    .purchaseValue(measures.getPurchaseValue())
                    .videoPlays25Pct(measures.getVideoPlays25Pct())
                    .videoPlays50Pct(measures.getVideoPlays50Pct())
                    .videoPlays75Pct(measures.getVideoPlays75Pct())
                    .videoPlays95Pct(measures.getVideoPlays95Pct())
                    .videoPlays100Pct(measures.getVideoPlays100Pct())
                    .results(measures.getResults())
                    .costPerResult(measures.getCostPerResult())
                    .createdDate(LocalDateTime.now())
                    .build();
            adMetricRepository.saveAndFlush(metric);

            log.debug("{} fact row at {}", removed > 0 ? "Replaced" : "Inserted", keys.grain());
        } catch (DataAccessException e) {
            throw new FactReplacementException(keys, e);
        }
    }
}
