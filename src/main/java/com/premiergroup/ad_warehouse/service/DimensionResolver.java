package com.premiergroup.ad_warehouse.service;

import com.premiergroup.ad_warehouse.dto.AdAttributes;
import com.premiergroup.ad_warehouse.dto.AdPerformanceRecord;
import com.premiergroup.ad_warehouse.dto.AdSetAttributes;
import com.premiergroup.ad_warehouse.dto.CampaignAttributes;
import com.premiergroup.ad_warehouse.dto.ClientAttributes;
import com.premiergroup.ad_warehouse.dto.DemographicKey;
import com.premiergroup.ad_warehouse.dto.DimensionAttributes;
import com.premiergroup.ad_warehouse.dto.DimensionKeySet;
import com.premiergroup.ad_warehouse.dto.PlacementKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Turns one record into the surrogate keys of all seven dimensions.
 * Client, campaign, ad set and ad resolve in that order since each needs its
 * parent's key; nothing is cached between records.
 */
@Service
@RequiredArgsConstructor
public class DimensionResolver {

    private final DateKeyDeriver dateKeyDeriver;
    private final SurrogateKeyStore<Long, ClientAttributes> clientKeyStore;
    private final SurrogateKeyStore<Long, CampaignAttributes> campaignKeyStore;
    private final SurrogateKeyStore<Long, AdSetAttributes> adSetKeyStore;
    private final SurrogateKeyStore<Long, AdAttributes> adKeyStore;
    private final SurrogateKeyStore<DemographicKey, DimensionAttributes> demographicKeyStore;
    private final SurrogateKeyStore<PlacementKey, DimensionAttributes> placementKeyStore;

    public DimensionKeySet resolve(AdPerformanceRecord record) {
        Integer dateKey = dateKeyDeriver.resolve(record.getDate());

        Integer clientKey = clientKeyStore.resolve(
                record.getAccountId(),
                new ClientAttributes(record.getAccountName()));
        Integer campaignKey = campaignKeyStore.resolve(
                record.getCampaignId(),
                new CampaignAttributes(clientKey, record.getCampaignName(), record.getObjective()));
        Integer adSetKey = adSetKeyStore.resolve(
                record.getAdSetId(),
                new AdSetAttributes(campaignKey, record.getAdSetName()));
        Integer adKey = adKeyStore.resolve(
                record.getAdId(),
                new AdAttributes(adSetKey, record.getAdName(), record.getAdBody(),
                        record.getAdThumbnailUrl(), record.getPermanentLink()));

        Integer demographicKey = demographicKeyStore.resolve(
                new DemographicKey(record.getAgeBracket(), record.getGender()),
                DimensionAttributes.NONE);
        Integer placementKey = placementKeyStore.resolve(
                new PlacementKey(record.getPlatform(), record.getDevice(), record.getPosition()),
                DimensionAttributes.NONE);

        return new DimensionKeySet(dateKey, clientKey, campaignKey, adSetKey, adKey, demographicKey, placementKey);
    }
}
