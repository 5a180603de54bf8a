package com.premiergroup.ad_warehouse.config;

import com.premiergroup.ad_warehouse.dto.AdAttributes;
import com.premiergroup.ad_warehouse.dto.AdSetAttributes;
import com.premiergroup.ad_warehouse.dto.CampaignAttributes;
import com.premiergroup.ad_warehouse.dto.ClientAttributes;
import com.premiergroup.ad_warehouse.dto.DemographicKey;
import com.premiergroup.ad_warehouse.dto.DimensionAttributes;
import com.premiergroup.ad_warehouse.dto.PlacementKey;
import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.repository.AdRepository;
import com.premiergroup.ad_warehouse.repository.AdSetRepository;
import com.premiergroup.ad_warehouse.repository.CampaignRepository;
import com.premiergroup.ad_warehouse.repository.ClientRepository;
import com.premiergroup.ad_warehouse.repository.DemographicRepository;
import com.premiergroup.ad_warehouse.repository.PlacementRepository;
import com.premiergroup.ad_warehouse.service.SurrogateKeyStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Objects;

/**
 * One key store per non-date dimension, each bound to its repository's
 * natural-key lookup and conditional insert.
 */
@Configuration(proxyBeanMethods = false)
public class DimensionStoreConfig {

    @Bean
    public SurrogateKeyStore<Long, ClientAttributes> clientKeyStore(ClientRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.CLIENT,
                Objects::nonNull,
                repository::findByAccountFbid,
                (accountFbid, attributes) -> repository.insertIfAbsent(accountFbid, attributes.clientName()));
    }

    @Bean
    public SurrogateKeyStore<Long, CampaignAttributes> campaignKeyStore(CampaignRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.CAMPAIGN,
                Objects::nonNull,
                repository::findByCampaignFbid,
                (campaignFbid, attributes) -> repository.insertIfAbsent(
                        campaignFbid, attributes.clientKey(), attributes.campaignName(), attributes.objective()));
    }

    @Bean
    public SurrogateKeyStore<Long, AdSetAttributes> adSetKeyStore(AdSetRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.AD_SET,
                Objects::nonNull,
                repository::findByAdSetFbid,
                (adSetFbid, attributes) -> repository.insertIfAbsent(
                        adSetFbid, attributes.campaignKey(), attributes.adSetName()));
    }

    @Bean
    public SurrogateKeyStore<Long, AdAttributes> adKeyStore(AdRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.AD,
                Objects::nonNull,
                repository::findByAdFbid,
                (adFbid, attributes) -> {
                    int inserted = repository.insertIfAbsent(
                            adFbid,
                            attributes.adSetKey(),
                            attributes.adName(),
                            attributes.adThumbnailUrl(),
                            attributes.permanentLink());
                    if (inserted > 0 && attributes.adBody() != null) {
                        repository.updateAdBody(adFbid, attributes.adBody());
                    }
                    return inserted;
                });
    }

    @Bean
    public SurrogateKeyStore<DemographicKey, DimensionAttributes> demographicKeyStore(DemographicRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.DEMOGRAPHIC,
                DemographicKey::isComplete,
                key -> repository.findByAgeBracketAndGender(key.ageBracket(), key.gender()),
                (key, attributes) -> repository.insertIfAbsent(key.ageBracket(), key.gender()));
    }

    @Bean
    public SurrogateKeyStore<PlacementKey, DimensionAttributes> placementKeyStore(PlacementRepository repository) {
        return new SurrogateKeyStore<>(
                Dimension.PLACEMENT,
                PlacementKey::isComplete,
                key -> repository.findByPlatformAndDeviceAndPosition(key.platform(), key.device(), key.position()),
                (key, attributes) -> repository.insertIfAbsent(key.platform(), key.device(), key.position()));
    }
}
