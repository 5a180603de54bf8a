package com.premiergroup.ad_warehouse.dto;

/**
 * Surrogate keys resolved for one record. The fact grain is
 * (dateKey, adKey, demographicKey, placementKey).
 */
public record DimensionKeySet(
        Integer dateKey,
        Integer clientKey,
        Integer campaignKey,
        Integer adSetKey,
        Integer adKey,
        Integer demographicKey,
        Integer placementKey
) {

    public String grain() {
        return "date=" + dateKey + ", ad=" + adKey + ", demographic=" + demographicKey + ", placement=" + placementKey;
    }
}
