package com.premiergroup.ad_warehouse.dto;

public record CampaignAttributes(
        Integer clientKey,
        String campaignName,
        String objective
) implements DimensionAttributes {

    @Override
    public Integer parentKey() {
        return clientKey;
    }
}
