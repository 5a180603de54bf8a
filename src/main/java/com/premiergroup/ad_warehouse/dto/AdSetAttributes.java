package com.premiergroup.ad_warehouse.dto;

public record AdSetAttributes(
        Integer campaignKey,
        String adSetName
) implements DimensionAttributes {

    @Override
    public Integer parentKey() {
        return campaignKey;
    }
}
