package com.premiergroup.ad_warehouse.dto;

public record AdAttributes(
        Integer adSetKey,
        String adName,
        String adBody,
        String adThumbnailUrl,
        String permanentLink
) implements DimensionAttributes {

    @Override
    public Integer parentKey() {
        return adSetKey;
    }
}
