package com.premiergroup.ad_warehouse.enums;

/**
 * Dimension tables of the star schema, in resolution order.
 */
public enum Dimension {
    DATE("dim_date"),
    CLIENT("dim_clients"),
    CAMPAIGN("dim_campaigns"),
    AD_SET("dim_ad_sets"),
    AD("dim_ads"),
    DEMOGRAPHIC("dim_demographics"),
    PLACEMENT("dim_placements");

    private final String tableName;

    Dimension(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
