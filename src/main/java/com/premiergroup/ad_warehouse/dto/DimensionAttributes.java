package com.premiergroup.ad_warehouse.dto;

/**
 * Descriptive attributes written when a dimension row is created.
 * Hierarchical dimensions also name the surrogate key of their owner.
 */
public interface DimensionAttributes {

    DimensionAttributes NONE = new DimensionAttributes() {
    };

    default Integer parentKey() {
        return null;
    }
}
