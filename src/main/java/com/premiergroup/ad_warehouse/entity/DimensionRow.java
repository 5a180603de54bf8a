package com.premiergroup.ad_warehouse.entity;

/**
 * A dimension row as seen by the key stores: its surrogate key and, for the
 * client → campaign → ad set → ad chain, the surrogate key of its owner.
 */
public interface DimensionRow {

    Integer getSurrogateKey();

    default Integer getParentKey() {
        return null;
    }
}
