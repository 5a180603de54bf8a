package com.premiergroup.ad_warehouse.enums;

public enum RecordStage {
    PENDING,
    RESOLVING,
    REPLACING,
    COMMITTED,
    ROLLED_BACK
}
