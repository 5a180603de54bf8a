package com.premiergroup.ad_warehouse.dto;

public record PlacementKey(String platform, String device, String position) {

    public boolean isComplete() {
        return platform != null && device != null && position != null;
    }
}
