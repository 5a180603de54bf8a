package com.premiergroup.ad_warehouse.dto;

public record DemographicKey(String ageBracket, String gender) {

    public boolean isComplete() {
        return ageBracket != null && gender != null;
    }
}
