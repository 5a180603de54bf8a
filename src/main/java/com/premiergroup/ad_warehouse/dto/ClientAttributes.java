package com.premiergroup.ad_warehouse.dto;

public record ClientAttributes(String clientName) implements DimensionAttributes {
}
