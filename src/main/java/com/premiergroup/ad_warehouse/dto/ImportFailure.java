package com.premiergroup.ad_warehouse.dto;

import com.premiergroup.ad_warehouse.enums.Dimension;
import com.premiergroup.ad_warehouse.enums.RecordStage;
import com.premiergroup.ad_warehouse.exception.DimensionResolutionException;

/**
 * A record that was rolled back. Position is 1-based in input order.
 */
public record ImportFailure(
        int position,
        RecordStage failedAt,
        Dimension dimension,
        String cause
) {

    public static ImportFailure of(int position, RecordStage failedAt, RuntimeException error) {
        Dimension dimension = error instanceof DimensionResolutionException dre ? dre.getDimension() : null;
        return new ImportFailure(position, failedAt, dimension, error.getMessage());
    }
}
