package com.premiergroup.ad_warehouse.exception;

import com.premiergroup.ad_warehouse.enums.Dimension;
import lombok.Getter;

@Getter
public class DimensionResolutionException extends RecordProcessingException {

    private final Dimension dimension;
    private final Object naturalKey;

    public DimensionResolutionException(Dimension dimension, Object naturalKey, String reason) {
        super(describe(dimension, naturalKey) + ": " + reason);
        this.dimension = dimension;
        this.naturalKey = naturalKey;
    }

    public DimensionResolutionException(Dimension dimension, Object naturalKey, Throwable cause) {
        super(describe(dimension, naturalKey), cause);
        this.dimension = dimension;
        this.naturalKey = naturalKey;
    }

    private static String describe(Dimension dimension, Object naturalKey) {
        return "Failed to resolve " + dimension + " for natural key " + naturalKey;
    }
}
