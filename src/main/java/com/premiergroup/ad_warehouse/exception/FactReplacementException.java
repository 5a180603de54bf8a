package com.premiergroup.ad_warehouse.exception;

import com.premiergroup.ad_warehouse.dto.DimensionKeySet;
import lombok.Getter;

@Getter
public class FactReplacementException extends RecordProcessingException {

    private final DimensionKeySet keys;

    public FactReplacementException(DimensionKeySet keys, String reason) {
        super("Failed to replace fact row at " + keys.grain() + ": " + reason);
        this.keys = keys;
    }

    public FactReplacementException(DimensionKeySet keys, Throwable cause) {
        super("Failed to replace fact row at " + keys.grain(), cause);
        this.keys = keys;
    }
}
