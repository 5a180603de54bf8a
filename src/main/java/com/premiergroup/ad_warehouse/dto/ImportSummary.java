package com.premiergroup.ad_warehouse.dto;

import java.util.List;

public record ImportSummary(
        int total,
        int succeeded,
        int failed,
        List<ImportFailure> failures
) {
}
