package com.catalog.indexer.merge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MergeResult {
    int total;
    int found;

    @Singular("missingCode")
    List<String> missingCodes;
}
