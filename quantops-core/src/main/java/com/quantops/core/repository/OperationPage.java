package com.quantops.core.repository;

import com.quantops.core.model.Operation;

import java.util.List;

/**
 * One page of a filtered operation listing.
 */
public record OperationPage(
    List<Operation> items,
    long totalCount,
    long activeCount
) {
    public OperationPage {
        items = List.copyOf(items);
    }
}
