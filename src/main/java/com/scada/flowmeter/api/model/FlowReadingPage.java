package com.scada.flowmeter.api.model;

import java.util.List;

/**
 * One page of readings plus the number of rows matching the filters regardless of paging.
 */
public record FlowReadingPage(long totalCount, int page, int pageSize, List<FlowReading> readings) {

    public int totalPages() {
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }
}
