package com.scada.flowmeter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scada.flowmeter.api.model.FlowReadingPage;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReadingPageResponse {
    private final boolean success;
    private final long totalCount;
    private final int page;
    private final int pageSize;
    private final int totalPages;
    private final int count;
    private final List<FlowReadingView> data;
    private final String environment;

    public static ReadingPageResponse of(FlowReadingPage page, String environment) {
        List<FlowReadingView> rows = page.readings().stream().map(FlowReadingView::from).toList();
        return ReadingPageResponse.builder()
                .success(true)
                .totalCount(page.totalCount())
                .page(page.page())
                .pageSize(page.pageSize())
                .totalPages(page.totalPages())
                .count(rows.size())
                .data(rows)
                .environment(environment)
                .build();
    }
}
