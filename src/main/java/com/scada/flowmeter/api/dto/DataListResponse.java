package com.scada.flowmeter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.List;

/**
 * Envelope for unpaged lists.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataListResponse<T> {
    private final boolean success = true;
    private final int count;
    private final List<T> data;
    private final String environment;

    public DataListResponse(List<T> data, String environment) {
        this.count = data.size();
        this.data = data;
        this.environment = environment;
    }
}
