package com.fxpipeline.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of POST /api/pipeline/{stage}; every field may be omitted.
 */
public record PipelineRunRequest(
        String date,
        String baseCurrency,
        Integer windowDays
) {
    @JsonCreator
    public PipelineRunRequest(
            @JsonProperty("date") String date,
            @JsonProperty("baseCurrency") String baseCurrency,
            @JsonProperty("windowDays") Integer windowDays
    ) {
        this.date = date;
        this.baseCurrency = baseCurrency;
        this.windowDays = windowDays;
    }
}
