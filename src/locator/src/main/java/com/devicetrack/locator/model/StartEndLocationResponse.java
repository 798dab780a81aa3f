package com.devicetrack.locator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Start and end position of a device over the loaded dataset.
 *
 * @param startLocation position of the earliest ({@code sts}) record
 * @param endLocation position of the latest ({@code sts}) record
 */
public record StartEndLocationResponse(
    @JsonProperty("start_location") Location startLocation,
    @JsonProperty("end_location") Location endLocation) {}
