package com.devicetrack.locator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Latitude/longitude pair.
 *
 * <p>Serialized as a two-element {@code [lat, lon]} array to keep the public response shape.
 *
 * @param latitude latitude
 * @param longitude longitude
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"latitude", "longitude"})
public record Location(Double latitude, Double longitude) {}
