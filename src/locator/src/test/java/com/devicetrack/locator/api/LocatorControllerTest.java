package com.devicetrack.locator.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devicetrack.locator.cache.CacheUnavailableException;
import com.devicetrack.locator.cache.TelemetryCacheStore;
import com.devicetrack.locator.model.Snapshot;
import com.devicetrack.locator.model.TelemetryRecord;
import com.devicetrack.locator.service.TelemetryQueryService;
import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = LocatorController.class)
@Import(TelemetryQueryService.class)
class LocatorControllerTest {
  private static final Instant T1 = Instant.parse("2021-10-23T10:00:01.123456Z");
  private static final Instant T2 = Instant.parse("2021-10-23T10:00:02Z");
  private static final Instant T3 = Instant.parse("2021-10-23T10:00:03Z");

  private static final Snapshot SNAPSHOT = new Snapshot(List.of(
      new TelemetryRecord(1L, 1.0, 2.0, T1, T1, 3.0),
      new TelemetryRecord(1L, 10.0, 20.0, T2, T2, 5.0),
      new TelemetryRecord(2L, 5.0, 5.0, T3, T3, 0.0)));

  @Autowired private MockMvc mockMvc;

  @MockBean private TelemetryCacheStore cacheStore;

  @Test
  void getAllData_returns200WithRecordsInSnapshotOrder() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.of(SNAPSHOT));

    mockMvc.perform(get("/get_all_data"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].device_fk_id").value(1))
        .andExpect(jsonPath("$[0].time_stamp").value("2021-10-23T10:00:01.123456Z"))
        .andExpect(jsonPath("$[0].sts").value("2021-10-23T10:00:01.123456Z"))
        .andExpect(jsonPath("$[2].latitude").value(5.0));
  }

  @Test
  void getAllData_returns404WhenNothingCached() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.empty());

    mockMvc.perform(get("/get_all_data"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void getAllData_returns500WithUnderlyingErrorWhenRedisRefusesConnection() throws Exception {
    when(cacheStore.getSnapshot()).thenThrow(new CacheUnavailableException(
        "Redis unavailable while trying to read snapshot: Connection refused: localhost/127.0.0.1:6379",
        new ConnectException("Connection refused")));

    mockMvc.perform(get("/get_all_data"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("cache_unavailable"))
        .andExpect(jsonPath("$.message", containsString("Connection refused")));
  }

  @Test
  void latestDeviceInfo_returns200() throws Exception {
    when(cacheStore.getLatest(1L)).thenReturn(Optional.of(SNAPSHOT.records().get(1)));

    mockMvc.perform(get("/latest_device_info").queryParam("device_id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.latitude").value(10.0))
        .andExpect(jsonPath("$.longitude").value(20.0))
        .andExpect(jsonPath("$.time_stamp").value("2021-10-23T10:00:02Z"))
        .andExpect(jsonPath("$.speed").value(5.0));
  }

  @Test
  void latestDeviceInfo_returns404ForUnknownDevice() throws Exception {
    when(cacheStore.getLatest(7L)).thenReturn(Optional.empty());

    mockMvc.perform(get("/latest_device_info").queryParam("device_id", "7"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("device not found for device_id=7"));
  }

  @Test
  void missingDeviceId_returns400WithoutConsultingCache() throws Exception {
    mockMvc.perform(get("/latest_device_info"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("device_id not provided"));
    mockMvc.perform(get("/fetch_start_end_location"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("device_id not provided"));
    mockMvc.perform(get("/fetch_location_points")
            .queryParam("start_time", "2021-10-23T10:00:00Z")
            .queryParam("end_time", "2021-10-23T11:00:00Z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message", containsString("device_id")));

    verifyNoInteractions(cacheStore);
  }

  @Test
  void fetchStartEndLocation_returnsLatLonPairs() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.of(SNAPSHOT));

    mockMvc.perform(get("/fetch_start_end_location").queryParam("device_id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.start_location", hasSize(2)))
        .andExpect(jsonPath("$.start_location[0]").value(1.0))
        .andExpect(jsonPath("$.start_location[1]").value(2.0))
        .andExpect(jsonPath("$.end_location[0]").value(10.0))
        .andExpect(jsonPath("$.end_location[1]").value(20.0));
  }

  @Test
  void fetchStartEndLocation_returns404ForUnknownDevice() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.of(SNAPSHOT));

    mockMvc.perform(get("/fetch_start_end_location").queryParam("device_id", "42"))
        .andExpect(status().isNotFound());
  }

  @Test
  void fetchLocationPoints_returnsPointsInsideWindow() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.of(SNAPSHOT));

    mockMvc.perform(get("/fetch_location_points")
            .queryParam("device_id", "1")
            .queryParam("start_time", "2021-10-23T10:00:01.123456Z")
            .queryParam("end_time", "2021-10-23T10:00:02Z"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[0].latitude").value(1.0))
        .andExpect(jsonPath("$[0].time_stamp").value("2021-10-23T10:00:01.123456Z"))
        .andExpect(jsonPath("$[1].longitude").value(20.0))
        .andExpect(jsonPath("$[0].sts").doesNotExist());
  }

  @Test
  void fetchLocationPoints_returnsEmptyArrayNot404WhenWindowMisses() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.of(SNAPSHOT));

    mockMvc.perform(get("/fetch_location_points")
            .queryParam("device_id", "1")
            .queryParam("start_time", "2030-01-01T00:00:00Z")
            .queryParam("end_time", "2030-01-02T00:00:00Z"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void fetchLocationPoints_returns400ForUnparsableTime() throws Exception {
    mockMvc.perform(get("/fetch_location_points")
            .queryParam("device_id", "1")
            .queryParam("start_time", "2021-10-23T10:00:00Z")
            .queryParam("end_time", "later"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));

    verifyNoInteractions(cacheStore);
  }

  @Test
  void locationQuery_returns500WhenDatasetNotLoaded() throws Exception {
    when(cacheStore.getSnapshot()).thenReturn(Optional.empty());

    mockMvc.perform(get("/fetch_start_end_location").queryParam("device_id", "1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("dataset_not_loaded"));
  }
}
