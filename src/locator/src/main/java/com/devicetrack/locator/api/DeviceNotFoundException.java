package com.devicetrack.locator.api;

public class DeviceNotFoundException extends NotFoundException {
  public DeviceNotFoundException(long deviceId) {
    super("device not found for device_id=" + deviceId);
  }
}
