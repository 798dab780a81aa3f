package com.devicetrack.locator.loader;

import com.devicetrack.locator.model.LatestIndex;
import com.devicetrack.locator.model.Snapshot;

/**
 * Output of one successful dataset load.
 *
 * @param snapshot sts-ordered records
 * @param latestIndex latest record per device
 */
public record LoadResult(Snapshot snapshot, LatestIndex latestIndex) {}
