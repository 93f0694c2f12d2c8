package com.example.osr.application.port.in;

import java.time.Duration;

/**
 * Input port for removing aged history records.
 */
public interface PurgeHistoryUseCase {

    /**
     * Removes every record whose last update is older than the threshold.
     *
     * @return number of records removed
     */
    int purge(Duration olderThan);
}
