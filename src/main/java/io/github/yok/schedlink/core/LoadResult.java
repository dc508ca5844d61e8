package io.github.yok.schedlink.core;

import java.util.Map;
import lombok.Value;

/**
 * Summary of a committed load.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class LoadResult {

    // Appointment rows committed, one per source record
    int appointments;
    // Patient rows created during the run
    int patientsCreated;
    // Service rows created during the run
    int servicesCreated;
    // Appointment/service junction rows created during the run
    int appointmentServices;
    // Row count per destination table after commit
    Map<String, Integer> tableRowCounts;

    /**
     * Returns the result of a run that had nothing to load.
     *
     * @return all-zero result
     */
    public static LoadResult empty() {
        return new LoadResult(0, 0, 0, 0, Map.of());
    }
}
