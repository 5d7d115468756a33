package io.memoryrunr.attention;

import io.memoryrunr.model.MemoryItem;

import java.util.List;

/**
 * Outcome of one admission cycle.
 *
 * @param capacity capacity drawn for the cycle
 * @param admitted items in the active set, best score first
 * @param evicted  items returned to the pending pool
 */
public record AdmissionResult(int capacity, List<MemoryItem> admitted, List<MemoryItem> evicted) {

    public AdmissionResult {
        admitted = List.copyOf(admitted);
        evicted = List.copyOf(evicted);
    }
}
