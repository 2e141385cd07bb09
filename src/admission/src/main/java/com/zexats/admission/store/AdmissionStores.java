package com.zexats.admission.store;

/**
 * Backends selected at startup.
 *
 * @param counters request counter store
 * @param slots concurrency slot registry
 * @param distributed {@code true} when state is shared through a distributed backend
 */
public record AdmissionStores(CounterStore counters, SlotStore slots, boolean distributed) {}
