package com.zexats.admission.admin;

/**
 * Reachability of the counter backend.
 *
 * @param backend backend identifier, e.g. {@code local} or {@code redis+local}
 * @param distributed {@code true} when a shared backend is configured
 * @param reachable {@code true} when the backend answered a ping
 */
public record BackendStatus(String backend, boolean distributed, boolean reachable) {}
