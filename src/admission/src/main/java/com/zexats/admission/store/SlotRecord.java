package com.zexats.admission.store;

import java.time.Instant;

/**
 * One concurrently executing analysis.
 *
 * @param analysisId opaque slot token handed to the caller
 * @param userId owning user
 * @param issuedAt time the slot was granted
 */
public record SlotRecord(String analysisId, String userId, Instant issuedAt) {}
