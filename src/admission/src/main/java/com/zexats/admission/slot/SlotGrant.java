package com.zexats.admission.slot;

/**
 * Outcome of a slot request.
 *
 * @param analysisId slot token to pass back on finish, {@code null} when rejected
 * @param allowed {@code true} when a slot was issued
 */
public record SlotGrant(String analysisId, boolean allowed) {

  public static SlotGrant granted(String analysisId) {
    return new SlotGrant(analysisId, true);
  }

  public static SlotGrant rejected() {
    return new SlotGrant(null, false);
  }
}
