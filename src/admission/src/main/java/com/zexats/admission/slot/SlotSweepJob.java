package com.zexats.admission.slot;

import com.zexats.admission.config.AdmissionProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically reclaims slots left behind by callers that never called finish. */
@Component
public class SlotSweepJob {
  private static final Logger log = LoggerFactory.getLogger(SlotSweepJob.class);

  private final ConcurrencyGovernor governor;
  private final AdmissionProperties properties;
  private final Counter errorCounter;

  public SlotSweepJob(ConcurrencyGovernor governor, AdmissionProperties properties, MeterRegistry meterRegistry) {
    this.governor = governor;
    this.properties = properties;
    this.errorCounter = meterRegistry.counter("admission.sweep.errors");
  }

  @Scheduled(
      fixedDelayString = "${admission.slots.sweep-interval:PT5M}",
      initialDelayString = "${admission.slots.sweep-interval:PT5M}")
  public void sweep() {
    try {
      int reclaimed = governor.sweep(properties.getSlots().getLeaseTtl());
      if (reclaimed > 0) {
        log.info("Slot sweep reclaimed {} expired slots", reclaimed);
      }
    } catch (Exception ex) {
      // Keep the scheduler running; the next cycle retries.
      errorCounter.increment();
      log.error("Slot sweep cycle failed", ex);
    }
  }
}
