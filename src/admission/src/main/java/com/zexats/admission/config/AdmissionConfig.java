package com.zexats.admission.config;

import com.zexats.admission.TieredAdmissionController;
import com.zexats.admission.admin.AdmissionAdminService;
import com.zexats.admission.policy.TierPolicyRegistry;
import com.zexats.admission.rate.WindowedRateLimiter;
import com.zexats.admission.slot.ConcurrencyGovernor;
import com.zexats.admission.store.AdmissionKeys;
import com.zexats.admission.store.AdmissionStores;
import com.zexats.admission.store.FailoverCounterStore;
import com.zexats.admission.store.FailoverSlotStore;
import com.zexats.admission.store.local.InMemoryAdmissionStore;
import com.zexats.admission.store.redis.RedisCounterStore;
import com.zexats.admission.store.redis.RedisSlotStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Builds the admission controller graph once at startup.
 *
 * <p>The backend is chosen here and nowhere else: with a Redis template available the stores
 * are Redis with local fallback, otherwise the local store alone.
 */
@Configuration(proxyBeanMethods = false)
public class AdmissionConfig {
  private static final Logger log = LoggerFactory.getLogger(AdmissionConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AdmissionKeys admissionKeys(AdmissionProperties properties) {
    return new AdmissionKeys(properties.getRedis().getKeyPrefix());
  }

  @Bean
  public AdmissionStores admissionStores(
      AdmissionProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      AdmissionKeys keys,
      Clock clock,
      MeterRegistry meterRegistry) {
    InMemoryAdmissionStore localStore =
        new InMemoryAdmissionStore(clock, properties.getLocal().getSweepThreshold());
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (template == null) {
      log.info("No Redis URL configured, admission state is local to this instance");
      return new AdmissionStores(localStore, localStore, false);
    }
    return new AdmissionStores(
        new FailoverCounterStore(new RedisCounterStore(template), localStore, meterRegistry),
        new FailoverSlotStore(new RedisSlotStore(template, keys), localStore, meterRegistry),
        true);
  }

  @Bean
  public WindowedRateLimiter windowedRateLimiter(
      AdmissionStores stores,
      TierPolicyRegistry tierPolicies,
      AdmissionKeys keys,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new WindowedRateLimiter(stores.counters(), tierPolicies, keys, clock, meterRegistry);
  }

  @Bean
  public ConcurrencyGovernor concurrencyGovernor(
      AdmissionStores stores, TierPolicyRegistry tierPolicies, Clock clock, MeterRegistry meterRegistry) {
    return new ConcurrencyGovernor(stores.slots(), tierPolicies, clock, meterRegistry);
  }

  @Bean
  public AdmissionAdminService admissionAdminService(AdmissionStores stores, AdmissionKeys keys) {
    return new AdmissionAdminService(stores.counters(), stores.slots(), keys, stores.distributed());
  }

  @Bean
  public TieredAdmissionController tieredAdmissionController(
      WindowedRateLimiter rateLimiter,
      ConcurrencyGovernor governor,
      AdmissionAdminService adminService,
      Clock clock) {
    return new TieredAdmissionController(rateLimiter, governor, adminService, clock);
  }
}
