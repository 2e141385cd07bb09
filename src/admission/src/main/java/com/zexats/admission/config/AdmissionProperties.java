package com.zexats.admission.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the admission controller.
 *
 * <p>Values are bound from {@code admission.*} in {@code application.yml} and environment
 * variables. The tier table is read once at startup and is not reloaded.
 */
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {
  private Map<String, Tier> tiers = defaultTiers();
  private final Redis redis = new Redis();
  private final Slots slots = new Slots();
  private final Local local = new Local();

  public Map<String, Tier> getTiers() {
    return tiers;
  }

  public void setTiers(Map<String, Tier> tiers) {
    this.tiers = tiers;
  }

  public Redis getRedis() {
    return redis;
  }

  public Slots getSlots() {
    return slots;
  }

  public Local getLocal() {
    return local;
  }

  private static Map<String, Tier> defaultTiers() {
    Map<String, Tier> defaults = new LinkedHashMap<>();
    defaults.put("free", new Tier(2, 5, 10, 50, 1));
    defaults.put("pro", new Tier(10, 25, 100, 2000, 3));
    defaults.put("enterprise", new Tier(50, 200, 1000, 25000, 10));
    return defaults;
  }

  /** Per-tier request caps for each window plus the concurrent analysis limit. */
  public static class Tier {
    private int burst;
    private int hourly;
    private int daily;
    private int monthly;
    private int maxConcurrent;

    public Tier() {}

    public Tier(int burst, int hourly, int daily, int monthly, int maxConcurrent) {
      this.burst = burst;
      this.hourly = hourly;
      this.daily = daily;
      this.monthly = monthly;
      this.maxConcurrent = maxConcurrent;
    }

    public int getBurst() {
      return burst;
    }

    public void setBurst(int burst) {
      this.burst = burst;
    }

    public int getHourly() {
      return hourly;
    }

    public void setHourly(int hourly) {
      this.hourly = hourly;
    }

    public int getDaily() {
      return daily;
    }

    public void setDaily(int daily) {
      this.daily = daily;
    }

    public int getMonthly() {
      return monthly;
    }

    public void setMonthly(int monthly) {
      this.monthly = monthly;
    }

    public int getMaxConcurrent() {
      return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
      this.maxConcurrent = maxConcurrent;
    }
  }

  /**
   * Optional distributed backend. When {@code url} is blank the controller runs on the
   * in-process store only.
   */
  public static class Redis {
    private String url;
    private String keyPrefix = "admission";
    private Duration commandTimeout = Duration.ofMillis(500);

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }

    public Duration getCommandTimeout() {
      return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
      this.commandTimeout = commandTimeout;
    }
  }

  /** Concurrency slot lease settings. */
  public static class Slots {
    private Duration leaseTtl = Duration.ofHours(1);
    private Duration sweepInterval = Duration.ofMinutes(5);

    public Duration getLeaseTtl() {
      return leaseTtl;
    }

    public void setLeaseTtl(Duration leaseTtl) {
      this.leaseTtl = leaseTtl;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }
  }

  /** In-process fallback store tuning. */
  public static class Local {
    private int sweepThreshold = 10_000;

    public int getSweepThreshold() {
      return sweepThreshold;
    }

    public void setSweepThreshold(int sweepThreshold) {
      this.sweepThreshold = sweepThreshold;
    }
  }
}
