package com.hedgeplatform.worker.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hedge.engine")
public class HedgeEngineProperties {
  private Feed feed = new Feed();
  private Verification verification = new Verification();
  private Session session = new Session();
  private Collateral collateral = new Collateral();

  public Feed getFeed() {
    return feed;
  }

  public void setFeed(Feed feed) {
    this.feed = feed;
  }

  public Verification getVerification() {
    return verification;
  }

  public void setVerification(Verification verification) {
    this.verification = verification;
  }

  public Session getSession() {
    return session;
  }

  public void setSession(Session session) {
    this.session = session;
  }

  public Collateral getCollateral() {
    return collateral;
  }

  public void setCollateral(Collateral collateral) {
    this.collateral = collateral;
  }

  public static class Feed {
    private Duration maxSnapshotAge = Duration.ofSeconds(3);
    private Duration stallTimeout = Duration.ofSeconds(30);
    private Duration resubscribeBaseBackoff = Duration.ofMillis(500);
    private Duration resubscribeMaxBackoff = Duration.ofSeconds(15);

    public Duration getMaxSnapshotAge() {
      return maxSnapshotAge;
    }

    public void setMaxSnapshotAge(Duration maxSnapshotAge) {
      this.maxSnapshotAge = maxSnapshotAge;
    }

    public Duration getStallTimeout() {
      return stallTimeout;
    }

    public void setStallTimeout(Duration stallTimeout) {
      this.stallTimeout = stallTimeout;
    }

    public Duration getResubscribeBaseBackoff() {
      return resubscribeBaseBackoff;
    }

    public void setResubscribeBaseBackoff(Duration resubscribeBaseBackoff) {
      this.resubscribeBaseBackoff = resubscribeBaseBackoff;
    }

    public Duration getResubscribeMaxBackoff() {
      return resubscribeMaxBackoff;
    }

    public void setResubscribeMaxBackoff(Duration resubscribeMaxBackoff) {
      this.resubscribeMaxBackoff = resubscribeMaxBackoff;
    }
  }

  public static class Verification {
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration maxWait = Duration.ofSeconds(15);

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public Duration getMaxWait() {
      return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
      this.maxWait = maxWait;
    }
  }

  public static class Session {
    private Duration idleWait = Duration.ofSeconds(1);
    private Duration tradeCooldown = Duration.ofSeconds(1);
    private boolean autostart = true;

    public Duration getIdleWait() {
      return idleWait;
    }

    public void setIdleWait(Duration idleWait) {
      this.idleWait = idleWait;
    }

    public Duration getTradeCooldown() {
      return tradeCooldown;
    }

    public void setTradeCooldown(Duration tradeCooldown) {
      this.tradeCooldown = tradeCooldown;
    }

    public boolean isAutostart() {
      return autostart;
    }

    public void setAutostart(boolean autostart) {
      this.autostart = autostart;
    }
  }

  public static class Collateral {
    private BigDecimal spotBuffer = new BigDecimal("1.02");
    private BigDecimal marginBuffer = new BigDecimal("1.05");
    private BigDecimal redeemBuffer = new BigDecimal("1.01");

    public BigDecimal getSpotBuffer() {
      return spotBuffer;
    }

    public void setSpotBuffer(BigDecimal spotBuffer) {
      this.spotBuffer = spotBuffer;
    }

    public BigDecimal getMarginBuffer() {
      return marginBuffer;
    }

    public void setMarginBuffer(BigDecimal marginBuffer) {
      this.marginBuffer = marginBuffer;
    }

    public BigDecimal getRedeemBuffer() {
      return redeemBuffer;
    }

    public void setRedeemBuffer(BigDecimal redeemBuffer) {
      this.redeemBuffer = redeemBuffer;
    }
  }
}
