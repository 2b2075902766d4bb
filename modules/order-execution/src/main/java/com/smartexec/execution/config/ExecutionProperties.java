package com.smartexec.execution.config;

import com.smartexec.execution.lifecycle.TradingSession;
import com.smartexec.execution.routing.RoutingConfig;
import com.smartexec.execution.routing.RoutingStrategy;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "execution", ignoreUnknownFields = false)
public class ExecutionProperties {
  private Routing routing = new Routing();
  private Dispatch dispatch = new Dispatch();
  private Algo algo = new Algo();
  private Compliance compliance = new Compliance();
  private Session session = new Session();

  public Routing getRouting() {
    return routing;
  }

  public void setRouting(Routing routing) {
    this.routing = routing;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public void setDispatch(Dispatch dispatch) {
    this.dispatch = dispatch;
  }

  public Algo getAlgo() {
    return algo;
  }

  public void setAlgo(Algo algo) {
    this.algo = algo;
  }

  public Compliance getCompliance() {
    return compliance;
  }

  public void setCompliance(Compliance compliance) {
    this.compliance = compliance;
  }

  public Session getSession() {
    return session;
  }

  public void setSession(Session session) {
    this.session = session;
  }

  public RoutingConfig toRoutingConfig() {
    Routing source = routing == null ? new Routing() : routing;
    List<String> venues = source.getVenues() == null ? List.of() : source.getVenues();
    int maxSplitVenues =
        source.getMaxSplitVenues() > 0 ? source.getMaxSplitVenues() : Math.max(1, venues.size());
    return new RoutingConfig(
        source.getStrategy() == null ? RoutingStrategy.BEST_EXECUTION : source.getStrategy(),
        venues,
        source.getVenueLatencies(),
        source.getMaxVenueLatency(),
        source.isDarkPoolsEnabled(),
        source.getDarkPoolVenues(),
        source.getAggressiveness(),
        maxSplitVenues,
        source.getVenueFeeRatesBps());
  }

  public TradingSession toTradingSession() {
    Session source = session == null ? new Session() : session;
    return new TradingSession(
        LocalTime.parse(source.getCloseTime().trim()), ZoneId.of(source.getZone().trim()));
  }

  public static class Routing {
    private RoutingStrategy strategy = RoutingStrategy.BEST_EXECUTION;
    private List<String> venues = new ArrayList<>();
    private Map<String, Duration> venueLatencies = new LinkedHashMap<>();
    private Duration maxVenueLatency;
    private boolean darkPoolsEnabled;
    private Set<String> darkPoolVenues = new LinkedHashSet<>();
    private BigDecimal aggressiveness = BigDecimal.ONE;
    // 0 means one route per configured venue
    private int maxSplitVenues;
    private Map<String, BigDecimal> venueFeeRatesBps = new LinkedHashMap<>();

    public RoutingStrategy getStrategy() {
      return strategy;
    }

    public void setStrategy(RoutingStrategy strategy) {
      this.strategy = strategy;
    }

    public List<String> getVenues() {
      return venues;
    }

    public void setVenues(List<String> venues) {
      this.venues = venues;
    }

    public Map<String, Duration> getVenueLatencies() {
      return venueLatencies;
    }

    public void setVenueLatencies(Map<String, Duration> venueLatencies) {
      this.venueLatencies = venueLatencies;
    }

    public Duration getMaxVenueLatency() {
      return maxVenueLatency;
    }

    public void setMaxVenueLatency(Duration maxVenueLatency) {
      this.maxVenueLatency = maxVenueLatency;
    }

    public boolean isDarkPoolsEnabled() {
      return darkPoolsEnabled;
    }

    public void setDarkPoolsEnabled(boolean darkPoolsEnabled) {
      this.darkPoolsEnabled = darkPoolsEnabled;
    }

    public Set<String> getDarkPoolVenues() {
      return darkPoolVenues;
    }

    public void setDarkPoolVenues(Set<String> darkPoolVenues) {
      this.darkPoolVenues = darkPoolVenues;
    }

    public BigDecimal getAggressiveness() {
      return aggressiveness;
    }

    public void setAggressiveness(BigDecimal aggressiveness) {
      this.aggressiveness = aggressiveness;
    }

    public int getMaxSplitVenues() {
      return maxSplitVenues;
    }

    public void setMaxSplitVenues(int maxSplitVenues) {
      this.maxSplitVenues = maxSplitVenues;
    }

    public Map<String, BigDecimal> getVenueFeeRatesBps() {
      return venueFeeRatesBps;
    }

    public void setVenueFeeRatesBps(Map<String, BigDecimal> venueFeeRatesBps) {
      this.venueFeeRatesBps = venueFeeRatesBps;
    }
  }

  public static class Dispatch {
    private Duration venueTimeout = Duration.ofSeconds(2);
    private int threads = 8;

    public Duration getVenueTimeout() {
      return venueTimeout;
    }

    public void setVenueTimeout(Duration venueTimeout) {
      this.venueTimeout = venueTimeout;
    }

    public int getThreads() {
      return threads;
    }

    public void setThreads(int threads) {
      this.threads = threads;
    }
  }

  public static class Algo {
    private Duration tickInterval = Duration.ofSeconds(1);
    private BigDecimal onScheduleTolerance = new BigDecimal("0.10");
    private int schedulerThreads = 2;
    private int retainedFinishedOrders = 1_000;

    public Duration getTickInterval() {
      return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
    }

    public BigDecimal getOnScheduleTolerance() {
      return onScheduleTolerance;
    }

    public void setOnScheduleTolerance(BigDecimal onScheduleTolerance) {
      this.onScheduleTolerance = onScheduleTolerance;
    }

    public int getSchedulerThreads() {
      return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
      this.schedulerThreads = schedulerThreads;
    }

    public int getRetainedFinishedOrders() {
      return retainedFinishedOrders;
    }

    public void setRetainedFinishedOrders(int retainedFinishedOrders) {
      this.retainedFinishedOrders = retainedFinishedOrders;
    }
  }

  public static class Compliance {
    private Set<String> restrictedSymbols = new LinkedHashSet<>();
    // 0 disables the limit
    private long maxOrderQuantity;
    private BigDecimal maxOrderNotional;
    private long largeOrderWarningQuantity;

    public Set<String> getRestrictedSymbols() {
      return restrictedSymbols;
    }

    public void setRestrictedSymbols(Set<String> restrictedSymbols) {
      this.restrictedSymbols = restrictedSymbols;
    }

    public long getMaxOrderQuantity() {
      return maxOrderQuantity;
    }

    public void setMaxOrderQuantity(long maxOrderQuantity) {
      this.maxOrderQuantity = maxOrderQuantity;
    }

    public BigDecimal getMaxOrderNotional() {
      return maxOrderNotional;
    }

    public void setMaxOrderNotional(BigDecimal maxOrderNotional) {
      this.maxOrderNotional = maxOrderNotional;
    }

    public long getLargeOrderWarningQuantity() {
      return largeOrderWarningQuantity;
    }

    public void setLargeOrderWarningQuantity(long largeOrderWarningQuantity) {
      this.largeOrderWarningQuantity = largeOrderWarningQuantity;
    }
  }

  public static class Session {
    private String closeTime = "16:00";
    private String zone = "America/New_York";

    public String getCloseTime() {
      return closeTime;
    }

    public void setCloseTime(String closeTime) {
      this.closeTime = closeTime;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }
}
