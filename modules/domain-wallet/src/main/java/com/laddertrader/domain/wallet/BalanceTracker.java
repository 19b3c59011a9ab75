package com.laddertrader.domain.wallet;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Venue balances merged with the predicted effect of orders the venue has not yet reflected.
 *
 * <p>{@link #reconcile(Collection)} consumes a pending delta on the same pass that observes it
 * in a fresh fetch, so a confirmed effect is never counted twice. An adjustment that is not
 * observed survives one further pass and is then dropped in favour of venue truth.
 */
public class BalanceTracker {
  private static final Logger log = LoggerFactory.getLogger(BalanceTracker.class);
  private static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.000000001");
  private static final int MAX_UNREFLECTED_CYCLES = 1;

  private final BigDecimal tolerance;
  private final Map<String, Balance> venueBalances = new LinkedHashMap<>();
  private final Map<String, List<PendingAdjustment>> pendingByAsset = new LinkedHashMap<>();
  private boolean fetched;

  public BalanceTracker() {
    this(DEFAULT_TOLERANCE);
  }

  public BalanceTracker(BigDecimal tolerance) {
    Objects.requireNonNull(tolerance, "tolerance must not be null");
    if (tolerance.signum() < 0) {
      throw new WalletDomainException("tolerance must be >= 0");
    }
    this.tolerance = tolerance;
  }

  public synchronized BigDecimal get(String asset) {
    String key = normalize(asset);
    Balance venue = venueBalances.get(key);
    BigDecimal base = venue == null ? BigDecimal.ZERO : venue.available();
    return base.add(pendingAdjustment(key));
  }

  public synchronized BigDecimal pendingAdjustment(String asset) {
    BigDecimal total = BigDecimal.ZERO;
    for (PendingAdjustment adjustment : pendingByAsset.getOrDefault(normalize(asset), List.of())) {
      total = total.add(adjustment.delta());
    }
    return total;
  }

  public synchronized void applyPending(String key, String asset, BigDecimal delta) {
    Objects.requireNonNull(delta, "delta must not be null");
    if (delta.signum() == 0) {
      return;
    }
    String normalized = normalize(asset);
    pendingByAsset
        .computeIfAbsent(normalized, ignored -> new ArrayList<>())
        .add(new PendingAdjustment(key, normalized, delta, 0));
    log.debug("Pending balance adjustment recorded key={} asset={} delta={}", key, normalized, delta);
  }

  /** Clears the adjustments recorded under {@code key}, e.g. for a cancelled or rejected order. */
  public synchronized int release(String key) {
    int removed = 0;
    for (List<PendingAdjustment> adjustments : pendingByAsset.values()) {
      Iterator<PendingAdjustment> iterator = adjustments.iterator();
      while (iterator.hasNext()) {
        if (iterator.next().key().equals(key)) {
          iterator.remove();
          removed++;
        }
      }
    }
    pendingByAsset.values().removeIf(List::isEmpty);
    return removed;
  }

  public synchronized BalanceReconciliation reconcile(Collection<Balance> freshBalances) {
    Objects.requireNonNull(freshBalances, "freshBalances must not be null");
    Map<String, Balance> fresh = new LinkedHashMap<>();
    for (Balance balance : freshBalances) {
      fresh.put(balance.asset(), balance);
    }
    Set<String> assets = new LinkedHashSet<>(venueBalances.keySet());
    assets.addAll(fresh.keySet());
    assets.addAll(pendingByAsset.keySet());

    int cleared = 0;
    int carried = 0;
    int expired = 0;
    for (String asset : assets) {
      Balance previous = venueBalances.getOrDefault(asset, Balance.zero(asset));
      Balance current = fresh.getOrDefault(asset, Balance.zero(asset));
      List<PendingAdjustment> pending = pendingByAsset.getOrDefault(asset, List.of());
      if (!pending.isEmpty()) {
        BigDecimal observed = current.available().subtract(previous.available());
        int reflected = reflectedPrefix(pending, observed);
        List<PendingAdjustment> remaining = new ArrayList<>();
        for (int i = reflected; i < pending.size(); i++) {
          PendingAdjustment adjustment = pending.get(i);
          if (adjustment.cyclesUnreflected() >= MAX_UNREFLECTED_CYCLES) {
            expired++;
            log.warn(
                "Pending balance adjustment not reflected by venue, dropping key={} asset={} delta={}",
                adjustment.key(),
                asset,
                adjustment.delta());
          } else {
            remaining.add(adjustment.aged());
            carried++;
          }
        }
        cleared += reflected;
        if (remaining.isEmpty()) {
          pendingByAsset.remove(asset);
        } else {
          pendingByAsset.put(asset, remaining);
        }
      }
      if (fresh.containsKey(asset)) {
        venueBalances.put(asset, current);
      } else {
        venueBalances.remove(asset);
      }
    }
    fetched = true;
    return new BalanceReconciliation(cleared, carried, expired);
  }

  public synchronized void requireAvailable(String asset, BigDecimal amount) {
    BigDecimal available = get(asset);
    if (available.compareTo(amount) < 0) {
      throw new InsufficientBalanceException(normalize(asset), amount, available);
    }
  }

  public synchronized boolean hasFetched() {
    return fetched;
  }

  public synchronized Map<String, Balance> venueBalances() {
    return Map.copyOf(venueBalances);
  }

  public synchronized List<PendingAdjustment> pendingAdjustments() {
    List<PendingAdjustment> all = new ArrayList<>();
    pendingByAsset.values().forEach(all::addAll);
    return List.copyOf(all);
  }

  /** Longest insertion-ordered run of deltas whose sum matches the observed venue movement. */
  private int reflectedPrefix(List<PendingAdjustment> pending, BigDecimal observed) {
    int best = 0;
    BigDecimal running = BigDecimal.ZERO;
    for (int i = 0; i < pending.size(); i++) {
      running = running.add(pending.get(i).delta());
      if (running.subtract(observed).abs().compareTo(tolerance) <= 0) {
        best = i + 1;
      }
    }
    return best;
  }

  private static String normalize(String asset) {
    if (asset == null || asset.isBlank()) {
      throw new WalletDomainException("asset must not be blank");
    }
    return asset.trim().toUpperCase(Locale.ROOT);
  }
}
