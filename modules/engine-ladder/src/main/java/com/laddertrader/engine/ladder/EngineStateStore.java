package com.laddertrader.engine.ladder;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON snapshot of the engine on disk. Writes go to a sibling {@code .tmp} file that is then
 * renamed over the target, so a reader never sees a half-written snapshot.
 */
public class EngineStateStore {
  private static final Logger log = LoggerFactory.getLogger(EngineStateStore.class);
  private static final List<String> SENSITIVE_KEY_FRAGMENTS =
      List.of("apikey", "apisecret", "secret", "token", "password", "authorization", "signature");

  private final Path path;
  private final ObjectMapper objectMapper;

  public EngineStateStore(Path path, ObjectMapper objectMapper) {
    this.path = Objects.requireNonNull(path, "path is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
  }

  public Path path() {
    return path;
  }

  public void save(EngineSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    EngineSnapshot sanitized =
        new EngineSnapshot(
            snapshot.symbol(),
            snapshot.variant(),
            snapshot.running(),
            snapshot.lastError(),
            snapshot.referencePrice(),
            snapshot.lowestBuyPrice(),
            snapshot.highestSellPrice(),
            snapshot.cumulativeSellRevenueGross(),
            snapshot.realizedNetProfit(),
            snapshot.completedRoundTrips(),
            snapshot.openOrders(),
            snapshot.unresolvedOrders(),
            sanitize(snapshot.configuration()),
            snapshot.startedAt(),
            snapshot.savedAt());
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(sanitized);
      Files.write(
          tmp,
          json,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE);
      try {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move not supported, replacing snapshot path={}", path);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      throw new EngineStateStoreException("Failed to write engine snapshot path=" + path, ex);
    }
  }

  public Optional<EngineSnapshot> load() {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), EngineSnapshot.class));
    } catch (IOException ex) {
      throw new EngineStateStoreException("Failed to read engine snapshot path=" + path, ex);
    }
  }

  /**
   * Copy of {@code configuration} without credential-like keys, at any depth. Keys of nested maps
   * are written as their string form.
   */
  public static Map<String, Object> sanitize(Map<?, ?> configuration) {
    if (configuration == null) {
      return null;
    }
    Map<String, Object> clean = new LinkedHashMap<>();
    configuration.forEach(
        (key, value) -> {
          String name = String.valueOf(key);
          if (!isSensitive(name)) {
            clean.put(name, sanitizeValue(value));
          }
        });
    return clean;
  }

  static boolean isSensitive(String key) {
    if (key == null) {
      return false;
    }
    String normalized = key.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    for (String fragment : SENSITIVE_KEY_FRAGMENTS) {
      if (normalized.contains(fragment)) {
        return true;
      }
    }
    return false;
  }

  private static Object sanitizeValue(Object value) {
    if (value instanceof Map<?, ?> nested) {
      return sanitize(nested);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(sanitizeValue(item));
      }
      return copy;
    }
    return value;
  }
}
