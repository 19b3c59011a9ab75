package com.laddertrader.engine.ladder;

public enum LadderVariant {
  /** Level count stays constant; sells are never placed above the seeded ceiling. */
  BOUNDED,
  /** Each sell fill extends the ladder one step above the highest sell. */
  UNBOUNDED
}
