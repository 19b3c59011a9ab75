package com.laddertrader.domain.orders;

/** What a reported status means for a locally tracked order. */
public enum OrderTransition {
  /** Same status as before; nothing to apply. */
  UNCHANGED,
  /** Still working on the venue: acknowledged or more quantity executed. */
  PROGRESS,
  FILL,
  /** Left the book without trading its remainder. */
  WITHDRAWAL,
  INVALID;

  public boolean isApplicable() {
    return this == PROGRESS || this == FILL || this == WITHDRAWAL;
  }
}
