package com.dinoair.resilience.limiter;

import java.util.Locale;

public enum PlanTier {
  FREE,
  PREMIUM,
  ENTERPRISE;

  /** Unknown or missing plans get the free tier. */
  public static PlanTier fromPlan(String plan) {
    if (plan == null)
      return FREE;
    try {
      return valueOf(plan.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return FREE;
    }
  }
}
