package com.etendoerp.eventlog.filter;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.etendoerp.eventlog.model.DecodedEvent;

/**
 * Drops events whose provider is in the exclusion set. Matching is exact and case-sensitive.
 */
public class ProviderFilter {
  private final Set<String> excludedProviders;

  public ProviderFilter(Set<String> excludedProviders) {
    this.excludedProviders = Collections.unmodifiableSet(new HashSet<>(excludedProviders));
  }

  public boolean accept(DecodedEvent event) {
    return !excludedProviders.contains(event.getProviderName());
  }

  public boolean isEmpty() {
    return excludedProviders.isEmpty();
  }
}
