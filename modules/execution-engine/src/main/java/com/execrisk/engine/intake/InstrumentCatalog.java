package com.execrisk.engine.intake;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class InstrumentCatalog {
  private final Map<String, InstrumentSpec> instruments;

  public InstrumentCatalog(List<InstrumentSpec> specs) {
    Objects.requireNonNull(specs, "specs must not be null");
    Map<String, InstrumentSpec> bySymbol = new LinkedHashMap<>();
    for (InstrumentSpec spec : specs) {
      if (bySymbol.putIfAbsent(spec.symbol(), spec) != null) {
        throw new IllegalArgumentException("duplicate instrument " + spec.symbol());
      }
    }
    this.instruments = Collections.unmodifiableMap(bySymbol);
  }

  public Optional<InstrumentSpec> find(String symbol) {
    return Optional.ofNullable(instruments.get(symbol));
  }

  public Collection<InstrumentSpec> all() {
    return instruments.values();
  }
}
