package com.launchbot.hft.launchpad.execution;

import java.math.BigDecimal;
import java.util.Optional;

public interface PriceSource {

    Optional<BigDecimal> lastPrice(String mintId);
}
