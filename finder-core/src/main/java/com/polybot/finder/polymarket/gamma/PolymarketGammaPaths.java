package com.polybot.finder.polymarket.gamma;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PolymarketGammaPaths {

  public static final String MARKETS = "/markets";
}
