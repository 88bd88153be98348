package com.kotsin.snapshot.source;

import com.kotsin.snapshot.domain.model.Feed;

import java.util.OptionalDouble;

/**
 * Latest trade price per feed, raw (not yet normalized).
 */
public interface TradePriceSource {

    OptionalDouble lastPrice(Feed feed);
}
