package com.fxpipeline.application.port.out;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Output port for fetching rate snapshots from the upstream provider.
 */
public interface ExchangeRateProvider {

    /**
     * Fetch the latest rates for a base currency.
     * @param baseCurrency 3-letter base currency code
     * @return provider response containing at least base_code and a non-empty conversion_rates object
     */
    Future<JsonObject> fetchLatestRates(String baseCurrency);
}
