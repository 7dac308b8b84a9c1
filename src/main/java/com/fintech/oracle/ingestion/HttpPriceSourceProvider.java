package com.fintech.oracle.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.oracle.domain.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Fetches a price from a JSON HTTP endpoint.
 *
 * The endpoint is a URI template with a {@code {symbol}} variable; the price is located in the
 * response body with a JSON Pointer and may be a JSON number or a numeric string.
 * Timeouts are enforced by the request factory of the supplied {@link RestClient}.
 */
public class HttpPriceSourceProvider implements PriceSourceProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpPriceSourceProvider.class);

    private final PriceSource source;
    private final RestClient restClient;

    public HttpPriceSourceProvider(PriceSource source, RestClient restClient) {
        this.source = source;
        this.restClient = restClient;
    }

    @Override
    public PriceSource source() {
        return source;
    }

    @Override
    public double fetchPrice(String symbol) {
        JsonNode body;
        try {
            body = restClient.get()
                .uri(source.endpoint(), Map.of("symbol", symbol))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PriceFetchException(source.name(),
                String.format("Failed to fetch %s from %s: %s", symbol, source.name(), e.getMessage()), e);
        }

        if (body == null) {
            throw new PriceFetchException(source.name(), "Empty response from " + source.name() + " for " + symbol);
        }

        double price = extractPrice(body, symbol);
        log.trace("Fetched price: source={}, symbol={}, price={}", source.name(), symbol, price);
        return price;
    }

    private double extractPrice(JsonNode body, String symbol) {
        JsonNode node = body.at(source.pricePath());
        if (node.isMissingNode() || node.isNull()) {
            throw new PriceFetchException(source.name(),
                String.format("Path %s not found in %s response for %s", source.pricePath(), source.name(), symbol));
        }

        double price;
        if (node.isNumber()) {
            price = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                price = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new PriceFetchException(source.name(),
                    String.format("Non-numeric price '%s' from %s for %s", node.textValue(), source.name(), symbol), e);
            }
        } else {
            throw new PriceFetchException(source.name(),
                String.format("Unexpected value type %s at %s from %s", node.getNodeType(), source.pricePath(), source.name()));
        }

        if (!Double.isFinite(price) || price <= 0.0) {
            throw new PriceFetchException(source.name(),
                String.format("Invalid price %s from %s for %s", price, source.name(), symbol));
        }
        return price;
    }
}
