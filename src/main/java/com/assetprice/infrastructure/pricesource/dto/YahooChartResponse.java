package com.assetprice.infrastructure.pricesource.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Yahoo Finance chart API response, reduced to the quote metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record YahooChartResponse(
    @JsonProperty("chart") Chart chart
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chart(
        @JsonProperty("result") List<Result> result,
        @JsonProperty("error") ErrorInfo error
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
        @JsonProperty("meta") Meta meta
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("currency") String currency,
        @JsonProperty("regularMarketPrice") BigDecimal regularMarketPrice,
        @JsonProperty("chartPreviousClose") BigDecimal chartPreviousClose,
        @JsonProperty("previousClose") BigDecimal previousClose,
        @JsonProperty("shortName") String shortName,
        @JsonProperty("longName") String longName
    ) {

        /**
         * Previous session close, preferring the explicit field over the chart baseline
         */
        public BigDecimal previousCloseOrNull() {
            return previousClose != null ? previousClose : chartPreviousClose;
        }

        public String displayName() {
            if (longName != null && !longName.isBlank()) {
                return longName;
            }
            return shortName;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorInfo(
        @JsonProperty("code") String code,
        @JsonProperty("description") String description
    ) {
    }

    /**
     * Checks if the response is an error
     */
    public boolean isError() {
        return chart == null || chart.error() != null;
    }

    public Optional<Meta> firstMeta() {
        if (chart == null || chart.result() == null || chart.result().isEmpty()) {
            return Optional.empty();
        }
        Result first = chart.result().get(0);
        return first == null ? Optional.empty() : Optional.ofNullable(first.meta());
    }
}
