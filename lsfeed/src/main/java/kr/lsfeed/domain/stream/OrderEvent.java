package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of an order lifecycle event (SC0..SC4).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderEvent(
    @JsonProperty("ordno") String orderNo,
    @JsonProperty("orgordno") String originalOrderNo,
    @JsonProperty("shtnIsuno") String shortCode,
    @JsonProperty("Isunm") String instrumentName,
    @JsonProperty("ordqty") String orderQuantity,
    @JsonProperty("execqty") String executedQuantity,
    @JsonProperty("unercqty") String remainingQuantity,
    @JsonProperty("ordprc") String orderPrice,
    @JsonProperty("execprc") String executedPrice,
    @JsonProperty("ordtm") String orderTime,
    @JsonProperty("exectime") String executionTime,
    @JsonProperty("msgcode") String messageCode
) {
    /**
     * Six-digit symbol. Account feeds prefix short codes with "A" (e.g. A005930).
     */
    public String symbol() {
        if (shortCode == null) return null;
        String s = shortCode.trim();
        return s.length() == 7 && s.charAt(0) == 'A' ? s.substring(1) : s;
    }

    public long orderQuantityValue() {
        return WireNumbers.longValue(orderQuantity);
    }

    public long executedQuantityValue() {
        return WireNumbers.longValue(executedQuantity);
    }

    public long remainingQuantityValue() {
        return WireNumbers.longValue(remainingQuantity);
    }

    public BigDecimal orderPriceValue() {
        return WireNumbers.decimal(orderPrice);
    }

    public BigDecimal executedPriceValue() {
        return WireNumbers.decimal(executedPrice);
    }
}
