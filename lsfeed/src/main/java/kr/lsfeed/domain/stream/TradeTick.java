package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of a trade tick (S3_ for KOSPI, K3_ for KOSDAQ).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradeTick(
    @JsonProperty("shcode") String symbol,
    @JsonProperty("chetime") String tradeTime,
    @JsonProperty("price") String price,
    @JsonProperty("sign") String sign,
    @JsonProperty("change") String change,
    @JsonProperty("drate") String changeRate,
    @JsonProperty("cvolume") String tradeVolume,
    @JsonProperty("volume") String cumulativeVolume,
    @JsonProperty("cpower") String tradeStrength
) {
    public BigDecimal priceValue() {
        return WireNumbers.decimal(price);
    }

    public BigDecimal changeRateValue() {
        return WireNumbers.decimal(changeRate);
    }

    public long tradeVolumeValue() {
        return WireNumbers.longValue(tradeVolume);
    }

    public long cumulativeVolumeValue() {
        return WireNumbers.longValue(cumulativeVolume);
    }
}
