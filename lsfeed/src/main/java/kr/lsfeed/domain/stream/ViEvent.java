package kr.lsfeed.domain.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of a VI_ (volatility interruption) event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ViEvent(
    @JsonProperty("vi_gubun") String viGubun,          // 0 release, 1 static, 2 dynamic, 3 both
    @JsonProperty("svi_recprice") String staticBasePrice,
    @JsonProperty("dvi_recprice") String dynamicBasePrice,
    @JsonProperty("vi_trgprice") String triggerPrice,
    @JsonProperty("shcode") String shcode,
    @JsonProperty("ref_shcode") String refShcode,
    @JsonProperty("time") String time,
    @JsonProperty("exchname") String exchangeName
) {
    /**
     * Symbol the event applies to: ref_shcode, falling back to shcode.
     */
    public String symbol() {
        if (refShcode != null && !refShcode.isBlank()) return refShcode.trim();
        return shcode == null ? null : shcode.trim();
    }

    /**
     * Numeric activation code; 0 means release. Returns -1 when the field is missing or malformed.
     */
    public int activationCode() {
        if (viGubun == null || viGubun.isBlank()) return -1;
        try {
            return Integer.parseInt(viGubun.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public boolean isRelease() {
        return activationCode() == 0;
    }

    public BigDecimal triggerPriceValue() {
        return WireNumbers.decimal(triggerPrice);
    }

    public BigDecimal staticBasePriceValue() {
        return WireNumbers.decimal(staticBasePrice);
    }

    public BigDecimal dynamicBasePriceValue() {
        return WireNumbers.decimal(dynamicBasePrice);
    }
}
