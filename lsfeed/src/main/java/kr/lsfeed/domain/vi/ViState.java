package kr.lsfeed.domain.vi;

import kr.lsfeed.domain.stream.Market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * VI state of one symbol.
 *
 * @param symbol           six-digit symbol code
 * @param status           ACTIVE while the interruption lasts
 * @param type             kind of interruption that activated it (null if the code was not recognised)
 * @param market           market whose trade channel carries the symbol's ticks
 * @param triggerPrice     price that triggered the VI, may be null
 * @param staticBasePrice  static VI reference price, may be null
 * @param dynamicBasePrice dynamic VI reference price, may be null
 * @param activationTime   when the activation was observed
 * @param releaseTime      when the release was observed, null while active
 * @param duration         releaseTime - activationTime, null while active
 */
public record ViState(
    String symbol,
    ViStatus status,
    ViType type,
    Market market,
    BigDecimal triggerPrice,
    BigDecimal staticBasePrice,
    BigDecimal dynamicBasePrice,
    Instant activationTime,
    Instant releaseTime,
    Duration duration
) {
    public static ViState activated(String symbol, ViType type, Market market, BigDecimal triggerPrice,
                                    BigDecimal staticBasePrice, BigDecimal dynamicBasePrice, Instant at) {
        return new ViState(symbol, ViStatus.ACTIVE, type, market, triggerPrice,
            staticBasePrice, dynamicBasePrice, at, null, null);
    }

    /**
     * The released state, with duration measured from activation.
     */
    public ViState release(Instant at) {
        return new ViState(symbol, ViStatus.INACTIVE, type, market, triggerPrice,
            staticBasePrice, dynamicBasePrice, activationTime, at, Duration.between(activationTime, at));
    }

    public boolean isActive() {
        return status == ViStatus.ACTIVE;
    }

    public long durationSeconds() {
        return duration == null ? 0 : duration.getSeconds();
    }
}
