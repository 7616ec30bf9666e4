package kr.lsfeed.service.vi;

import kr.lsfeed.domain.stream.TradeTick;
import kr.lsfeed.domain.vi.ViState;

/**
 * Receives VI cascade events on the router thread. Implementations must not block.
 */
public interface ViObserver {

    default void onActivated(String symbol, ViState state) {
    }

    /**
     * The state carries releaseTime and duration.
     */
    default void onReleased(String symbol, ViState state) {
    }

    default void onTrade(String symbol, TradeTick tick) {
    }
}
