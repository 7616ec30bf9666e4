package kr.lsfeed.service.vi;

import kr.lsfeed.domain.stream.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listing market per symbol, used to pick the trade channel for a VI symbol.
 *
 * Until a stock master is loaded ({@link #load(Path)} or {@link #registerAll(Map)}),
 * symbols that were never registered fall back to the default market. Once loaded,
 * the directory is authoritative and unknown symbols have no market.
 *
 * Stock master file format, one symbol per line:
 * <pre>
 * # symbol,market
 * 005930,KOSPI
 * 035720,KOSDAQ
 * </pre>
 */
public class MarketDirectory {
    private static final Logger log = LoggerFactory.getLogger(MarketDirectory.class);

    private final Map<String, Market> markets = new ConcurrentHashMap<>();
    private final Market defaultMarket;
    private volatile boolean loaded = false;

    public MarketDirectory(Market defaultMarket) {
        this.defaultMarket = Objects.requireNonNull(defaultMarket, "defaultMarket");
    }

    public void register(String symbol, Market market) {
        markets.put(symbol, market);
    }

    /**
     * Add a stock master. From here on, unknown symbols are no longer mapped to the default market.
     */
    public void registerAll(Map<String, Market> entries) {
        markets.putAll(entries);
        loaded = true;
        log.info("[VI] Market directory loaded {} symbols ({} total)", entries.size(), markets.size());
    }

    /**
     * Load a stock master file. Malformed lines are skipped with a warning.
     *
     * @return number of symbols read from the file
     * @throws IOException if the file cannot be read
     */
    public int load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Map<String, Market> entries = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(",");
            if (parts.length != 2 || parts[0].isBlank()) {
                log.warn("[VI] {}:{} skipped, expected 'symbol,market': {}", file, lineNo, line);
                continue;
            }
            try {
                entries.put(parts[0].trim(), Market.valueOf(parts[1].trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("[VI] {}:{} skipped, unknown market '{}'", file, lineNo, parts[1].trim());
            }
        }
        registerAll(entries);
        return entries.size();
    }

    /**
     * Market of a symbol, or empty when a stock master is loaded and does not list it.
     */
    public Optional<Market> lookup(String symbol) {
        Market market = markets.get(symbol);
        if (market != null) {
            return Optional.of(market);
        }
        if (loaded) {
            return Optional.empty();
        }
        log.debug("[VI] No market for {}, using {}", symbol, defaultMarket);
        return Optional.of(defaultMarket);
    }

    public boolean isLoaded() {
        return loaded;
    }

    public int size() {
        return markets.size();
    }
}
