package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.model.StatKey;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-symbol synchronization shared by the price, financial report and index tasks.
 * <p>
 * Params:
 * <ul>
 *   <li>{@code stock_range}: {@code all} (default), {@code favorites} or {@code custom}</li>
 *   <li>{@code custom_stocks}: the symbols for {@code custom}, must not be empty</li>
 *   <li>{@code stocks}: explicit symbols for {@code favorites}; the watch list is used when absent</li>
 * </ul>
 * A symbol whose update throws counts as one failure and the run goes on.
 */
public class SymbolSyncHandler implements TaskHandler {

    public static final String UPDATE_STOCK_PRICES = "update_stock_prices";
    public static final String UPDATE_ALL_STOCKS = "update_all_stocks";
    public static final String UPDATE_FAVORITES = "update_favorites";
    public static final String UPDATE_FINANCIAL_REPORTS = "update_financial_reports";
    public static final String UPDATE_INDEX_DATA = "update_index_data";

    private static final Logger log = LoggerFactory.getLogger(SymbolSyncHandler.class);

    private final String description;
    private final SymbolUniverse universe;
    private final SymbolUpdater updater;
    private final int checkpointInterval;
    private final Duration pausePollInterval;

    public SymbolSyncHandler(String description, SymbolUniverse universe, SymbolUpdater updater,
            int checkpointInterval, Duration pausePollInterval) {
        this.description = Objects.requireNonNull(description);
        this.universe = Objects.requireNonNull(universe);
        this.updater = Objects.requireNonNull(updater);
        this.checkpointInterval = checkpointInterval;
        this.pausePollInterval = Objects.requireNonNull(pausePollInterval);
    }

    /**
     * Register the stock price handler (with its legacy names) on the registry.
     */
    public static void registerStockPrices(HandlerRegistry registry, SymbolUniverse universe, SymbolUpdater updater,
            int checkpointInterval, Duration pausePollInterval) {
        registry.register(new SymbolSyncHandler("stock prices", universe, updater, checkpointInterval, pausePollInterval),
                UPDATE_STOCK_PRICES, UPDATE_ALL_STOCKS, UPDATE_FAVORITES);
    }

    public static void registerFinancialReports(HandlerRegistry registry, SymbolUniverse universe,
            SymbolUpdater updater, int checkpointInterval, Duration pausePollInterval) {
        registry.register(UPDATE_FINANCIAL_REPORTS,
                new SymbolSyncHandler("financial reports", universe, updater, checkpointInterval, pausePollInterval));
    }

    /**
     * The universe here lists index codes rather than stocks.
     */
    public static void registerIndexData(HandlerRegistry registry, SymbolUniverse indices,
            SymbolUpdater updater, int checkpointInterval, Duration pausePollInterval) {
        registry.register(UPDATE_INDEX_DATA,
                new SymbolSyncHandler("index data", indices, updater, checkpointInterval, pausePollInterval));
    }

    @Override
    public void handle(TaskService tasks, String taskId, JsonNode params) throws Exception {
        String prefix = "[Task-" + Task.shortId(taskId) + "]";

        List<String> symbols;
        try {
            symbols = resolveSymbols(HandlerParams.of(params), prefix);
        } catch (InvalidParamsException e) {
            tasks.fail(taskId, "Invalid params: " + e.getMessage());
            return;
        }
        if (symbols.isEmpty()) {
            tasks.fail(taskId, "Unable to resolve stock list");
            return;
        }

        log.info("{} Updating {} for {} symbols", prefix, description, symbols.size());

        ResumableLoop loop = ResumableLoop.builder(tasks, taskId)
                .totalItems(symbols.size())
                .checkpointInterval(checkpointInterval)
                .pausePollInterval(pausePollInterval)
                .itemLabel(symbols::get)
                .build();

        ResumableLoop.Outcome outcome = loop.run(index -> syncOne(tasks, taskId, symbols.get(index), prefix));
        if (outcome != ResumableLoop.Outcome.COMPLETED) {
            return;
        }

        TaskStats stats = tasks.get(taskId).map(Task::stats).orElse(TaskStats.ZERO);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("updated_symbols", stats.success());
        result.put("total_symbols", symbols.size());

        tasks.complete(taskId, symbols.size(), result,
                "Updated " + description + ": " + stats.success() + " succeeded, "
                        + stats.failed() + " failed, " + stats.skipped() + " skipped");
    }

    private void syncOne(TaskService tasks, String taskId, String symbol, String prefix) throws InterruptedException {
        TaskStats counts;
        try {
            counts = updater.update(symbol);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("{} Failed to update {}: {}", prefix, symbol, e.getMessage());
            tasks.incrementStats(taskId, StatKey.FAILED);
            return;
        }
        if (counts == null) {
            return;
        }
        for (StatKey key : StatKey.values()) {
            tasks.incrementStats(taskId, key, counts.get(key));
        }
    }

    private List<String> resolveSymbols(HandlerParams params, String prefix)
            throws InvalidParamsException, InterruptedException {
        String range = params.getString("stock_range", "all");
        switch (range) {
            case "custom": {
                List<String> custom = params.getStringList("custom_stocks");
                if (custom.isEmpty()) {
                    throw new InvalidParamsException("custom_stocks must be a non-empty list when stock_range is custom");
                }
                return custom;
            }
            case "favorites": {
                List<String> explicit = params.getStringList("stocks");
                return explicit.isEmpty() ? lookup(universe::favoriteSymbols, "favorites", prefix) : explicit;
            }
            case "all":
                return lookup(universe::allSymbols, "all", prefix);
            default:
                throw new InvalidParamsException("stock_range must be one of all, favorites, custom, got '" + range + "'");
        }
    }

    private interface SymbolLookup {
        List<String> get() throws Exception;
    }

    /**
     * Lookup failures read as an empty list. Interruption propagates so the task
     * stays live for recovery.
     */
    private static List<String> lookup(SymbolLookup lookup, String range, String prefix) throws InterruptedException {
        try {
            List<String> symbols = lookup.get();
            return symbols != null ? symbols : List.of();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} Could not list {} symbols", prefix, range, e);
            return List.of();
        }
    }
}
