package mytrader.worker.handler;

import mytrader.worker.model.TaskStats;

/**
 * Refreshes the local data of one symbol from an upstream provider.
 */
@FunctionalInterface
public interface SymbolUpdater {

    /**
     * @return how many records were written, failed or skipped for this symbol
     * @throws Exception if the symbol could not be updated at all; counted as one failure
     */
    TaskStats update(String symbol) throws Exception;
}
