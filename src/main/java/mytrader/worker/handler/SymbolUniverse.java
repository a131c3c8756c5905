package mytrader.worker.handler;

import java.util.List;

/**
 * Source of the symbols a synchronization task iterates over.
 */
public interface SymbolUniverse {

    /** Every symbol known to the local market database. */
    List<String> allSymbols() throws Exception;

    /** The user's watch list, used when a task asks for favorites without naming any. */
    List<String> favoriteSymbols() throws Exception;
}
