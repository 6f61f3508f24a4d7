package com.stocksignal.data;

import com.stocksignal.model.Bar;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Supplies daily bars for one instrument, ascending by date and unique per date.
 * An instrument with no data in the range yields an empty list.
 */
public interface BarSource {

    List<Bar> fetchBars(String code, LocalDate start, LocalDate end) throws IOException;

    boolean healthCheck();
}
