package dev.devanks.tuya.processor.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Options for a paginated device log fetch.
 * <p>
 * {@code start} and {@code end} accept epoch seconds, epoch milliseconds, negative day offsets
 * relative to now, or {@code null}/0 (end: now, start: one day before end).
 */
@Value
@Builder(toBuilder = true)
public class LogQuery {

    public static final String ALL_EVENT_TYPES = "1,2,3,4,5,6,7,8,9,10";
    public static final int DEFAULT_MAX_PAGES = 50;

    Long start;
    Long end;
    @Builder.Default
    String eventTypeFilter = ALL_EVENT_TYPES;
    /**
     * Total number of entries wanted across all pages; 0 means no limit.
     */
    @Builder.Default
    int size = 0;
    @Builder.Default
    int maxPages = DEFAULT_MAX_PAGES;
    String startRowKey;
    @Builder.Default
    Map<String, String> extraParams = Map.of();
}
