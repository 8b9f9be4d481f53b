package dev.devanks.tuya.processor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LogFetchResult {

    /**
     * Why the pagination loop stopped.
     */
    public enum Termination {
        NO_MORE_PAGES,
        SIZE_REACHED,
        MAX_PAGES_REACHED,
        CURSOR_REPEATED
    }

    List<TuyaLogEntry> entries; // All pages, in server order
    int pageCount;
    Termination terminationReason;
}
