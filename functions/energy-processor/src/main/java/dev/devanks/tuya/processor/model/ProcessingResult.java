// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/model/ProcessingResult.java
package dev.devanks.tuya.processor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingResult {

    public static final String NO_NEW_LOGS_MESSAGE = "No new logs.";
    public static final String COMPLETED_MESSAGE = "Scheduled task completed successfully.";

    public enum Status {
        NO_NEW_LOGS, COMPLETED
    }

    private Status status;
    private String message;
    private String deviceId;
    private int readingsFetched;
    private int readingsAggregated;
    private int readingsSkipped;    // Stale or corrupt entries
    private int bucketsInserted;
    private int bucketsUpdated;
    private Long durationMs;

}
