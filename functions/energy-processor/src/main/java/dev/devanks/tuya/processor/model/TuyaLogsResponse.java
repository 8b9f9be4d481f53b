// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/model/TuyaLogsResponse.java
package dev.devanks.tuya.processor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of {@code GET /v1.0/devices/{id}/logs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TuyaLogsResponse {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("code")
    private Integer code;

    @JsonProperty("msg")
    private String msg;

    @JsonProperty("t")
    private Long t;

    @JsonProperty("result")
    private LogsResult result;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogsResult {

        @JsonProperty("logs")
        private List<TuyaLogEntry> logs;

        @JsonProperty("has_next")
        private Boolean hasNext;

        @JsonProperty("next_row_key")
        private String nextRowKey;
    }
}
