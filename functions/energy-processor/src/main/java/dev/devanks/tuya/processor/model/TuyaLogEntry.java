// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/model/TuyaLogEntry.java
package dev.devanks.tuya.processor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TuyaLogEntry {

    @JsonProperty("code")
    private String code;        // Data point code, e.g. "add_ele"

    @JsonProperty("event_time")
    private Long eventTime;     // Epoch seconds or milliseconds, depending on firmware

    @JsonProperty("value")
    private String value;       // Numeric string in milli-units (Wh for add_ele)
}
