package dev.devanks.tuya.processor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL) // deviceId is absent for all-device totals
public class ConsumptionTotals {
    private String deviceId;
    private String startDate;
    private String endDate;
    private double totalLow;
    private double totalHigh;
}
