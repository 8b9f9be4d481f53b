package dev.devanks.tuya.processor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-day consumption rows, newest first, with a summary over the returned rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DailyBreakdown {

    private String deviceId;
    private Period period;
    private List<DayRow> dailyData;
    private int totalDays;
    private Summary summary;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Period {
        private String start;
        private String end;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DayRow {
        private String date;
        private double low;
        private double high;
        private double total;
        private int devicesCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private double totalLow;
        private double totalHigh;
        private double grandTotal;
        private double averageLow;
        private double averageHigh;
        private double averageTotal;
    }
}
