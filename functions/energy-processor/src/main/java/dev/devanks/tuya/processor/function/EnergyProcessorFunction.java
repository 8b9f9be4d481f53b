package dev.devanks.tuya.processor.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.tuya.processor.config.ProcessorProperties;
import dev.devanks.tuya.processor.exception.InvalidRequestException;
import dev.devanks.tuya.processor.model.ConsumptionTotals;
import dev.devanks.tuya.processor.model.DailyBreakdown;
import dev.devanks.tuya.processor.service.ConsumptionQueryService;
import dev.devanks.tuya.processor.service.EnergyProcessorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class EnergyProcessorFunction {

    static final String DEVICE_ID = "deviceId";
    static final String FORCE_START_TIMESTAMP = "forceStartTimestamp";
    static final String START_DATE = "startDate";
    static final String END_DATE = "endDate";
    static final String MAX_DAYS = "maxDays";

    private final EnergyProcessorService energyProcessorService;
    private final ConsumptionQueryService consumptionQueryService;
    private final ProcessorProperties properties;

    /**
     * Main function bean, invoked by the scheduler. Returns the status message of the run.
     */
    @Bean
    public Function<HashMap<String, Object>, String> processEnergyLogs() {
        return payload -> {
            log.info("processEnergyLogs function triggered with payload: {}", payload);
            try {
                return runProcessing(payload == null ? Map.of() : payload);
            } catch (Exception e) {
                // Logging of the failure happens within the service
                return "Processing failed: " + e.getMessage();
            }
        };
    }

    @Bean
    public Function<HashMap<String, Object>, ConsumptionTotals> consumptionTotals() {
        return payload -> {
            Map<String, Object> request = payload == null ? Map.of() : payload;
            return consumptionQueryService.getConsumptionTotals(
                    optionalString(request, DEVICE_ID),
                    optionalString(request, START_DATE),
                    optionalString(request, END_DATE));
        };
    }

    @Bean
    public Function<HashMap<String, Object>, DailyBreakdown> dailyBreakdown() {
        return payload -> {
            Map<String, Object> request = payload == null ? Map.of() : payload;
            Long maxDays = optionalLong(request, MAX_DAYS);
            return consumptionQueryService.getDailyBreakdown(
                    optionalString(request, DEVICE_ID),
                    optionalString(request, START_DATE),
                    optionalString(request, END_DATE),
                    maxDays == null ? properties.getQuery().getMaxBreakdownDays() : maxDays.intValue());
        };
    }

    @VisibleForTesting
    String runProcessing(Map<String, Object> payload) {
        String deviceId = optionalString(payload, DEVICE_ID);
        if (deviceId == null) {
            deviceId = properties.getTuya().getDeviceId();
            log.info("No deviceId in payload, using configured device {}", deviceId);
        }
        Long forceStart = optionalLong(payload, FORCE_START_TIMESTAMP);
        return energyProcessorService.processEnergyLogs(deviceId, forceStart).getMessage();
    }

    private static String optionalString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static Long optionalLong(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid '" + key + "' in payload: " + value, e);
        }
    }
}
