package dev.devanks.tuya.processor.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.tuya.processor.exception.AuthException;
import dev.devanks.tuya.processor.exception.InvalidRequestException;
import dev.devanks.tuya.processor.exception.RemoteFetchException;
import dev.devanks.tuya.processor.model.LogFetchResult;
import dev.devanks.tuya.processor.model.LogFetchResult.Termination;
import dev.devanks.tuya.processor.model.LogQuery;
import dev.devanks.tuya.processor.model.TuyaLogEntry;
import dev.devanks.tuya.processor.model.TuyaLogsResponse;
import dev.devanks.tuya.processor.model.TuyaTokenResponse;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signed, paginated access to Tuya device logs.
 * A fetch either returns every page it walked through or throws; partial pages are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TuyaLogClient {

    static final int MAX_PAGE_SIZE = 100;
    static final long DAY_MS = 86_400_000L;
    // Values below this are epoch seconds (10^10 s is in the year 2286)
    static final long SECONDS_THRESHOLD = 10_000_000_000L;
    private static final int SIMPLE_GRANT_TYPE = 1;

    private final TuyaApiClient tuyaApiClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public String acquireAccessToken() {
        log.info("Requesting Tuya access token.");
        TuyaTokenResponse response;
        try {
            response = tuyaApiClient.getToken(SIMPLE_GRANT_TYPE);
        } catch (FeignException e) {
            log.error("Tuya token call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8(), e);
            throw new AuthException("Failed to get access token: HTTP " + e.status() + " " + e.contentUTF8(), e);
        }

        if (response == null || !response.isSuccess()
                || response.getResult() == null || response.getResult().getAccessToken() == null) {
            String body = toJson(response);
            log.error("Tuya refused to issue an access token: {}", body);
            throw new AuthException("Failed to get access token: " + body);
        }
        log.info("Access token obtained.");
        return response.getResult().getAccessToken();
    }

    /**
     * Acquires a new token and fetches logs with it. Tokens are not cached between calls.
     */
    public LogFetchResult fetchLogsWithFreshToken(String deviceId, LogQuery query) {
        String accessToken = acquireAccessToken();
        log.info("Fetching device logs (deviceId={}, start={}, end={}, size={})...",
                deviceId, query.getStart(), query.getEnd(), query.getSize());
        return fetchLogs(accessToken, deviceId, query);
    }

    public LogFetchResult fetchLogs(String accessToken, String deviceId, LogQuery query) {
        long[] window = resolveWindow(query.getStart(), query.getEnd(), clock.millis());
        int wantSize = Math.max(0, query.getSize());
        int requestSize = (wantSize == 0 || wantSize > MAX_PAGE_SIZE) ? MAX_PAGE_SIZE : wantSize;
        int maxPages = query.getMaxPages() >= 1 ? query.getMaxPages() : LogQuery.DEFAULT_MAX_PAGES;

        Map<String, String> params = new LinkedHashMap<>();
        params.put("start_time", String.valueOf(window[0]));
        params.put("end_time", String.valueOf(window[1]));
        params.put("type", query.getEventTypeFilter() == null ? LogQuery.ALL_EVENT_TYPES : query.getEventTypeFilter());
        params.put("size", String.valueOf(requestSize));
        params.put("query_type", "1");
        if (query.getExtraParams() != null) {
            query.getExtraParams().forEach((key, value) -> {
                if (key == null || value == null) {
                    throw new InvalidRequestException("Extra query parameter with null key or value: " + key + "=" + value);
                }
                params.put(key, value);
            });
        }
        if (query.getStartRowKey() != null && !query.getStartRowKey().isBlank()) {
            params.put("start_row_key", query.getStartRowKey());
        }

        List<TuyaLogEntry> entries = new ArrayList<>();
        TuyaLogsResponse.LogsResult page = fetchPage(accessToken, deviceId, params, 1);
        int pageCount = 1;
        appendLogs(entries, page);
        log.debug("Fetched {} logs in first request", sizeOf(page));

        String previousCursor = null;
        Termination termination;
        while (true) {
            termination = nextStep(page, entries.size(), wantSize, pageCount, maxPages, previousCursor);
            if (termination != null) {
                break;
            }
            previousCursor = page.getNextRowKey();
            params.put("start_row_key", previousCursor);
            pageCount++;
            page = fetchPage(accessToken, deviceId, params, pageCount);
            appendLogs(entries, page);
            log.debug("Fetched {} more logs, total so far: {}", sizeOf(page), entries.size());
        }

        log.info("Fetched {} logs for device {} in {} page(s); stopped: {}",
                entries.size(), deviceId, pageCount, termination);
        return LogFetchResult.builder()
                .entries(List.copyOf(entries))
                .pageCount(pageCount)
                .terminationReason(termination)
                .build();
    }

    /**
     * Decides whether the pagination loop stops after the page just read.
     *
     * @return the termination reason, or null when another page should be requested
     */
    @VisibleForTesting
    static Termination nextStep(TuyaLogsResponse.LogsResult page, int fetchedSoFar, int wantSize,
                                int pageCount, int maxPages, String previousCursor) {
        if (!Boolean.TRUE.equals(page.getHasNext()) || page.getNextRowKey() == null || page.getNextRowKey().isEmpty()) {
            return Termination.NO_MORE_PAGES;
        }
        if (wantSize > 0 && fetchedSoFar >= wantSize) {
            return Termination.SIZE_REACHED;
        }
        if (pageCount >= maxPages) {
            return Termination.MAX_PAGES_REACHED;
        }
        if (Objects.equals(previousCursor, page.getNextRowKey())) {
            return Termination.CURSOR_REPEATED;
        }
        return null;
    }

    /**
     * Resolves the requested window to epoch milliseconds.
     *
     * @return {@code [startMs, endMs]} with start not after end
     */
    @VisibleForTesting
    static long[] resolveWindow(Long start, Long end, long nowMs) {
        long endMs;
        if (end == null || end == 0) {
            endMs = nowMs;
        } else if (end < 0) {
            endMs = nowMs + end * DAY_MS;
        } else {
            endMs = toMillis(end);
        }

        long startMs;
        if (start == null || start == 0) {
            startMs = endMs - DAY_MS;
        } else if (start < 0) {
            startMs = nowMs + start * DAY_MS;
        } else {
            startMs = toMillis(start);
        }

        if (startMs > endMs) {
            return new long[]{endMs, startMs};
        }
        return new long[]{startMs, endMs};
    }

    private static long toMillis(long epoch) {
        return epoch < SECONDS_THRESHOLD ? epoch * 1000 : epoch;
    }

    private TuyaLogsResponse.LogsResult fetchPage(String accessToken, String deviceId,
                                                  Map<String, String> params, int pageNumber) {
        TuyaLogsResponse response;
        try {
            response = tuyaApiClient.getDeviceLogs(accessToken, deviceId, Map.copyOf(params));
        } catch (FeignException e) {
            log.error("Tuya device log call failed (Feign): page={}, Status={}, Body={}",
                    pageNumber, e.status(), e.contentUTF8(), e);
            throw new RemoteFetchException("Failed to get device logs: HTTP " + e.status() + " " + e.contentUTF8(), e);
        }

        if (response == null || !response.isSuccess()) {
            String body = toJson(response);
            log.error("Tuya returned a failed device log page {}: {}", pageNumber, body);
            throw new RemoteFetchException("Failed to get device logs: " + body);
        }
        if (response.getResult() == null) {
            throw new RemoteFetchException("Device log page " + pageNumber + " has no result: " + toJson(response));
        }
        return response.getResult();
    }

    private static void appendLogs(List<TuyaLogEntry> entries, TuyaLogsResponse.LogsResult page) {
        if (page.getLogs() != null) {
            entries.addAll(page.getLogs());
        }
    }

    private static int sizeOf(TuyaLogsResponse.LogsResult page) {
        return page.getLogs() == null ? 0 : page.getLogs().size();
    }

    private String toJson(Object response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize Tuya response for diagnostics: {}", e.getMessage());
            return String.valueOf(response);
        }
    }
}
