// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/client/TuyaApiClient.java
package dev.devanks.tuya.processor.client;

import dev.devanks.tuya.processor.config.TuyaApiClientConfig;
import dev.devanks.tuya.processor.model.TuyaLogsResponse;
import dev.devanks.tuya.processor.model.TuyaTokenResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

/**
 * Feign client for the Tuya OpenAPI.
 * Every request is signed by the interceptor registered in {@link TuyaApiClientConfig}.
 */
@FeignClient(name = "tuya-api",
        url = "${processor.tuya.base-url}",
        configuration = TuyaApiClientConfig.class)
public interface TuyaApiClient {

    String ACCESS_TOKEN_HEADER = "access_token";

    // grant_type=1 is the "simple mode" token used by cloud projects
    @GetMapping("/v1.0/token")
    TuyaTokenResponse getToken(@RequestParam("grant_type") int grantType);

    @GetMapping("/v1.0/devices/{deviceId}/logs")
    TuyaLogsResponse getDeviceLogs(@RequestHeader(ACCESS_TOKEN_HEADER) String accessToken,
                                   @PathVariable("deviceId") String deviceId,
                                   @RequestParam Map<String, String> query);

}
