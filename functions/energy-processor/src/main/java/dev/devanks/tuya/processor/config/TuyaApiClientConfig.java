// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/config/TuyaApiClientConfig.java
package dev.devanks.tuya.processor.config;

import dev.devanks.tuya.processor.client.TuyaApiClient;
import dev.devanks.tuya.processor.client.TuyaRequestSigner;
import feign.Logger.Level;
import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.Collection;
import java.util.UUID;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign configuration scoped to {@link TuyaApiClient}. Not a {@code @Configuration} on purpose,
 * so its beans do not leak into the application context.
 */
@RequiredArgsConstructor
@Slf4j
public class TuyaApiClientConfig {

    static final String CLIENT_ID_HEADER = "client_id";
    static final String TIMESTAMP_HEADER = "t";
    static final String SIGN_HEADER = "sign";
    static final String SIGN_METHOD_HEADER = "sign_method";
    static final String NONCE_HEADER = "nonce";

    private final ProcessorProperties processorProperties;
    private final Clock clock;

    @Bean
    public TuyaRequestSigner tuyaRequestSigner() {
        var tuya = processorProperties.getTuya();
        if (tuya.getClientId() == null || tuya.getClientId().isBlank()
                || tuya.getSecret() == null || tuya.getSecret().isBlank()) {
            log.error("Tuya client id or secret is missing. Cannot sign Tuya API requests.");
            throw new IllegalStateException("Tuya credentials not available for Feign client.");
        }
        return new TuyaRequestSigner(tuya.getClientId(), tuya.getSecret());
    }

    @Bean
    public RequestInterceptor signingInterceptor(TuyaRequestSigner signer) {
        return template -> signRequest(template, signer, clock);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }

    /**
     * Adds the Tuya signature headers. A fresh timestamp and nonce are drawn for every request,
     * so no two pages share a signature.
     */
    static void signRequest(RequestTemplate template, TuyaRequestSigner signer, Clock clock) {
        String t = String.valueOf(clock.millis());
        String nonce = UUID.randomUUID().toString();
        String accessToken = firstHeader(template, TuyaApiClient.ACCESS_TOKEN_HEADER);

        String stringToSign = signer.stringToSign(template.method(), template.body(), template.path(), template.queries());
        String sign = signer.sign(accessToken, t, nonce, stringToSign);

        log.debug("Signing Tuya request {} {} (token present: {})", template.method(), template.path(), accessToken != null);
        template.header(CLIENT_ID_HEADER, signer.getClientId());
        template.header(TIMESTAMP_HEADER, t);
        template.header(SIGN_HEADER, sign);
        template.header(SIGN_METHOD_HEADER, TuyaRequestSigner.SIGN_METHOD);
        template.header(NONCE_HEADER, nonce);
        template.header(USER_AGENT, "GCP-Cloud-Function-Tuya-Energy-Processor-Java-Feign/1.0");
    }

    private static String firstHeader(RequestTemplate template, String name) {
        Collection<String> values = template.headers().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.iterator().next();
    }
}
