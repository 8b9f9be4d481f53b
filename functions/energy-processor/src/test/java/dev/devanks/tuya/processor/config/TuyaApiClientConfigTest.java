package dev.devanks.tuya.processor.config;

import dev.devanks.tuya.processor.client.TuyaApiClient;
import dev.devanks.tuya.processor.client.TuyaRequestSigner;
import feign.Logger;
import feign.Request;
import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TuyaApiClientConfig Unit Tests")
class TuyaApiClientConfigTest {

    private static final Instant NOW = Instant.parse("2024-03-21T12:00:00Z");

    private ProcessorProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new ProcessorProperties();
        properties.getTuya().setClientId("client-id");
        properties.getTuya().setSecret("secret-key");
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private static RequestTemplate tokenRequest() {
        RequestTemplate template = new RequestTemplate();
        template.method(Request.HttpMethod.GET);
        template.uri("/v1.0/token");
        template.query("grant_type", "1");
        return template;
    }

    private static String header(RequestTemplate template, String name) {
        Collection<String> values = template.headers().get(name);
        assertThat(values).as("header %s", name).isNotNull().hasSize(1);
        return values.iterator().next();
    }

    @Test
    @DisplayName("tuyaRequestSigner: fails fast when the secret is missing")
    void tuyaRequestSigner_missingSecret_throws() {
        properties.getTuya().setSecret(" ");
        TuyaApiClientConfig config = new TuyaApiClientConfig(properties, clock);

        assertThatThrownBy(config::tuyaRequestSigner)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Tuya credentials");
    }

    @Test
    @DisplayName("tuyaRequestSigner: fails fast when the client id is missing")
    void tuyaRequestSigner_missingClientId_throws() {
        properties.getTuya().setClientId(null);
        TuyaApiClientConfig config = new TuyaApiClientConfig(properties, clock);

        assertThatThrownBy(config::tuyaRequestSigner).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("signingInterceptor: adds all signature headers to a token request")
    void signingInterceptor_addsSignatureHeaders() {
        // Arrange
        TuyaApiClientConfig config = new TuyaApiClientConfig(properties, clock);
        TuyaRequestSigner signer = config.tuyaRequestSigner();
        RequestInterceptor interceptor = config.signingInterceptor(signer);
        RequestTemplate template = tokenRequest();

        // Act
        interceptor.apply(template);

        // Assert
        assertThat(header(template, TuyaApiClientConfig.CLIENT_ID_HEADER)).isEqualTo("client-id");
        assertThat(header(template, TuyaApiClientConfig.TIMESTAMP_HEADER)).isEqualTo(String.valueOf(NOW.toEpochMilli()));
        assertThat(header(template, TuyaApiClientConfig.SIGN_METHOD_HEADER)).isEqualTo("HMAC-SHA256");
        String nonce = header(template, TuyaApiClientConfig.NONCE_HEADER);
        assertThat(nonce).isNotBlank();

        String expectedSign = signer.sign(null, String.valueOf(NOW.toEpochMilli()), nonce,
                signer.stringToSign("GET", null, "/v1.0/token", template.queries()));
        assertThat(header(template, TuyaApiClientConfig.SIGN_HEADER))
                .isEqualTo(expectedSign)
                .matches("[0-9A-F]{64}");
    }

    @Test
    @DisplayName("signRequest: includes the access token of business requests in the signature")
    void signRequest_withAccessToken() {
        TuyaRequestSigner signer = new TuyaRequestSigner("client-id", "secret-key");
        RequestTemplate withToken = tokenRequest();
        withToken.header(TuyaApiClient.ACCESS_TOKEN_HEADER, "token-abc");

        TuyaApiClientConfig.signRequest(withToken, signer, clock);

        String nonce = header(withToken, TuyaApiClientConfig.NONCE_HEADER);
        String expectedSign = signer.sign("token-abc", String.valueOf(NOW.toEpochMilli()), nonce,
                signer.stringToSign("GET", null, "/v1.0/token", withToken.queries()));
        assertThat(header(withToken, TuyaApiClientConfig.SIGN_HEADER)).isEqualTo(expectedSign);
    }

    @Test
    @DisplayName("signRequest: draws a fresh nonce for every request")
    void signRequest_freshNoncePerRequest() {
        TuyaRequestSigner signer = new TuyaRequestSigner("client-id", "secret-key");
        RequestTemplate first = tokenRequest();
        RequestTemplate second = tokenRequest();

        TuyaApiClientConfig.signRequest(first, signer, clock);
        TuyaApiClientConfig.signRequest(second, signer, clock);

        assertThat(header(first, TuyaApiClientConfig.NONCE_HEADER))
                .isNotEqualTo(header(second, TuyaApiClientConfig.NONCE_HEADER));
        assertThat(header(first, TuyaApiClientConfig.SIGN_HEADER))
                .isNotEqualTo(header(second, TuyaApiClientConfig.SIGN_HEADER));
    }

    @Test
    @DisplayName("feignLoggerLevel: BASIC")
    void feignLoggerLevel_basic() {
        assertThat(new TuyaApiClientConfig(properties, clock).feignLoggerLevel()).isEqualTo(Logger.Level.BASIC);
    }
}
