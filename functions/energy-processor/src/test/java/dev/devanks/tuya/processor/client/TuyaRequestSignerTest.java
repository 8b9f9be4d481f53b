package dev.devanks.tuya.processor.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TuyaRequestSigner Unit Tests")
class TuyaRequestSignerTest {

    private static final String EMPTY_BODY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    private final TuyaRequestSigner signer = new TuyaRequestSigner("client-id", "secret-key");

    @Test
    @DisplayName("stringToSign: method, empty body hash, blank signature key and path with query")
    void stringToSign_tokenRequest() {
        String result = signer.stringToSign("get", null, "/v1.0/token", Map.of("grant_type", List.of("1")));

        assertThat(result).isEqualTo("GET\n" + EMPTY_BODY_SHA256 + "\n\n/v1.0/token?grant_type=1");
    }

    @Test
    @DisplayName("stringToSign: hashes the request body when present")
    void stringToSign_hashesBody() {
        String result = signer.stringToSign("POST", "{}".getBytes(StandardCharsets.UTF_8), "/v1.0/x", Map.of());

        assertThat(result).isEqualTo("POST\n44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a\n\n/v1.0/x");
    }

    @Test
    @DisplayName("pathWithSortedQuery: sorts keys and signs decoded values")
    void pathWithSortedQuery_sortsAndDecodes() {
        Map<String, Collection<String>> queries = new LinkedHashMap<>();
        queries.put("type", List.of("1%2C2"));
        queries.put("start_time", List.of("1700000000000"));
        queries.put("size", List.of("100"));
        queries.put("end_time", List.of("1700086400000"));

        String result = TuyaRequestSigner.pathWithSortedQuery("/v1.0/devices/dev-1/logs", queries);

        assertThat(result).isEqualTo(
                "/v1.0/devices/dev-1/logs?end_time=1700086400000&size=100&start_time=1700000000000&type=1,2");
    }

    @Test
    @DisplayName("pathWithSortedQuery: returns the bare path without queries")
    void pathWithSortedQuery_noQueries() {
        assertThat(TuyaRequestSigner.pathWithSortedQuery("/v1.0/token", Map.of())).isEqualTo("/v1.0/token");
        assertThat(TuyaRequestSigner.pathWithSortedQuery("/v1.0/token", null)).isEqualTo("/v1.0/token");
    }

    @Test
    @DisplayName("sign: token request signature without access token")
    void sign_withoutAccessToken() {
        String stringToSign = "GET\n" + EMPTY_BODY_SHA256 + "\n\n/v1.0/token?grant_type=1";

        String sign = signer.sign(null, "1700000000000", "nonce-1", stringToSign);

        assertThat(sign).isEqualTo("986F5A0AD70AEA807AC712C8877CC3E31333B15970F58888A109C540B654DE77");
    }

    @Test
    @DisplayName("sign: business request signature includes the access token")
    void sign_withAccessToken() {
        String stringToSign = "GET\n" + EMPTY_BODY_SHA256
                + "\n\n/v1.0/devices/dev-1/logs?end_time=1700086400000&size=100&start_time=1700000000000&type=1,2";

        String sign = signer.sign("token-abc", "1700000000000", "nonce-1", stringToSign);

        assertThat(sign).isEqualTo("EFF07966B75F06CAA341E4DD37B9182DFF203DF1307A39007E08D1BB4E472954");
        assertThat(sign).isNotEqualTo(signer.sign(null, "1700000000000", "nonce-1", stringToSign));
    }

    @Test
    @DisplayName("sign: a different nonce yields a different signature")
    void sign_dependsOnNonce() {
        String stringToSign = "GET\n" + EMPTY_BODY_SHA256 + "\n\n/v1.0/token?grant_type=1";

        assertThat(signer.sign(null, "1700000000000", "nonce-1", stringToSign))
                .isNotEqualTo(signer.sign(null, "1700000000000", "nonce-2", stringToSign));
    }
}
