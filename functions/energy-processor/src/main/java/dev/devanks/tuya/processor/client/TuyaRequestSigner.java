package dev.devanks.tuya.processor.client;

import com.google.common.hash.Hashing;
import lombok.RequiredArgsConstructor;
import org.springframework.web.util.UriUtils;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Tuya "new signature" algorithm (HMAC-SHA256).
 * <pre>
 * stringToSign = METHOD \n sha256Hex(body) \n optionalSignatureKey \n path[?k1=v1&amp;k2=v2]
 * sign         = HEX_UPPER(HMAC_SHA256(secret, clientId + [accessToken] + t + nonce + stringToSign))
 * </pre>
 * Query keys are sorted and values are signed in decoded form.
 */
@RequiredArgsConstructor
public class TuyaRequestSigner {

    public static final String SIGN_METHOD = "HMAC-SHA256";

    private final String clientId;
    private final String secret;

    public String stringToSign(String method, byte[] body, String path, Map<String, Collection<String>> queries) {
        String contentSha256 = Hashing.sha256()
                .hashBytes(body == null ? new byte[0] : body)
                .toString();
        String optionalSignatureKey = "";
        return String.join("\n",
                method.toUpperCase(Locale.ROOT),
                contentSha256,
                optionalSignatureKey,
                pathWithSortedQuery(path, queries));
    }

    /**
     * @param accessToken null for the token request itself
     */
    public String sign(String accessToken, String t, String nonce, String stringToSign) {
        String payload = clientId + (accessToken == null ? "" : accessToken) + t + nonce + stringToSign;
        return Hashing.hmacSha256(secret.getBytes(UTF_8))
                .hashString(payload, UTF_8)
                .toString()
                .toUpperCase(Locale.ROOT);
    }

    public String getClientId() {
        return clientId;
    }

    static String pathWithSortedQuery(String path, Map<String, Collection<String>> queries) {
        if (queries == null || queries.isEmpty()) {
            return path;
        }
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(queries).forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                joiner.add(key + "=");
                return;
            }
            values.forEach(value -> joiner.add(key + "=" + (value == null ? "" : UriUtils.decode(value, UTF_8))));
        });
        return path + "?" + joiner;
    }
}
