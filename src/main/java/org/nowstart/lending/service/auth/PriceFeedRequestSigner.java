package org.nowstart.lending.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class PriceFeedRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    @Getter
    private final String apiKey;
    private final String apiSecret;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    /**
     * Hex HMAC-SHA256 of {@code timestamp + path} keyed by the API secret.
     */
    public String sign(long timestamp, String path) {
        String payload = timestamp + (path == null ? "" : path);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign price feed request", e);
        }
    }
}
