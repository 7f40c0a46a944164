package org.nowstart.lending.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class PriceFeedRequestSignerTest {

    @Test
    void sign_returnsHexHmacOfTimestampAndPath() throws Exception {
        PriceFeedRequestSigner signer = new PriceFeedRequestSigner("key", "secret");

        String signature = signer.sign(1_700_000_000L, "/v1/feeds/eth-usd/latest");

        assertThat(signature).hasSize(64).matches("[0-9a-f]+");
        assertThat(signature).isEqualTo(hmacHex("secret", "1700000000/v1/feeds/eth-usd/latest"));
    }

    @Test
    void sign_changesWithTimestamp() {
        PriceFeedRequestSigner signer = new PriceFeedRequestSigner("key", "secret");

        assertThat(signer.sign(1L, "/v1/feeds/eth-usd/latest")).isNotEqualTo(signer.sign(2L, "/v1/feeds/eth-usd/latest"));
    }

    @Test
    void isConfigured_requiresKeyAndSecret() {
        assertThat(new PriceFeedRequestSigner("key", "secret").isConfigured()).isTrue();
        assertThat(new PriceFeedRequestSigner("", "secret").isConfigured()).isFalse();
        assertThat(new PriceFeedRequestSigner("key", null).isConfigured()).isFalse();
    }

    private String hmacHex(String secret, String payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }
}
