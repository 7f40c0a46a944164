package org.nowstart.lending.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PriceFeedAuthRequestInterceptorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Test
    void apply_addsSignedHeadersWhenCredentialsConfigured() {
        PriceFeedRequestSigner signer = new PriceFeedRequestSigner("key", "secret");
        PriceFeedAuthRequestInterceptor interceptor = new PriceFeedAuthRequestInterceptor(signer, CLOCK);
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/v1/feeds/eth-usd/latest");

        interceptor.apply(template);

        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
        assertThat(headerValue(template, "User-Agent")).isEqualTo("lending-price-feed/1.0");
        assertThat(headerValue(template, "X-Api-Key")).isEqualTo("key");
        assertThat(headerValue(template, "X-Timestamp")).isEqualTo("1700000000");
        assertThat(headerValue(template, "X-Signature")).isEqualTo(signer.sign(1_700_000_000L, "/v1/feeds/eth-usd/latest"));
    }

    @Test
    void apply_sendsUnsignedRequestWithoutCredentials() {
        PriceFeedAuthRequestInterceptor interceptor = new PriceFeedAuthRequestInterceptor(new PriceFeedRequestSigner("", ""), CLOCK);
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/v1/feeds/eth-usd/latest");

        interceptor.apply(template);

        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
        assertThat(template.headers()).doesNotContainKeys("X-Api-Key", "X-Signature");
    }

    private String headerValue(RequestTemplate template, String key) {
        return template.headers().get(key).iterator().next();
    }
}
