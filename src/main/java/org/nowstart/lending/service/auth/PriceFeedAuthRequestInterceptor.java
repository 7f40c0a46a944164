package org.nowstart.lending.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.time.Clock;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class PriceFeedAuthRequestInterceptor implements RequestInterceptor {

    private final PriceFeedRequestSigner priceFeedRequestSigner;
    private final Clock clock;

    public PriceFeedAuthRequestInterceptor(PriceFeedRequestSigner priceFeedRequestSigner) {
        this(priceFeedRequestSigner, Clock.systemUTC());
    }

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", "lending-price-feed/1.0");
        if (!priceFeedRequestSigner.isConfigured()) {
            return;
        }

        long timestamp = clock.instant().getEpochSecond();
        template.header("X-Api-Key", priceFeedRequestSigner.getApiKey());
        template.header("X-Timestamp", String.valueOf(timestamp));
        template.header("X-Signature", priceFeedRequestSigner.sign(timestamp, template.path()));
    }
}
