package org.nowstart.lending.config;

import feign.RequestInterceptor;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.service.auth.PriceFeedAuthRequestInterceptor;
import org.nowstart.lending.service.auth.PriceFeedRequestSigner;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PriceFeedFeignConfig {

    @Bean
    @RefreshScope
    public PriceFeedRequestSigner priceFeedRequestSigner(LendingProperties lendingProperties) {
        return new PriceFeedRequestSigner(lendingProperties.oracle().apiKey(), lendingProperties.oracle().apiSecret());
    }

    @Bean
    @RefreshScope
    public RequestInterceptor priceFeedAuthRequestInterceptor(PriceFeedRequestSigner priceFeedRequestSigner) {
        return new PriceFeedAuthRequestInterceptor(priceFeedRequestSigner);
    }
}
