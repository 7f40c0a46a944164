package org.nowstart.lending.repository;

import org.nowstart.lending.config.PriceFeedFeignConfig;
import org.nowstart.lending.data.dto.PriceFeedResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "priceFeedClient",
        url = "${lending.oracle.base-url}",
        configuration = PriceFeedFeignConfig.class
)
public interface PriceFeedFeignClient {

    @GetMapping("/v1/feeds/{feedId}/latest")
    PriceFeedResponse getLatest(@PathVariable("feedId") String feedId);
}
