package org.nowstart.lending.service.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.lending.data.dto.PriceFeedResponse;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.repository.PriceFeedFeignClient;

@ExtendWith(MockitoExtension.class)
class FeedPriceOracleTest {

    @Mock
    private PriceFeedFeignClient priceFeedFeignClient;

    @InjectMocks
    private FeedPriceOracle feedPriceOracle;

    @Test
    void latestPrice_mapsFeedResponse() {
        when(priceFeedFeignClient.getLatest("eth-usd"))
                .thenReturn(new PriceFeedResponse("eth-usd", " 200000000000 ", 8, 1_735_689_600L));

        OracleReading reading = feedPriceOracle.latestPrice("eth-usd");

        assertThat(reading.price()).isEqualTo(new BigInteger("200000000000"));
        assertThat(reading.decimals()).isEqualTo(8);
        assertThat(reading.updatedAt()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void latestPrice_rejectsIncompleteResponse() {
        when(priceFeedFeignClient.getLatest("eth-usd")).thenReturn(new PriceFeedResponse("eth-usd", "1", null, 1L));

        assertThatThrownBy(() -> feedPriceOracle.latestPrice("eth-usd"))
                .isInstanceOf(LendingException.class)
                .extracting("errorCode")
                .isEqualTo(LendingErrorCode.INVALID_PRICE);
    }

    @Test
    void latestPrice_rejectsUnparsablePrice() {
        when(priceFeedFeignClient.getLatest("eth-usd")).thenReturn(new PriceFeedResponse("eth-usd", "2.5e3", 8, 1L));

        assertThatThrownBy(() -> feedPriceOracle.latestPrice("eth-usd"))
                .isInstanceOf(LendingException.class)
                .hasMessageContaining("Unparsable")
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
