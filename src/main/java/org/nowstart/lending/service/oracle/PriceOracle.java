package org.nowstart.lending.service.oracle;

public interface PriceOracle {

    OracleReading latestPrice(String feedId);
}
