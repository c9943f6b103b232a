package com.arbtrader.connector;

import java.math.BigInteger;
import java.util.Optional;

/** Current network gas price. Empty when the network could not be queried. */
public interface FeeOracle {

    Optional<BigInteger> currentGasPriceWei();
}
