package org.ledgerswap.asset;

import java.util.Map;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

/**
 * Assets exchanged by a swap.
 * <p>
 * Every asset has exactly one unit, fixed at compile time.
 */
public enum Asset {
	BTC("BTC", Unit.SATOSHI),
	USDX("USDX", Unit.CENT);

	private static final Map<String, Asset> map = stream(Asset.values()).collect(toMap(asset -> asset.value, asset -> asset));

	public final String value;
	public final Unit unit;

	Asset(String value, Unit unit) {
		this.value = value;
		this.unit = unit;
	}

	/** @throws IllegalArgumentException if <tt>value</tt> is not a known asset */
	public static Asset fromValue(String value) {
		Asset asset = map.get(value);
		if (asset == null)
			throw new IllegalArgumentException(String.format("%s is not a valid value for Asset", value));

		return asset;
	}

	public static Unit assetToUnit(Asset asset) {
		return asset.unit;
	}
}
