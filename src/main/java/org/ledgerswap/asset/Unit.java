package org.ledgerswap.asset;

import java.util.Map;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

/** Smallest indivisible denomination of an {@link Asset}. */
public enum Unit {
	CENT("cent"),
	SATOSHI("satoshi");

	private static final Map<String, Unit> map = stream(Unit.values()).collect(toMap(unit -> unit.value, unit -> unit));

	public final String value;

	Unit(String value) {
		this.value = value;
	}

	/** @throws IllegalArgumentException if <tt>value</tt> is not a known unit */
	public static Unit fromValue(String value) {
		Unit unit = map.get(value);
		if (unit == null)
			throw new IllegalArgumentException(String.format("%s is not a valid value for Unit", value));

		return unit;
	}
}
