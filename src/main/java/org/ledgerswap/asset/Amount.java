package org.ledgerswap.asset;

import java.util.Objects;

/** Quantity of an asset, in that asset's only unit. */
public final class Amount {

	private final Asset asset;
	private final Unit unit;
	private final long value;

	/**
	 * @throws IllegalArgumentException if <tt>unit</tt> isn't <tt>asset</tt>'s unit, or <tt>value</tt> is negative
	 */
	public Amount(Asset asset, Unit unit, long value) {
		Objects.requireNonNull(asset, "asset");
		Objects.requireNonNull(unit, "unit");

		if (Asset.assetToUnit(asset) != unit)
			throw new IllegalArgumentException(String.format("Unit %s is not valid for asset %s", unit.value, asset.value));

		if (value < 0)
			throw new IllegalArgumentException(String.format("Negative amount: %d", value));

		this.asset = asset;
		this.unit = unit;
		this.value = value;
	}

	public static Amount of(Asset asset, long value) {
		return new Amount(asset, asset.unit, value);
	}

	public Asset getAsset() {
		return this.asset;
	}

	public Unit getUnit() {
		return this.unit;
	}

	public long getValue() {
		return this.value;
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (!(other instanceof Amount))
			return false;

		Amount otherAmount = (Amount) other;

		return this.asset == otherAmount.asset && this.value == otherAmount.value;
	}

	@Override
	public int hashCode() {
		return this.asset.hashCode() ^ Long.hashCode(this.value);
	}

	@Override
	public String toString() {
		return String.format("%d %s %s", this.value, this.asset.value, this.unit.value);
	}

}
