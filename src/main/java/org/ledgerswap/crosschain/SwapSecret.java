package org.ledgerswap.crosschain;

import java.util.Arrays;

/** Fixed-length 32-byte secret shared by both legs of a swap. Immutable. */
public abstract class SwapSecret {

	private final byte[] bytes;

	protected SwapSecret(byte[] bytes) throws SwapException.InvalidEncodingException {
		this.bytes = SwapSecrets.checkLength(bytes).clone();
	}

	public byte[] getBytes() {
		return this.bytes.clone();
	}

	/** Canonical form. */
	public String toBase64() {
		return SwapSecrets.encodeBase64(this.bytes);
	}

	/** Escrow wire form. */
	public String toHex() {
		return SwapSecrets.encodeHex(this.bytes);
	}

	@Override
	public boolean equals(Object other) {
		if (other == this)
			return true;

		if (other == null || other.getClass() != this.getClass())
			return false;

		return Arrays.equals(this.bytes, ((SwapSecret) other).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.bytes);
	}

	@Override
	public String toString() {
		return this.toBase64();
	}

}
