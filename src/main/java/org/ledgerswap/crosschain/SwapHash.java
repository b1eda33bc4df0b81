package org.ledgerswap.crosschain;

/** SHA-256 hash of a {@link SwapPreimage}. Keys both the escrow and the channel commitment. */
public final class SwapHash extends SwapSecret {

	private SwapHash(byte[] bytes) throws SwapException.InvalidEncodingException {
		super(bytes);
	}

	public static SwapHash fromBytes(byte[] bytes) throws SwapException.InvalidEncodingException {
		return new SwapHash(bytes);
	}

	public static SwapHash fromBase64(String base64) throws SwapException.InvalidEncodingException {
		return new SwapHash(SwapSecrets.decodeBase64(base64));
	}

	public static SwapHash fromWireHex(String hex) throws SwapException.InvalidEncodingException {
		return new SwapHash(SwapSecrets.decodeHex(hex));
	}

}
