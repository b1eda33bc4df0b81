package org.ledgerswap.crosschain;

/** 32 bytes of randomness whose revelation settles a swap. */
public final class SwapPreimage extends SwapSecret {

	private SwapPreimage(byte[] bytes) throws SwapException.InvalidEncodingException {
		super(bytes);
	}

	public static SwapPreimage fromBytes(byte[] bytes) throws SwapException.InvalidEncodingException {
		return new SwapPreimage(bytes);
	}

	public static SwapPreimage fromBase64(String base64) throws SwapException.InvalidEncodingException {
		return new SwapPreimage(SwapSecrets.decodeBase64(base64));
	}

	public static SwapPreimage fromWireHex(String hex) throws SwapException.InvalidEncodingException {
		return new SwapPreimage(SwapSecrets.decodeHex(hex));
	}

}
