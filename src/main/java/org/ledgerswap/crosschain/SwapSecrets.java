package org.ledgerswap.crosschain;

import com.google.common.io.BaseEncoding;

/**
 * Converts swap hashes and preimages between their two encodings.
 * <p>
 * In memory (and on the channel side) a secret's canonical form is a Base64 string of its 32 bytes.
 * The escrow service's wire protocol uses lowercase hexadecimal instead.
 */
public class SwapSecrets {

	/** Length, in bytes, of both a swap hash (SHA-256) and a swap preimage. */
	public static final int SECRET_LENGTH = 32;

	private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
	private static final BaseEncoding BASE64 = BaseEncoding.base64();

	private SwapSecrets() {
	}

	/** Returns escrow-wire hex for canonical Base64 <tt>secret</tt>. */
	public static String toWireHex(String secret) throws SwapException.InvalidEncodingException {
		return HEX.encode(decodeBase64(secret));
	}

	/** Returns canonical Base64 for escrow-wire <tt>hex</tt>. Accepts either letter case. */
	public static String fromWireHex(String hex) throws SwapException.InvalidEncodingException {
		return BASE64.encode(decodeHex(hex));
	}

	/*package*/ static byte[] decodeHex(String hex) throws SwapException.InvalidEncodingException {
		if (hex == null)
			throw new SwapException.InvalidEncodingException("Missing hex-encoded secret");

		byte[] bytes;
		try {
			bytes = HEX.decode(hex.toLowerCase());
		} catch (IllegalArgumentException e) {
			throw new SwapException.InvalidEncodingException(String.format("Malformed hex secret: %s", hex), e);
		}

		return checkLength(bytes);
	}

	/*package*/ static byte[] decodeBase64(String base64) throws SwapException.InvalidEncodingException {
		if (base64 == null)
			throw new SwapException.InvalidEncodingException("Missing Base64-encoded secret");

		byte[] bytes;
		try {
			bytes = BASE64.decode(base64);
		} catch (IllegalArgumentException e) {
			throw new SwapException.InvalidEncodingException(String.format("Malformed Base64 secret: %s", base64), e);
		}

		return checkLength(bytes);
	}

	/*package*/ static byte[] checkLength(byte[] bytes) throws SwapException.InvalidEncodingException {
		if (bytes == null || bytes.length != SECRET_LENGTH)
			throw new SwapException.InvalidEncodingException(String.format("Secret must be %d bytes, not %d",
					SECRET_LENGTH, bytes == null ? 0 : bytes.length));

		return bytes;
	}

	/*package*/ static String encodeHex(byte[] bytes) {
		return HEX.encode(bytes);
	}

	/*package*/ static String encodeBase64(byte[] bytes) {
		return BASE64.encode(bytes);
	}

}
