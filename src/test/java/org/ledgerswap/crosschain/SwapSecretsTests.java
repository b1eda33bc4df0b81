package org.ledgerswap.crosschain;

import static org.junit.Assert.*;

import org.junit.Test;
import org.ledgerswap.test.common.Common;

import com.google.common.io.BaseEncoding;

public class SwapSecretsTests extends Common {

	private static final String PREIMAGE_HEX = "2ca4a9fb3f2b0d2d5e4b1b1a8e9c7e3b52a24c0e53a1d3f6a0c6ef39b7a4d1e0";

	@Test
	public void testWireHexRoundTrip() throws SwapException {
		for (int i = 0; i < 20; ++i) {
			String base64 = BaseEncoding.base64().encode(randomBytes(SwapSecrets.SECRET_LENGTH));

			String hex = SwapSecrets.toWireHex(base64);
			assertEquals(64, hex.length());
			assertEquals(hex.toLowerCase(), hex);

			assertEquals(base64, SwapSecrets.fromWireHex(hex));
		}
	}

	@Test
	public void testUppercaseHexAccepted() throws SwapException {
		assertEquals(SwapSecrets.fromWireHex(PREIMAGE_HEX), SwapSecrets.fromWireHex(PREIMAGE_HEX.toUpperCase()));
	}

	@Test
	public void testWrongLengths() {
		assertInvalid(() -> SwapSecrets.fromWireHex("00ff"));
		assertInvalid(() -> SwapSecrets.fromWireHex(PREIMAGE_HEX + "00"));
		assertInvalid(() -> SwapSecrets.toWireHex(BaseEncoding.base64().encode(new byte[31])));
		assertInvalid(() -> SwapSecrets.toWireHex(BaseEncoding.base64().encode(new byte[33])));
	}

	@Test
	public void testMalformedInput() {
		assertInvalid(() -> SwapSecrets.fromWireHex("zz" + PREIMAGE_HEX.substring(2)));
		assertInvalid(() -> SwapSecrets.fromWireHex(PREIMAGE_HEX.substring(1)));
		assertInvalid(() -> SwapSecrets.toWireHex("not*base64!"));
		assertInvalid(() -> SwapSecrets.fromWireHex(null));
		assertInvalid(() -> SwapSecrets.toWireHex(null));
	}

	@Test
	public void testSecretObjects() throws SwapException {
		SwapPreimage preimage = SwapPreimage.fromWireHex(PREIMAGE_HEX);
		assertEquals(PREIMAGE_HEX, preimage.toHex());
		assertEquals(preimage, SwapPreimage.fromBase64(preimage.toBase64()));
		assertEquals(preimage.toBase64(), preimage.toString());

		// Same bytes, different kind of secret
		SwapHash hash = SwapHash.fromBytes(preimage.getBytes());
		assertFalse(hash.equals(preimage));

		// Defensive copies
		byte[] bytes = preimage.getBytes();
		bytes[0] ^= 0xff;
		assertEquals(PREIMAGE_HEX, preimage.toHex());
	}

	private interface ThrowingRunnable {
		void run() throws SwapException;
	}

	private static void assertInvalid(ThrowingRunnable runnable) {
		try {
			runnable.run();
			fail("Expected InvalidEncodingException");
		} catch (SwapException.InvalidEncodingException e) {
			// expected
		} catch (SwapException e) {
			fail("Expected InvalidEncodingException, not " + e.getClass().getSimpleName());
		}
	}

}
