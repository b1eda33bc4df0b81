package org.ledgerswap.test.common;

import static org.junit.Assert.*;

import java.net.URL;
import java.security.SecureRandom;
import java.util.Random;

import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapPreimage;
import org.ledgerswap.settings.Settings;

import com.google.common.hash.Hashing;

public class Common {

	public static final String testSettingsFilename = "test-settings.json";

	private static final Random RANDOM = new SecureRandom();

	static {
		useTestSettings();
	}

	/** (Re)loads test settings, e.g. after a test installed its own. */
	public static void useTestSettings() {
		URL testSettingsUrl = Common.class.getClassLoader().getResource(testSettingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());
	}

	public static byte[] randomBytes(int length) {
		byte[] bytes = new byte[length];
		RANDOM.nextBytes(bytes);
		return bytes;
	}

	public static SwapPreimage randomPreimage() {
		try {
			return SwapPreimage.fromBytes(randomBytes(32));
		} catch (SwapException.InvalidEncodingException e) {
			throw new AssertionError(e);
		}
	}

	/** Returns SHA-256 of <tt>preimage</tt>, for building realistic hash/preimage pairs. */
	public static byte[] sha256(SwapPreimage preimage) {
		return Hashing.sha256().hashBytes(preimage.getBytes()).asBytes();
	}

}
