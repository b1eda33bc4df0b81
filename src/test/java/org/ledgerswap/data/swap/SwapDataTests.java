package org.ledgerswap.data.swap;

import static org.junit.Assert.*;

import org.json.JSONObject;
import org.junit.Test;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.test.common.Common;

public class SwapDataTests extends Common {

	private static SwapData newSwapData() throws SwapException {
		return new SwapData(SwapHash.fromBytes(randomBytes(32)), SwapRole.PAYEE, "INIT", 10, 1_700_000_000_000L,
				"GCOUNTERPARTY", "GOWNACCOUNT", "bolt:02abcdef",
				500L, 100_000L, 1_700_003_600_000L, 1_700_001_800_000L,
				null, null, false, null, null);
	}

	@Test
	public void testFreshSwapJson() throws SwapException {
		SwapData swapData = newSwapData();

		JSONObject json = swapData.toJson();
		assertEquals(swapData.getHash().toBase64(), json.getString("hash"));
		assertEquals("PAYEE", json.getString("role"));
		assertFalse(json.has("preimage"));
		assertFalse(json.has("settleTarget"));

		SwapData restored = SwapData.fromJson(json);
		assertEquals(swapData.getHash(), restored.getHash());
		assertNull(restored.getEscrowId());
		assertNull(restored.getEscrowTimeout());
		assertNull(restored.getPreimage());
		assertEquals(1_700_001_800_000L, restored.getChannelExpiration());
	}

	@Test
	public void testProgressedSwapJson() throws SwapException {
		SwapData swapData = newSwapData();
		swapData.setEscrowId("escrow-7");
		swapData.setEscrowTimeout(1_700_003_600_000L);
		swapData.setCommitmentIssued(true);
		swapData.setPreimage(randomPreimage());
		swapData.setSettleTarget(SettleTarget.CHANNEL);
		swapData.setState("SETTLING");
		swapData.setStateValue(50);

		SwapData restored = SwapData.fromJson(new JSONObject(swapData.toJson().toString()));

		assertEquals("SETTLING", restored.getState());
		assertEquals(50, restored.getStateValue());
		assertEquals("escrow-7", restored.getEscrowId());
		assertEquals(Long.valueOf(1_700_003_600_000L), restored.getEscrowTimeout());
		assertTrue(restored.isCommitmentIssued());
		assertEquals(swapData.getPreimage(), restored.getPreimage());
		assertEquals(SettleTarget.CHANNEL, restored.getSettleTarget());
	}

	@Test
	public void testMalformedHashRejected() throws SwapException {
		JSONObject json = newSwapData().toJson();
		json.put("hash", "bm90LTMyLWJ5dGVz");

		try {
			SwapData.fromJson(json);
			fail("Expected InvalidEncodingException");
		} catch (SwapException.InvalidEncodingException e) {
			// expected
		}
	}

}
