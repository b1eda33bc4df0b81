package org.ledgerswap.escrow;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.ledgerswap.asset.Amount;
import org.ledgerswap.asset.Asset;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;
import org.ledgerswap.data.escrow.AccountData;
import org.ledgerswap.data.escrow.DepositIntentData;
import org.ledgerswap.data.escrow.EscrowData;
import org.ledgerswap.data.escrow.EscrowStatus;
import org.ledgerswap.data.escrow.KycData;
import org.ledgerswap.data.escrow.RegistrationData;
import org.ledgerswap.settings.Settings;
import org.ledgerswap.test.common.CallLog;
import org.ledgerswap.test.common.Common;
import org.ledgerswap.test.common.FakeEscrowTransport;
import org.ledgerswap.test.common.TestClock;

public class EscrowGatewayTests extends Common {

	private static final long NOW = 1_700_000_000_000L;
	private static final String RECIPIENT = "GRECIPIENT";

	private CallLog callLog;
	private FakeEscrowTransport transport;
	private EscrowGateway gateway;

	private SwapPreimage preimage;
	private SwapHash hash;

	@Before
	public void beforeTest() throws SwapException {
		this.callLog = new CallLog();
		this.transport = new FakeEscrowTransport(this.callLog, new TestClock(NOW));
		this.gateway = new EscrowGateway(this.transport, "test-api-key");

		this.preimage = randomPreimage();
		this.hash = SwapHash.fromBytes(sha256(this.preimage));
	}

	@Test
	public void testOwnAccount() throws SwapException {
		AccountData accountData = this.gateway.getOwnAccount();
		assertEquals(FakeEscrowTransport.OWN_ACCOUNT_ID, accountData.getId());
		assertEquals(1, accountData.getBalances().size());
		assertEquals("USDx", accountData.getBalances().get(0).getCurrency());
	}

	@Test
	public void testCreateEscrow() throws SwapException {
		long expiration = NOW + 60 * 60 * 1000L;

		EscrowData escrowData = this.gateway.createEscrow(this.hash, RECIPIENT, Amount.of(Asset.USDX, 500L), expiration);

		assertEquals(EscrowStatus.PENDING, escrowData.getStatus());
		assertEquals(this.hash, escrowData.getHash());
		assertEquals(500L, escrowData.getAmount());
		assertEquals(RECIPIENT, escrowData.getRecipient());
		assertNull(escrowData.getPreimage());

		// Wire uses hex hash and seconds
		Map<String, ?> params = this.transport.getPostedParams().get(0);
		assertEquals(this.hash.toHex(), params.get("hash"));
		assertEquals(expiration / 1000L, ((Number) params.get("timeout")).longValue());
		assertEquals(expiration, escrowData.getTimeout());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCreateEscrowRejectsBitcoin() throws SwapException {
		this.gateway.createEscrow(this.hash, RECIPIENT, Amount.of(Asset.BTC, 500L), NOW + 1000L);
	}

	@Test
	public void testGetEscrowByHash() throws SwapException {
		assertNull(this.gateway.getEscrowByHash(this.hash));

		JSONObject escrowJson = this.transport.addEscrow("GPAYER", RECIPIENT, 500L, NOW / 1000L + 3600L, this.hash.toHex());

		EscrowData escrowData = this.gateway.getEscrowByHash(this.hash);
		assertNotNull(escrowData);
		assertEquals(escrowJson.getString("id"), escrowData.getId());

		// Filters
		assertNotNull(this.gateway.getEscrowByHash(this.hash, "GPAYER", RECIPIENT));
		assertNull(this.gateway.getEscrowByHash(this.hash, "GSOMEONEELSE", null));
		assertNull(this.gateway.getEscrowByHash(this.hash, null, "GSOMEONEELSE"));
	}

	@Test
	public void testAmbiguousEscrow() throws SwapException {
		this.transport.addEscrow("GPAYER", RECIPIENT, 500L, NOW / 1000L + 3600L, this.hash.toHex());
		this.transport.addEscrow("GPAYER", RECIPIENT, 700L, NOW / 1000L + 3600L, this.hash.toHex());

		try {
			this.gateway.getEscrowByHash(this.hash);
			fail("Expected AmbiguousEscrowException");
		} catch (SwapException.AmbiguousEscrowException e) {
			// expected
		}
	}

	@Test
	public void testPagination() throws SwapException {
		this.transport.setPageSize(2);

		for (int i = 0; i < 5; ++i)
			this.transport.addEscrow("GPAYER", RECIPIENT, 100L + i, NOW / 1000L + 3600L, this.hash.toHex());

		List<EscrowData> escrows = this.gateway.listEscrowsByHash(this.hash);
		assertEquals(5, escrows.size());
		assertEquals(3, this.callLog.count("escrow:GET /api/escrows"));

		this.callLog.clear();

		// Cap stops paging early and truncates
		escrows = this.gateway.listEscrowsByHash(this.hash, 3);
		assertEquals(3, escrows.size());
		assertEquals(102L, escrows.get(2).getAmount());
		assertEquals(2, this.callLog.count("escrow:GET /api/escrows"));
	}

	@Test
	public void testCompleteAndCancel() throws SwapException {
		EscrowData completable = this.gateway.createEscrow(this.hash, RECIPIENT, Amount.of(Asset.USDX, 500L), NOW + 60_000L);
		this.gateway.completeEscrow(completable.getId(), this.preimage);

		EscrowData completed = this.gateway.getEscrow(completable.getId());
		assertEquals(EscrowStatus.COMPLETE, completed.getStatus());
		assertEquals(this.preimage, completed.getPreimage());
		assertEquals(this.preimage.toHex(), this.transport.getEscrowJson(completable.getId()).getString("preimage"));

		SwapHash otherHash = SwapHash.fromBytes(randomBytes(32));
		EscrowData cancelable = this.gateway.createEscrow(otherHash, RECIPIENT, Amount.of(Asset.USDX, 500L), NOW + 60_000L);
		this.gateway.cancelEscrow(cancelable.getId());
		assertTrue(this.callLog.contains("escrow:DELETE /api/escrows/" + cancelable.getId()));
		assertEquals(EscrowStatus.CANCELED, this.gateway.getEscrow(cancelable.getId()).getStatus());

		// Canceling again is told apart from other rejections
		try {
			this.gateway.cancelEscrow(cancelable.getId());
			fail("Expected AlreadyCanceledException");
		} catch (SwapException.AlreadyCanceledException e) {
			// expected
		}

		// Completed escrow can't be canceled
		try {
			this.gateway.cancelEscrow(completable.getId());
			fail("Expected RemoteRejectedException");
		} catch (SwapException.RemoteRejectedException e) {
			assertEquals(400, e.getHttpStatus());
		}
	}

	@Test
	public void testCancelEscrowCanceledByService() throws SwapException {
		EscrowData escrowData = this.gateway.createEscrow(this.hash, RECIPIENT, Amount.of(Asset.USDX, 500L), NOW + 60_000L);
		this.transport.cancelByService(escrowData.getId());

		try {
			this.gateway.cancelEscrow(escrowData.getId());
			fail("Expected AlreadyCanceledException");
		} catch (SwapException.AlreadyCanceledException e) {
			// expected
		}

		// Status was re-read after the rejection
		assertEquals(1, this.callLog.count("escrow:GET /api/escrow/" + escrowData.getId()));
	}

	@Test
	public void testDepositIntent() throws SwapException {
		DepositIntentData depositIntentData = this.gateway.createDepositIntent("user@example.com");
		assertEquals("user@example.com", depositIntentData.getIdentifier());
		assertNotNull(depositIntentData.getUrl());
		assertEquals("new-api-key", depositIntentData.getApiKey());

		// Without 403 configured as ignorable, it's a rejection
		EscrowGateway strictGateway = new EscrowGateway(this.transport, "test-api-key", Settings.getInstance().getEscrowPageLimit(), Set.of());
		try {
			strictGateway.createDepositIntent("user@example.com");
			fail("Expected RemoteRejectedException");
		} catch (SwapException.RemoteRejectedException e) {
			assertEquals(403, e.getHttpStatus());
		}
	}

	@Test
	public void testRegister() throws SwapException {
		KycData kycData = new KycData();
		kycData.name = "Satoshi Nakamoto";
		kycData.birthdayYear = "1975";
		kycData.taxCountry = "JP";

		RegistrationData registrationData = this.gateway.register("satoshi@example.com", kycData);
		assertEquals("GNEWACCOUNT", registrationData.getAccountId());

		Map<String, ?> params = this.transport.getPostedParams().get(0);
		assertEquals("satoshi@example.com", params.get("identifier"));
		assertEquals("1975", params.get("birthday[year]"));
		assertEquals("JP", params.get("tax-country"));
	}

	@Test
	public void testWireDecoding() throws SwapException {
		JSONObject json = new JSONObject();
		json.put("id", "escrow-x");
		json.put("created", 1_600_000_000L);
		json.put("user", "GPAYER");
		json.put("recipient", RECIPIENT);
		json.put("amount", 500L);
		json.put("currency", "USDx");
		json.put("status", "complete");
		json.put("timeout", 1_600_003_600L);
		json.put("hash", this.hash.toHex().toUpperCase());
		json.put("preimage", this.preimage.toHex());

		EscrowData escrowData = EscrowGateway.toEscrowData(json);
		assertEquals(1_600_000_000_000L, escrowData.getCreated());
		assertEquals(1_600_003_600_000L, escrowData.getTimeout());
		assertEquals(this.hash, escrowData.getHash());
		assertEquals(this.preimage, escrowData.getPreimage());

		// Unknown status fails loudly
		json.put("status", "refunded");
		try {
			EscrowGateway.toEscrowData(json);
			fail("Expected UnknownStatusException");
		} catch (SwapException.UnknownStatusException e) {
			assertEquals("refunded", e.getStatus());
		}

		// Preimage on a pending escrow is a protocol violation
		json.put("status", "pending");
		try {
			EscrowGateway.toEscrowData(json);
			fail("Expected NetworkException");
		} catch (SwapException.NetworkException e) {
			// expected
		}

		// Wrong currency
		json.put("status", "complete");
		json.put("currency", "USD");
		try {
			EscrowGateway.toEscrowData(json);
			fail("Expected NetworkException");
		} catch (SwapException.NetworkException e) {
			// expected
		}

		// Malformed hash
		json.put("currency", "USDx");
		json.put("hash", "abcd");
		try {
			EscrowGateway.toEscrowData(json);
			fail("Expected InvalidEncodingException");
		} catch (SwapException.InvalidEncodingException e) {
			// expected
		}
	}

}
