package org.ledgerswap.escrow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.ledgerswap.asset.Amount;
import org.ledgerswap.asset.Asset;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;
import org.ledgerswap.data.escrow.AccountData;
import org.ledgerswap.data.escrow.BalanceData;
import org.ledgerswap.data.escrow.DepositIntentData;
import org.ledgerswap.data.escrow.EscrowData;
import org.ledgerswap.data.escrow.EscrowStatus;
import org.ledgerswap.data.escrow.KycData;
import org.ledgerswap.data.escrow.RegistrationData;
import org.ledgerswap.escrow.EscrowTransport.RequestMethod;
import org.ledgerswap.settings.ConfigStore;
import org.ledgerswap.settings.Settings;

/**
 * Typed client for the centralized escrow service.
 * <p>
 * Hashes and preimages are hex on the wire but canonical Base64 everywhere else,
 * so every value crossing this class is converted here.
 * <p>
 * Transient failures are surfaced to the caller, never retried or swallowed here.
 */
public class EscrowGateway {

	private static final Logger LOGGER = LogManager.getLogger(EscrowGateway.class);

	private final EscrowTransport transport;
	private final String apiKey;
	private final int pageLimit;
	private final Set<Integer> depositIntentIgnoredStatusCodes;

	public EscrowGateway(EscrowTransport transport, String apiKey, int pageLimit, Set<Integer> depositIntentIgnoredStatusCodes) {
		this.transport = transport;
		this.apiKey = apiKey;
		this.pageLimit = pageLimit;
		this.depositIntentIgnoredStatusCodes = Set.copyOf(depositIntentIgnoredStatusCodes);
	}

	/** Gateway over <tt>transport</tt> using page limit and deposit-intent status codes from {@link Settings}. */
	public EscrowGateway(EscrowTransport transport, String apiKey) {
		this(transport, apiKey, Settings.getInstance().getEscrowPageLimit(), Settings.getInstance().getDepositIntentIgnoredStatusCodes());
	}

	/** Gateway to the escrow service endpoint configured in {@link Settings}. */
	public static EscrowGateway fromSettings(String apiKey) {
		Settings settings = Settings.getInstance();

		EscrowTransport transport = new HttpEscrowTransport(settings.getEscrowApiUrl(), settings.getHttpConnectTimeout(), settings.getHttpReadTimeout());

		return new EscrowGateway(transport, apiKey);
	}

	/**
	 * Gateway to the escrow service endpoint configured in {@link Settings}, using the escrow API key held by <tt>configStore</tt>.
	 *
	 * @throws IllegalStateException if no escrow API key is stored
	 */
	public static EscrowGateway fromSettings(ConfigStore configStore) {
		String apiKey = configStore.getAnchorConfig().getApiKey();
		if (apiKey == null || apiKey.isEmpty())
			throw new IllegalStateException("No escrow service API key configured");

		return fromSettings(apiKey);
	}

	public AccountData getOwnAccount() throws SwapException {
		JSONObject json = this.transport.request(this.apiKey, "/api/account");

		try {
			List<BalanceData> balances = new ArrayList<>();

			JSONArray balancesJson = json.optJSONArray("balances");
			if (balancesJson != null)
				for (int i = 0; i < balancesJson.length(); ++i) {
					JSONObject balanceJson = balancesJson.getJSONObject(i);
					balances.add(new BalanceData(balanceJson.getLong("amount"), balanceJson.getString("currency")));
				}

			return new AccountData(json.getString("id"), balances);
		} catch (JSONException e) {
			throw new SwapException.NetworkException(String.format("Unexpected JSON format for account: %s", e.getMessage()));
		}
	}

	public EscrowData getEscrow(String id) throws SwapException {
		return toEscrowData(this.transport.request(this.apiKey, String.format("/api/escrow/%s", id)));
	}

	/**
	 * Returns up to <tt>limit</tt> escrows sharing <tt>hash</tt>, following continuation pages as needed.
	 */
	public List<EscrowData> listEscrowsByHash(SwapHash hash, int limit) throws SwapException {
		Map<String, Object> query = Map.of("hash", hash.toHex());
		JSONObject page = this.transport.request(this.apiKey, "/api/escrows", query, RequestMethod.GET);

		List<JSONObject> items = new ArrayList<>();
		String nextPage = extractPage(page, items);

		while (items.size() < limit && nextPage != null) {
			page = this.transport.request(this.apiKey, nextPage);
			nextPage = extractPage(page, items);
		}

		List<EscrowData> escrows = new ArrayList<>();
		for (JSONObject item : items.subList(0, Math.min(limit, items.size())))
			escrows.add(toEscrowData(item));

		return escrows;
	}

	public List<EscrowData> listEscrowsByHash(SwapHash hash) throws SwapException {
		return listEscrowsByHash(hash, this.pageLimit);
	}

	/**
	 * Returns the escrow for <tt>hash</tt>, if any, optionally filtered by user and/or recipient.
	 *
	 * @return escrow, or null if none exists or none survives filtering
	 * @throws SwapException.AmbiguousEscrowException if more than one escrow shares <tt>hash</tt>
	 */
	public EscrowData getEscrowByHash(SwapHash hash, String userId, String recipientId) throws SwapException {
		// Two is enough to detect ambiguity
		List<EscrowData> escrows = listEscrowsByHash(hash, 2);

		if (escrows.size() > 1)
			throw new SwapException.AmbiguousEscrowException(String.format("More than one escrow with hash %s", hash));

		if (escrows.isEmpty())
			return null;

		EscrowData escrow = escrows.get(0);

		if (userId != null && !userId.equals(escrow.getUser())) {
			LOGGER.debug(() -> String.format("Escrow %s for hash %s isn't from user %s", escrow.getId(), hash, userId));
			return null;
		}

		if (recipientId != null && !recipientId.equals(escrow.getRecipient())) {
			LOGGER.debug(() -> String.format("Escrow %s for hash %s isn't to recipient %s", escrow.getId(), hash, recipientId));
			return null;
		}

		return escrow;
	}

	public EscrowData getEscrowByHash(SwapHash hash) throws SwapException {
		return getEscrowByHash(hash, null, null);
	}

	/**
	 * Creates a new escrow.
	 *
	 * @param expiration absolute deadline, in milliseconds since epoch, after which the service may cancel the escrow
	 * @throws IllegalArgumentException if <tt>amount</tt> isn't USDX
	 * @throws SwapException.RemoteRejectedException if the service rejects amount or recipient
	 */
	public EscrowData createEscrow(SwapHash hash, String recipientId, Amount amount, long expiration) throws SwapException {
		if (amount.getAsset() != Asset.USDX)
			throw new IllegalArgumentException(String.format("Escrow amounts must be in %s, not %s", Asset.USDX.value, amount.getAsset().value));

		Map<String, Object> params = new LinkedHashMap<>();
		params.put("hash", hash.toHex());
		params.put("recipient", recipientId);
		params.put("amount", amount.getValue());
		params.put("timeout", expiration / 1000L);

		EscrowData escrow = toEscrowData(this.transport.request(this.apiKey, "/api/escrow", params, RequestMethod.POST));

		LOGGER.debug(() -> String.format("Created escrow %s for hash %s", escrow.getId(), hash));

		return escrow;
	}

	/**
	 * Asks the service to cancel escrow <tt>id</tt>.
	 * <p>
	 * The service rejects canceling an escrow that isn't pending. The escrow is then re-read to tell an
	 * already canceled escrow apart from a completed one.
	 *
	 * @throws SwapException.AlreadyCanceledException if escrow was already canceled
	 * @throws SwapException.RemoteRejectedException if the service rejected cancelation for any other reason
	 */
	public void cancelEscrow(String id) throws SwapException {
		try {
			this.transport.request(this.apiKey, String.format("/api/escrows/%s", id), Map.of(), RequestMethod.DELETE);
		} catch (SwapException.RemoteRejectedException e) {
			if (getEscrow(id).getStatus() == EscrowStatus.CANCELED)
				throw new SwapException.AlreadyCanceledException(String.format("Escrow %s already canceled", id));

			throw e;
		}
	}

	/** Reveals <tt>preimage</tt> to settle escrow <tt>id</tt>. */
	public void completeEscrow(String id, SwapPreimage preimage) throws SwapException {
		Map<String, Object> params = Map.of("preimage", preimage.toHex());
		this.transport.request(this.apiKey, String.format("/api/escrow/%s/complete", id), params, RequestMethod.POST);
	}

	/**
	 * Starts a USD deposit for <tt>email</tt>.
	 * <p>
	 * The service answers with a 403 because deposits need interactive confirmation by the user.
	 * That response carries the URL to send the user to, so it's a successful outcome here.
	 * Which status codes are treated like this is configurable.
	 */
	public DepositIntentData createDepositIntent(String email) throws SwapException {
		Map<String, Object> query = new LinkedHashMap<>();
		query.put("asset_code", "USD");
		query.put("email_address", email);

		JSONObject json = this.transport.request(this.apiKey, "/transfer/deposit", query, RequestMethod.GET, this.depositIntentIgnoredStatusCodes);

		return new DepositIntentData(optString(json, "type"), optString(json, "url"),
				optString(json, "identifier"), optString(json, "api_key"));
	}

	/** Registers a new user. The API key is not required for this request. */
	public RegistrationData register(String identifier, KycData kycData) throws SwapException {
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("identifier", identifier);
		params.putAll(kycData.toFormParameters());

		JSONObject json = this.transport.request(this.apiKey, "/api/register", params, RequestMethod.POST);

		return new RegistrationData(optString(json, "url"), optString(json, "account_id"));
	}

	private static String extractPage(JSONObject page, List<JSONObject> items) throws SwapException.NetworkException {
		try {
			JSONArray itemsJson = page.getJSONArray("items");
			for (int i = 0; i < itemsJson.length(); ++i)
				items.add(itemsJson.getJSONObject(i));
		} catch (JSONException e) {
			throw new SwapException.NetworkException(String.format("Unexpected JSON format for escrow list: %s", e.getMessage()));
		}

		return optString(page, "next_page");
	}

	/*package*/ static EscrowData toEscrowData(JSONObject json) throws SwapException {
		try {
			String currency = optString(json, "currency");
			if (!EscrowData.CURRENCY.equals(currency))
				throw new SwapException.NetworkException(String.format("Invalid escrow currency: %s", currency));

			EscrowStatus status = EscrowStatus.fromWireValue(optString(json, "status"));

			String preimageHex = optString(json, "preimage");
			SwapPreimage preimage = preimageHex == null || preimageHex.isEmpty() ? null : SwapPreimage.fromWireHex(preimageHex);

			if (preimage != null && status != EscrowStatus.COMPLETE)
				throw new SwapException.NetworkException(String.format("Escrow %s has preimage but status %s",
						optString(json, "id"), status.wireValue));

			return new EscrowData(json.getString("id"),
					json.getLong("created") * 1000L,
					optString(json, "user"),
					optString(json, "recipient"),
					json.getLong("amount"),
					status,
					json.getLong("timeout") * 1000L,
					SwapHash.fromWireHex(optString(json, "hash")),
					preimage);
		} catch (JSONException e) {
			throw new SwapException.NetworkException(String.format("Unexpected JSON format for escrow: %s", e.getMessage()));
		}
	}

	private static String optString(JSONObject json, String key) {
		return json.isNull(key) ? null : json.get(key).toString();
	}

}
