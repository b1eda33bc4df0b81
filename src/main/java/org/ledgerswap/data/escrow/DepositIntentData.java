package org.ledgerswap.data.escrow;

/**
 * Deposit that the user must complete interactively at {@link #getUrl()}.
 */
public class DepositIntentData {

	private final String type;
	private final String url;
	private final String identifier;
	private final String apiKey;

	public DepositIntentData(String type, String url, String identifier, String apiKey) {
		this.type = type;
		this.url = url;
		this.identifier = identifier;
		this.apiKey = apiKey;
	}

	public String getType() {
		return this.type;
	}

	public String getUrl() {
		return this.url;
	}

	public String getIdentifier() {
		return this.identifier;
	}

	public String getApiKey() {
		return this.apiKey;
	}

}
