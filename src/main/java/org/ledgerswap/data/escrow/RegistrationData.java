package org.ledgerswap.data.escrow;

public class RegistrationData {

	private final String url;
	private final String accountId;

	public RegistrationData(String url, String accountId) {
		this.url = url;
		this.accountId = accountId;
	}

	/** Where the user continues onboarding. */
	public String getUrl() {
		return this.url;
	}

	public String getAccountId() {
		return this.accountId;
	}

}
