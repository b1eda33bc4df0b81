package org.ledgerswap.data.escrow;

public class BalanceData {

	private final long amount;
	private final String currency;

	public BalanceData(long amount, String currency) {
		this.amount = amount;
		this.currency = currency;
	}

	public long getAmount() {
		return this.amount;
	}

	public String getCurrency() {
		return this.currency;
	}

}
