package org.ledgerswap.data.escrow;

import java.util.List;

/** Escrow service account belonging to the API credential's owner. */
public class AccountData {

	private final String id;
	private final List<BalanceData> balances;

	public AccountData(String id, List<BalanceData> balances) {
		this.id = id;
		this.balances = List.copyOf(balances);
	}

	public String getId() {
		return this.id;
	}

	public List<BalanceData> getBalances() {
		return this.balances;
	}

}
