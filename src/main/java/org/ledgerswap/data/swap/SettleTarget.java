package org.ledgerswap.data.swap;

/** Ledger a known preimage still has to be presented to. */
public enum SettleTarget {
	ESCROW,
	CHANNEL;
}
