package org.ledgerswap.data.swap;

/** Which leg of a swap we fund. */
public enum SwapRole {
	/** We fund the escrow leg and receive on the channel leg. */
	PAYER,
	/** Counterparty funds the escrow leg to us; we pay on the channel leg. */
	PAYEE;
}
