package org.ledgerswap.channel;

/** Readiness of the local payment-channel engine. Only {@link #VALIDATED} engines can swap. */
public enum EngineStatus {
	UNKNOWN,
	NO_CONFIG,
	LOCKED,
	NEEDS_WALLET,
	UNAVAILABLE,
	UNLOCKED,
	NOT_SYNCED,
	VALIDATED;
}
