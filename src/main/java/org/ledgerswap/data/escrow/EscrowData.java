package org.ledgerswap.data.escrow;

import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;

/**
 * Server-held, hash-keyed escrow.
 * <p>
 * Only ever built from an escrow service response; never mutated locally.
 * Timestamps are milliseconds since epoch.
 */
public class EscrowData {

	/** The only currency the escrow service holds. */
	public static final String CURRENCY = "USDx";

	private final String id;
	private final long created;
	private final String user;
	private final String recipient;
	private final long amount;
	private final EscrowStatus status;
	private final long timeout;
	private final SwapHash hash;
	// Only present once COMPLETE
	private final SwapPreimage preimage;

	public EscrowData(String id, long created, String user, String recipient, long amount,
			EscrowStatus status, long timeout, SwapHash hash, SwapPreimage preimage) {
		this.id = id;
		this.created = created;
		this.user = user;
		this.recipient = recipient;
		this.amount = amount;
		this.status = status;
		this.timeout = timeout;
		this.hash = hash;
		this.preimage = preimage;
	}

	public String getId() {
		return this.id;
	}

	public long getCreated() {
		return this.created;
	}

	public String getUser() {
		return this.user;
	}

	public String getRecipient() {
		return this.recipient;
	}

	/** Amount in USDx cents. */
	public long getAmount() {
		return this.amount;
	}

	public String getCurrency() {
		return CURRENCY;
	}

	public EscrowStatus getStatus() {
		return this.status;
	}

	public long getTimeout() {
		return this.timeout;
	}

	public SwapHash getHash() {
		return this.hash;
	}

	public SwapPreimage getPreimage() {
		return this.preimage;
	}

	// Mostly for debugging
	public String toString() {
		return String.format("escrow %s: %d %s, %s", this.id, this.amount, CURRENCY, this.status.wireValue);
	}

}
