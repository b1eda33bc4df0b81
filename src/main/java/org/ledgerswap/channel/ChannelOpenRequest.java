package org.ledgerswap.channel;

public class ChannelOpenRequest {

	private final String publicKey;
	private final long fundingAmount;
	private final int confirmationTarget;
	private final boolean isPrivate;

	public ChannelOpenRequest(String publicKey, long fundingAmount, int confirmationTarget, boolean isPrivate) {
		this.publicKey = publicKey;
		this.fundingAmount = fundingAmount;
		this.confirmationTarget = confirmationTarget;
		this.isPrivate = isPrivate;
	}

	/** Peer's public key, hex-encoded. */
	public String getPublicKey() {
		return this.publicKey;
	}

	/** Local funding amount, in satoshis. */
	public long getFundingAmount() {
		return this.fundingAmount;
	}

	/** Number of blocks within which the funding transaction should confirm. */
	public int getConfirmationTarget() {
		return this.confirmationTarget;
	}

	public boolean isPrivate() {
		return this.isPrivate;
	}

}
