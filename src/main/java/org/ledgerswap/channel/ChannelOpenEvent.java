package org.ledgerswap.channel;

/** Update emitted by the channel engine while a channel opens. */
public enum ChannelOpenEvent {
	/** Funding transaction broadcast, not yet confirmed. */
	PENDING_OPEN(true),
	/** Funding transaction confirmed. */
	OPEN_UPDATE(true),
	/** Anything else the engine reports along the way, e.g. funding negotiation. */
	OTHER(false);

	public final boolean isUsable;

	ChannelOpenEvent(boolean isUsable) {
		this.isUsable = isUsable;
	}
}
