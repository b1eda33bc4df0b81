package org.ledgerswap.channel;

public class ChannelOptions {

	/** Desired seconds until the funding transaction confirms. */
	public static final long DEFAULT_TARGET_TIME = 1800L;

	private final long targetTime;
	private final boolean privateChannel;

	public ChannelOptions(long targetTime, boolean privateChannel) {
		if (targetTime < 0)
			throw new IllegalArgumentException("Channel confirmation target time can't be negative");

		this.targetTime = targetTime;
		this.privateChannel = privateChannel;
	}

	public ChannelOptions() {
		this(DEFAULT_TARGET_TIME, false);
	}

	public long getTargetTime() {
		return this.targetTime;
	}

	public boolean isPrivateChannel() {
		return this.privateChannel;
	}

}
