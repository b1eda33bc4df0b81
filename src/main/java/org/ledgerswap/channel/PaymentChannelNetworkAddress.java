package org.ledgerswap.channel;

/**
 * Parsed payment channel network address, of the form <tt>bolt:&lt;publicKey&gt;[@&lt;host&gt;]</tt>.
 * <p>
 * A missing host means the peer is expected to be connected already.
 */
public final class PaymentChannelNetworkAddress {

	public static final String NETWORK_TYPE = "bolt";
	private static final char NETWORK_DELIMITER = ':';
	private static final char HOST_DELIMITER = '@';

	private static final int LOGGABLE_PUBKEY_LENGTH = 15;

	private final String publicKey;
	private final String host;

	private PaymentChannelNetworkAddress(String publicKey, String host) {
		this.publicKey = publicKey;
		this.host = host;
	}

	/** @throws IllegalArgumentException if <tt>address</tt> isn't a <tt>bolt</tt> address with a public key */
	public static PaymentChannelNetworkAddress parse(String address) {
		if (address == null)
			throw new IllegalArgumentException("Missing payment channel network address");

		int delimiterIndex = address.indexOf(NETWORK_DELIMITER);
		String networkType = delimiterIndex < 0 ? address : address.substring(0, delimiterIndex);

		if (!NETWORK_TYPE.equals(networkType))
			throw new IllegalArgumentException(String.format("Unable to parse address for payment channel network type of '%s'", networkType));

		String networkAddress = address.substring(delimiterIndex + 1);

		int hostIndex = networkAddress.indexOf(HOST_DELIMITER);
		String publicKey = hostIndex < 0 ? networkAddress : networkAddress.substring(0, hostIndex);
		String host = hostIndex < 0 ? null : networkAddress.substring(hostIndex + 1);

		if (publicKey.isEmpty())
			throw new IllegalArgumentException(String.format("Missing public key in payment channel network address '%s'", address));

		return new PaymentChannelNetworkAddress(publicKey, host == null || host.isEmpty() ? null : host);
	}

	public String getPublicKey() {
		return this.publicKey;
	}

	/** @return host, or null if peer is assumed reachable */
	public String getHost() {
		return this.host;
	}

	public boolean hasHost() {
		return this.host != null;
	}

	/** Public key truncated for logging. */
	public String getLoggablePublicKey() {
		return loggablePublicKey(this.publicKey);
	}

	public static String loggablePublicKey(String publicKey) {
		if (publicKey == null)
			return null;

		if (publicKey.length() <= LOGGABLE_PUBKEY_LENGTH)
			return publicKey;

		return publicKey.substring(0, LOGGABLE_PUBKEY_LENGTH) + "...";
	}

	@Override
	public String toString() {
		return NETWORK_TYPE + NETWORK_DELIMITER + this.publicKey + (this.host != null ? HOST_DELIMITER + this.host : "");
	}

}
