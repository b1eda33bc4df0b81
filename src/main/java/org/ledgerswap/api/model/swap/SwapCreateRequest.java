package org.ledgerswap.api.model.swap;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.ledgerswap.data.swap.SwapRole;

@XmlAccessorType(XmlAccessType.FIELD)
public class SwapCreateRequest {

	/** Swap hash, canonical Base64. */
	public String hash;

	public SwapRole role;

	/** Escrow service account funding the escrow. Optional: filters discovery when known. */
	public String userId;

	/** Escrow service account receiving the escrow. */
	public String recipientId;

	/** USDX amount held in escrow, in cents. */
	public long escrowAmount;

	/** BTC amount carried over the channel leg, in satoshis. */
	public long channelAmount;

	/** Counterparty's payment channel network address, e.g. <tt>bolt:pubkey@host</tt>. */
	public String counterpartyAddress;

	/** Escrow expiration, in milliseconds since epoch. */
	public long escrowExpiration;

	/** Latest time, in milliseconds since epoch, the channel leg may remain locked. Defaults to <tt>escrowExpiration</tt>. */
	public Long channelExpiration;

	public SwapCreateRequest() {
	}

}
