package org.ledgerswap.data.swap;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlTransient;

import org.json.JSONObject;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class SwapData {

	@XmlTransient
	private SwapHash hash;

	private SwapRole role;
	private String swapState;

	// Internal use - not shown via API
	@XmlTransient
	private int swapStateValue;

	/** When state last changed, in milliseconds since epoch. */
	private long timestamp;

	private String userId;
	private String recipientId;
	private String counterpartyAddress;

	/** In cents. */
	private long escrowAmount;
	/** In satoshis. */
	private long channelAmount;

	private long escrowExpiration;
	private long channelExpiration;

	private String escrowId;
	/** Escrow's own timeout, as reported by the escrow service. */
	private Long escrowTimeout;

	private boolean commitmentIssued;

	// Never expose this via API
	@XmlTransient
	private SwapPreimage preimage;

	private SettleTarget settleTarget;

	protected SwapData() {
		/* JAXB */
	}

	public SwapData(SwapHash hash, SwapRole role, String swapState, int swapStateValue, long timestamp,
			String userId, String recipientId, String counterpartyAddress,
			long escrowAmount, long channelAmount, long escrowExpiration, long channelExpiration,
			String escrowId, Long escrowTimeout, boolean commitmentIssued,
			SwapPreimage preimage, SettleTarget settleTarget) {
		this.hash = hash;
		this.role = role;
		this.swapState = swapState;
		this.swapStateValue = swapStateValue;
		this.timestamp = timestamp;
		this.userId = userId;
		this.recipientId = recipientId;
		this.counterpartyAddress = counterpartyAddress;
		this.escrowAmount = escrowAmount;
		this.channelAmount = channelAmount;
		this.escrowExpiration = escrowExpiration;
		this.channelExpiration = channelExpiration;
		this.escrowId = escrowId;
		this.escrowTimeout = escrowTimeout;
		this.commitmentIssued = commitmentIssued;
		this.preimage = preimage;
		this.settleTarget = settleTarget;
	}

	public SwapHash getHash() {
		return this.hash;
	}

	public SwapRole getRole() {
		return this.role;
	}

	public String getState() {
		return this.swapState;
	}

	public void setState(String state) {
		this.swapState = state;
	}

	public int getStateValue() {
		return this.swapStateValue;
	}

	public void setStateValue(int stateValue) {
		this.swapStateValue = stateValue;
	}

	public long getTimestamp() {
		return this.timestamp;
	}

	public void setTimestamp(long timestamp) {
		this.timestamp = timestamp;
	}

	public String getUserId() {
		return this.userId;
	}

	public String getRecipientId() {
		return this.recipientId;
	}

	public String getCounterpartyAddress() {
		return this.counterpartyAddress;
	}

	public long getEscrowAmount() {
		return this.escrowAmount;
	}

	public long getChannelAmount() {
		return this.channelAmount;
	}

	public long getEscrowExpiration() {
		return this.escrowExpiration;
	}

	public long getChannelExpiration() {
		return this.channelExpiration;
	}

	public String getEscrowId() {
		return this.escrowId;
	}

	public void setEscrowId(String escrowId) {
		this.escrowId = escrowId;
	}

	public Long getEscrowTimeout() {
		return this.escrowTimeout;
	}

	public void setEscrowTimeout(Long escrowTimeout) {
		this.escrowTimeout = escrowTimeout;
	}

	public boolean isCommitmentIssued() {
		return this.commitmentIssued;
	}

	public void setCommitmentIssued(boolean commitmentIssued) {
		this.commitmentIssued = commitmentIssued;
	}

	public SwapPreimage getPreimage() {
		return this.preimage;
	}

	public void setPreimage(SwapPreimage preimage) {
		this.preimage = preimage;
	}

	public SettleTarget getSettleTarget() {
		return this.settleTarget;
	}

	public void setSettleTarget(SettleTarget settleTarget) {
		this.settleTarget = settleTarget;
	}

	public JSONObject toJson() {
		JSONObject jsonObject = new JSONObject();
		jsonObject.put("hash", this.getHash().toBase64());
		jsonObject.put("role", this.getRole().name());
		jsonObject.put("swapState", this.getState());
		jsonObject.put("swapStateValue", this.getStateValue());
		jsonObject.put("timestamp", this.getTimestamp());
		jsonObject.put("userId", this.getUserId());
		jsonObject.put("recipientId", this.getRecipientId());
		jsonObject.put("counterpartyAddress", this.getCounterpartyAddress());
		jsonObject.put("escrowAmount", this.getEscrowAmount());
		jsonObject.put("channelAmount", this.getChannelAmount());
		jsonObject.put("escrowExpiration", this.getEscrowExpiration());
		jsonObject.put("channelExpiration", this.getChannelExpiration());
		jsonObject.put("escrowId", this.getEscrowId());
		jsonObject.put("escrowTimeout", this.getEscrowTimeout());
		jsonObject.put("commitmentIssued", this.isCommitmentIssued());
		if (this.getPreimage() != null) jsonObject.put("preimage", this.getPreimage().toBase64());
		if (this.getSettleTarget() != null) jsonObject.put("settleTarget", this.getSettleTarget().name());
		return jsonObject;
	}

	public static SwapData fromJson(JSONObject json) throws SwapException.InvalidEncodingException {
		return new SwapData(
				SwapHash.fromBase64(json.getString("hash")),
				SwapRole.valueOf(json.getString("role")),
				json.isNull("swapState") ? null : json.getString("swapState"),
				json.getInt("swapStateValue"),
				json.getLong("timestamp"),
				json.isNull("userId") ? null : json.getString("userId"),
				json.isNull("recipientId") ? null : json.getString("recipientId"),
				json.isNull("counterpartyAddress") ? null : json.getString("counterpartyAddress"),
				json.getLong("escrowAmount"),
				json.getLong("channelAmount"),
				json.getLong("escrowExpiration"),
				json.getLong("channelExpiration"),
				json.isNull("escrowId") ? null : json.getString("escrowId"),
				json.isNull("escrowTimeout") ? null : json.getLong("escrowTimeout"),
				json.optBoolean("commitmentIssued", false),
				json.isNull("preimage") ? null : SwapPreimage.fromBase64(json.getString("preimage")),
				json.isNull("settleTarget") ? null : SettleTarget.valueOf(json.getString("settleTarget"))
		);
	}

	// Mostly for debugging
	public String toString() {
		return String.format("%s: %s (%d)", this.hash, this.swapState, this.swapStateValue);
	}

}
