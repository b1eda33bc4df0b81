package org.ledgerswap.crosschain;

@SuppressWarnings("serial")
public class SwapException extends Exception {

	public SwapException() {
		super();
	}

	public SwapException(String message) {
		super(message);
	}

	public SwapException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Malformed hash or preimage. Never retried. */
	public static class InvalidEncodingException extends SwapException {
		public InvalidEncodingException(String message) {
			super(message);
		}

		public InvalidEncodingException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	/** Transient failure talking to a remote ledger. Safe for the caller to retry. */
	public static class NetworkException extends SwapException {
		private final Integer httpStatus;

		public NetworkException(String message) {
			super(message);
			this.httpStatus = null;
		}

		public NetworkException(String message, Throwable cause) {
			super(message, cause);
			this.httpStatus = null;
		}

		public NetworkException(int httpStatus, String message) {
			super(message);
			this.httpStatus = httpStatus;
		}

		public Integer getHttpStatus() {
			return this.httpStatus;
		}
	}

	/** Escrow service declined the request. */
	public static class RemoteRejectedException extends SwapException {
		private final int httpStatus;
		private final String remoteMessage;

		public RemoteRejectedException(int httpStatus, String remoteMessage) {
			super(String.format("Escrow service rejected request (HTTP %d): %s", httpStatus, remoteMessage));
			this.httpStatus = httpStatus;
			this.remoteMessage = remoteMessage;
		}

		public int getHttpStatus() {
			return this.httpStatus;
		}

		public String getRemoteMessage() {
			return this.remoteMessage;
		}
	}

	/** Escrow status string outside the known set. Protocol violation. */
	public static class UnknownStatusException extends SwapException {
		private final String status;

		public UnknownStatusException(String status) {
			super(String.format("Invalid escrow status: %s", status));
			this.status = status;
		}

		public String getStatus() {
			return this.status;
		}
	}

	/** More than one escrow shares a swap hash. Protocol violation. */
	public static class AmbiguousEscrowException extends SwapException {
		public AmbiguousEscrowException(String message) {
			super(message);
		}
	}

	/** Peer connection or channel-open failed. The engine's original exception is the cause. */
	public static class ChannelOpenFailedException extends SwapException {
		public ChannelOpenFailedException(String message) {
			super(message);
		}

		public ChannelOpenFailedException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public static class ExpiredSwapException extends SwapException {
		public ExpiredSwapException(String message) {
			super(message);
		}
	}

	public static class AlreadySettledException extends SwapException {
		public AlreadySettledException(String message) {
			super(message);
		}
	}

	public static class AlreadyCanceledException extends SwapException {
		public AlreadyCanceledException(String message) {
			super(message);
		}
	}

	/** Channel engine reports the swap can never succeed. */
	public static class PermanentSwapException extends SwapException {
		public PermanentSwapException(String message) {
			super(message);
		}
	}

	/** Cancellation requested once a preimage may already be public. */
	public static class TooLateToCancelException extends SwapException {
		public TooLateToCancelException(String message) {
			super(message);
		}
	}

}
