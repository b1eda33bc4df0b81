package org.ledgerswap.escrow;

import java.util.Map;
import java.util.Set;

import org.json.JSONObject;
import org.ledgerswap.crosschain.SwapException;

/** Low-level request/response access to the escrow service's REST API. */
public interface EscrowTransport {

	public enum RequestMethod { GET, POST, DELETE }

	/**
	 * Performs a single request and returns the decoded JSON response body.
	 * <p>
	 * Responses whose HTTP status is in <tt>ignoredStatusCodes</tt> are returned as if successful.
	 *
	 * @param apiKey API credential, or empty/null for unauthenticated requests
	 * @param path path relative to the service's base URL, or an absolute URL (e.g. a continuation page)
	 * @param params query parameters for GET/DELETE, form parameters for POST; null values are omitted
	 * @return response body, or an empty object if the body was empty
	 * @throws SwapException.RemoteRejectedException if the service declined the request (4xx)
	 * @throws SwapException.NetworkException on I/O failure, server error or undecodable body
	 */
	public JSONObject request(String apiKey, String path, Map<String, ?> params, RequestMethod method,
			Set<Integer> ignoredStatusCodes) throws SwapException;

	public default JSONObject request(String apiKey, String path, Map<String, ?> params, RequestMethod method) throws SwapException {
		return request(apiKey, path, params, method, Set.of());
	}

	public default JSONObject request(String apiKey, String path) throws SwapException {
		return request(apiKey, path, Map.of(), RequestMethod.GET, Set.of());
	}

}
