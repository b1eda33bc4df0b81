package org.ledgerswap.escrow;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.ledgerswap.crosschain.SwapException;

import com.google.common.io.BaseEncoding;
import com.google.common.io.CharStreams;

/**
 * {@link EscrowTransport} over plain HTTP(S).
 * <p>
 * Authenticates with HTTP Basic auth, using the API key as user name and an empty password.
 * No retries are performed here.
 */
public class HttpEscrowTransport implements EscrowTransport {

	private static final Logger LOGGER = LogManager.getLogger(HttpEscrowTransport.class);

	private final String baseUrl;
	private final int connectTimeout;
	private final int readTimeout;

	public HttpEscrowTransport(String baseUrl, int connectTimeout, int readTimeout) {
		// Strip trailing slash as all our paths start with one
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.connectTimeout = connectTimeout;
		this.readTimeout = readTimeout;
	}

	@Override
	public JSONObject request(String apiKey, String path, Map<String, ?> params, RequestMethod method,
			Set<Integer> ignoredStatusCodes) throws SwapException {
		String encodedParams = encodeParams(params);

		String url = path.startsWith("http://") || path.startsWith("https://") ? path : this.baseUrl + path;
		if (method != RequestMethod.POST && !encodedParams.isEmpty())
			url += (url.contains("?") ? "&" : "?") + encodedParams;

		final String loggableUrl = url;
		LOGGER.trace(() -> String.format("%s %s", method.name(), loggableUrl));

		HttpURLConnection connection = null;
		try {
			connection = (HttpURLConnection) new URL(url).openConnection();
			connection.setRequestMethod(method.name());
			connection.setConnectTimeout(this.connectTimeout);
			connection.setReadTimeout(this.readTimeout);
			connection.setRequestProperty("Accept", "application/json");

			if (apiKey != null && !apiKey.isEmpty()) {
				String credentials = BaseEncoding.base64().encode((apiKey + ":").getBytes(StandardCharsets.UTF_8));
				connection.setRequestProperty("Authorization", "Basic " + credentials);
			}

			if (method == RequestMethod.POST) {
				byte[] body = encodedParams.getBytes(StandardCharsets.UTF_8);
				connection.setDoOutput(true);
				connection.setRequestProperty("Content-Type", "application/x-www-form-urlencoded");
				connection.setFixedLengthStreamingMode(body.length);

				try (OutputStream out = connection.getOutputStream()) {
					out.write(body);
				}
			}

			int status = connection.getResponseCode();
			String body = readBody(status >= 400 ? connection.getErrorStream() : connection.getInputStream());

			boolean isSuccess = (status >= 200 && status < 300) || ignoredStatusCodes.contains(status);
			if (isSuccess)
				return parseBody(body, status);

			String remoteMessage = extractErrorMessage(body);

			if (status >= 400 && status < 500)
				throw new SwapException.RemoteRejectedException(status, remoteMessage);

			throw new SwapException.NetworkException(status, String.format("Escrow service error (HTTP %d) for %s %s: %s",
					status, method.name(), path, remoteMessage));
		} catch (IOException e) {
			throw new SwapException.NetworkException(String.format("Unable to reach escrow service for %s %s: %s",
					method.name(), path, e.getMessage()), e);
		} finally {
			if (connection != null)
				connection.disconnect();
		}
	}

	/*package*/ static String encodeParams(Map<String, ?> params) {
		StringJoiner joiner = new StringJoiner("&");

		if (params != null)
			for (Map.Entry<String, ?> entry : params.entrySet()) {
				if (entry.getValue() == null)
					continue;

				joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
						+ "=" + URLEncoder.encode(String.valueOf(entry.getValue()), StandardCharsets.UTF_8));
			}

		return joiner.toString();
	}

	private static String readBody(InputStream stream) throws IOException {
		if (stream == null)
			return "";

		try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
			return CharStreams.toString(reader);
		}
	}

	private static JSONObject parseBody(String body, int status) throws SwapException.NetworkException {
		if (body.isBlank())
			return new JSONObject();

		try {
			return new JSONObject(body);
		} catch (JSONException e) {
			throw new SwapException.NetworkException(status, String.format("Unexpected non-JSON response from escrow service: %s", e.getMessage()));
		}
	}

	private static String extractErrorMessage(String body) {
		if (body.isBlank())
			return "(no response body)";

		try {
			JSONObject json = new JSONObject(body);

			if (json.has("message"))
				return json.optString("message");

			if (json.has("error"))
				return json.optString("error");
		} catch (JSONException e) {
			// Not JSON so use raw body
		}

		return body;
	}

}
