package com.vbot.plugins.telegram.internal;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.vbot.api.TransportException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * Minimal Bot API caller: POSTs a JSON body to {@code <apiBase>/bot<token>/<method>} and
 * unwraps the {@code result} field, turning every failure into a {@link TransportException}.
 */
public class BotApiClient {
    private static final String USER_AGENT = "VBot/2.0";
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final String apiBase;
    private final String botToken;

    public BotApiClient(String apiBase, String botToken) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.botToken = botToken;
    }

    public JsonElement call(String method, JsonObject params) throws TransportException {
        return call(method, params, 30_000);
    }

    public JsonElement call(String method, JsonObject params, int readTimeoutMs) throws TransportException {
        String body;
        try {
            URL url = new URL(apiBase + "/bot" + botToken + "/" + method);
            HttpURLConnection conn = (HttpURLConnection) url.openConnection();
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(CONNECT_TIMEOUT_MS);
            conn.setReadTimeout(readTimeoutMs);
            conn.setRequestProperty("User-Agent", USER_AGENT);
            conn.setRequestProperty("Content-Type", "application/json; charset=UTF-8");
            conn.setRequestProperty("Accept", "application/json");
            conn.setDoOutput(true);

            try (OutputStream os = conn.getOutputStream()) {
                byte[] input = params.toString().getBytes(StandardCharsets.UTF_8);
                os.write(input, 0, input.length);
            }
            body = readResponse(conn);
        } catch (IOException e) {
            throw new TransportException(method + " failed: " + e.getMessage(), e);
        }
        return unwrap(method, body);
    }

    /**
     * Extracts {@code result} from a Bot API response body.
     */
    static JsonElement unwrap(String method, String body) throws TransportException {
        if (body == null || body.isEmpty())
            throw new TransportException(method + " returned no body");

        JsonObject root;
        try {
            root = JsonParser.parseString(body).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new TransportException(method + " returned invalid JSON", e);
        }

        if (root.has("ok") && root.get("ok").getAsBoolean())
            return root.get("result");

        String description = root.has("description") ? root.get("description").getAsString() : "unknown error";
        int code = root.has("error_code") ? root.get("error_code").getAsInt() : 0;
        if (code == 429) {
            long retryAfter = 1;
            if (root.has("parameters") && root.getAsJsonObject("parameters").has("retry_after"))
                retryAfter = root.getAsJsonObject("parameters").get("retry_after").getAsLong();
            throw new RateLimitedException(retryAfter, method + " rate limited: " + description);
        }
        throw new TransportException(method + " failed (" + code + "): " + description);
    }

    private static String readResponse(HttpURLConnection conn) throws IOException {
        int code = conn.getResponseCode();
        InputStream in = (code >= 400) ? conn.getErrorStream() : conn.getInputStream();
        if (in == null)
            return null;

        if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
            in = new GZIPInputStream(in);
        }

        StringBuilder result = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null)
                result.append(line);
        }
        return result.toString();
    }
}
