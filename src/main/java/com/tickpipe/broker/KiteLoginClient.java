package com.tickpipe.broker;

import com.eatthepath.otp.TimeBasedOneTimePasswordGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.tickpipe.config.KiteConfig;
import com.tickpipe.exception.AuthRejectedException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Headless Kite login over plain HTTP: credentials, TOTP two-factor, then the Connect redirect
 * chain that carries the request_token.
 *
 * <p>Steps:
 * <ol>
 *   <li>{@code POST /api/login} with user_id and password, returning a request_id</li>
 *   <li>{@code POST /api/twofa} with the current TOTP; on rejection waits for the next 30s TOTP
 *       window and retries once</li>
 *   <li>{@code GET /connect/login?v=3&api_key=...} with the session cookies, following redirects by
 *       hand until a {@code request_token} shows up in a Location header or response body</li>
 * </ol>
 * Every login uses a fresh cookie jar. Redirects are never followed automatically because the
 * final hop points at the app's registered redirect URL, which need not be reachable.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KiteLoginClient {

    private static final Logger log = LoggerFactory.getLogger(KiteLoginClient.class);

    private static final Pattern REQUEST_TOKEN = Pattern.compile("request_token=([A-Za-z0-9]+)");

    private static final long TOTP_STEP_MS = 30_000;

    private final KiteConfig kiteConfig;

    public KiteLoginClient(KiteConfig kiteConfig) {
        this.kiteConfig = kiteConfig;
    }

    /**
     * @throws AuthRejectedException when any step is refused or no request_token is found
     */
    public String obtainRequestToken() {
        KiteConfig.Login login = kiteConfig.getLogin();
        if (isBlank(login.getUserId()) || isBlank(login.getPassword()) || isBlank(login.getTotpSecret())) {
            throw new AuthRejectedException("Kite login credentials are not configured");
        }

        log.info("Starting Kite login for user: {}", login.getUserId());
        RestClient client = newClient(login);
        try {
            String requestId = submitCredentials(client, login);
            submitTwoFactor(client, login, requestId);
            String requestToken = followConnectRedirects(client, login);
            log.info("Obtained request_token via HTTP login");
            return requestToken;
        } catch (RestClientException e) {
            throw new AuthRejectedException("Kite login failed: " + e.getMessage(), e);
        }
    }

    String generateTotp(String base32Secret) {
        try {
            SecretKeySpec key = new SecretKeySpec(base32Decode(base32Secret), "HmacSHA1");
            int otp = new TimeBasedOneTimePasswordGenerator().generateOneTimePassword(key, Instant.now());
            return String.format("%06d", otp);
        } catch (InvalidKeyException e) {
            throw new AuthRejectedException("Failed to generate TOTP: " + e.getMessage(), e);
        }
    }

    /** Extracts the request_token from a redirect URL or an HTML/JSON body, or null. */
    static String extractRequestToken(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = REQUEST_TOKEN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
    }

    private RestClient newClient(KiteConfig.Login login) {
        HttpClient httpClient = HttpClient.newBuilder()
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(login.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(login.getReadTimeout());
        return RestClient.builder()
                .baseUrl(login.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    private String submitCredentials(RestClient client, KiteConfig.Login login) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("user_id", login.getUserId());
        form.add("password", login.getPassword());

        JsonNode response = client.post()
                .uri("/api/login")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);

        String requestId = response != null ? response.path("data").path("request_id").asText(null) : null;
        if (isBlank(requestId)) {
            throw new AuthRejectedException("Kite login returned no request_id");
        }
        log.info("Credentials accepted, submitting TOTP");
        return requestId;
    }

    private void submitTwoFactor(RestClient client, KiteConfig.Login login, String requestId) {
        try {
            postTwoFactor(client, login, requestId);
        } catch (RestClientException e) {
            long waitMs = TOTP_STEP_MS - (System.currentTimeMillis() % TOTP_STEP_MS) + 1000;
            log.warn("TOTP rejected ({}), retrying with the next code in {}ms", e.getMessage(), waitMs);
            sleep(waitMs);
            postTwoFactor(client, login, requestId);
        }
    }

    private void postTwoFactor(RestClient client, KiteConfig.Login login, String requestId) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("user_id", login.getUserId());
        form.add("request_id", requestId);
        form.add("twofa_value", generateTotp(login.getTotpSecret()));
        form.add("twofa_type", "totp");

        client.post()
                .uri("/api/twofa")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .toBodilessEntity();
    }

    private String followConnectRedirects(RestClient client, KiteConfig.Login login) {
        String url = login.getBaseUrl() + "/connect/login?v=3&api_key=" + kiteConfig.getApiKey();

        for (int hop = 0; hop <= login.getMaxRedirects(); hop++) {
            RedirectHop response = client.get()
                    .uri(URI.create(url))
                    .exchange((request, clientResponse) -> new RedirectHop(
                            clientResponse.getStatusCode().is3xxRedirection(),
                            clientResponse.getHeaders().getFirst(HttpHeaders.LOCATION),
                            readBody(clientResponse.getBody().readAllBytes())));

            String token = extractRequestToken(response.location());
            if (token == null) {
                token = extractRequestToken(response.body());
            }
            if (token != null) {
                return token;
            }
            if (!response.redirect() || response.location() == null) {
                break;
            }
            url = URI.create(url).resolve(response.location()).toString();
            log.debug("Following login redirect {} -> {}", hop + 1, url);
        }
        throw new AuthRejectedException("request_token not found after following the Kite connect redirects");
    }

    private static String readBody(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private byte[] base32Decode(String base32) {
        String normalized = base32.replace("=", "").replace(" ", "").toUpperCase();
        String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

        byte[] result = new byte[normalized.length() * 5 / 8];
        int buffer = 0;
        int bitsInBuffer = 0;
        int index = 0;

        for (char c : normalized.toCharArray()) {
            int val = alphabet.indexOf(c);
            if (val < 0) {
                throw new AuthRejectedException("Invalid base32 character in TOTP secret");
            }
            buffer = (buffer << 5) | val;
            bitsInBuffer += 5;
            if (bitsInBuffer >= 8) {
                result[index++] = (byte) (buffer >> (bitsInBuffer - 8));
                bitsInBuffer -= 8;
                buffer &= (1 << bitsInBuffer) - 1;
            }
        }
        return result;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthRejectedException("Interrupted while waiting for the next TOTP window", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record RedirectHop(boolean redirect, String location, String body) {}
}
