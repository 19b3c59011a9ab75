package com.laddertrader.integration.nonkyc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Signs venue requests as {@code hex(HMAC-SHA256(secret, apiKey + data + nonce))}. For GET the
 * data is the URL plus its sorted query; otherwise it is the URL followed by the compact JSON body
 * with sorted keys.
 */
public class NonkycRequestSigner {
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String LOGIN_ALGO = "HS256";
  private static final String NONCE_ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
  private static final int LOGIN_NONCE_LENGTH = 14;

  private final ObjectMapper sortedMapper;
  private final SignatureScope scope;
  private final SecureRandom random = new SecureRandom();

  public NonkycRequestSigner(ObjectMapper objectMapper) {
    this(objectMapper, SignatureScope.ABSOLUTE_URL);
  }

  public NonkycRequestSigner(ObjectMapper objectMapper, SignatureScope scope) {
    Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.sortedMapper =
        objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    this.scope = Objects.requireNonNull(scope, "scope must not be null");
  }

  public SignedRequest sign(
      String method,
      String url,
      Map<String, ?> params,
      Map<String, ?> body,
      ApiCredentials credentials,
      long nonce) {
    Objects.requireNonNull(credentials, "credentials must not be null");
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("method is required");
    }
    String normalizedMethod = method.trim().toUpperCase(Locale.ROOT);
    URI uri = URI.create(Objects.requireNonNull(url, "url must not be null"));
    if (scope == SignatureScope.ABSOLUTE_URL && (!uri.isAbsolute() || uri.getHost() == null)) {
      throw new IllegalArgumentException("Signing requires an absolute URL, got: " + url);
    }
    String signedUrl = scope == SignatureScope.PATH_ONLY ? uri.getRawPath() : url;

    String requestUrl = url;
    String payload = null;
    String dataToSign;
    if ("GET".equals(normalizedMethod)) {
      String query = canonicalQuery(params);
      if (!query.isEmpty()) {
        requestUrl = url + "?" + query;
        dataToSign = signedUrl + "?" + query;
      } else {
        dataToSign = signedUrl;
      }
    } else {
      payload = body == null || body.isEmpty() ? null : serializeBody(body);
      dataToSign = payload == null ? signedUrl : signedUrl + payload;
    }

    String message = credentials.apiKey() + dataToSign + nonce;
    String signature = hmacSha256Hex(credentials.apiSecret(), message);
    return new SignedRequest(normalizedMethod, requestUrl, nonce, signature, message, payload);
  }

  /** Login frame for the streaming API; its nonce is a random token rather than a counter. */
  public Map<String, Object> loginPayload(ApiCredentials credentials) {
    Objects.requireNonNull(credentials, "credentials must not be null");
    String nonce = randomToken(LOGIN_NONCE_LENGTH);
    return loginPayload(credentials, nonce);
  }

  Map<String, Object> loginPayload(ApiCredentials credentials, String nonce) {
    Map<String, Object> params = new TreeMap<>();
    params.put("algo", LOGIN_ALGO);
    params.put("pKey", credentials.apiKey());
    params.put("nonce", nonce);
    params.put("signature", hmacSha256Hex(credentials.apiSecret(), nonce));
    Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("method", "login");
    frame.put("params", params);
    return frame;
  }

  public String serializeBody(Map<String, ?> body) {
    try {
      return sortedMapper.writeValueAsString(new TreeMap<>(body));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Request body cannot be serialized", ex);
    }
  }

  static String canonicalQuery(Map<String, ?> params) {
    if (params == null || params.isEmpty()) {
      return "";
    }
    StringBuilder query = new StringBuilder();
    for (Map.Entry<String, ?> entry : new TreeMap<>(params).entrySet()) {
      if (entry.getValue() == null) {
        continue;
      }
      if (query.length() > 0) {
        query.append('&');
      }
      query
          .append(urlEncode(entry.getKey()))
          .append('=')
          .append(urlEncode(String.valueOf(entry.getValue())));
    }
    return query.toString();
  }

  static String hmacSha256Hex(String secret, String payload) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      byte[] signatureBytes = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to sign NonKYC request", ex);
    }
  }

  private String randomToken(int length) {
    StringBuilder token = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      token.append(NONCE_ALPHABET.charAt(random.nextInt(NONCE_ALPHABET.length())));
    }
    return token.toString();
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
