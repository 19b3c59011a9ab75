package com.laddertrader.integration.nonkyc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class NonkycRequestSignerTest {
  private static final ApiCredentials CREDENTIALS = new ApiCredentials("test-key", "test-secret");
  private static final String BALANCES_URL = "https://api.nonkyc.io/api/v2/balances";

  private final NonkycRequestSigner signer = new NonkycRequestSigner(new ObjectMapper());

  @Test
  void shouldSignGetRequestOverAbsoluteUrlAndNonce() throws Exception {
    SignedRequest signed = signer.sign("get", BALANCES_URL, null, null, CREDENTIALS, 1700000000000L);

    String expectedMessage = "test-key" + BALANCES_URL + "1700000000000";
    assertEquals("GET", signed.method());
    assertEquals(BALANCES_URL, signed.url());
    assertEquals(expectedMessage, signed.signedMessage());
    assertEquals(hmac("test-secret", expectedMessage), signed.signature());
    assertNull(signed.body());
  }

  @Test
  void shouldAppendSortedQueryToSignedData() throws Exception {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", "BTC_USDT");
    params.put("status", "active");

    SignedRequest signed =
        signer.sign(
            "GET", "https://api.nonkyc.io/api/v2/getorders", params, null, CREDENTIALS, 42L);

    String url = "https://api.nonkyc.io/api/v2/getorders?status=active&symbol=BTC_USDT";
    assertEquals(url, signed.url());
    assertEquals(hmac("test-secret", "test-key" + url + "42"), signed.signature());
  }

  @Test
  void shouldSignPostBodyAsCompactJsonWithSortedKeys() throws Exception {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("symbol", "BTC_USDT");
    body.put("side", "buy");
    body.put("strictValidate", true);

    SignedRequest signed =
        signer.sign(
            "POST", "https://api.nonkyc.io/api/v2/createorder", null, body, CREDENTIALS, 7L);

    String payload = "{\"side\":\"buy\",\"strictValidate\":true,\"symbol\":\"BTC_USDT\"}";
    assertEquals(payload, signed.body());
    assertEquals(
        "test-key" + "https://api.nonkyc.io/api/v2/createorder" + payload + "7",
        signed.signedMessage());
    assertEquals(hmac("test-secret", signed.signedMessage()), signed.signature());
  }

  @Test
  void shouldRejectPathOnlyUrlUnlessScopeAllowsIt() {
    assertThrows(
        IllegalArgumentException.class,
        () -> signer.sign("GET", "/api/v2/balances", null, null, CREDENTIALS, 1L));

    NonkycRequestSigner pathOnly =
        new NonkycRequestSigner(new ObjectMapper(), SignatureScope.PATH_ONLY);
    SignedRequest signed = pathOnly.sign("GET", BALANCES_URL, null, null, CREDENTIALS, 1L);
    assertEquals("test-key/api/v2/balances1", signed.signedMessage());
  }

  @Test
  void shouldExposeSignatureHeaders() {
    SignedRequest signed = signer.sign("GET", BALANCES_URL, null, null, CREDENTIALS, 99L);

    Map<String, String> headers = signed.headers(CREDENTIALS);

    assertEquals("test-key", headers.get("X-API-KEY"));
    assertEquals("99", headers.get("X-API-NONCE"));
    assertEquals(signed.signature(), headers.get("X-API-SIGN"));
    assertFalse(signed.toString().contains(signed.signature()));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldBuildLoginFrameSigningOnlyTheNonce() throws Exception {
    Map<String, Object> frame = signer.loginPayload(CREDENTIALS, "AbCdEfGhIjKlMn");

    assertEquals("login", frame.get("method"));
    Map<String, Object> params = (Map<String, Object>) frame.get("params");
    assertEquals("HS256", params.get("algo"));
    assertEquals("test-key", params.get("pKey"));
    assertEquals("AbCdEfGhIjKlMn", params.get("nonce"));
    assertEquals(hmac("test-secret", "AbCdEfGhIjKlMn"), params.get("signature"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldGenerateFourteenCharacterLoginNonce() {
    Map<String, Object> params = (Map<String, Object>) signer.loginPayload(CREDENTIALS).get("params");

    String nonce = (String) params.get("nonce");
    assertEquals(14, nonce.length());
    assertTrue(nonce.matches("[A-Za-z0-9]+"));
  }

  @Test
  void shouldMaskSecretsInCredentialsToString() {
    String rendered = new ApiCredentials("abcdef123456", "very-secret").toString();

    assertFalse(rendered.contains("very-secret"));
    assertFalse(rendered.contains("abcdef123456"));
    assertTrue(rendered.contains("3456"));
  }

  private static String hmac(String secret, String message) throws Exception {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
    return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
  }
}
