package io.mcp.client;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Signs and verifies webhook deliveries.
 * <p>
 * The server signs the raw request body with the secret given at registration and sends the
 * lowercase hex HMAC-SHA256 in the {@value #SIGNATURE_HEADER} header, optionally prefixed with
 * {@code sha256=}.
 */
public final class WebhookSignatures {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private WebhookSignatures() {
    }

    public static String sign(String secret, byte[] body) {
        Assert.checkNotNullParam("secret", secret);
        Assert.checkNotNullParam("body", body);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            // every JRE ships HmacSHA256
            throw new IllegalStateException("Cannot compute " + ALGORITHM, e);
        }
    }

    public static String sign(String secret, String body) {
        Assert.checkNotNullParam("body", body);
        return sign(secret, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Checks a delivery's signature in constant time.
     *
     * @param secret the secret of the webhook registration
     * @param body the raw request body
     * @param signatureHeader the value of the {@value #SIGNATURE_HEADER} header, may be {@code null}
     * @return {@code true} if the signature matches
     */
    public static boolean verify(String secret, byte[] body, @Nullable String signatureHeader) {
        if (signatureHeader == null) {
            return false;
        }
        String signature = signatureHeader.trim();
        if (signature.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            signature = signature.substring(PREFIX.length());
        }
        byte[] expected = sign(secret, body).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    public static boolean verify(String secret, String body, @Nullable String signatureHeader) {
        Assert.checkNotNullParam("body", body);
        return verify(secret, body.getBytes(StandardCharsets.UTF_8), signatureHeader);
    }
}
