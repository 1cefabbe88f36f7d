package com.payment.gateway.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * RSA signatures over canonical strings. Keys are Base64 text as issued by the open platform
 * console: PKCS#8 for the merchant private key, X.509 for the provider public key.
 */
@Slf4j
@Component
public class RsaSigner {

    private static final String KEY_ALGORITHM = "RSA";

    /**
     * Signs the UTF-8 bytes of {@code content}.
     *
     * @return Base64 signature
     * @throws GatewayException if the private key cannot be used
     */
    public String sign(String content, String privateKey, SignType signType) {
        try {
            Signature signature = Signature.getInstance(signType.getAlgorithm());
            signature.initSign(readPrivateKey(privateKey));
            signature.update(content.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new GatewayException("Failed to sign request with " + signType, e);
        }
    }

    /**
     * Checks {@code sign} against {@code content}. Never throws: a malformed signature or an
     * unusable key counts as a mismatch, and callers decide how to escalate.
     */
    public boolean verify(String content, String sign, String publicKey, SignType signType) {
        if (content == null || sign == null || sign.isBlank()) {
            return false;
        }
        if (publicKey == null || publicKey.isBlank()) {
            log.warn("Signature verification skipped: no public key configured for signType={}", signType);
            return false;
        }
        try {
            Signature signature = Signature.getInstance(signType.getAlgorithm());
            signature.initVerify(readPublicKey(publicKey));
            signature.update(content.getBytes(StandardCharsets.UTF_8));
            return signature.verify(Base64.getDecoder().decode(sign));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Signature verification could not run: signType={}, error={}", signType, e.getMessage());
            return false;
        }
    }

    private static PrivateKey readPrivateKey(String base64) throws GeneralSecurityException {
        byte[] encoded = Base64.getMimeDecoder().decode(base64);
        return KeyFactory.getInstance(KEY_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(encoded));
    }

    private static PublicKey readPublicKey(String base64) throws GeneralSecurityException {
        byte[] encoded = Base64.getMimeDecoder().decode(base64);
        return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }
}
