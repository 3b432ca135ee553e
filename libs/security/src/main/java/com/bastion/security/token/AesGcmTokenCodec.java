package com.bastion.security.token;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * {@link TokenCodec} using AES-256-GCM.
 * <p>
 * Envelope: {@code version (1) | iv (12) | ciphertext (40) | tag (16)}, URL-safe Base64 without
 * padding. The version byte is authenticated as additional data. Plaintext, big-endian:
 * <pre>
 * tenantId int32 | userId 16 bytes | tenantGen int32 | userGen int32 | expiresAt int64 millis | loginEventId int32
 * </pre>
 */
public final class AesGcmTokenCodec implements TokenCodec {

    /** Current envelope version. */
    public static final byte VERSION = 0x01;

    static final int PAYLOAD_LENGTH = 4 + 16 + 4 + 4 + 8 + 4;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int ENVELOPE_LENGTH = 1 + GCM_IV_LENGTH + PAYLOAD_LENGTH + GCM_TAG_LENGTH / 8;
    private static final int KEY_LENGTH = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKey key;

    /**
     * @param keyBytes 256-bit AES key
     * @throws IllegalArgumentException if the key is not 32 bytes
     */
    public AesGcmTokenCodec(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException("token secret must be 256 bits (32 bytes)");
        }
        this.key = new SecretKeySpec(keyBytes.clone(), "AES");
    }

    /**
     * Creates a codec from a standard Base64 encoded key ({@code openssl rand -base64 32}).
     *
     * @throws IllegalArgumentException if the value is not valid Base64 or not 32 bytes
     */
    public static AesGcmTokenCodec fromBase64Secret(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("token secret must not be blank");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64Key.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("token secret must be valid Base64", e);
        }
        return new AesGcmTokenCodec(keyBytes);
    }

    @Override
    public String encode(SessionToken token) {
        ByteBuffer payload = ByteBuffer.allocate(PAYLOAD_LENGTH)
                .putInt(token.tenantId())
                .putLong(token.userId().getMostSignificantBits())
                .putLong(token.userId().getLeastSignificantBits())
                .putInt(token.tenantGeneration())
                .putInt(token.userGeneration())
                .putLong(token.expiresAt().toEpochMilli())
                .putInt(token.loginEventId());

        byte[] iv = new byte[GCM_IV_LENGTH];
        SECURE_RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(new byte[] {VERSION});
            byte[] encrypted = cipher.doFinal(payload.array());

            ByteBuffer envelope = ByteBuffer.allocate(1 + iv.length + encrypted.length)
                    .put(VERSION)
                    .put(iv)
                    .put(encrypted);
            return ENCODER.encodeToString(envelope.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt session token", e);
        }
    }

    @Override
    public SessionToken decode(String encoded) throws TokenDecodeException {
        if (encoded == null || encoded.isBlank()) {
            throw new TokenDecodeException(TokenDecodeException.Reason.MALFORMED, "empty token");
        }
        try {
            byte[] envelope = DECODER.decode(encoded);
            if (envelope.length == 0) {
                throw new TokenDecodeException(TokenDecodeException.Reason.MALFORMED, "empty token");
            }
            if (envelope[0] != VERSION) {
                throw new TokenDecodeException(TokenDecodeException.Reason.UNSUPPORTED_VERSION,
                        "unsupported token version " + envelope[0]);
            }
            if (envelope.length != ENVELOPE_LENGTH) {
                throw new TokenDecodeException(TokenDecodeException.Reason.MALFORMED,
                        "unexpected token length " + envelope.length);
            }
            return readPayload(decrypt(envelope));
        } catch (AEADBadTagException e) {
            throw new TokenDecodeException(TokenDecodeException.Reason.INTEGRITY, "token integrity check failed", e);
        } catch (GeneralSecurityException | RuntimeException e) {
            // Base64 errors surface as IllegalArgumentException
            throw new TokenDecodeException(TokenDecodeException.Reason.MALFORMED, "token could not be decoded", e);
        }
    }

    private byte[] decrypt(byte[] envelope) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, envelope, 1, GCM_IV_LENGTH));
        cipher.updateAAD(envelope, 0, 1);
        return cipher.doFinal(envelope, 1 + GCM_IV_LENGTH, envelope.length - 1 - GCM_IV_LENGTH);
    }

    private static SessionToken readPayload(byte[] payload) throws TokenDecodeException {
        if (payload.length != PAYLOAD_LENGTH) {
            throw new TokenDecodeException(TokenDecodeException.Reason.MALFORMED,
                    "unexpected payload length " + payload.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        int tenantId = buffer.getInt();
        UUID userId = new UUID(buffer.getLong(), buffer.getLong());
        int tenantGeneration = buffer.getInt();
        int userGeneration = buffer.getInt();
        Instant expiresAt = Instant.ofEpochMilli(buffer.getLong());
        int loginEventId = buffer.getInt();
        return new SessionToken(tenantId, userId, tenantGeneration, userGeneration, expiresAt, loginEventId);
    }
}
