package com.bastion.security.token;

/**
 * Turns a {@link SessionToken} into an opaque cookie value and back. Implementations are
 * stateless and safe to call from any thread.
 */
public interface TokenCodec {

    String encode(SessionToken token);

    /**
     * Decodes an untrusted cookie value.
     *
     * @throws TokenDecodeException for malformed, tampered or unsupported values; no other
     *     exception escapes
     */
    SessionToken decode(String encoded) throws TokenDecodeException;
}
