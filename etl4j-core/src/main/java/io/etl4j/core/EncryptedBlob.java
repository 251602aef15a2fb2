package io.etl4j.core;

import java.util.Objects;

/**
 * Output of one encryption call. All parts are Base64 and freshly random per call.
 */
public record EncryptedBlob(String ciphertext, String iv, String salt, String tag) {
    public EncryptedBlob {
        Objects.requireNonNull(ciphertext, "ciphertext must not be null");
        Objects.requireNonNull(iv, "iv must not be null");
        Objects.requireNonNull(salt, "salt must not be null");
        Objects.requireNonNull(tag, "tag must not be null");
    }

    @Override
    public String toString() {
        return "EncryptedBlob[...]";
    }
}
