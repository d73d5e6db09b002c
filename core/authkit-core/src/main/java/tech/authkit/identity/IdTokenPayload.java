package tech.authkit.identity;

import java.util.Base64;
import java.util.Optional;

/**
 * Reads the claims segment of a compact-serialized ID token without verifying it.
 *
 * <p>The token is only used as a local source of identity claims; its signature
 * is not checked here.
 */
public final class IdTokenPayload {

    private IdTokenPayload() {
    }

    /**
     * Decode the middle segment of {@code header.payload.signature}.
     *
     * @return the raw payload bytes, or empty if the token is not a three-part
     *         structure or the segment is not valid base64url
     */
    public static Optional<byte[]> decode(String idToken) {
        if (idToken == null) {
            return Optional.empty();
        }

        String[] parts = idToken.split("\\.", -1);
        if (parts.length != 3 || parts[1].isEmpty()) {
            return Optional.empty();
        }

        // Some providers emit the standard alphabet; normalise before decoding.
        String segment = parts[1].replace('+', '-').replace('/', '_');
        try {
            byte[] payload = Base64.getUrlDecoder().decode(segment);
            return payload.length == 0 ? Optional.empty() : Optional.of(payload);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
