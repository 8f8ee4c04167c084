package com.purchasingpower.upmsync.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.purchasingpower.upmsync.model.unity.IdentityToken;
import com.purchasingpower.upmsync.service.IdentityDeriver;
import com.purchasingpower.upmsync.util.PackagePaths;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * SHA-256 based identity derivation.
 *
 * <p>token = first 128 bits of SHA-256(rootToken + NUL + normalizedPath), printed as
 * lowercase {@code 8-4-4-4-12} hex. The NUL separator keeps ("a", "b/c") and
 * ("a/b", "c") apart.
 */
@Service
public class IdentityDeriverImpl implements IdentityDeriver {

    private static final char SEPARATOR = '\0';
    private static final int TOKEN_BYTES = 16;

    @Override
    public IdentityToken derive(String packageRootToken, String relativePath) {
        Preconditions.checkArgument(packageRootToken != null && !packageRootToken.isBlank(),
                "Package root token is required");

        String input = packageRootToken + SEPARATOR + PackagePaths.normalize(relativePath);
        byte[] digest = Hashing.sha256().hashString(input, StandardCharsets.UTF_8).asBytes();

        return new IdentityToken(format(digest));
    }

    private static String format(byte[] digest) {
        StringBuilder hex = new StringBuilder(36);
        for (int i = 0; i < TOKEN_BYTES; i++) {
            if (i == 4 || i == 6 || i == 8 || i == 10) {
                hex.append('-');
            }
            hex.append(Character.forDigit((digest[i] >> 4) & 0xF, 16));
            hex.append(Character.forDigit(digest[i] & 0xF, 16));
        }
        return hex.toString();
    }
}
