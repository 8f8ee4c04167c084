package com.purchasingpower.upmsync.model.unity;

import com.google.common.base.Preconditions;

import java.util.regex.Pattern;

/**
 * Stable identity of one package-relative path, shaped {@code 8-4-4-4-12} lowercase hex.
 *
 * <p>Unity stores the same 128 bits without hyphens in the {@code guid:} line of a
 * .meta file; see {@link #toGuid()}.
 */
public record IdentityToken(String value) {

    private static final Pattern FORMAT = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    public IdentityToken {
        Preconditions.checkArgument(value != null && FORMAT.matcher(value).matches(),
                "Malformed identity token: %s", value);
    }

    /**
     * 32 hex characters as written into Unity .meta files.
     */
    public String toGuid() {
        return value.replace("-", "");
    }

    @Override
    public String toString() {
        return value;
    }
}
