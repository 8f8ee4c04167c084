package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.unity.IdentityToken;

/**
 * Maps a package-relative path to its stable identity.
 *
 * <p>Implementations must be pure: the same root token and path produce the same
 * token on every call, on every machine, without any persisted mapping. Content,
 * timestamps and the rest of the tree never influence the result.
 */
public interface IdentityDeriver {

    /**
     * @param packageRootToken per-package seed (normally the package name)
     * @param relativePath     package-relative path; "" is the package root
     * @return identity token for that path
     */
    IdentityToken derive(String packageRootToken, String relativePath);
}
