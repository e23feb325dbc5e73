package com.example.draftarchiver.domain;

/**
 * A remote asset the draft-editing layer requires inside the workspace.
 *
 * @param locator        Remote URL, or a local file path when local sources are enabled.
 * @param kind           Expected media kind.
 * @param targetSubpath  Relative path inside the workspace the asset is written to.
 * @param expectedSha256 Optional lowercase hex SHA-256 of the content; may be null.
 */
public record AssetDescriptor(String locator, AssetKind kind, String targetSubpath, String expectedSha256) {

    public AssetDescriptor(String locator, AssetKind kind, String targetSubpath) {
        this(locator, kind, targetSubpath, null);
    }
}
