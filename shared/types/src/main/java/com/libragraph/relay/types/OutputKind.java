package com.libragraph.relay.types;

/**
 * Kinds of artifact a backend node can list in its output manifest,
 * keyed by the manifest section they appear under.
 */
public enum OutputKind {
    IMAGE("images"),
    VIDEO("videos"),
    GIF("gifs");

    private final String manifestKey;

    OutputKind(String manifestKey) {
        this.manifestKey = manifestKey;
    }

    public String manifestKey() {
        return manifestKey;
    }

    public static OutputKind fromManifestKey(String key) {
        for (OutputKind k : values()) {
            if (k.manifestKey.equals(key)) return k;
        }
        throw new IllegalArgumentException("Unknown OutputKind manifest key: " + key);
    }
}
