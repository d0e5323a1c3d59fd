package com.revolution.backend.security;

import com.revolution.backend.exception.UnknownHashFormatException;

import java.util.List;

/**
 * Stored credential formats, recognised by prefix. A new format is a new constant plus a matching arm in
 * {@link CredentialHasher#verify}.
 */
public enum HashFormat {

    /** Primary memory-hard format, PHC string {@code $argon2id$v=19$m=..,t=..,p=..$salt$hash}. */
    ARGON2ID(List.of("$argon2id$")),

    /** Legacy low-cost format kept so pre-existing accounts can log in and be migrated. */
    BCRYPT(List.of("$2a$", "$2b$", "$2y$"));

    private final List<String> prefixes;

    HashFormat(List<String> prefixes) {
        this.prefixes = prefixes;
    }

    public static HashFormat detect(String hash) {
        if (hash != null) {
            for (HashFormat format : values()) {
                for (String prefix : format.prefixes) {
                    if (hash.startsWith(prefix)) {
                        return format;
                    }
                }
            }
        }
        throw new UnknownHashFormatException("Unrecognised credential hash format");
    }
}
