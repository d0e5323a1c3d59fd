package com.revolution.backend.security;

import java.util.List;

/**
 * A freshly generated backup-code set. {@code plainCodes} is shown to the user once and never stored;
 * {@code hashedCodes} is what gets persisted, index-aligned with {@code plainCodes}.
 */
public record BackupCodes(List<String> plainCodes, List<String> hashedCodes) {
}
