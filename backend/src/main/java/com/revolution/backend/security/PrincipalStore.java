package com.revolution.backend.security;

import java.util.Optional;

/**
 * Account lookup owned by the user domain.
 */
public interface PrincipalStore {

    Optional<AccountRecord> findById(Long id);

    Optional<AccountRecord> findByEmail(String email);
}
