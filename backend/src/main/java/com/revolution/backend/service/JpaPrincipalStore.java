package com.revolution.backend.service;

import com.revolution.backend.model.User;
import com.revolution.backend.repository.UserRepository;
import com.revolution.backend.security.AccountRecord;
import com.revolution.backend.security.PrincipalStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaPrincipalStore implements PrincipalStore {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountRecord> findById(Long id) {
        return userRepository.findById(id).map(JpaPrincipalStore::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountRecord> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userRepository.findByEmail(normalizeEmail(email)).map(JpaPrincipalStore::toRecord);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static AccountRecord toRecord(User user) {
        return new AccountRecord(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.getBannedAt(),
                user.getPasswordHash(),
                user.isMfaEnabled(),
                user.getTokenVersion());
    }
}
