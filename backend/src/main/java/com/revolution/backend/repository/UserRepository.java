package com.revolution.backend.repository;

import com.revolution.backend.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Emails are stored lower-cased; callers normalise before lookup.
     */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Row lock held until the surrounding transaction ends. Used where a read-modify-write on MFA state
     * must not interleave, e.g. consuming a backup code.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query("update User u set u.lastLoginAt = :at where u.id = :id")
    int updateLastLoginAt(@Param("id") Long id, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update User u set u.tokenVersion = u.tokenVersion + 1 where u.id = :id")
    int incrementTokenVersion(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query("update User u set u.passwordHash = :hash where u.id = :id")
    int updatePasswordHash(@Param("id") Long id, @Param("hash") String hash);
}
