package com.example.auditcore.access;

import com.example.auditcore.models.UserAccount;
import java.util.Optional;

/**
 * Read-only lookup into the account table owned by the authentication layer.
 */
public interface UserAccess {

    Optional<UserAccount> findByUserId(String userId);
}
