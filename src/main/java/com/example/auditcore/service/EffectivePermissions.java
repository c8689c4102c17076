package com.example.auditcore.service;

import com.example.auditcore.models.Scope;
import java.util.List;

public record EffectivePermissions(
        String userId,
        List<String> roles,
        List<EffectivePermission> permissions
) {

    /**
     * @param roleName set for role-derived entries
     * @param scope    set for direct grants; empty scope means unrestricted
     */
    public record EffectivePermission(
            String name,
            GrantSource source,
            String roleName,
            Scope scope
    ) { }
}
