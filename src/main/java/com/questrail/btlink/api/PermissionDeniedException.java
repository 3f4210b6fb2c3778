package com.questrail.btlink.api;

import java.util.List;

/**
 * Thrown (signalled) when the caller lacks an authorization required for the
 * attempted operation. Fatal to that operation; never retried internally.
 */
public final class PermissionDeniedException extends RuntimeException
{
    private final List<String> missingPermissions;

    public PermissionDeniedException(List<String> missingPermissions) {
        super("Missing permissions: " + missingPermissions);
        this.missingPermissions = List.copyOf(missingPermissions);
    }

    public List<String> missingPermissions() {
        return missingPermissions;
    }
}
