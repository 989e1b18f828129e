package com.codeops.notebook.entity.enums;

/**
 * Access level granted to a collaborator. Declaration order is significant: EDIT implies VIEW.
 */
public enum SharePermission {
    VIEW,
    EDIT;

    /**
     * Returns true if this permission is at least as strong as the required one.
     *
     * @param required the minimum permission
     * @return true when this grant satisfies the requirement
     */
    public boolean covers(SharePermission required) {
        return this.ordinal() >= required.ordinal();
    }

    /**
     * Returns the stronger of two permissions, treating null as no grant.
     *
     * @param a first permission, may be null
     * @param b second permission, may be null
     * @return the stronger permission, or null when both are null
     */
    public static SharePermission strongest(SharePermission a, SharePermission b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.covers(b) ? a : b;
    }
}
