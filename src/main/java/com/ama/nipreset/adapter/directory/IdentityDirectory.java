package com.ama.nipreset.adapter.directory;

/**
 * Read-only catalog of customers and their vehicles, keyed by email + phone.
 */
public interface IdentityDirectory {

    /**
     * Look up the customer registered with both the email and the phone.
     *
     * @throws com.ama.nipreset.exception.DependencyUnavailableException if the directory cannot answer
     */
    DirectoryLookup lookup(String email, String phone);

    /**
     * Check if the directory is reachable.
     */
    boolean isAvailable();
}
