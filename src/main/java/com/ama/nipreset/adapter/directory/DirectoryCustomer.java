package com.ama.nipreset.adapter.directory;

/**
 * Customer as returned by the identity directory.
 */
public record DirectoryCustomer(String customerId, String contactRecordId, String email) {
}
