package com.example.PhishGuard.service;

import com.example.PhishGuard.exceptions.ReputationLookupException;

import java.util.OptionalDouble;

/**
 * External file-reputation source keyed by content hash.
 */
public interface ReputationLookup {

    /**
     * @param sha256 lowercase hex SHA-256 of the file content
     * @return malicious score in [0,100], or empty when the source has no data for this hash
     * @throws ReputationLookupException when the source could not be consulted (timeout, bad response)
     */
    OptionalDouble lookup(String sha256) throws ReputationLookupException;
}
