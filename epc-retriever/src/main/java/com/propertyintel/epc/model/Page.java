package com.propertyintel.epc.model;

import java.util.List;

/**
 * One batch of certificates from a single fetch cycle.
 *
 * @param records        certificates in API order
 * @param pageNumber     1-based index within the pagination session
 * @param pageSize       number of records on this page
 * @param totalRetrieved running total across the session, this page included
 */
public record Page(List<CertificateRecord> records, int pageNumber, int pageSize, long totalRetrieved) {

    public Page {
        records = List.copyOf(records);
    }
}
