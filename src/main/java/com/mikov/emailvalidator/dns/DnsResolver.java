package com.mikov.emailvalidator.dns;

import java.util.List;

/**
 * Looks up DNS records for a domain. Implementations do no caching of their own;
 * {@link DnsResultCache} owns that.
 *
 * @author zahari.mikov
 */
public interface DnsResolver {

    /**
     * Resolves the MX records of a domain.
     *
     * @param domain the domain to query
     * @return MX records in resolver order, empty when the domain exists but has none
     * @throws DnsLookupException if the domain does not exist or the lookup failed
     */
    List<MxRecord> resolveMx(String domain) throws DnsLookupException;

    /**
     * Resolves the IPv4 addresses of a domain.
     *
     * @param domain the domain to query
     * @return dotted-quad addresses, empty when the domain exists but has none
     * @throws DnsLookupException if the domain does not exist or the lookup failed
     */
    List<String> resolveA(String domain) throws DnsLookupException;
}
