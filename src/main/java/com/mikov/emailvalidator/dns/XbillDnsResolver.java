package com.mikov.emailvalidator.dns;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.Arrays;
import java.util.List;

/**
 * {@link DnsResolver} backed by dnsjava lookups against the configured upstream servers.
 *
 * @author zahari.mikov
 */
@Slf4j
@RequiredArgsConstructor
public class XbillDnsResolver implements DnsResolver {

    private final Resolver resolver;

    @Override
    public List<MxRecord> resolveMx(final String domain) throws DnsLookupException {
        return Arrays.stream(lookup(domain, Type.MX))
                .filter(MXRecord.class::isInstance)
                .map(MXRecord.class::cast)
                .map(mx -> new MxRecord(mx.getPriority(), mx.getTarget().toString(true)))
                .toList();
    }

    @Override
    public List<String> resolveA(final String domain) throws DnsLookupException {
        return Arrays.stream(lookup(domain, Type.A))
                .filter(ARecord.class::isInstance)
                .map(ARecord.class::cast)
                .map(a -> a.getAddress().getHostAddress())
                .toList();
    }

    private Record[] lookup(final String domain, final int type) throws DnsLookupException {
        final Lookup lookup;
        try {
            lookup = new Lookup(domain, type);
        } catch (final TextParseException e) {
            throw new DnsLookupException(DnsErrorCode.DNS_ERROR, "Invalid domain name: " + domain, e);
        }
        lookup.setResolver(resolver);
        // Results are cached by DnsResultCache, not by dnsjava.
        lookup.setCache(null);

        final var records = lookup.run();
        final var result = lookup.getResult();
        log.debug("{} lookup for {} finished with {}", Type.string(type), domain, lookup.getErrorString());

        switch (result) {
            case Lookup.SUCCESSFUL:
                return records != null ? records : new Record[0];
            case Lookup.TYPE_NOT_FOUND:
                return new Record[0];
            case Lookup.HOST_NOT_FOUND:
                throw new DnsLookupException(DnsErrorCode.DOMAIN_NOT_FOUND, "Domain " + domain + " does not exist");
            case Lookup.TRY_AGAIN:
                throw new DnsLookupException(DnsErrorCode.DNS_TIMEOUT, "DNS lookup timeout for " + domain);
            default:
                throw new DnsLookupException(DnsErrorCode.DNS_ERROR,
                        "DNS lookup failed for " + domain + ": " + lookup.getErrorString());
        }
    }
}
