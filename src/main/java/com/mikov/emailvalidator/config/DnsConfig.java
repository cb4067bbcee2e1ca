package com.mikov.emailvalidator.config;

import com.mikov.emailvalidator.dns.DnsResolver;
import com.mikov.emailvalidator.dns.DnsResultCache;
import com.mikov.emailvalidator.dns.XbillDnsResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(ValidatorProperties.class)
public class DnsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Resolver upstreamResolver(final ValidatorProperties properties) throws UnknownHostException {
        final var dns = properties.getDns();
        final List<Resolver> resolvers = new ArrayList<>();
        for (final var server : dns.getServers()) {
            final InetAddress dnsServer = InetAddress.getByName(server);
            final Resolver resolver = new SimpleResolver(dnsServer);
            resolver.setTimeout(dns.getTimeout());
            resolvers.add(resolver);
        }
        if (resolvers.isEmpty()) {
            throw new IllegalStateException("validator.dns.servers must list at least one server");
        }
        final var extended = new ExtendedResolver(resolvers);
        extended.setTimeout(dns.getTimeout());
        log.info("Using DNS servers {} with timeout {} ms", dns.getServers(), dns.getTimeout().toMillis());
        return extended;
    }

    @Bean
    public DnsResolver dnsResolver(final Resolver upstreamResolver) {
        return new XbillDnsResolver(upstreamResolver);
    }

    @Bean
    public ThreadPoolTaskExecutor dnsLookupExecutor(final ValidatorProperties properties) {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDns().getLookupThreads());
        executor.setMaxPoolSize(properties.getDns().getLookupThreads());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("dns-lookup-");
        executor.initialize();
        return executor;
    }

    @Bean
    public DnsResultCache dnsResultCache(final DnsResolver dnsResolver,
                                         @Qualifier("dnsLookupExecutor") final ThreadPoolTaskExecutor dnsLookupExecutor,
                                         final Clock clock, final ValidatorProperties properties) {
        final var dns = properties.getDns();
        return new DnsResultCache(dnsResolver, dnsLookupExecutor, clock, dns.getBaseTtl(), dns.getCacheCapacity());
    }
}
