package com.mikov.emailvalidator.dns;

public enum DnsErrorCode {
    DOMAIN_NOT_FOUND,
    DNS_TIMEOUT,
    DNS_ERROR
}
