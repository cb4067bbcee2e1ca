package com.mikov.emailvalidator.validation;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResourceBackedListTest {

    @Test
    void loadsDisposableDomainsFromClasspath() {
        final var list = new DisposableDomainList();
        list.init();

        assertTrue(list.size() > 20);
        assertTrue(list.isDisposable("guerrillamail.org"));
        assertTrue(list.isDisposable("MAILINATOR.COM"));
        assertTrue(list.isDisposable("eu.mailinator.com"));
        assertFalse(list.isDisposable("notmailinator.com"));
        assertFalse(list.isDisposable(null));
    }

    @Test
    void disposableMatchWalksParentDomains() {
        final var list = new DisposableDomainList();
        list.init();

        assertTrue(list.isDisposable("a.b.c.yopmail.com"));
        assertFalse(list.isDisposable("yopmail.com.example.org"));
        assertFalse(list.isDisposable("com"));
        assertFalse(list.isDisposable("mailinator.com."));
    }

    @Test
    void loadsRolePrefixesFromClasspath() {
        final var list = new RoleAccountList();
        list.init();

        assertTrue(list.isRoleAccount("postmaster"));
        assertTrue(list.isRoleAccount("sales_team"));
        assertTrue(list.isRoleAccount("Admin.Ops"));
        assertFalse(list.isRoleAccount("information"));
        assertFalse(list.isRoleAccount("jane.doe"));
    }

    @Test
    void missingResourceFallsBackToBuiltInEntries() {
        final var list = new ResourceBackedList("/does-not-exist.txt") {
            @Override
            protected Set<String> fallbackEntries() {
                return Set.of("Example.ORG");
            }
        };
        list.reload();

        assertEquals(1, list.size());
        assertTrue(list.contains("example.org"));
    }
}
