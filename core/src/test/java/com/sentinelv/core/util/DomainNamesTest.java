package com.sentinelv.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainNamesTest {

    @Test
    void normalize_lowercases_and_strips_trailing_dot() {
        assertEquals("example.com", DomainNames.normalize("  Example.COM. "));
        assertEquals("", DomainNames.normalize(null));
    }

    @Test
    void hostname_syntax() {
        assertTrue(DomainNames.isValidHostname("api-2.example.com"));
        assertTrue(DomainNames.isValidHostname("localhost"));
        assertFalse(DomainNames.isValidHostname("-api.example.com"));
        assertFalse(DomainNames.isValidHostname("api..example.com"));
        assertFalse(DomainNames.isValidHostname("*.example.com"));
        assertFalse(DomainNames.isValidHostname("admin@example.com"));
        assertFalse(DomainNames.isValidHostname("a".repeat(64) + ".com"));
    }

    @Test
    void domain_needs_two_labels() {
        assertTrue(DomainNames.isValidDomain("example.com"));
        assertFalse(DomainNames.isValidDomain("localhost"));
        assertEquals("example.com", DomainNames.requireDomain("EXAMPLE.com."));
        assertThrows(IllegalArgumentException.class, () -> DomainNames.requireDomain(""));
        assertThrows(IllegalArgumentException.class, () -> DomainNames.requireDomain("http://example.com"));
    }

    @Test
    void within_matches_on_label_boundary() {
        assertTrue(DomainNames.isWithin("example.com", "example.com"));
        assertTrue(DomainNames.isWithin("a.b.example.com", "example.com"));
        assertFalse(DomainNames.isWithin("badexample.com", "example.com"));
    }
}
