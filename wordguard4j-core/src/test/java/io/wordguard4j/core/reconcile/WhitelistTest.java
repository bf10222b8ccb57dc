/*
 * Copyright (c) 2025 Wordguard4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.wordguard4j.core.reconcile;

import static org.junit.jupiter.api.Assertions.*;

import io.wordguard4j.core.api.model.WhitelistEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class WhitelistTest {

    @Test
    void defaultEntryIgnoresCase() {
        Whitelist w = Whitelist.of(List.of(WhitelistEntry.of("Damn")));
        assertTrue(w.suppresses("damn"));
        assertTrue(w.suppresses("DAMN"));
        assertFalse(w.suppresses("damnit"));
    }

    @Test
    void caseSensitiveEntryComparesExactly() {
        Whitelist w = Whitelist.of(List.of(new WhitelistEntry("Damn", true, true)));
        assertTrue(w.suppresses("Damn"));
        assertFalse(w.suppresses("damn"));
    }

    @Test
    void partialEntryCoversContainingWords() {
        Whitelist w = Whitelist.of(List.of(new WhitelistEntry("hell", false, false)));
        assertTrue(w.suppresses("Hellfire"));
        assertFalse(w.suppresses("heck"));
    }

    @Test
    void emptyWhitelistSuppressesNothing() {
        assertTrue(Whitelist.empty().isEmpty());
        assertFalse(Whitelist.of(List.of()).suppresses("damn"));
        assertFalse(Whitelist.empty().suppresses(null));
    }
}
