package io.github.social.nostr.shard.specs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

class RelayPolicyTest {

    @Test
    void readsLimitationFromBundledDocument() throws IOException {
        final RelayPolicy policy = RelayPolicy.from(RelayInformation.load(null));

        assertEquals(20, policy.getMaxSubscriptions());
        assertEquals(10, policy.getMaxFilters());
        assertEquals(500, policy.getMaxLimit());
        assertEquals(50, policy.getMaxSubidLength());
        assertFalse(policy.isAuthRequired());
        assertTrue(policy.isRestrictedWrites());
    }

    @Test
    void parsesPartialDocumentWithDefaults() throws IOException {
        final RelayInformation information = RelayInformation.parse(
            "{\"name\":\"test\",\"limitation\":{\"auth_required\":true,\"max_limit\":100}}");
        final RelayPolicy policy = RelayPolicy.from(information);

        assertEquals("test", information.getName());
        assertTrue(policy.isAuthRequired());
        assertEquals(100, policy.getMaxLimit());
        assertEquals(20, policy.getMaxSubscriptions());
    }

    @Test
    void rejectsInvalidDocument() {
        assertThrows(IOException.class, () -> RelayInformation.parse("{\"limitation\":"));
    }

    @Test
    void effectiveLimitFallsBackToDefaultAndIsCapped() {
        final RelayPolicy policy = RelayPolicy.builder().maxLimit(100).defaultLimit(20).build();

        assertEquals(20, policy.effectiveLimit(ReqFilter.builder().build()));
        assertEquals(7, policy.effectiveLimit(ReqFilter.builder().limit(7).build()));
        assertEquals(100, policy.effectiveLimit(ReqFilter.builder().limit(5000).build()));
    }

}
