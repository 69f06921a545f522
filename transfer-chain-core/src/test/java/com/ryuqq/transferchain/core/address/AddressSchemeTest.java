package com.ryuqq.transferchain.core.address;

import com.ryuqq.transferchain.core.config.NamespaceConfig;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AddressScheme 테스트.
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
class AddressSchemeTest {

    private final AddressScheme scheme = new AddressScheme(new NamespaceConfig());

    @Test
    void prefix_DefaultFamily_IsFirstSixHexOfSha512() {
        // When & Then
        assertEquals("19d832", scheme.prefix());
    }

    @Test
    void address_Asset_MatchesKnownVector() {
        // When
        String address = scheme.address(EntityKind.ASSET, "widget");

        // Then
        assertEquals("19d83200488de9b786e56e5542751a98d65db3df4ecfc22ce85f48a74f63246a65328f", address);
    }

    @Test
    void address_AnyKind_HasFixedLayout() {
        for (EntityKind kind : EntityKind.values()) {
            // When
            String address = scheme.address(kind, "alice");

            // Then
            assertThat(address)
                .hasSize(AddressScheme.ADDRESS_LENGTH)
                .startsWith(scheme.prefix() + kind.code())
                .matches("[0-9a-f]+");
        }
    }

    @Test
    void address_SameKeyDifferentKind_DiffersOnlyInKindTag() {
        // When
        String ackn = scheme.address(EntityKind.TRANSFER_ACKN, "widget");
        String approve = scheme.address(EntityKind.TRANSFER_APPROVE, "widget");

        // Then
        assertNotEquals(ackn, approve);
        assertEquals(ackn.substring(8), approve.substring(8));
    }

    @Test
    void address_IsReproducibleAcrossInstances() {
        // Given
        AddressScheme other = new AddressScheme(new NamespaceConfig());

        // When & Then
        assertEquals(scheme.address(EntityKind.REGULATOR, "regulator1"),
            other.address(EntityKind.REGULATOR, "regulator1"));
    }

    @Test
    void address_OtherFamily_UsesInjectedPrefix() {
        // Given
        AddressScheme other = new AddressScheme(new NamespaceConfig().withFamilyName("other-family"));

        // When & Then
        assertEquals("65f51c", other.prefix());
        assertTrue(other.address(EntityKind.ASSET, "widget").startsWith("65f51c00"));
        assertFalse(scheme.isInNamespace(other.address(EntityKind.ASSET, "widget")));
    }

    @Test
    void address_TenThousandRandomNames_NoCollisionWithinKind() {
        // Given
        Random random = new Random(42);
        Set<String> names = new HashSet<>();
        while (names.size() < 10_000) {
            names.add(Long.toHexString(random.nextLong()) + "-" + random.nextInt(1000));
        }

        for (EntityKind kind : EntityKind.values()) {
            // When
            Set<String> addresses = new HashSet<>();
            for (String name : names) {
                addresses.add(scheme.address(kind, name));
            }

            // Then
            assertEquals(names.size(), addresses.size(), "collision within kind " + kind);
        }
    }

    @Test
    void address_NonAsciiKey_HashesUtf8Bytes() {
        // When
        String address = scheme.address(EntityKind.ASSET, "자산-1");

        // Then
        assertThat(address).hasSize(AddressScheme.ADDRESS_LENGTH);
        assertNotEquals(address, scheme.address(EntityKind.ASSET, "자산-2"));
    }

    @Test
    void isInNamespace_ValidatesLengthAndPrefix() {
        String address = scheme.address(EntityKind.ASSET, "widget");

        assertTrue(scheme.isInNamespace(address));
        assertFalse(scheme.isInNamespace(address.substring(1)));
        assertFalse(scheme.isInNamespace("000000" + address.substring(6)));
        assertFalse(scheme.isInNamespace(null));
    }

    @Test
    void address_NullArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> scheme.address(null, "widget"));
        assertThrows(IllegalArgumentException.class, () -> scheme.address(EntityKind.ASSET, null));
        assertThrows(IllegalArgumentException.class, () -> new AddressScheme(null));
    }
}
