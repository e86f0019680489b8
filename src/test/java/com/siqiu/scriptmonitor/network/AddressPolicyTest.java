package com.siqiu.scriptmonitor.network;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressPolicyTest {

    private final AddressPolicy policy = AddressPolicy.defaults();

    @ParameterizedTest
    @ValueSource(strings = {
            "127.0.0.1", "10.1.2.3", "172.16.0.1", "192.168.1.1", "169.254.169.254", "0.0.0.0",
            "100.64.0.1", "224.0.0.1", "255.255.255.255", "::1", "fe80::1", "fd00::1", "::ffff:127.0.0.1"
    })
    void deniesNonPublicAddresses(String address) throws Exception {
        assertThat(policy.isAllowed(InetAddress.getByName(address))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"93.184.216.34", "8.8.8.8", "2606:4700:4700::1111"})
    void allowsPublicAddresses(String address) throws Exception {
        assertThat(policy.isAllowed(InetAddress.getByName(address))).isTrue();
    }

    @Test
    void allowRangeOverridesBuiltInDenial() throws Exception {
        AddressPolicy custom = new AddressPolicy(List.of(), List.of(CidrRange.parse("10.20.0.0/16")));

        assertThat(custom.isAllowed(InetAddress.getByName("10.20.3.4"))).isTrue();
        assertThat(custom.isAllowed(InetAddress.getByName("10.21.3.4"))).isFalse();
    }

    @Test
    void extraDenyRangeBlocksPublicAddress() throws Exception {
        AddressPolicy custom = new AddressPolicy(List.of(CidrRange.parse("93.184.216.0/24")), List.of());

        assertThat(custom.isAllowed(InetAddress.getByName("93.184.216.34"))).isFalse();
        assertThat(custom.isAllowed(InetAddress.getByName("8.8.8.8"))).isTrue();
    }

    @Test
    void cidrRangeRejectsHostnames() {
        assertThatThrownBy(() -> CidrRange.parse("example.com/24"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
