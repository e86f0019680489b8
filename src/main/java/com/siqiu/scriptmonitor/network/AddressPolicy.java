package com.siqiu.scriptmonitor.network;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Decides whether a resolved destination address may be contacted by a script.
 * Loopback, link-local, private, carrier-grade NAT, unique-local and other
 * non-routable ranges are always denied unless an explicit allow range covers them.
 */
public class AddressPolicy {

    private static final List<CidrRange> BUILT_IN_DENIED = List.of(
            CidrRange.parse("0.0.0.0/8"),
            CidrRange.parse("100.64.0.0/10"),
            CidrRange.parse("192.0.0.0/24"),
            CidrRange.parse("198.18.0.0/15"),
            CidrRange.parse("240.0.0.0/4"),
            CidrRange.parse("fc00::/7"),
            CidrRange.parse("64:ff9b::/96")
    );

    private final List<CidrRange> denied;
    private final List<CidrRange> allowed;

    public AddressPolicy(List<CidrRange> denied, List<CidrRange> allowed) {
        this.denied = List.copyOf(denied);
        this.allowed = List.copyOf(allowed);
    }

    public static AddressPolicy defaults() {
        return new AddressPolicy(List.of(), List.of());
    }

    public boolean isAllowed(InetAddress address) {
        InetAddress effective = unwrapEmbeddedIpv4(address);

        for (CidrRange range : allowed) {
            if (range.contains(effective)) return true;
        }
        if (isBuiltInDenied(effective)) return false;
        for (CidrRange range : denied) {
            if (range.contains(effective)) return false;
        }
        return true;
    }

    private static boolean isBuiltInDenied(InetAddress a) {
        if (a.isAnyLocalAddress()
                || a.isLoopbackAddress()
                || a.isLinkLocalAddress()
                || a.isSiteLocalAddress()
                || a.isMulticastAddress()) {
            return true;
        }
        if (a instanceof Inet4Address && isBroadcast(a.getAddress())) {
            return true;
        }
        for (CidrRange range : BUILT_IN_DENIED) {
            if (range.contains(a)) return true;
        }
        return false;
    }

    private static boolean isBroadcast(byte[] v4) {
        for (byte b : v4) {
            if (b != (byte) 0xFF) return false;
        }
        return true;
    }

    // ::a.b.c.d must be judged by its IPv4 part (::ffff:a.b.c.d is already mapped to Inet4Address by the JDK)
    private static InetAddress unwrapEmbeddedIpv4(InetAddress address) {
        if (address instanceof Inet6Address && ((Inet6Address) address).isIPv4CompatibleAddress()) {
            byte[] bytes = address.getAddress();
            byte[] v4 = new byte[] {bytes[12], bytes[13], bytes[14], bytes[15]};
            try {
                InetAddress embedded = InetAddress.getByAddress(v4);
                // :: and ::1 are IPv4-compatible by construction but are any-local / loopback in their own right
                return address.isAnyLocalAddress() || address.isLoopbackAddress() ? address : embedded;
            } catch (UnknownHostException e) {
                throw new IllegalStateException("4-byte address rejected by JDK", e);
            }
        }
        return address;
    }
}
