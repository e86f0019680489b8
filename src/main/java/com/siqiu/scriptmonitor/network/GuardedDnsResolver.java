package com.siqiu.scriptmonitor.network;

import org.apache.http.conn.DnsResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves through a delegate and refuses the whole answer if any address is denied.
 * Installed in the connection manager so the check also runs at connect time.
 */
public class GuardedDnsResolver implements DnsResolver {

    private final AddressPolicy policy;
    private final DnsResolver delegate;

    public GuardedDnsResolver(AddressPolicy policy, DnsResolver delegate) {
        this.policy = policy;
        this.delegate = delegate;
    }

    @Override
    public InetAddress[] resolve(String host) throws UnknownHostException {
        InetAddress[] addresses = delegate.resolve(host);
        if (addresses == null || addresses.length == 0) {
            throw new UnknownHostException(host);
        }
        for (InetAddress address : addresses) {
            if (!policy.isAllowed(address)) {
                throw new BlockedAddressException(host, address.getHostAddress());
            }
        }
        return addresses;
    }
}
