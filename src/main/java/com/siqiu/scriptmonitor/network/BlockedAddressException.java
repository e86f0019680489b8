package com.siqiu.scriptmonitor.network;

import java.net.UnknownHostException;

/**
 * Raised from DNS resolution when a host resolves to a denied address, so the HTTP client
 * never opens a connection to it.
 */
public class BlockedAddressException extends UnknownHostException {

    public BlockedAddressException(String host, String address) {
        super("destination " + host + " resolves to disallowed address " + address);
    }
}
