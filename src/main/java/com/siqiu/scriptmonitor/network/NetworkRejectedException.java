package com.siqiu.scriptmonitor.network;

/**
 * A script's outbound request was refused by policy. Surfaces to the script as a catchable fetch error.
 */
public class NetworkRejectedException extends RuntimeException {

    public NetworkRejectedException(String reason) {
        super(reason);
    }
}
