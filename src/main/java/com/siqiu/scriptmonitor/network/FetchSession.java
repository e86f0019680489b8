package com.siqiu.scriptmonitor.network;

import java.io.IOException;

/**
 * Egress handle for one execution. Every request is bounded by the execution's outer deadline.
 */
public interface FetchSession {

    /**
     * @throws NetworkRejectedException when policy refuses the target (including any redirect hop)
     * @throws IOException on transport failure or when the deadline has passed
     */
    FetchResponse fetch(FetchRequest request) throws IOException;

    /** Abort the in-flight request, if any, and refuse further requests. */
    void abort();
}
