package com.apisite.checker.config;

/**
 * How the probe treats server certificates on HTTPS endpoints.
 */
public enum TrustPolicy {
    /** Standard JDK certificate and hostname verification. */
    VERIFY,
    /**
     * Accept any certificate chain and skip hostname checks. Many provider sites run
     * self-signed or misconfigured certificates and the probe only checks reachability.
     */
    TRUST_ALL
}
