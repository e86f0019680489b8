package com.siqiu.scriptmonitor.config;

import com.siqiu.scriptmonitor.network.AddressPolicy;
import com.siqiu.scriptmonitor.network.CidrRange;
import com.siqiu.scriptmonitor.network.GuardedDnsResolver;
import com.siqiu.scriptmonitor.network.HostAllowList;
import com.siqiu.scriptmonitor.network.NetworkGatekeeper;
import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.impl.conn.SystemDefaultDnsResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class NetworkConfig {

    @Bean
    public AddressPolicy addressPolicy(
            @Value("${monitor.network.deny-cidrs:}") List<String> denyCidrs,
            @Value("${monitor.network.allow-cidrs:}") List<String> allowCidrs
    ) {
        return new AddressPolicy(parse(denyCidrs), parse(allowCidrs));
    }

    @Bean
    public HostAllowList hostAllowList(@Value("${monitor.network.allowed-hosts:}") List<String> allowedHosts) {
        return new HostAllowList(allowedHosts);
    }

    @Bean
    public GuardedDnsResolver guardedDnsResolver(AddressPolicy policy) {
        return new GuardedDnsResolver(policy, SystemDefaultDnsResolver.INSTANCE);
    }

    /**
     * The gatekeeper owns its HTTP client; redirects, retries and cookies are handled (or refused) by the gatekeeper.
     */
    @Bean
    public NetworkGatekeeper networkGatekeeper(
            HostAllowList allowList,
            GuardedDnsResolver resolver,
            Clock clock,
            @Value("${monitor.network.max-redirects:5}") int maxRedirects,
            @Value("${monitor.network.max-body-bytes:5242880}") long maxBodyBytes,
            @Value("${monitor.worker.pool-size:5}") int poolSize
    ) {
        Registry<ConnectionSocketFactory> sockets = RegistryBuilder.<ConnectionSocketFactory>create()
                .register("http", PlainConnectionSocketFactory.getSocketFactory())
                .register("https", SSLConnectionSocketFactory.getSocketFactory())
                .build();

        PoolingHttpClientConnectionManager connections = new PoolingHttpClientConnectionManager(sockets, resolver);
        connections.setMaxTotal(Math.max(20, poolSize * 4));
        connections.setDefaultMaxPerRoute(Math.max(2, poolSize));

        CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(connections)
                .disableRedirectHandling()
                .disableAutomaticRetries()
                .disableCookieManagement()
                .setUserAgent("script-monitor/1.0")
                .build();

        return new NetworkGatekeeper(allowList, resolver, client, maxRedirects, maxBodyBytes, clock);
    }

    private static List<CidrRange> parse(List<String> cidrs) {
        return cidrs.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(CidrRange::parse)
                .toList();
    }
}
