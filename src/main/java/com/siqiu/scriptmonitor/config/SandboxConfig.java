package com.siqiu.scriptmonitor.config;

import com.siqiu.scriptmonitor.sandbox.SandboxLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SandboxConfig {

    @Bean
    public SandboxLimits sandboxLimits(
            @Value("${monitor.sandbox.max-statements:10000000}") long maxStatements,
            @Value("${monitor.sandbox.max-allocated-bytes:268435456}") long maxAllocatedBytes,
            @Value("${monitor.sandbox.max-log-entries:1000}") int maxLogEntries,
            @Value("${monitor.sandbox.denied-globals:load,loadWithNewGlobal,print,printErr,quit,exit,Java,Packages,java,javax,com,org,edu,net,Polyglot,Graal,require,importScripts,read,readbuffer,readline}")
            List<String> deniedGlobals
    ) {
        return new SandboxLimits(maxStatements, maxAllocatedBytes, maxLogEntries, deniedGlobals);
    }
}
