package com.siqiu.scriptmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling //Trigger loop + schedule reconciliation
public class ScriptMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptMonitorApplication.class, args);
    }

}
