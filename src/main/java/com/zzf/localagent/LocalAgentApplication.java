package com.zzf.localagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LocalAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocalAgentApplication.class, args);
    }
}
