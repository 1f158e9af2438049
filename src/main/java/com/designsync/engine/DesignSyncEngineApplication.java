package com.designsync.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DesignSyncEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DesignSyncEngineApplication.class, args);
    }
}
