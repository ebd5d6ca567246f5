package com.mirrorswarm.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MirrorSwarm entry point.
 */
@SpringBootApplication
public class MirrorSwarmApplication {

    public static void main(String[] args) {
        SpringApplication.run(MirrorSwarmApplication.class, args);
    }
}
