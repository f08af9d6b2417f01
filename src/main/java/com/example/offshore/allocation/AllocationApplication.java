package com.example.offshore.allocation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class AllocationApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AllocationApplication.class, args);
        if (context.getEnvironment().getProperty("app.backfill.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
