package com.example.statements;

import com.example.statements.config.StatementsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Statement dispatch service entry point. Runs the scheduled enqueue tick and the
 * background dispatch worker.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(StatementsProperties.class)
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
