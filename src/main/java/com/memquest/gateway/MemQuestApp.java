package com.memquest.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/** The dead-letter DataSource is optional, so JDBC auto-configuration is off. */
@SpringBootApplication(scanBasePackages = "com.memquest", exclude = DataSourceAutoConfiguration.class)
public class MemQuestApp {

    public static void main(String[] args) {
        SpringApplication.run(MemQuestApp.class, args);
    }
}
