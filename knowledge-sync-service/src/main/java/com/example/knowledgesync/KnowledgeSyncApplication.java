package com.example.knowledgesync;

import com.example.knowledgesync.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
public class KnowledgeSyncApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(KnowledgeSyncApplication.class, args);

        if (context.getEnvironment().getProperty("sync.run-once", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
