package org.openphc.insight.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InsightRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightRealtimeApplication.class, args);
    }
}
