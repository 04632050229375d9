package com.postflow;

import com.postflow.core.Event;
import com.postflow.core.EventFactory;
import com.postflow.core.PostflowEngine;
import com.postflow.dispatch.DispatchReport;
import com.postflow.job.JobFilter;
import com.postflow.job.JobSnapshot;
import com.postflow.job.JobSort;
import com.postflow.job.PageRequest;
import com.postflow.spring.EnablePostflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Example Spring Boot application demonstrating Postflow usage.
 */
@SpringBootApplication
@EnablePostflow
public class PostflowApplication {

    private static final Logger log = LoggerFactory.getLogger(PostflowApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PostflowApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "postflow.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(PostflowEngine engine) {
        return args -> {
            log.info("=== Postflow Demo Started ===");

            EventFactory events = new EventFactory(Clock.systemUTC());
            for (int i = 0; i < 3; i++) {
                String json = """
                    {
                        "trigger": "file_closed",
                        "subject_id": "asset-%d",
                        "payload": {
                            "path": "/media/recordings/session-%d.mkv",
                            "size_bytes": 734003200
                        }
                    }
                    """.formatted(i, i);
                Event event = events.fromJson(json);
                DispatchReport report = engine.submitEvent(event).get(10, TimeUnit.SECONDS);
                log.info("Event on {}: {}", event.subjectId(), report.outcomes());
            }

            // Give the workers a moment
            Thread.sleep(1000);

            for (JobSnapshot job : engine.listJobs(JobFilter.all(), JobSort.CREATED_ASC, PageRequest.first(50))
                    .items()) {
                log.info("Job {} rule={} subject={} state={} reason={}", job.id(), job.ruleId(),
                        job.subjectId(), job.state(), job.blockedReason());
            }
            log.info("Stats: {}", engine.getStats());
            log.info("=== Postflow Demo Completed ===");
        };
    }
}
