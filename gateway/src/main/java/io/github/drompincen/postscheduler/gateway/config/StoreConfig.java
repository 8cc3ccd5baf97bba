package io.github.drompincen.postscheduler.gateway.config;

import io.github.drompincen.postscheduler.persistence.repository.JsonFileScheduleRepository;
import io.github.drompincen.postscheduler.persistence.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    ScheduleRepository scheduleRepository(@Value("${postscheduler.store.path:data/schedules.json}") String path) {
        JsonFileScheduleRepository repository = new JsonFileScheduleRepository(Path.of(path));
        log.info("Schedule store at {}", repository.getPath());
        return repository;
    }
}
