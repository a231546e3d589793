package net.javahippie.liftlog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for LiftLog.
 * LiftLog turns logged strength-training workouts into XP, levels, personal records,
 * weekly streaks and badges.
 */
@SpringBootApplication
@Slf4j
public class LiftLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiftLogApplication.class, args);
        log.info("LiftLog gamification engine started");
    }
}
