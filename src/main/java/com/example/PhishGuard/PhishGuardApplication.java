package com.example.PhishGuard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
public class PhishGuardApplication {
	public static final Logger logger = LoggerFactory.getLogger(PhishGuardApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(PhishGuardApplication.class, args);
		logger.info("PhishGuard is running");
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
