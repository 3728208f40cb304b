package com.copyleft.LetterClash;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@ConfigurationPropertiesScan
@SpringBootApplication
public class LetterClashApplication {

	public static void main(String[] args) {
		// 처리되지 않은 예외는 기록만 하고 프로세스는 유지한다
		Thread.setDefaultUncaughtExceptionHandler((thread, e) ->
				log.error("처리되지 않은 예외: [스레드: {}]", thread.getName(), e));

		SpringApplication.run(LetterClashApplication.class, args);
	}

}
