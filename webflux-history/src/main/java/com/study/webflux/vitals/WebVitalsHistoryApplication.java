package com.study.webflux.vitals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebVitalsHistoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(WebVitalsHistoryApplication.class, args);
	}
}
