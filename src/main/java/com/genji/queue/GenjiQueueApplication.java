package com.genji.queue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GenjiQueueApplication {

	public static void main(String[] args) {
		SpringApplication.run(GenjiQueueApplication.class, args);
	}

}
