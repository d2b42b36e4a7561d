package com.example.pawluxe_export;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PawluxeExportApplication {

	public static void main(String[] args) {
		SpringApplication.run(PawluxeExportApplication.class, args);
	}

}
