package com.example.vrudetect_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class VrudetectBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(VrudetectBackendApplication.class, args);
	}

}
