package com.slb.chaos_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.chaos_engine")
public class ChaosEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChaosEngineApplication.class, args);
	}

}
