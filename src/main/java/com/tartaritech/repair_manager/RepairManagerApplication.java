package com.tartaritech.repair_manager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepairManagerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RepairManagerApplication.class, args);
	}

}
